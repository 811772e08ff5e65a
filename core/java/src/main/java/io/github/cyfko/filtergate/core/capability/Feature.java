package io.github.cyfko.filtergate.core.capability;

/**
 * Backend features that gate operators or analysis strategies.
 *
 * @since 1.0.0
 */
public enum Feature {
    NATIVE_ARRAYS("native array columns"),
    JSON_ARRAYS("JSON-encoded arrays"),
    ARRAY_OVERLAP("array overlap (_includes_any)"),
    ARRAY_CONTAINS_ALL("array containment (_includes_all)"),
    FULL_TEXT_SEARCH("full-text search (_search)"),
    TRIGRAM_SIMILARITY("trigram similarity (_similar)"),
    FUZZY_MATCH("fuzzy matching (_fuzzy)"),
    JSON_OPERATIONS("JSON document operators"),
    JSON_PATH("JSON path matching (_path_match)"),
    GEO_SPATIAL("geospatial distance (_st_dwithin)"),
    QUERY_EXPLAIN("query plan introspection (EXPLAIN)");

    private final String description;

    Feature(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
