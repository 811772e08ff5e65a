package io.github.cyfko.filtergate.jpa.postgres;

import io.github.cyfko.filtergate.core.api.GeoOperator;
import io.github.cyfko.filtergate.core.api.JsonOperator;
import io.github.cyfko.filtergate.core.api.OperatorCategory;
import io.github.cyfko.filtergate.core.api.ScalarOperator;
import io.github.cyfko.filtergate.core.capability.AdapterCapabilities;
import io.github.cyfko.filtergate.core.capability.CapabilityDetector;
import io.github.cyfko.filtergate.core.capability.ConnectionDescriptor;
import io.github.cyfko.filtergate.core.capability.Feature;
import io.github.cyfko.filtergate.core.capability.OperatorSets;
import io.github.cyfko.filtergate.core.capability.SqlProbe;
import io.github.cyfko.filtergate.core.model.FieldKind;
import io.github.cyfko.filtergate.jpa.DatabaseVersion;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Detects what a PostgreSQL connection offers from {@code version()} and the installed
 * extensions.
 *
 * <table>
 *   <caption>Detected features</caption>
 *   <tr><th>Feature</th><th>Condition</th></tr>
 *   <tr><td>native arrays, overlap, contains-all</td><td>always</td></tr>
 *   <tr><td>full-text search</td><td>8.3+</td></tr>
 *   <tr><td>JSON operations</td><td>9.4+ (jsonb)</td></tr>
 *   <tr><td>JSON path</td><td>12+</td></tr>
 *   <tr><td>trigram similarity</td><td>{@code pg_trgm}</td></tr>
 *   <tr><td>fuzzy match</td><td>{@code fuzzystrmatch}</td></tr>
 *   <tr><td>geo-spatial</td><td>{@code postgis}</td></tr>
 * </table>
 * <p>
 * A failed probe query is logged and treated as version {@code 0.0.0} with no extensions,
 * which leaves only the always-available operators.
 * </p>
 *
 * @since 1.0.0
 */
public class PostgresCapabilityDetector implements CapabilityDetector {

    private static final Logger log = Logger.getLogger(PostgresCapabilityDetector.class.getName());

    static final int MAX_IN_ITEMS = 10_000;

    @Override
    public AdapterCapabilities detect(ConnectionDescriptor connection) {
        Optional<SqlProbe> probe = connection == null ? Optional.empty() : connection.probeOptional();
        DatabaseVersion version = probe.map(PostgresCapabilityDetector::version).orElse(DatabaseVersion.UNKNOWN);
        Set<String> extensions = probe.map(PostgresCapabilityDetector::extensions).orElse(Set.of());
        return capabilities(version, extensions);
    }

    /**
     * Builds the capabilities for a known version and extension set.
     */
    public static AdapterCapabilities capabilities(DatabaseVersion version, Set<String> extensions) {
        AdapterCapabilities.Builder builder = AdapterCapabilities.builder(PostgresFilterAdapter.ID)
                .version(version.toString())
                .maxInItems(MAX_IN_ITEMS)
                .feature(Feature.NATIVE_ARRAYS)
                .feature(Feature.ARRAY_OVERLAP)
                .feature(Feature.ARRAY_CONTAINS_ALL)
                .feature(Feature.QUERY_EXPLAIN)
                .feature(Feature.FULL_TEXT_SEARCH, version.atLeast(8, 3), "Upgrade to PostgreSQL 8.3 or later")
                .feature(Feature.JSON_OPERATIONS, version.atLeast(9, 4), "Upgrade to PostgreSQL 9.4 or later for jsonb")
                .feature(Feature.JSON_PATH, version.atLeast(12, 0), "Upgrade to PostgreSQL 12 or later for jsonpath")
                .feature(Feature.TRIGRAM_SIMILARITY, extensions.contains("pg_trgm"), "CREATE EXTENSION pg_trgm")
                .feature(Feature.FUZZY_MATCH, extensions.contains("fuzzystrmatch"), "CREATE EXTENSION fuzzystrmatch")
                .feature(Feature.GEO_SPATIAL, extensions.contains("postgis"), "CREATE EXTENSION postgis");
        OperatorSets.scalarBaseline(builder);
        OperatorSets.arrays(builder, OperatorSets.ARRAY_FULL);
        if (builder.has(Feature.FULL_TEXT_SEARCH)) {
            builder.operators(OperatorCategory.SCALAR, Set.of(ScalarOperator.SEARCH), FieldKind.STRING);
        }
        if (builder.has(Feature.TRIGRAM_SIMILARITY)) {
            builder.operators(OperatorCategory.SCALAR, Set.of(ScalarOperator.SIMILAR), FieldKind.STRING);
        }
        if (builder.has(Feature.FUZZY_MATCH)) {
            builder.operators(OperatorCategory.SCALAR, Set.of(ScalarOperator.FUZZY), FieldKind.STRING);
        }
        if (builder.has(Feature.JSON_OPERATIONS)) {
            builder.operators(OperatorCategory.JSON, EnumSet.of(JsonOperator.CONTAINS, JsonOperator.CONTAINED_BY,
                    JsonOperator.HAS_KEY, JsonOperator.HAS_KEYS, JsonOperator.HAS_ANY_KEYS), FieldKind.JSON);
        }
        if (builder.has(Feature.JSON_PATH)) {
            builder.operators(OperatorCategory.JSON, Set.of(JsonOperator.PATH_MATCH), FieldKind.JSON);
        }
        if (builder.has(Feature.GEO_SPATIAL)) {
            builder.operators(OperatorCategory.GEO, Set.of(GeoOperator.ST_DWITHIN), FieldKind.GEO);
        }
        return builder.build();
    }

    private static DatabaseVersion version(SqlProbe probe) {
        try {
            return DatabaseVersion.parse(probe.queryScalar("SELECT version()"));
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Failed to detect PostgreSQL version", e);
            return DatabaseVersion.UNKNOWN;
        }
    }

    private static Set<String> extensions(SqlProbe probe) {
        try {
            Set<String> names = new HashSet<>();
            for (Object row : probe.queryColumn("SELECT extname FROM pg_extension")) {
                names.add(String.valueOf(row));
            }
            return names;
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Failed to detect PostgreSQL extensions", e);
            return Set.of();
        }
    }
}
