package io.github.cyfko.filtergate.elasticsearch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.cyfko.filtergate.core.api.ArrayOperator;
import io.github.cyfko.filtergate.core.api.GeoDistance;
import io.github.cyfko.filtergate.core.api.GeoOperator;
import io.github.cyfko.filtergate.core.api.Operator;
import io.github.cyfko.filtergate.core.api.OperatorCategory;
import io.github.cyfko.filtergate.core.api.ScalarOperator;
import io.github.cyfko.filtergate.core.capability.AdapterCapabilities;
import io.github.cyfko.filtergate.core.capability.AdapterRegistration;
import io.github.cyfko.filtergate.core.capability.Feature;
import io.github.cyfko.filtergate.core.capability.OperatorSets;
import io.github.cyfko.filtergate.core.complexity.QueryWindow;
import io.github.cyfko.filtergate.core.complexity.SortField;
import io.github.cyfko.filtergate.core.model.FieldDescriptor;
import io.github.cyfko.filtergate.core.model.FieldKind;
import io.github.cyfko.filtergate.core.spi.FilterAdapter;
import io.github.cyfko.filtergate.core.spi.OperatorOptions;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Adapter compiling filters into Elasticsearch Query DSL, as Jackson trees.
 * <p>
 * Every operator becomes a leaf query ({@code term}, {@code range}, {@code wildcard}...) and
 * combinators become {@code bool} queries. Multi-valued fields are native, so the whole
 * array operator set is available; an empty array is indistinguishable from a missing one.
 * Negative operators ({@code _neq}, {@code _nin}, {@code _nlike}) require the field to
 * exist, matching the SQL adapters where a comparison against {@code NULL} never holds.
 * </p>
 *
 * <pre>{@code
 * ElasticsearchAdapter adapter = new ElasticsearchAdapter();
 * ObjectNode query = queryBuilder.compile(expression, catalog, authorized, adapter);
 * ObjectNode body = adapter.toSearchBody(query, QueryWindow.of(20, 0, SortField.desc("createdAt")));
 * // POST /users/_search with body
 * }</pre>
 *
 * @since 1.0.0
 */
public class ElasticsearchAdapter implements FilterAdapter<ObjectNode> {

    public static final String ID = "elasticsearch";

    /** Default {@code index.max_terms_count}. */
    public static final int MAX_TERMS = 65_536;

    private final ObjectMapper mapper;
    private final AdapterCapabilities capabilities;

    public ElasticsearchAdapter() {
        this(defaultCapabilities());
    }

    public ElasticsearchAdapter(AdapterCapabilities capabilities) {
        this(new ObjectMapper(), capabilities);
    }

    public ElasticsearchAdapter(ObjectMapper mapper, AdapterCapabilities capabilities) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
    }

    public static AdapterCapabilities defaultCapabilities() {
        AdapterCapabilities.Builder builder = AdapterCapabilities.builder(ID)
                .maxInItems(MAX_TERMS)
                .feature(Feature.ARRAY_OVERLAP)
                .feature(Feature.ARRAY_CONTAINS_ALL)
                .feature(Feature.FULL_TEXT_SEARCH)
                .feature(Feature.FUZZY_MATCH)
                .feature(Feature.GEO_SPATIAL)
                .feature(Feature.QUERY_EXPLAIN, false, "Elasticsearch has no cost estimate; the heuristic scorer is used");
        OperatorSets.scalarBaseline(builder);
        OperatorSets.arrays(builder, OperatorSets.ARRAY_FULL);
        builder.operators(OperatorCategory.SCALAR, EnumSet.of(ScalarOperator.SEARCH, ScalarOperator.FUZZY), FieldKind.STRING);
        builder.operators(OperatorCategory.GEO, Set.of(GeoOperator.ST_DWITHIN), FieldKind.GEO);
        return builder.build();
    }

    /**
     * Registration routing the {@code elasticsearch} connector type here. Capabilities are
     * static: nothing is probed.
     */
    public static AdapterRegistration registration() {
        return new AdapterRegistration(ID, Set.of("elasticsearch", "opensearch"),
                connection -> defaultCapabilities(), ElasticsearchAdapter::new);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<ObjectNode> compiledType() {
        return ObjectNode.class;
    }

    @Override
    public AdapterCapabilities capabilities() {
        return capabilities;
    }

    @Override
    public ObjectNode applyOperator(FieldDescriptor field, Operator operator, Object value, OperatorOptions options) {
        String path = field.storagePath();
        if (operator instanceof ScalarOperator scalar) {
            return scalar(path, scalar, value, options);
        }
        if (operator instanceof ArrayOperator array) {
            return array(path, array, value);
        }
        if (operator instanceof GeoOperator) {
            return geoDistance(path, (GeoDistance) value);
        }
        throw new UnsupportedOperationException("Operator " + operator.symbol() + " is not rendered by adapter " + ID);
    }

    private ObjectNode scalar(String path, ScalarOperator operator, Object value, OperatorOptions options) {
        return switch (operator) {
            case EQ -> term(path, value);
            case NEQ -> present(path, term(path, value));
            case GT -> range(path, "gt", value);
            case GTE -> range(path, "gte", value);
            case LT -> range(path, "lt", value);
            case LTE -> range(path, "lte", value);
            case IN -> terms(path, (List<?>) value);
            case NIN -> present(path, terms(path, (List<?>) value));
            case IS_NULL -> Boolean.TRUE.equals(value) ? mustNot(exists(path)) : exists(path);
            case LIKE -> wildcard(path, fromLike(value.toString()), false);
            case NLIKE -> present(path, wildcard(path, fromLike(value.toString()), false));
            case ILIKE -> wildcard(path, fromLike(value.toString()), true);
            case NILIKE -> present(path, wildcard(path, fromLike(value.toString()), true));
            case STARTS_WITH -> prefix(path, value.toString(), false);
            case ISTARTS_WITH -> prefix(path, value.toString(), true);
            case ENDS_WITH -> wildcard(path, "*" + escapeWildcard(value.toString()), false);
            case IENDS_WITH -> wildcard(path, "*" + escapeWildcard(value.toString()), true);
            case CONTAINS -> wildcard(path, "*" + escapeWildcard(value.toString()) + "*", false);
            case ICONTAINS -> wildcard(path, "*" + escapeWildcard(value.toString()) + "*", true);
            case SEARCH -> {
                ObjectNode node = mapper.createObjectNode();
                node.putObject("match").putObject(path).put("query", value.toString());
                yield node;
            }
            case FUZZY -> {
                ObjectNode node = mapper.createObjectNode();
                node.putObject("fuzzy").putObject(path)
                        .put("value", value.toString())
                        .put("fuzziness", options.fuzziness());
                yield node;
            }
            case SIMILAR -> throw new UnsupportedOperationException(
                    "Operator " + operator.symbol() + " is not rendered by adapter " + ID);
        };
    }

    private ObjectNode array(String path, ArrayOperator operator, Object value) {
        return switch (operator) {
            case INCLUDES -> term(path, value);
            case EXCLUDES -> mustNot(term(path, value));
            case INCLUDES_ALL -> allTerms(path, (List<?>) value);
            case EXCLUDES_ALL -> mustNot(terms(path, (List<?>) value));
            case INCLUDES_ANY -> terms(path, (List<?>) value);
            case EXCLUDES_ANY -> mustNot(allTerms(path, (List<?>) value));
            case IS_EMPTY, IS_NULL -> Boolean.TRUE.equals(value) ? mustNot(exists(path)) : exists(path);
        };
    }

    private ObjectNode term(String path, Object value) {
        ObjectNode node = mapper.createObjectNode();
        node.putObject("term").set(path, mapper.valueToTree(value));
        return node;
    }

    private ObjectNode terms(String path, List<?> values) {
        ObjectNode node = mapper.createObjectNode();
        node.putObject("terms").set(path, mapper.valueToTree(values));
        return node;
    }

    private ObjectNode allTerms(String path, List<?> values) {
        ObjectNode node = mapper.createObjectNode();
        ArrayNode must = node.putObject("bool").putArray("must");
        for (Object value : values) {
            must.add(term(path, value));
        }
        return node;
    }

    private ObjectNode range(String path, String bound, Object value) {
        ObjectNode node = mapper.createObjectNode();
        node.putObject("range").putObject(path).set(bound, mapper.valueToTree(value));
        return node;
    }

    private ObjectNode exists(String path) {
        ObjectNode node = mapper.createObjectNode();
        node.putObject("exists").put("field", path);
        return node;
    }

    private ObjectNode wildcard(String path, String pattern, boolean caseInsensitive) {
        ObjectNode node = mapper.createObjectNode();
        ObjectNode body = node.putObject("wildcard").putObject(path).put("value", pattern);
        if (caseInsensitive) {
            body.put("case_insensitive", true);
        }
        return node;
    }

    private ObjectNode prefix(String path, String value, boolean caseInsensitive) {
        ObjectNode node = mapper.createObjectNode();
        ObjectNode body = node.putObject("prefix").putObject(path).put("value", value);
        if (caseInsensitive) {
            body.put("case_insensitive", true);
        }
        return node;
    }

    private ObjectNode geoDistance(String path, GeoDistance distance) {
        ObjectNode node = mapper.createObjectNode();
        ObjectNode geo = node.putObject("geo_distance");
        geo.put("distance", distance.distanceMeters() + "m");
        geo.putObject(path).put("lat", distance.lat()).put("lon", distance.lon());
        return node;
    }

    /** {@code field exists AND NOT query}. */
    private ObjectNode present(String path, ObjectNode excluded) {
        ObjectNode node = mapper.createObjectNode();
        ObjectNode bool = node.putObject("bool");
        bool.putArray("must").add(exists(path));
        bool.putArray("must_not").add(excluded);
        return node;
    }

    private ObjectNode mustNot(ObjectNode query) {
        ObjectNode node = mapper.createObjectNode();
        node.putObject("bool").putArray("must_not").add(query);
        return node;
    }

    /**
     * Converts a SQL LIKE pattern to a wildcard pattern: {@code %} becomes {@code *},
     * {@code _} becomes {@code ?}, and literal {@code *}, {@code ?} and {@code \} are escaped.
     */
    static String fromLike(String like) {
        StringBuilder sb = new StringBuilder(like.length());
        for (int i = 0; i < like.length(); i++) {
            char c = like.charAt(i);
            switch (c) {
                case '%' -> sb.append('*');
                case '_' -> sb.append('?');
                case '*', '?', '\\' -> sb.append('\\').append(c);
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    static String escapeWildcard(String literal) {
        StringBuilder sb = new StringBuilder(literal.length());
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (c == '*' || c == '?' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    @Override
    public ObjectNode combineAnd(List<ObjectNode> parts) {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        ObjectNode node = mapper.createObjectNode();
        node.putObject("bool").putArray("must").addAll(parts);
        return node;
    }

    @Override
    public ObjectNode combineOr(List<ObjectNode> parts) {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        ObjectNode node = mapper.createObjectNode();
        ObjectNode bool = node.putObject("bool");
        bool.putArray("should").addAll(parts);
        bool.put("minimum_should_match", 1);
        return node;
    }

    @Override
    public ObjectNode negate(ObjectNode query) {
        return mustNot(query);
    }

    @Override
    public ObjectNode matchAll() {
        ObjectNode node = mapper.createObjectNode();
        node.putObject("match_all");
        return node;
    }

    @Override
    public ObjectNode matchNone() {
        ObjectNode node = mapper.createObjectNode();
        node.putObject("match_none");
        return node;
    }

    @Override
    public String signature(ObjectNode query) {
        return query.toString();
    }

    /**
     * Wraps a compiled query into a {@code _search} request body.
     *
     * @param query  compiled query
     * @param window paging and sort; {@code size} is omitted when there is no limit
     * @return the request body
     */
    public ObjectNode toSearchBody(ObjectNode query, QueryWindow window) {
        ObjectNode body = mapper.createObjectNode();
        body.set("query", query);
        if (window == null) {
            return body;
        }
        if (window.offset() > 0) {
            body.put("from", window.offset());
        }
        if (window.hasLimit()) {
            body.put("size", window.limit());
        }
        if (!window.sort().isEmpty()) {
            ArrayNode sort = body.putArray("sort");
            for (SortField field : window.sort()) {
                sort.addObject().putObject(field.field()).put("order", field.descending() ? "desc" : "asc");
            }
        }
        return body;
    }
}
