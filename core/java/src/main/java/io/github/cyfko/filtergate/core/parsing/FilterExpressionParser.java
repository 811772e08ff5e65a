package io.github.cyfko.filtergate.core.parsing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.filtergate.core.api.FilterExpression;
import io.github.cyfko.filtergate.core.api.Operator;
import io.github.cyfko.filtergate.core.exception.FilterSyntaxException;
import io.github.cyfko.filtergate.core.model.FieldCatalog;
import io.github.cyfko.filtergate.core.model.FieldDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Turns raw filter input into a {@link FilterExpression}.
 * <p>
 * The raw shape is a JSON object (or an equivalent {@code Map}) where:
 * </p>
 * <ul>
 *   <li>{@code _and} maps to a list of filter objects</li>
 *   <li>{@code _or} maps to a list of filter objects</li>
 *   <li>{@code _not} maps to a single filter object</li>
 *   <li>any other key is a field name mapping to an object of {@code operator: value} pairs</li>
 * </ul>
 * <p>
 * Several keys in one object are combined with AND, in the order they appear. An empty
 * object is an empty conjunction and matches everything.
 * </p>
 *
 * <pre>{@code
 * {
 *   "age": {"_gte": 18},
 *   "_or": [
 *     {"status": {"_eq": "active"}},
 *     {"status": {"_eq": "trial"}}
 *   ]
 * }
 * }</pre>
 *
 * <h2>Validation scope</h2>
 * <p>
 * The parser only establishes structural validity: known combinators, known fields,
 * operator symbols that exist for each field's category, and a non-blank field name.
 * Authorization and backend capability are checked by the compiler.
 * </p>
 *
 * <p>Instances are stateless and thread-safe.</p>
 *
 * @since 1.0.0
 */
public class FilterExpressionParser {
    private static final Logger log = Logger.getLogger(FilterExpressionParser.class.getName());

    public static final String AND = "_and";
    public static final String OR = "_or";
    public static final String NOT = "_not";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public FilterExpressionParser() {
        this(new ObjectMapper());
    }

    public FilterExpressionParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Parses a JSON document.
     *
     * @param json    the raw filter as JSON text
     * @param catalog fields of the target entity
     * @return the parsed expression
     * @throws FilterSyntaxException if the JSON is malformed or the filter is structurally invalid
     */
    public FilterExpression parse(String json, FieldCatalog catalog) {
        if (json == null || json.isBlank()) {
            return new FilterExpression.And(List.of());
        }
        Map<String, Object> raw;
        try {
            raw = mapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new FilterSyntaxException("Filter is not a valid JSON object: " + e.getOriginalMessage(), "$", e);
        }
        return parse(raw, catalog);
    }

    /**
     * Parses an already decoded filter object.
     *
     * @param raw     the raw filter; {@code null} is treated as an empty filter
     * @param catalog fields of the target entity
     * @return the parsed expression
     * @throws FilterSyntaxException if the filter is structurally invalid
     */
    public FilterExpression parse(Map<String, ?> raw, FieldCatalog catalog) {
        Objects.requireNonNull(catalog, "catalog");
        if (raw == null) {
            return new FilterExpression.And(List.of());
        }
        FilterExpression expression = parseObject(raw, catalog, "$");
        log.fine(() -> "Parsed filter for " + catalog.entity() + ": " + expression);
        return expression;
    }

    private FilterExpression parseObject(Map<?, ?> raw, FieldCatalog catalog, String path) {
        List<FilterExpression> parts = new ArrayList<>(raw.size());
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            String key = entry.getKey() == null ? "" : entry.getKey().toString();
            Object value = entry.getValue();
            switch (key) {
                case AND -> parts.add(new FilterExpression.And(parseList(value, catalog, path + "." + AND)));
                case OR -> parts.add(new FilterExpression.Or(parseList(value, catalog, path + "." + OR)));
                case NOT -> {
                    if (!(value instanceof Map<?, ?> child)) {
                        throw new FilterSyntaxException("'_not' expects a filter object", path + "." + NOT);
                    }
                    parts.add(new FilterExpression.Not(parseObject(child, catalog, path + "." + NOT)));
                }
                default -> parts.add(parseLeaf(key, value, catalog, path));
            }
        }
        return parts.size() == 1 ? parts.get(0) : new FilterExpression.And(parts);
    }

    private List<FilterExpression> parseList(Object value, FieldCatalog catalog, String path) {
        if (!(value instanceof List<?> items)) {
            throw new FilterSyntaxException("Combinator expects a list of filter objects", path);
        }
        List<FilterExpression> children = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            String itemPath = path + "[" + i + "]";
            if (!(item instanceof Map<?, ?> child)) {
                throw new FilterSyntaxException("Combinator items must be filter objects", itemPath);
            }
            children.add(parseObject(child, catalog, itemPath));
        }
        return children;
    }

    private FilterExpression parseLeaf(String field, Object value, FieldCatalog catalog, String path) {
        if (field.isBlank()) {
            throw new FilterSyntaxException("Filter leaf has no field name", path);
        }
        if (field.startsWith("_")) {
            throw new FilterSyntaxException("Unknown combinator '" + field + "'", path);
        }
        String fieldPath = path + "." + field;
        FieldDescriptor descriptor = catalog.field(field)
                .orElseThrow(() -> new FilterSyntaxException(
                        "Unknown field '" + field + "' for " + catalog.entity(), fieldPath));
        if (!(value instanceof Map<?, ?> rawOperators)) {
            throw new FilterSyntaxException("Field '" + field + "' expects an object of operators", fieldPath);
        }
        if (rawOperators.isEmpty()) {
            throw new FilterSyntaxException("Field '" + field + "' has no operator", fieldPath);
        }

        Map<Operator, Object> operators = new LinkedHashMap<>();
        for (Map.Entry<?, ?> op : rawOperators.entrySet()) {
            String symbol = op.getKey() == null ? "" : op.getKey().toString();
            Operator operator = Operator.lookup(descriptor.type().category(), symbol)
                    .orElseThrow(() -> new FilterSyntaxException("Unknown operator '" + symbol + "' for "
                            + descriptor.type().category().name().toLowerCase(Locale.ROOT) + " field '" + field + "'",
                            fieldPath));
            if (operators.containsKey(operator)) {
                throw new FilterSyntaxException("Operator " + operator.symbol() + " is given twice", fieldPath);
            }
            operators.put(operator, op.getValue());
        }
        return new FilterExpression.Leaf(field, operators);
    }
}
