package io.github.cyfko.filtergate.core.api;

/**
 * Operators applicable to JSON document fields.
 * {@link #PATH_MATCH} requires full JSON-path support on the backend.
 *
 * @since 1.0.0
 */
public enum JsonOperator implements Operator {
    CONTAINS("_contains", ValueShape.DOCUMENT),
    CONTAINED_BY("_contained_by", ValueShape.DOCUMENT),
    HAS_KEY("_has_key", ValueShape.SINGLE),
    HAS_KEYS("_has_keys", ValueShape.LIST),
    HAS_ANY_KEYS("_has_any_keys", ValueShape.LIST),
    PATH_MATCH("_path_match", ValueShape.SINGLE);

    private final String symbol;
    private final ValueShape valueShape;

    JsonOperator(String symbol, ValueShape valueShape) {
        this.symbol = symbol;
        this.valueShape = valueShape;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public OperatorCategory category() {
        return OperatorCategory.JSON;
    }

    @Override
    public ValueShape valueShape() {
        return valueShape;
    }
}
