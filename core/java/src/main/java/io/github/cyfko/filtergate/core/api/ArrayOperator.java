package io.github.cyfko.filtergate.core.api;

/**
 * Operators applicable to array-valued fields.
 *
 * <ul>
 *   <li>{@code _includes v}: the array contains {@code v}</li>
 *   <li>{@code _excludes v}: the array does not contain {@code v}</li>
 *   <li>{@code _includes_all [..]}: the array is a superset of the list</li>
 *   <li>{@code _excludes_all [..]}: the array contains none of the list</li>
 *   <li>{@code _includes_any [..]}: the array shares at least one element with the list</li>
 *   <li>{@code _excludes_any [..]}: the array is not a superset of the list</li>
 *   <li>{@code _is_empty true|false}: cardinality is zero (a missing array counts as empty)</li>
 *   <li>{@code _is_null true|false}: the array itself is absent</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum ArrayOperator implements Operator {
    INCLUDES("_includes", ValueShape.SINGLE),
    EXCLUDES("_excludes", ValueShape.SINGLE),
    INCLUDES_ALL("_includes_all", ValueShape.LIST),
    EXCLUDES_ALL("_excludes_all", ValueShape.LIST),
    INCLUDES_ANY("_includes_any", ValueShape.LIST),
    EXCLUDES_ANY("_excludes_any", ValueShape.LIST),
    IS_EMPTY("_is_empty", ValueShape.FLAG),
    IS_NULL("_is_null", ValueShape.FLAG);

    private final String symbol;
    private final ValueShape valueShape;

    ArrayOperator(String symbol, ValueShape valueShape) {
        this.symbol = symbol;
        this.valueShape = valueShape;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public OperatorCategory category() {
        return OperatorCategory.ARRAY;
    }

    @Override
    public ValueShape valueShape() {
        return valueShape;
    }
}
