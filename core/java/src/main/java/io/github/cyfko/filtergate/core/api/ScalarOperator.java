package io.github.cyfko.filtergate.core.api;

/**
 * Operators applicable to single-valued fields.
 * <p>
 * {@link #SEARCH}, {@link #SIMILAR} and {@link #FUZZY} are advanced text operators; an
 * adapter only offers them when the backing feature (full-text search, trigram
 * similarity, fuzzy matching) was detected for the connection.
 * </p>
 *
 * @since 1.0.0
 */
public enum ScalarOperator implements Operator {
    EQ("_eq", ValueShape.SINGLE),
    NEQ("_neq", ValueShape.SINGLE),
    GT("_gt", ValueShape.SINGLE),
    GTE("_gte", ValueShape.SINGLE),
    LT("_lt", ValueShape.SINGLE),
    LTE("_lte", ValueShape.SINGLE),
    IN("_in", ValueShape.LIST),
    NIN("_nin", ValueShape.LIST),
    IS_NULL("_is_null", ValueShape.FLAG),
    LIKE("_like", ValueShape.SINGLE),
    NLIKE("_nlike", ValueShape.SINGLE),
    ILIKE("_ilike", ValueShape.SINGLE),
    NILIKE("_nilike", ValueShape.SINGLE),
    STARTS_WITH("_starts_with", ValueShape.SINGLE),
    ISTARTS_WITH("_istarts_with", ValueShape.SINGLE),
    ENDS_WITH("_ends_with", ValueShape.SINGLE),
    IENDS_WITH("_iends_with", ValueShape.SINGLE),
    CONTAINS("_contains", ValueShape.SINGLE),
    ICONTAINS("_icontains", ValueShape.SINGLE),
    SEARCH("_search", ValueShape.SINGLE),
    SIMILAR("_similar", ValueShape.SINGLE),
    FUZZY("_fuzzy", ValueShape.SINGLE);

    private final String symbol;
    private final ValueShape valueShape;

    ScalarOperator(String symbol, ValueShape valueShape) {
        this.symbol = symbol;
        this.valueShape = valueShape;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public OperatorCategory category() {
        return OperatorCategory.SCALAR;
    }

    @Override
    public ValueShape valueShape() {
        return valueShape;
    }
}
