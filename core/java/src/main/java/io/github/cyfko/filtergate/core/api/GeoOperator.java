package io.github.cyfko.filtergate.core.api;

/**
 * Operators applicable to geographic point fields.
 *
 * @since 1.0.0
 */
public enum GeoOperator implements Operator {
    /** Within a distance of a point; value is {@code {lat, lon, distance}} with distance in metres. */
    ST_DWITHIN("_st_dwithin", ValueShape.DOCUMENT);

    private final String symbol;
    private final ValueShape valueShape;

    GeoOperator(String symbol, ValueShape valueShape) {
        this.symbol = symbol;
        this.valueShape = valueShape;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public OperatorCategory category() {
        return OperatorCategory.GEO;
    }

    @Override
    public ValueShape valueShape() {
        return valueShape;
    }
}
