package io.github.cyfko.filtergate.core.model;

/**
 * Semantic kind of a field's value (or of an array's elements).
 * <p>
 * {@link #ENUM}, {@link #JSON} and {@link #GEO} are the kinds of the corresponding
 * {@link FieldType} variants and let capability tables be keyed uniformly by kind.
 * </p>
 *
 * @since 1.0.0
 */
public enum FieldKind {
    ID,
    STRING,
    INTEGER,
    FLOAT,
    DECIMAL,
    BOOLEAN,
    DATE,
    DATETIME,
    TIME,
    ENUM,
    JSON,
    GEO;

    /**
     * @return {@code true} if values of this kind have a natural order usable with
     * {@code _gt}/{@code _lt} style operators
     */
    public boolean isOrdered() {
        return switch (this) {
            case ID, STRING, INTEGER, FLOAT, DECIMAL, DATE, DATETIME, TIME -> true;
            case BOOLEAN, ENUM, JSON, GEO -> false;
        };
    }

    /**
     * @return {@code true} if values of this kind are text, usable with pattern operators
     */
    public boolean isTextual() {
        return this == STRING;
    }
}
