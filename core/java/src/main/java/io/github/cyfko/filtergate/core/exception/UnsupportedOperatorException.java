package io.github.cyfko.filtergate.core.exception;

import io.github.cyfko.filtergate.core.api.Operator;

/**
 * Thrown when the selected adapter does not offer an operator for a field's
 * category and kind.
 * <p>
 * Carries the field, the operator and the adapter identity so the message can point
 * at the exact leaf. Advanced operators are only offered when the backend feature
 * behind them was detected, so this is also what a client sees when, for instance,
 * {@code _similar} is used against a PostgreSQL database without {@code pg_trgm}.
 * </p>
 *
 * @since 1.0.0
 */
public class UnsupportedOperatorException extends FilterGateException {

    private final String field;
    private final Operator operator;
    private final String adapterId;

    /**
     * @param field     the field of the offending leaf
     * @param operator  the unsupported operator
     * @param adapterId the identity of the adapter the expression was compiled for
     */
    public UnsupportedOperatorException(String field, Operator operator, String adapterId) {
        super("Operator " + operator.symbol() + " is not supported on field '" + field
                + "' by adapter '" + adapterId + "'");
        this.field = field;
        this.operator = operator;
        this.adapterId = adapterId;
    }

    public String getField() {
        return field;
    }

    public Operator getOperator() {
        return operator;
    }

    public String getAdapterId() {
        return adapterId;
    }
}
