package io.github.cyfko.filtergate.core.spi;

import io.github.cyfko.filtergate.core.api.Operator;

/**
 * Filter function backing a custom field.
 * <p>
 * The function receives the adapter's match-all fragment as {@code query}, the operator
 * and the raw value exactly as written by the client, and returns a fragment of the
 * adapter's compiled type. The compiler treats the result opaquely and only checks its
 * runtime type against {@link FilterAdapter#compiledType()}.
 * </p>
 *
 * <pre>{@code
 * CustomFilter<SqlCondition> fullName = (query, op, value) ->
 *     query.and(SqlCondition.of("(first_name || ' ' || last_name) ILIKE ?", "%" + value + "%"));
 * registry.register("fullName", SqlCondition.class, fullName);
 * }</pre>
 *
 * @param <Q> compiled fragment type of the adapter the filter targets
 * @since 1.0.0
 */
@FunctionalInterface
public interface CustomFilter<Q> {

    Q apply(Q query, Operator operator, Object value);
}
