package io.github.cyfko.filtergate.core.spi;

import io.github.cyfko.filtergate.core.api.Operator;
import io.github.cyfko.filtergate.core.capability.AdapterCapabilities;
import io.github.cyfko.filtergate.core.model.FieldDescriptor;

import java.util.List;

/**
 * Translates filter predicates into one backend's native query form.
 * <p>
 * The compiled query type {@code Q} is owned by the adapter: the
 * {@link io.github.cyfko.filtergate.core.compile.QueryBuilder} never inspects it and only
 * composes fragments through {@link #combineAnd}, {@link #combineOr} and {@link #negate}.
 * Fragments must be immutable values; composing never alters the inputs.
 * </p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #applyOperator} is only called with operators listed in {@link #capabilities()}
 *       for the field's category and kind.</li>
 *   <li>Values reaching the adapter are already coerced: enum values are internal values,
 *       list operators receive a non-empty {@link List}, flag operators a {@link Boolean}.</li>
 *   <li>{@code _is_empty true} and {@code _is_empty false} must partition every dataset,
 *       a missing array counting as empty.</li>
 *   <li>The same inputs must always produce equal fragments.</li>
 * </ul>
 *
 * @param <Q> compiled query fragment type
 * @since 1.0.0
 */
public interface FilterAdapter<Q> {

    /**
     * @return stable adapter identity, e.g. {@code postgres}, {@code memory}
     */
    String id();

    /**
     * @return the runtime class of compiled fragments, used to check custom filter results
     */
    Class<Q> compiledType();

    /**
     * @return capabilities of the connection this adapter was created for
     */
    AdapterCapabilities capabilities();

    /**
     * Compiles one operator applied to one field.
     *
     * @param field    descriptor of the field
     * @param operator operator to apply
     * @param value    coerced value
     * @param options  per-compilation tuning
     * @return the compiled fragment
     */
    Q applyOperator(FieldDescriptor field, Operator operator, Object value, OperatorOptions options);

    /**
     * @param parts at least one fragment
     * @return conjunction of the fragments
     */
    Q combineAnd(List<Q> parts);

    /**
     * @param parts at least one fragment
     * @return disjunction of the fragments
     */
    Q combineOr(List<Q> parts);

    Q negate(Q query);

    /**
     * @return a fragment matching every row
     */
    Q matchAll();

    /**
     * @return a fragment matching no row
     */
    Q matchNone();

    /**
     * Structural signature of a fragment, used as part of the complexity cache key.
     * Equal fragments must have equal signatures.
     *
     * @param query compiled fragment
     * @return deterministic textual signature
     */
    String signature(Q query);
}
