package io.github.cyfko.filtergate.core;

import io.github.cyfko.filtergate.core.admission.AdmissionDecision;
import io.github.cyfko.filtergate.core.spi.FilterAdapter;

import java.util.Objects;

/**
 * A compiled query together with its admission decision.
 *
 * @param query    compiled query, ready for the backend's native execution call
 * @param adapter  adapter that compiled it
 * @param decision admission decision
 * @param <Q>      compiled type
 * @since 1.0.0
 */
public record PreparedQuery<Q>(Q query, FilterAdapter<Q> adapter, AdmissionDecision decision) {

    public PreparedQuery {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(adapter, "adapter");
        Objects.requireNonNull(decision, "decision");
    }

    /**
     * @return the compiled query if admitted
     * @throws io.github.cyfko.filtergate.core.exception.QueryTooComplexException if rejected
     */
    public Q admittedQuery() {
        decision.orThrow();
        return query;
    }
}
