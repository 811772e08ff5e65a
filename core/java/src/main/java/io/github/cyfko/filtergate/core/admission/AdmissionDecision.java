package io.github.cyfko.filtergate.core.admission;

import io.github.cyfko.filtergate.core.complexity.ComplexityAnalysis;
import io.github.cyfko.filtergate.core.exception.QueryTooComplexException;

/**
 * Outcome of admission control for one query.
 *
 * <pre>{@code
 * AdmissionDecision decision = controller.decide(query, adapter, options);
 * if (decision instanceof AdmissionDecision.Reject reject) {
 *     return badRequest(reject.payload());
 * }
 * // or, when exceptions are preferred
 * controller.decide(query, adapter, options).orThrow();
 * }</pre>
 *
 * @since 1.0.0
 */
public sealed interface AdmissionDecision permits AdmissionDecision.Accept, AdmissionDecision.Warn,
        AdmissionDecision.Reject {

    ComplexityAnalysis analysis();

    /**
     * @return the effective limit the score was compared against
     */
    double effectiveLimit();

    /**
     * @return {@code true} unless the query was rejected
     */
    default boolean admitted() {
        return !(this instanceof Reject);
    }

    /**
     * @return this decision if the query is admitted
     * @throws QueryTooComplexException if the query was rejected
     */
    default AdmissionDecision orThrow() {
        if (this instanceof Reject reject) {
            throw new QueryTooComplexException(reject.payload());
        }
        return this;
    }

    record Accept(ComplexityAnalysis analysis, double effectiveLimit) implements AdmissionDecision {
    }

    record Warn(ComplexityAnalysis analysis, double effectiveLimit) implements AdmissionDecision {
    }

    record Reject(ComplexityAnalysis analysis, double effectiveLimit, RejectionPayload payload)
            implements AdmissionDecision {
    }
}
