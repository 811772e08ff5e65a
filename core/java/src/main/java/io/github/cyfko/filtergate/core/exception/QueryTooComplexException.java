package io.github.cyfko.filtergate.core.exception;

import io.github.cyfko.filtergate.core.admission.RejectionPayload;

/**
 * Exception form of an admission rejection, raised by
 * {@link io.github.cyfko.filtergate.core.admission.AdmissionDecision#orThrow()}.
 * <p>
 * The structured {@link RejectionPayload} is kept intact so a transport layer can
 * serialize it as the error body.
 * </p>
 *
 * @since 1.0.0
 */
public class QueryTooComplexException extends FilterGateException {

    private final RejectionPayload payload;

    public QueryTooComplexException(RejectionPayload payload) {
        super("Query too complex: score " + payload.score() + " exceeds limit " + payload.limit());
        this.payload = payload;
    }

    public RejectionPayload getPayload() {
        return payload;
    }
}
