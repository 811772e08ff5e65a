package io.github.cyfko.filtergate.core.exception;

/**
 * Base class of every error raised by the filter compilation and admission pipeline.
 * <p>
 * All FilterGate errors are unchecked. Callers that want a single catch site for
 * "the request's filter was refused" can catch this type; callers that need to
 * distinguish structural, authorization and capability problems catch the subclasses.
 * </p>
 *
 * <p><strong>Hierarchy:</strong></p>
 * <ul>
 *   <li>{@link FilterSyntaxException}: malformed expression, unknown combinator or operator</li>
 *   <li>{@link FilterValidationException}: well-formed expression carrying an invalid value</li>
 *   <li>{@link FilterDefinitionException}: custom field without a usable custom filter</li>
 *   <li>{@link FieldAuthorizationException}: field outside the caller's visible set</li>
 *   <li>{@link UnsupportedOperatorException}: operator not offered by the selected adapter</li>
 *   <li>{@link AdapterSelectionException}: no adapter could be selected for a connection</li>
 *   <li>{@link MissingCapabilityException}: a required backend feature is not available</li>
 *   <li>{@link QueryTooComplexException}: an admission rejection raised as an exception</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class FilterGateException extends RuntimeException {

    /**
     * Creates an exception with an explanatory message.
     *
     * @param message the description of the failure
     */
    public FilterGateException(String message) {
        super(message);
    }

    /**
     * Creates an exception with an explanatory message and an underlying cause.
     *
     * @param message the description of the failure
     * @param cause   the original cause
     */
    public FilterGateException(String message, Throwable cause) {
        super(message, cause);
    }
}
