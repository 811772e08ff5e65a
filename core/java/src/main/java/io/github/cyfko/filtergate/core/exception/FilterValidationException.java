package io.github.cyfko.filtergate.core.exception;

/**
 * Thrown when a structurally valid filter carries a value the compiler cannot accept.
 * <p>
 * Raised during compilation for problems such as:
 * </p>
 * <ul>
 *   <li>an enum value that is not part of the enum's external value mapping</li>
 *   <li>a list-valued operator ({@code _in}, {@code _includes_any}, ...) given a scalar</li>
 *   <li>a boolean operator ({@code _is_null}, {@code _is_empty}) given a non-boolean</li>
 *   <li>a membership list larger than the adapter's {@code maxInItems} limit</li>
 * </ul>
 *
 * <pre>{@code
 * // status is Enum(Status) with external values ACTIVE, TRIAL
 * {"status": {"_eq": "DELETED"}}
 * // → FilterValidationException: Value 'DELETED' is not a member of enum Status for field 'status'
 * }</pre>
 *
 * @since 1.0.0
 */
public class FilterValidationException extends FilterGateException {

    /**
     * Creates an exception with an explanatory message.
     *
     * @param message the description of the invalid value, should be specific and actionable
     */
    public FilterValidationException(String message) {
        super(message);
    }

    /**
     * Creates an exception with an explanatory message and an underlying cause.
     *
     * @param message the description of the invalid value
     * @param cause   the original cause (e.g. a parse failure)
     */
    public FilterValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
