package io.github.cyfko.filtergate.core.exception;

/**
 * Thrown when a raw filter input cannot be turned into a well-formed
 * {@link io.github.cyfko.filtergate.core.api.FilterExpression}.
 * <p>
 * Typical causes are an unknown combinator key ({@code _xor}), an operator symbol
 * that does not exist for the field's category, a leaf without a field name, or an
 * operator map that is not a map. These errors are always surfaced to the caller and
 * are never retried.
 * </p>
 *
 * <pre>{@code
 * parser.parse(Map.of("_xor", List.of()), catalog);
 * // → FilterSyntaxException: Unknown combinator '_xor' at $
 * }</pre>
 *
 * @since 1.0.0
 */
public class FilterSyntaxException extends FilterGateException {

    private final String path;

    /**
     * @param message description of the structural problem
     */
    public FilterSyntaxException(String message) {
        this(message, null, null);
    }

    /**
     * @param message description of the structural problem
     * @param path    location in the input where the problem was found (e.g. {@code $._and[1].age})
     */
    public FilterSyntaxException(String message, String path) {
        this(message, path, null);
    }

    /**
     * @param message description of the structural problem
     * @param path    location in the input, may be {@code null}
     * @param cause   the underlying cause, typically a JSON processing error
     */
    public FilterSyntaxException(String message, String path, Throwable cause) {
        super(path == null ? message : message + " at " + path, cause);
        this.path = path;
    }

    /**
     * @return the location of the problem in the raw input, or {@code null} if unknown
     */
    public String getPath() {
        return path;
    }
}
