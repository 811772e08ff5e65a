package io.github.cyfko.filtergate.core.exception;

/**
 * Thrown when the field definitions behind a filter are inconsistent with the adapter in use.
 * <p>
 * Unlike {@link FilterValidationException}, the caller's filter is fine: the problem sits in
 * the server-side setup, for example a custom field without a custom filter registered for
 * the adapter's compiled type, or a custom filter returning something other than that type.
 * </p>
 *
 * @since 1.0.0
 */
public class FilterDefinitionException extends FilterGateException {

    private final String field;

    /**
     * @param field   the field whose definition is broken
     * @param message the description of the inconsistency
     */
    public FilterDefinitionException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
