package io.github.cyfko.filtergate.core.exception;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Thrown when a filter references fields the caller is not allowed to see.
 * <p>
 * The exception lists every offending field of the expression, in order of first
 * appearance, so a client can fix the request in a single round trip. Offending
 * fields are never silently dropped from the filter.
 * </p>
 *
 * @since 1.0.0
 */
public class FieldAuthorizationException extends FilterGateException {

    private final Set<String> fields;

    /**
     * @param fields the unauthorized field names, in order of first appearance
     */
    public FieldAuthorizationException(Set<String> fields) {
        super("Filtering on unauthorized field(s): " + String.join(", ", fields));
        this.fields = Collections.unmodifiableSet(new LinkedHashSet<>(fields));
    }

    /**
     * @return the unauthorized field names
     */
    public Set<String> getFields() {
        return fields;
    }
}
