package io.github.cyfko.filtergate.core.exception;

/**
 * Thrown when no adapter can be selected for a connection: the connector type has
 * no registered adapter and no fallback adapter is configured, or an explicit
 * override names an adapter that is not registered.
 * <p>
 * This is fatal for the request. It is distinct from the in-memory fallback used
 * when no connector is present at all, which is a normal outcome.
 * </p>
 *
 * @since 1.0.0
 */
public class AdapterSelectionException extends FilterGateException {

    public AdapterSelectionException(String message) {
        super(message);
    }
}
