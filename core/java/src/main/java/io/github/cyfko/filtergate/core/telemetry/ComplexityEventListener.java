package io.github.cyfko.filtergate.core.telemetry;

/**
 * One-way receiver of {@link ComplexityEvent}s.
 * <p>
 * Listeners are called synchronously on the admission path and must be cheap. An
 * exception thrown by a listener is logged and does not affect the decision.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ComplexityEventListener {

    void onEvent(ComplexityEvent event);
}
