package io.github.cyfko.filtergate.core.telemetry;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes admission events to {@code java.util.logging}: accepted queries at {@code FINE},
 * warned and rejected queries at {@code WARNING}.
 *
 * @since 1.0.0
 */
public class LoggingComplexityListener implements ComplexityEventListener {
    private static final Logger log = Logger.getLogger(LoggingComplexityListener.class.getName());

    @Override
    public void onEvent(ComplexityEvent event) {
        Level level = event.kind() == ComplexityEvent.Kind.QUERY_ACCEPTED ? Level.FINE : Level.WARNING;
        if (!log.isLoggable(level)) {
            return;
        }
        StringBuilder message = new StringBuilder()
                .append(event.kind()).append(" on ").append(event.adapterId())
                .append(": score ").append(event.analysis().normalizedScore())
                .append(", cost ").append(event.analysis().cost())
                .append(", load ").append(event.load().loadFactor());
        if (event.kind() != ComplexityEvent.Kind.QUERY_ACCEPTED) {
            message.append('\n').append(event.analysis().format());
        }
        log.log(level, message.toString());
    }
}
