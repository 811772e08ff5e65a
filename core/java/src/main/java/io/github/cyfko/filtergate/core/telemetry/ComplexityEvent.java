package io.github.cyfko.filtergate.core.telemetry;

import io.github.cyfko.filtergate.core.admission.LoadSnapshot;
import io.github.cyfko.filtergate.core.complexity.ComplexityAnalysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Notification emitted for every admission decision.
 *
 * @param kind         decision outcome
 * @param adapterId    adapter the query was compiled for
 * @param measurements {@code cost}, {@code complexity_score} and {@code load_factor}
 * @param analysis     the full analysis
 * @param load         the load snapshot the decision used
 * @since 1.0.0
 */
public record ComplexityEvent(
        Kind kind,
        String adapterId,
        Map<String, Double> measurements,
        ComplexityAnalysis analysis,
        LoadSnapshot load
) {

    public ComplexityEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(analysis, "analysis");
        Objects.requireNonNull(load, "load");
        measurements = Collections.unmodifiableMap(new LinkedHashMap<>(measurements));
    }

    /**
     * Builds an event with the standard measurements.
     */
    public static ComplexityEvent of(Kind kind, String adapterId, ComplexityAnalysis analysis, LoadSnapshot load) {
        Map<String, Double> measurements = new LinkedHashMap<>();
        measurements.put("cost", analysis.cost());
        measurements.put("complexity_score", (double) analysis.normalizedScore());
        measurements.put("load_factor", load.loadFactor());
        return new ComplexityEvent(kind, adapterId, measurements, analysis, load);
    }

    public enum Kind {
        QUERY_ACCEPTED,
        QUERY_WARNING,
        QUERY_REJECTED
    }
}
