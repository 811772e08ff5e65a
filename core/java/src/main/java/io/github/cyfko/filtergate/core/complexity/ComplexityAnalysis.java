package io.github.cyfko.filtergate.core.complexity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Estimated expense of one compiled query.
 *
 * @param cost            raw cost in backend units (or heuristic units)
 * @param normalizedScore cost mapped to 0..100
 * @param method          how the estimate was obtained
 * @param suggestions     actionable advice to make the query cheaper
 * @param rawDetails      signals the estimate was derived from
 * @since 1.0.0
 */
public record ComplexityAnalysis(
        double cost,
        int normalizedScore,
        AnalysisMethod method,
        List<String> suggestions,
        Map<String, Object> rawDetails
) {

    public ComplexityAnalysis {
        Objects.requireNonNull(method, "method");
        if (normalizedScore < 0 || normalizedScore > 100) {
            throw new IllegalArgumentException("normalizedScore must be in [0, 100], got: " + normalizedScore);
        }
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        rawDetails = rawDetails == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawDetails));
    }

    /**
     * Fail-open result: zero score, so the query is always admitted.
     *
     * @param reason why analysis failed
     * @return an {@link AnalysisMethod#UNKNOWN} analysis
     */
    public static ComplexityAnalysis unknown(String reason) {
        return new ComplexityAnalysis(0, 0, AnalysisMethod.UNKNOWN, List.of(), Map.of("error", String.valueOf(reason)));
    }

    /**
     * Maps a raw plan cost to a 0..100 score on a logarithmic scale:
     * {@code min(100, round(20 * log10(1 + cost)))}. Cost 10 scores 21, cost 1 000 scores 60
     * and any cost from 100 000 up scores 100.
     *
     * @param cost raw cost, negative values count as zero
     * @return normalized score
     */
    public static int normalize(double cost) {
        if (Double.isNaN(cost) || cost <= 0) {
            return 0;
        }
        if (Double.isInfinite(cost)) {
            return 100;
        }
        return (int) Math.min(100, Math.round(20 * Math.log10(1 + cost)));
    }

    public boolean isFailOpen() {
        return method == AnalysisMethod.UNKNOWN;
    }

    /**
     * Renders a human-readable report.
     *
     * @return multi-line report
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("Query complexity: ").append(normalizedScore).append("/100 (")
                .append(method.name().toLowerCase(Locale.ROOT)).append(")\n");
        sb.append("Estimated cost: ").append(String.format(Locale.ROOT, "%.2f", cost)).append('\n');
        if (!rawDetails.isEmpty()) {
            sb.append("Details:\n");
            rawDetails.forEach((key, value) -> sb.append("  ").append(key).append(": ").append(value).append('\n'));
        }
        if (!suggestions.isEmpty()) {
            sb.append("Suggestions:\n");
            suggestions.forEach(s -> sb.append("  - ").append(s).append('\n'));
        }
        return sb.toString().stripTrailing();
    }
}
