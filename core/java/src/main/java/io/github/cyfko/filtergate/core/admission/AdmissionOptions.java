package io.github.cyfko.filtergate.core.admission;

import io.github.cyfko.filtergate.core.complexity.AnalysisOptions;

import java.util.Objects;

/**
 * Per-decision admission settings.
 *
 * @param analysis              context passed to the analyzer
 * @param perFieldOverrideLimit limit replacing the base limit for this query only, {@code null} for none
 * @since 1.0.0
 */
public record AdmissionOptions(AnalysisOptions analysis, Integer perFieldOverrideLimit) {

    public AdmissionOptions {
        Objects.requireNonNull(analysis, "analysis");
        if (perFieldOverrideLimit != null && (perFieldOverrideLimit <= 0 || perFieldOverrideLimit > 100)) {
            throw new IllegalArgumentException("perFieldOverrideLimit must be in (0, 100], got: " + perFieldOverrideLimit);
        }
    }

    public static AdmissionOptions of(AnalysisOptions analysis) {
        return new AdmissionOptions(analysis, null);
    }
}
