package io.github.cyfko.filtergate.core.spi;

import io.github.cyfko.filtergate.core.complexity.AnalysisOptions;
import io.github.cyfko.filtergate.core.complexity.PlanEstimate;

/**
 * Runs a plan-only request against a backend and extracts its cost signals.
 * <p>
 * Implementations perform a blocking round trip. The
 * {@link io.github.cyfko.filtergate.core.complexity.ComplexityAnalyzer} runs them with a
 * bounded timeout and converts any failure into a fail-open analysis, so implementations
 * may simply let exceptions propagate.
 * </p>
 *
 * @param <Q> compiled fragment type of the adapter this explainer serves
 * @since 1.0.0
 */
@FunctionalInterface
public interface PlanExplainer<Q> {

    PlanEstimate explain(Q query, AnalysisOptions options) throws Exception;
}
