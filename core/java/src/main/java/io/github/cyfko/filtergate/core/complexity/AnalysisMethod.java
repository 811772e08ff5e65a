package io.github.cyfko.filtergate.core.complexity;

/**
 * How a {@link ComplexityAnalysis} was obtained.
 *
 * @since 1.0.0
 */
public enum AnalysisMethod {
    /** From the backend's query plan. */
    EXPLAIN,
    /** From static weights over the filter expression. */
    HEURISTIC,
    /** Analysis failed; the query is admitted (fail-open). */
    UNKNOWN
}
