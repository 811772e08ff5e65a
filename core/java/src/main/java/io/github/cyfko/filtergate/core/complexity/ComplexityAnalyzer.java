package io.github.cyfko.filtergate.core.complexity;

import io.github.cyfko.filtergate.core.capability.Feature;
import io.github.cyfko.filtergate.core.config.ComplexityPolicy;
import io.github.cyfko.filtergate.core.spi.FilterAdapter;
import io.github.cyfko.filtergate.core.spi.PlanExplainer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Estimates the cost of compiled queries.
 * <p>
 * Two strategies, chosen per adapter:
 * </p>
 * <ul>
 *   <li><strong>Introspective</strong>: when the adapter's capabilities include
 *       {@link Feature#QUERY_EXPLAIN} and a {@link PlanExplainer} is registered for it, the
 *       plan-only request runs on the analyzer's executor, bounded by the policy's
 *       {@code explainTimeout}, and the plan is scored with
 *       {@link ComplexityAnalysis#normalize(double)}.</li>
 *   <li><strong>Heuristic</strong>: otherwise the original expression is scored with
 *       {@link HeuristicScorer}.</li>
 * </ul>
 *
 * <h2>Fail-open</h2>
 * <p>
 * A timeout, an explainer error or an interrupt never reaches the caller: the failure is
 * logged at {@code WARNING} and an {@link AnalysisMethod#UNKNOWN} analysis with score 0 is
 * returned, which admission control always accepts. On interrupt the in-flight plan
 * request is cancelled and the thread's interrupt flag is restored.
 * </p>
 *
 * @since 1.0.0
 */
public class ComplexityAnalyzer implements AutoCloseable {
    private static final Logger log = Logger.getLogger(ComplexityAnalyzer.class.getName());

    static final double HIGH_COST = 10_000;
    static final int MANY_JOINS = 3;

    private final Map<String, PlanExplainer<?>> explainers = new ConcurrentHashMap<>();
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final Duration explainTimeout;
    private final HeuristicScorer heuristic;

    /**
     * Creates an analyzer with its own daemon thread pool for plan requests.
     *
     * @param policy complexity policy
     */
    public ComplexityAnalyzer(ComplexityPolicy policy) {
        this(policy, Executors.newCachedThreadPool(daemonThreads()), true);
    }

    /**
     * @param policy   complexity policy
     * @param executor executor running plan requests, owned by the caller
     */
    public ComplexityAnalyzer(ComplexityPolicy policy, ExecutorService executor) {
        this(policy, executor, false);
    }

    private ComplexityAnalyzer(ComplexityPolicy policy, ExecutorService executor, boolean ownsExecutor) {
        Objects.requireNonNull(policy, "policy");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = ownsExecutor;
        this.explainTimeout = policy.explainTimeout();
        this.heuristic = new HeuristicScorer(policy.largeOffsetThreshold());
    }

    /**
     * Registers the plan explainer used for an adapter.
     *
     * @param adapterId adapter identity
     * @param explainer plan explainer accepting the adapter's compiled type
     * @param <Q>       compiled type
     */
    public <Q> void registerExplainer(String adapterId, PlanExplainer<Q> explainer) {
        explainers.put(Objects.requireNonNull(adapterId, "adapterId"), Objects.requireNonNull(explainer, "explainer"));
    }

    /**
     * Analyzes a compiled query. Never throws for backend or analysis failures.
     *
     * @param query   compiled query
     * @param adapter adapter that compiled it
     * @param options analysis context
     * @param <Q>     compiled type
     * @return the analysis, {@link AnalysisMethod#UNKNOWN} on failure
     */
    @SuppressWarnings("unchecked")
    public <Q> ComplexityAnalysis analyze(Q query, FilterAdapter<Q> adapter, AnalysisOptions options) {
        PlanExplainer<Q> explainer = (PlanExplainer<Q>) explainers.get(adapter.id());
        try {
            if (explainer != null && adapter.capabilities().supports(Feature.QUERY_EXPLAIN)) {
                return explain(query, adapter, options, explainer);
            }
            ComplexityAnalysis analysis = heuristic.score(options);
            log.fine(() -> "Heuristic complexity for " + adapter.id() + ": " + analysis.normalizedScore());
            return analysis;
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Complexity analysis failed for " + adapter.id() + ", admitting query", e);
            return ComplexityAnalysis.unknown(e.toString());
        }
    }

    private <Q> ComplexityAnalysis explain(Q query, FilterAdapter<Q> adapter, AnalysisOptions options,
                                           PlanExplainer<Q> explainer) {
        Future<PlanEstimate> future = executor.submit(() -> explainer.explain(query, options));
        try {
            PlanEstimate estimate = future.get(explainTimeout.toMillis(), TimeUnit.MILLISECONDS);
            ComplexityAnalysis analysis = fromPlan(estimate, options.window());
            log.fine(() -> "Explained complexity for " + adapter.id() + ": cost " + estimate.totalCost()
                    + ", score " + analysis.normalizedScore());
            return analysis;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warning(() -> "Query plan for " + adapter.id() + " timed out after " + explainTimeout
                    + ", admitting query");
            return ComplexityAnalysis.unknown("explain timed out after " + explainTimeout);
        } catch (ExecutionException e) {
            log.log(Level.WARNING, "Query plan for " + adapter.id() + " failed, admitting query", e.getCause());
            return ComplexityAnalysis.unknown(String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warning(() -> "Query plan for " + adapter.id() + " interrupted, admitting query");
            return ComplexityAnalysis.unknown("interrupted");
        }
    }

    /**
     * Scores a plan estimate and derives suggestions from its signals.
     *
     * @param estimate plan signals
     * @param window   result window of the query
     * @return an {@link AnalysisMethod#EXPLAIN} analysis
     */
    public static ComplexityAnalysis fromPlan(PlanEstimate estimate, QueryWindow window) {
        List<String> suggestions = new ArrayList<>();
        if (!estimate.sequentialScans().isEmpty()) {
            suggestions.add("Consider adding indexes to: " + String.join(", ", estimate.sequentialScans()));
        }
        if (window == null || !window.hasLimit()) {
            suggestions.add("Add a LIMIT clause to bound the result size");
        }
        if (estimate.totalCost() > HIGH_COST) {
            suggestions.add("Query cost is very high; narrow the filter or add selective indexes");
        }
        if (estimate.joinCount() > MANY_JOINS) {
            suggestions.add("Query joins more than " + MANY_JOINS + " relations; consider a materialized view");
        }
        if (estimate.usesFilesort()) {
            suggestions.add("Add an index covering the ORDER BY columns to avoid a filesort");
        }
        if (estimate.usesTemporaryTable()) {
            suggestions.add("Optimize GROUP BY to avoid a temporary table");
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("totalCost", estimate.totalCost());
        details.put("planRows", estimate.planRows());
        details.put("nodeCount", estimate.nodeCount());
        details.put("joinCount", estimate.joinCount());
        details.put("sequentialScans", estimate.sequentialScans());
        details.put("indexScans", estimate.indexScans());
        details.put("usesFilesort", estimate.usesFilesort());
        details.put("usesTemporaryTable", estimate.usesTemporaryTable());
        details.putAll(estimate.rawDetails());
        return new ComplexityAnalysis(estimate.totalCost(), ComplexityAnalysis.normalize(estimate.totalCost()),
                AnalysisMethod.EXPLAIN, suggestions, details);
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "filtergate-explain-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
