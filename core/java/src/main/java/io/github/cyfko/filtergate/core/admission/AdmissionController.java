package io.github.cyfko.filtergate.core.admission;

import io.github.cyfko.filtergate.core.complexity.ComplexityAnalysis;
import io.github.cyfko.filtergate.core.complexity.ComplexityAnalyzer;
import io.github.cyfko.filtergate.core.complexity.ComplexityCache;
import io.github.cyfko.filtergate.core.config.ComplexityPolicy;
import io.github.cyfko.filtergate.core.spi.FilterAdapter;
import io.github.cyfko.filtergate.core.telemetry.ComplexityEvent;
import io.github.cyfko.filtergate.core.telemetry.ComplexityEventListener;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Gates execution of compiled queries on their estimated complexity.
 *
 * <h2>Decision</h2>
 * <ol>
 *   <li>The analysis is looked up in the {@link ComplexityCache} by adapter identity and
 *       query signature (including the result window); a miss runs the
 *       {@link ComplexityAnalyzer} and stores the result.</li>
 *   <li>The limit is the per-query override if given, else the base limit. With adaptive
 *       limits it is reduced under load:
 *       {@code limit * (1 - loadFactor * maxReductionFraction)}, clamped to
 *       {@code [min(minimumLimit, limit), limit]}.</li>
 *   <li>A score above the effective limit is rejected, a score above
 *       {@code warnThreshold * effectiveLimit} is admitted with a warning, anything else
 *       is accepted.</li>
 * </ol>
 * <p>
 * The load snapshot is read from a supplier that must not block (typically a
 * {@link LoadMonitor}). Every decision is published to the registered
 * {@link ComplexityEventListener}s. Fail-open analyses score 0 and are therefore always
 * accepted.
 * </p>
 *
 * @since 1.0.0
 */
public class AdmissionController {
    private static final Logger log = Logger.getLogger(AdmissionController.class.getName());

    static final String GENERIC_SUGGESTION =
            "Reduce the number of filter conditions or add a LIMIT clause to lower the query cost";

    private final ComplexityPolicy policy;
    private final ComplexityAnalyzer analyzer;
    private final ComplexityCache cache;
    private final Supplier<LoadSnapshot> load;
    private final List<ComplexityEventListener> listeners;

    /**
     * @param policy    complexity policy
     * @param analyzer  complexity analyzer
     * @param cache     analysis cache, used when the policy enables caching
     * @param load      non-blocking source of the current load snapshot
     * @param listeners telemetry listeners
     */
    public AdmissionController(ComplexityPolicy policy, ComplexityAnalyzer analyzer, ComplexityCache cache,
                               Supplier<LoadSnapshot> load, List<ComplexityEventListener> listeners) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.load = Objects.requireNonNull(load, "load");
        this.listeners = List.copyOf(listeners);
    }

    /**
     * Decides with the policy's base limit.
     */
    public <Q> AdmissionDecision decide(Q query, FilterAdapter<Q> adapter, AdmissionOptions options) {
        return decide(query, adapter, policy.baseLimit(), options);
    }

    /**
     * Decides whether a compiled query may run.
     *
     * @param query     compiled query
     * @param adapter   adapter that compiled it
     * @param baseLimit limit at zero load, replaced by the options' override when present
     * @param options   analysis context and per-query override
     * @param <Q>       compiled type
     * @return the decision
     */
    public <Q> AdmissionDecision decide(Q query, FilterAdapter<Q> adapter, int baseLimit, AdmissionOptions options) {
        Objects.requireNonNull(options, "options");
        ComplexityAnalysis analysis = analysis(query, adapter, options);
        LoadSnapshot snapshot = load.get();
        int limit = options.perFieldOverrideLimit() != null ? options.perFieldOverrideLimit() : baseLimit;
        double effectiveLimit = policy.adaptiveLimits()
                ? effectiveLimit(limit, snapshot.loadFactor(), policy.maxReductionFraction(), policy.minimumLimit())
                : limit;

        AdmissionDecision decision;
        ComplexityEvent.Kind kind;
        int score = analysis.normalizedScore();
        if (score > effectiveLimit) {
            List<String> suggestions = new ArrayList<>(analysis.suggestions());
            if (suggestions.isEmpty()) {
                suggestions.add(GENERIC_SUGGESTION);
            }
            RejectionPayload payload = new RejectionPayload(RejectionPayload.QUERY_TOO_COMPLEX, score,
                    analysis.cost(), effectiveLimit, suggestions);
            decision = new AdmissionDecision.Reject(analysis, effectiveLimit, payload);
            kind = ComplexityEvent.Kind.QUERY_REJECTED;
        } else if (score > policy.warnThreshold() * effectiveLimit) {
            decision = new AdmissionDecision.Warn(analysis, effectiveLimit);
            kind = ComplexityEvent.Kind.QUERY_WARNING;
        } else {
            decision = new AdmissionDecision.Accept(analysis, effectiveLimit);
            kind = ComplexityEvent.Kind.QUERY_ACCEPTED;
        }
        log.fine(() -> kind + " for " + adapter.id() + ": score " + score + ", effective limit " + effectiveLimit);
        publish(ComplexityEvent.of(kind, adapter.id(), analysis, snapshot));
        return decision;
    }

    /**
     * Adaptive limit under load.
     *
     * @param baseLimit            limit at zero load
     * @param loadFactor           load in [0, 1], clamped
     * @param maxReductionFraction fraction removed at full load
     * @param minimumLimit         floor, capped at {@code baseLimit}
     * @return the effective limit, non-increasing in {@code loadFactor}
     */
    public static double effectiveLimit(int baseLimit, double loadFactor, double maxReductionFraction, int minimumLimit) {
        double load = LoadSnapshot.clampLoad(loadFactor);
        double reduced = baseLimit * (1 - load * maxReductionFraction);
        double floor = Math.min(minimumLimit, baseLimit);
        return Math.max(floor, Math.min(baseLimit, reduced));
    }

    private <Q> ComplexityAnalysis analysis(Q query, FilterAdapter<Q> adapter, AdmissionOptions options) {
        if (!policy.cacheEnabled()) {
            return analyzer.analyze(query, adapter, options.analysis());
        }
        String signature = adapter.signature(query) + "\n" + options.analysis().relation() + "\n"
                + options.analysis().window().signature();
        String key = ComplexityCache.key(adapter.id(), signature);
        return cache.getOrCompute(key, () -> analyzer.analyze(query, adapter, options.analysis()));
    }

    private void publish(ComplexityEvent event) {
        for (ComplexityEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Complexity listener " + listener.getClass().getName() + " failed", e);
            }
        }
    }
}
