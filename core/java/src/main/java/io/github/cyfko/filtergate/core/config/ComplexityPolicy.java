package io.github.cyfko.filtergate.core.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of complexity analysis and admission control.
 *
 * <h2>Settings</h2>
 * <ul>
 *   <li><strong>baseLimit</strong>: maximum complexity score (0..100) admitted when the backend is idle</li>
 *   <li><strong>adaptiveLimits</strong>: lower the limit as backend load rises</li>
 *   <li><strong>warnThreshold</strong>: fraction of the effective limit above which a query is admitted with a warning</li>
 *   <li><strong>cacheEnabled</strong>: cache analyses by query signature</li>
 *   <li><strong>cacheTtl</strong>: lifetime of a cached analysis</li>
 *   <li><strong>maxReductionFraction</strong>: fraction of the base limit removed at full load</li>
 *   <li><strong>minimumLimit</strong>: floor the effective limit never goes below</li>
 *   <li><strong>explainTimeout</strong>: bound on a plan-only round trip</li>
 *   <li><strong>largeOffsetThreshold</strong>: offsets above this are penalized by the heuristic</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * ComplexityPolicy policy = ComplexityPolicy.defaults();
 *
 * // Strict (for public APIs with untrusted input)
 * ComplexityPolicy policy = ComplexityPolicy.strict();
 *
 * // Relaxed (for internal trusted systems)
 * ComplexityPolicy policy = ComplexityPolicy.relaxed();
 *
 * // Custom
 * ComplexityPolicy policy = ComplexityPolicy.builder()
 *     .baseLimit(60)
 *     .cacheTtl(Duration.ofMinutes(1))
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public record ComplexityPolicy(
        int baseLimit,
        boolean adaptiveLimits,
        double warnThreshold,
        boolean cacheEnabled,
        Duration cacheTtl,
        double maxReductionFraction,
        int minimumLimit,
        Duration explainTimeout,
        int largeOffsetThreshold
) {

    /**
     * Canonical constructor with validation.
     */
    public ComplexityPolicy {
        Objects.requireNonNull(cacheTtl, "cacheTtl");
        Objects.requireNonNull(explainTimeout, "explainTimeout");
        if (baseLimit <= 0 || baseLimit > 100) {
            throw new IllegalArgumentException("baseLimit must be in (0, 100], got: " + baseLimit);
        }
        if (warnThreshold <= 0 || warnThreshold > 1) {
            throw new IllegalArgumentException("warnThreshold must be in (0, 1], got: " + warnThreshold);
        }
        if (maxReductionFraction < 0 || maxReductionFraction > 1) {
            throw new IllegalArgumentException("maxReductionFraction must be in [0, 1], got: " + maxReductionFraction);
        }
        if (minimumLimit < 0) {
            throw new IllegalArgumentException("minimumLimit must not be negative, got: " + minimumLimit);
        }
        if (cacheTtl.isNegative() || cacheTtl.isZero()) {
            throw new IllegalArgumentException("cacheTtl must be positive, got: " + cacheTtl);
        }
        if (explainTimeout.isNegative() || explainTimeout.isZero()) {
            throw new IllegalArgumentException("explainTimeout must be positive, got: " + explainTimeout);
        }
        if (largeOffsetThreshold < 0) {
            throw new IllegalArgumentException("largeOffsetThreshold must not be negative, got: " + largeOffsetThreshold);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Base limit: 80, adaptive</li>
     *   <li>Warn above 70% of the effective limit</li>
     *   <li>Cache enabled, 5 minute TTL</li>
     *   <li>Up to 70% reduction under load, never below 20</li>
     *   <li>EXPLAIN timeout: 2 seconds</li>
     *   <li>Large offset: above 1000</li>
     * </ul>
     *
     * @return default configuration
     */
    public static ComplexityPolicy defaults() {
        return new ComplexityPolicy(
                80,                       // baseLimit
                true,                     // adaptiveLimits
                0.7,                      // warnThreshold
                true,                     // cacheEnabled
                Duration.ofMinutes(5),    // cacheTtl
                0.7,                      // maxReductionFraction
                20,                       // minimumLimit
                Duration.ofSeconds(2),    // explainTimeout
                1000                      // largeOffsetThreshold
        );
    }

    /**
     * Strict configuration for public APIs and untrusted input.
     *
     * @return strict configuration
     */
    public static ComplexityPolicy strict() {
        return new ComplexityPolicy(
                60,
                true,
                0.6,
                true,
                Duration.ofMinutes(5),
                0.8,
                15,
                Duration.ofSeconds(1),
                500
        );
    }

    /**
     * Relaxed configuration for internal trusted systems.
     *
     * @return relaxed configuration
     */
    public static ComplexityPolicy relaxed() {
        return new ComplexityPolicy(
                95,
                true,
                0.85,
                true,
                Duration.ofMinutes(10),
                0.5,
                40,
                Duration.ofSeconds(5),
                10_000
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder initialized with this policy's values
     */
    public Builder toBuilder() {
        return new Builder()
                .baseLimit(baseLimit)
                .adaptiveLimits(adaptiveLimits)
                .warnThreshold(warnThreshold)
                .cacheEnabled(cacheEnabled)
                .cacheTtl(cacheTtl)
                .maxReductionFraction(maxReductionFraction)
                .minimumLimit(minimumLimit)
                .explainTimeout(explainTimeout)
                .largeOffsetThreshold(largeOffsetThreshold);
    }

    /**
     * Builder starting from {@link #defaults()}.
     */
    public static final class Builder {
        private int baseLimit = 80;
        private boolean adaptiveLimits = true;
        private double warnThreshold = 0.7;
        private boolean cacheEnabled = true;
        private Duration cacheTtl = Duration.ofMinutes(5);
        private double maxReductionFraction = 0.7;
        private int minimumLimit = 20;
        private Duration explainTimeout = Duration.ofSeconds(2);
        private int largeOffsetThreshold = 1000;

        private Builder() {
        }

        public Builder baseLimit(int baseLimit) {
            this.baseLimit = baseLimit;
            return this;
        }

        public Builder adaptiveLimits(boolean adaptiveLimits) {
            this.adaptiveLimits = adaptiveLimits;
            return this;
        }

        public Builder warnThreshold(double warnThreshold) {
            this.warnThreshold = warnThreshold;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder maxReductionFraction(double maxReductionFraction) {
            this.maxReductionFraction = maxReductionFraction;
            return this;
        }

        public Builder minimumLimit(int minimumLimit) {
            this.minimumLimit = minimumLimit;
            return this;
        }

        public Builder explainTimeout(Duration explainTimeout) {
            this.explainTimeout = explainTimeout;
            return this;
        }

        public Builder largeOffsetThreshold(int largeOffsetThreshold) {
            this.largeOffsetThreshold = largeOffsetThreshold;
            return this;
        }

        public ComplexityPolicy build() {
            return new ComplexityPolicy(baseLimit, adaptiveLimits, warnThreshold, cacheEnabled, cacheTtl,
                    maxReductionFraction, minimumLimit, explainTimeout, largeOffsetThreshold);
        }
    }
}
