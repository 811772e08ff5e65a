package io.github.cyfko.filtergate.spring.autoconfigure;

import io.github.cyfko.filtergate.core.config.ComplexityPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * {@code filtergate.*} settings. Unset complexity values keep those of the chosen preset.
 *
 * <pre>
 * filtergate.complexity.preset=strict
 * filtergate.complexity.base-limit=70
 * filtergate.load.refresh-interval=10s
 * filtergate.capabilities.fallback-adapter=memory
 * </pre>
 */
@ConfigurationProperties(prefix = "filtergate")
public class FilterGateProperties {
    private Complexity complexity = new Complexity();
    private Load load = new Load();
    private Capabilities capabilities = new Capabilities();

    public enum Preset { DEFAULTS, STRICT, RELAXED }

    public static class Complexity {
        private Preset preset = Preset.DEFAULTS;
        private Integer baseLimit;
        private Boolean adaptiveLimits;
        private Double warnThreshold;
        private Boolean cacheEnabled;
        private Duration cacheTtl;
        private Double maxReductionFraction;
        private Integer minimumLimit;
        private Duration explainTimeout;
        private Integer largeOffsetThreshold;

        public ComplexityPolicy toPolicy() {
            ComplexityPolicy base = switch (preset) {
                case STRICT -> ComplexityPolicy.strict();
                case RELAXED -> ComplexityPolicy.relaxed();
                case DEFAULTS -> ComplexityPolicy.defaults();
            };
            ComplexityPolicy.Builder builder = base.toBuilder();
            if (baseLimit != null) builder.baseLimit(baseLimit);
            if (adaptiveLimits != null) builder.adaptiveLimits(adaptiveLimits);
            if (warnThreshold != null) builder.warnThreshold(warnThreshold);
            if (cacheEnabled != null) builder.cacheEnabled(cacheEnabled);
            if (cacheTtl != null) builder.cacheTtl(cacheTtl);
            if (maxReductionFraction != null) builder.maxReductionFraction(maxReductionFraction);
            if (minimumLimit != null) builder.minimumLimit(minimumLimit);
            if (explainTimeout != null) builder.explainTimeout(explainTimeout);
            if (largeOffsetThreshold != null) builder.largeOffsetThreshold(largeOffsetThreshold);
            return builder.build();
        }

        public Preset getPreset() { return preset; }
        public void setPreset(Preset preset) { this.preset = preset; }
        public Integer getBaseLimit() { return baseLimit; }
        public void setBaseLimit(Integer baseLimit) { this.baseLimit = baseLimit; }
        public Boolean getAdaptiveLimits() { return adaptiveLimits; }
        public void setAdaptiveLimits(Boolean adaptiveLimits) { this.adaptiveLimits = adaptiveLimits; }
        public Double getWarnThreshold() { return warnThreshold; }
        public void setWarnThreshold(Double warnThreshold) { this.warnThreshold = warnThreshold; }
        public Boolean getCacheEnabled() { return cacheEnabled; }
        public void setCacheEnabled(Boolean cacheEnabled) { this.cacheEnabled = cacheEnabled; }
        public Duration getCacheTtl() { return cacheTtl; }
        public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }
        public Double getMaxReductionFraction() { return maxReductionFraction; }
        public void setMaxReductionFraction(Double maxReductionFraction) { this.maxReductionFraction = maxReductionFraction; }
        public Integer getMinimumLimit() { return minimumLimit; }
        public void setMinimumLimit(Integer minimumLimit) { this.minimumLimit = minimumLimit; }
        public Duration getExplainTimeout() { return explainTimeout; }
        public void setExplainTimeout(Duration explainTimeout) { this.explainTimeout = explainTimeout; }
        public Integer getLargeOffsetThreshold() { return largeOffsetThreshold; }
        public void setLargeOffsetThreshold(Integer largeOffsetThreshold) { this.largeOffsetThreshold = largeOffsetThreshold; }
    }

    public static class Load {
        private Duration refreshInterval = Duration.ofSeconds(5);

        public Duration getRefreshInterval() { return refreshInterval; }
        public void setRefreshInterval(Duration refreshInterval) { this.refreshInterval = refreshInterval; }
    }

    public static class Capabilities {
        private String fallbackAdapter;

        public String getFallbackAdapter() { return fallbackAdapter; }
        public void setFallbackAdapter(String fallbackAdapter) { this.fallbackAdapter = fallbackAdapter; }
    }

    public Complexity getComplexity() { return complexity; }
    public void setComplexity(Complexity complexity) { this.complexity = complexity; }
    public Load getLoad() { return load; }
    public void setLoad(Load load) { this.load = load; }
    public Capabilities getCapabilities() { return capabilities; }
    public void setCapabilities(Capabilities capabilities) { this.capabilities = capabilities; }
}
