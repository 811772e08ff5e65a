package io.github.cyfko.filtergate.core.complexity;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A cached analysis. Entries are immutable and only published once fully built.
 *
 * @param key       hash of the query signature and adapter identity
 * @param analysis  cached analysis
 * @param createdAt creation instant
 * @param ttl       time to live
 * @since 1.0.0
 */
public record ComplexityCacheEntry(String key, ComplexityAnalysis analysis, Instant createdAt, Duration ttl) {

    public ComplexityCacheEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(analysis, "analysis");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(ttl, "ttl");
    }

    /**
     * @param now current instant
     * @return {@code true} once more than {@code ttl} has elapsed since creation
     */
    public boolean isExpired(Instant now) {
        return Duration.between(createdAt, now).compareTo(ttl) > 0;
    }
}
