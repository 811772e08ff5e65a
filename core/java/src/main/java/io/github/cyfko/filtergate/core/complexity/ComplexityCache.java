package io.github.cyfko.filtergate.core.complexity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Time-bounded cache of complexity analyses keyed by query signature and adapter.
 *
 * <h2>Concurrency</h2>
 * <ul>
 *   <li>Reads never block each other: the store is a caller-supplied {@link ConcurrentMap}.</li>
 *   <li>An expired entry is removed lazily by the read that observes it, with a conditional
 *       remove so a fresher concurrent entry is never dropped.</li>
 *   <li>A value is inserted only after its analysis is complete, so readers never see a
 *       partial entry. Two concurrent misses on the same key may both compute; the last
 *       write wins and either result is valid.</li>
 *   <li>Fail-open ({@link AnalysisMethod#UNKNOWN}) analyses are never stored, so a transient
 *       backend failure does not pin an unknown cost for the whole TTL.</li>
 * </ul>
 *
 * <h2>Bounds</h2>
 * <p>
 * The cache holds at most {@code maxEntries} analyses. Every {@value #SWEEP_INTERVAL} writes,
 * and whenever a write takes the store past its bound, expired entries are swept; if the
 * store is still too large the oldest entries are evicted until it fits.
 * </p>
 *
 * <pre>{@code
 * ComplexityCache cache = new ComplexityCache(new ConcurrentHashMap<>(), Duration.ofMinutes(5), Clock.systemUTC());
 * String key = ComplexityCache.key("postgres", signature);
 * ComplexityAnalysis analysis = cache.getOrCompute(key, () -> analyzer.analyze(query, adapter, options));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ComplexityCache {
    private static final Logger log = Logger.getLogger(ComplexityCache.class.getName());

    public static final int DEFAULT_MAX_ENTRIES = 10_000;
    static final int SWEEP_INTERVAL = 256;

    private final ConcurrentMap<String, ComplexityCacheEntry> store;
    private final Duration ttl;
    private final Clock clock;
    private final int maxEntries;
    private final AtomicInteger writes = new AtomicInteger();

    /**
     * Creates a cache bounded to {@link #DEFAULT_MAX_ENTRIES}.
     *
     * @param store backing map owned by the caller
     * @param ttl   time to live of entries
     * @param clock time source
     */
    public ComplexityCache(ConcurrentMap<String, ComplexityCacheEntry> store, Duration ttl, Clock clock) {
        this(store, ttl, clock, DEFAULT_MAX_ENTRIES);
    }

    /**
     * @param store      backing map owned by the caller
     * @param ttl        time to live of entries
     * @param clock      time source
     * @param maxEntries maximum number of stored analyses
     */
    public ComplexityCache(ConcurrentMap<String, ComplexityCacheEntry> store, Duration ttl, Clock clock,
                           int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got: " + maxEntries);
        }
        this.store = Objects.requireNonNull(store, "store");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxEntries = maxEntries;
    }

    /**
     * Builds a cache key: SHA-256 over the adapter identity and the query signature.
     *
     * @param adapterId adapter identity
     * @param signature structural signature of the query, including its window
     * @return hex-encoded key
     */
    public static String key(String adapterId, String signature) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(adapterId.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(signature.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * @param key cache key
     * @return the cached analysis if present and within TTL
     */
    public Optional<ComplexityAnalysis> get(String key) {
        ComplexityCacheEntry entry = store.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            store.remove(key, entry);
            log.fine(() -> "Evicted expired complexity entry " + key);
            return Optional.empty();
        }
        return Optional.of(entry.analysis());
    }

    /**
     * Stores a completed analysis. Fail-open analyses are ignored.
     *
     * @param key      cache key
     * @param analysis completed analysis
     */
    public void put(String key, ComplexityAnalysis analysis) {
        if (analysis.isFailOpen()) {
            return;
        }
        store.put(key, new ComplexityCacheEntry(key, analysis, clock.instant(), ttl));
        if (writes.incrementAndGet() % SWEEP_INTERVAL == 0 || store.size() > maxEntries) {
            sweep();
        }
    }

    /**
     * Removes expired entries, then the oldest ones while the store exceeds its bound.
     */
    private void sweep() {
        Instant now = clock.instant();
        int swept = 0;
        for (ComplexityCacheEntry entry : store.values()) {
            if (entry.isExpired(now) && store.remove(entry.key(), entry)) {
                swept++;
            }
        }
        int overflow = store.size() - maxEntries;
        if (overflow > 0) {
            List<ComplexityCacheEntry> oldestFirst = new ArrayList<>(store.values());
            oldestFirst.sort(Comparator.comparing(ComplexityCacheEntry::createdAt));
            for (int i = 0; i < oldestFirst.size() && store.size() > maxEntries; i++) {
                ComplexityCacheEntry entry = oldestFirst.get(i);
                if (store.remove(entry.key(), entry)) {
                    swept++;
                }
            }
        }
        int removed = swept;
        if (removed > 0) {
            log.fine(() -> "Complexity cache sweep removed " + removed + " entries");
        }
    }

    /**
     * Returns the cached analysis or computes, stores and returns a new one.
     *
     * @param key     cache key
     * @param compute analysis to run on a miss
     * @return the analysis
     */
    public ComplexityAnalysis getOrCompute(String key, Supplier<ComplexityAnalysis> compute) {
        Optional<ComplexityAnalysis> cached = get(key);
        if (cached.isPresent()) {
            log.fine(() -> "Complexity cache hit " + key);
            return cached.get();
        }
        log.fine(() -> "Complexity cache miss " + key);
        ComplexityAnalysis analysis = compute.get();
        put(key, analysis);
        return analysis;
    }

    /**
     * @return a snapshot of the cache state
     */
    public Stats stats() {
        Instant now = clock.instant();
        int expired = 0;
        int valid = 0;
        Instant oldest = null;
        for (ComplexityCacheEntry entry : store.values()) {
            if (entry.isExpired(now)) {
                expired++;
            } else {
                valid++;
            }
            if (oldest == null || entry.createdAt().isBefore(oldest)) {
                oldest = entry.createdAt();
            }
        }
        Duration oldestAge = oldest == null ? Duration.ZERO : Duration.between(oldest, now);
        return new Stats(expired + valid, expired, valid, oldestAge, ttl);
    }

    public void clear() {
        store.clear();
    }

    /**
     * Cache state snapshot.
     *
     * @param size      number of stored entries
     * @param expired   entries past their TTL not yet evicted
     * @param valid     entries within TTL
     * @param oldestAge age of the oldest entry
     * @param ttl       configured TTL
     */
    public record Stats(int size, int expired, int valid, Duration oldestAge, Duration ttl) {
    }
}
