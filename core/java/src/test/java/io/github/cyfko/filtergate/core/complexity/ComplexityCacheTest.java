package io.github.cyfko.filtergate.core.complexity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ComplexityCache Tests")
class ComplexityCacheTest {

    private MutableClock clock;
    private ConcurrentHashMap<String, ComplexityCacheEntry> store;
    private ComplexityCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        store = new ConcurrentHashMap<>();
        cache = new ComplexityCache(store, Duration.ofMinutes(5), clock);
    }

    private static ComplexityAnalysis analysis(int score) {
        return new ComplexityAnalysis(score * 100.0, score, AnalysisMethod.HEURISTIC, List.of(), Map.of());
    }

    @Test
    @DisplayName("Keys depend on both adapter and signature")
    void keys() {
        String key = ComplexityCache.key("postgres", "age > ?");

        assertEquals(64, key.length());
        assertEquals(key, ComplexityCache.key("postgres", "age > ?"));
        assertNotEquals(key, ComplexityCache.key("mysql", "age > ?"));
        assertNotEquals(key, ComplexityCache.key("postgres", "age < ?"));
    }

    @Test
    @DisplayName("Computes once within the TTL")
    void computeOnce() {
        // Given
        AtomicInteger computations = new AtomicInteger();

        // When
        ComplexityAnalysis first = cache.getOrCompute("k", () -> {
            computations.incrementAndGet();
            return analysis(40);
        });
        clock.advance(Duration.ofMinutes(4));
        ComplexityAnalysis second = cache.getOrCompute("k", () -> {
            computations.incrementAndGet();
            return analysis(90);
        });

        // Then
        assertEquals(1, computations.get());
        assertEquals(first, second);
    }

    @Test
    @DisplayName("Expired entries are evicted on read and recomputed")
    void expiry() {
        // Given
        cache.put("k", analysis(40));
        clock.advance(Duration.ofMinutes(5).plusSeconds(1));

        // When
        ComplexityAnalysis recomputed = cache.getOrCompute("k", () -> analysis(70));

        // Then
        assertEquals(70, recomputed.normalizedScore());
        assertEquals(70, store.get("k").analysis().normalizedScore());
    }

    @Test
    @DisplayName("Fail-open analyses are never stored")
    void failOpenNotStored() {
        // When
        cache.getOrCompute("k", () -> ComplexityAnalysis.unknown("timeout"));

        // Then
        assertTrue(store.isEmpty());
        assertTrue(cache.get("k").isEmpty());
    }

    @Test
    @DisplayName("Stats count valid and expired entries")
    void stats() {
        // Given
        cache.put("old", analysis(10));
        clock.advance(Duration.ofMinutes(6));
        cache.put("fresh", analysis(20));

        // When
        ComplexityCache.Stats stats = cache.stats();

        // Then
        assertEquals(2, stats.size());
        assertEquals(1, stats.expired());
        assertEquals(1, stats.valid());
        assertEquals(Duration.ofMinutes(6), stats.oldestAge());
        assertEquals(Duration.ofMinutes(5), stats.ttl());
    }

    @Test
    @DisplayName("Oldest entries are evicted once the bound is exceeded")
    void boundedSize() {
        // Given
        ComplexityCache bounded = new ComplexityCache(store, Duration.ofMinutes(5), clock, 3);

        // When
        for (String key : List.of("a", "b", "c", "d")) {
            bounded.put(key, analysis(10));
            clock.advance(Duration.ofSeconds(1));
        }

        // Then
        assertEquals(3, store.size());
        assertFalse(store.containsKey("a"));
        assertTrue(store.keySet().containsAll(List.of("b", "c", "d")));
    }

    @Test
    @DisplayName("Expired entries are swept before live ones are evicted")
    void expiredSweptFirst() {
        // Given
        ComplexityCache bounded = new ComplexityCache(store, Duration.ofMinutes(5), clock, 2);
        bounded.put("stale", analysis(10));
        clock.advance(Duration.ofMinutes(6));
        bounded.put("x", analysis(20));

        // When
        bounded.put("y", analysis(30));

        // Then
        assertEquals(2, store.size());
        assertTrue(store.keySet().containsAll(List.of("x", "y")));
    }

    @Test
    @DisplayName("Expired entries do not pile up under a steady stream of new keys")
    void periodicSweep() {
        // When
        for (int i = 0; i < 2_000; i++) {
            cache.put("k" + i, analysis(10));
            clock.advance(Duration.ofSeconds(1));
        }

        // Then
        ComplexityCache.Stats stats = cache.stats();
        assertTrue(stats.size() <= 300 + ComplexityCache.SWEEP_INTERVAL, "size was " + stats.size());
        assertTrue(stats.valid() >= 299);
    }

    @Test
    @DisplayName("The bound must be positive")
    void positiveBound() {
        assertThrows(IllegalArgumentException.class,
                () -> new ComplexityCache(store, Duration.ofMinutes(5), clock, 0));
    }

    @Test
    @DisplayName("Clear drops every entry")
    void clear() {
        cache.put("k", analysis(10));

        cache.clear();

        assertEquals(0, cache.stats().size());
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
