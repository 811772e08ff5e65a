package io.github.cyfko.filtergate.jpa.postgres;

import io.github.cyfko.filtergate.core.admission.LoadSnapshot;
import io.github.cyfko.filtergate.core.capability.SqlProbe;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("PostgresLoadMetrics Tests")
class PostgresLoadMetricsTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private SqlProbe probe;
    private PostgresLoadMetrics metrics;

    @BeforeEach
    void setUp() {
        probe = mock(SqlProbe.class);
        metrics = new PostgresLoadMetrics(probe, 40, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Load averages connection and cache pressure")
    void averagesPressure() throws Exception {
        // Given
        when(probe.queryScalar(PostgresLoadMetrics.ACTIVE_CONNECTIONS_SQL)).thenReturn(10L);
        when(probe.queryScalar(PostgresLoadMetrics.CACHE_HIT_RATIO_SQL)).thenReturn(0.75);

        // When
        LoadSnapshot snapshot = metrics.sample();

        // Then
        assertEquals(10, snapshot.activeConnections());
        assertEquals(0.75, snapshot.cacheHitRatio());
        assertEquals(0.25, snapshot.loadFactor(), 1e-9);
        assertEquals(NOW, snapshot.sampledAt());
    }

    @Test
    @DisplayName("Connection pressure is capped and a missing ratio counts as fully cached")
    void saturated() throws Exception {
        // Given
        when(probe.queryScalar(PostgresLoadMetrics.ACTIVE_CONNECTIONS_SQL)).thenReturn(90);
        when(probe.queryScalar(PostgresLoadMetrics.CACHE_HIT_RATIO_SQL)).thenReturn(null);

        // When
        LoadSnapshot snapshot = metrics.sample();

        // Then
        assertEquals(1.0, snapshot.cacheHitRatio());
        assertEquals(0.5, snapshot.loadFactor(), 1e-9);
    }

    @Test
    @DisplayName("Probe failures propagate to the monitor")
    void failure() {
        when(probe.queryScalar(anyString())).thenThrow(new IllegalStateException("connection refused"));

        assertThrows(IllegalStateException.class, () -> metrics.sample());
    }

    @Test
    @DisplayName("Saturation must be positive")
    void saturation() {
        assertThrows(IllegalArgumentException.class, () -> new PostgresLoadMetrics(probe, 0, Clock.systemUTC()));
    }
}
