package io.github.cyfko.filtergate.jpa.postgres;

import io.github.cyfko.filtergate.core.admission.LoadSnapshot;
import io.github.cyfko.filtergate.core.capability.SqlProbe;
import io.github.cyfko.filtergate.core.spi.LoadMetricsSource;

import java.time.Clock;
import java.util.Objects;

/**
 * Samples PostgreSQL load from {@code pg_stat_activity} and {@code pg_stat_database}.
 * <p>
 * The load factor averages connection pressure (active connections over
 * {@code saturationConnections}, capped at 1) and cache pressure (one minus the buffer
 * hit ratio).
 * </p>
 *
 * @since 1.0.0
 */
public class PostgresLoadMetrics implements LoadMetricsSource {

    public static final int DEFAULT_SATURATION_CONNECTIONS = 100;

    static final String ACTIVE_CONNECTIONS_SQL =
            "SELECT count(*) FROM pg_stat_activity WHERE state = 'active'";
    static final String CACHE_HIT_RATIO_SQL =
            "SELECT CAST(sum(blks_hit) AS double precision) / NULLIF(sum(blks_hit + blks_read), 0) FROM pg_stat_database";

    private final SqlProbe probe;
    private final int saturationConnections;
    private final Clock clock;

    public PostgresLoadMetrics(SqlProbe probe) {
        this(probe, DEFAULT_SATURATION_CONNECTIONS, Clock.systemUTC());
    }

    public PostgresLoadMetrics(SqlProbe probe, int saturationConnections, Clock clock) {
        if (saturationConnections <= 0) {
            throw new IllegalArgumentException("saturationConnections must be positive, got: " + saturationConnections);
        }
        this.probe = Objects.requireNonNull(probe, "probe");
        this.saturationConnections = saturationConnections;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public LoadSnapshot sample() {
        int active = ((Number) probe.queryScalar(ACTIVE_CONNECTIONS_SQL)).intValue();
        Object ratio = probe.queryScalar(CACHE_HIT_RATIO_SQL);
        double hitRatio = ratio == null ? 1.0 : LoadSnapshot.clampLoad(((Number) ratio).doubleValue());
        double connectionLoad = Math.min(1.0, (double) active / saturationConnections);
        double load = (connectionLoad + (1.0 - hitRatio)) / 2;
        return new LoadSnapshot(active, hitRatio, LoadSnapshot.clampLoad(load), clock.instant());
    }
}
