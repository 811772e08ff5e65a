package io.github.cyfko.filtergate.jpa.mysql;

import io.github.cyfko.filtergate.core.admission.LoadSnapshot;
import io.github.cyfko.filtergate.core.capability.SqlProbe;
import io.github.cyfko.filtergate.core.spi.LoadMetricsSource;

import java.time.Clock;
import java.util.Objects;

/**
 * Samples MySQL load from {@code Threads_connected}. MySQL exposes no cheap hit ratio, so
 * the load factor is connection pressure alone.
 *
 * @since 1.0.0
 */
public class MySqlLoadMetrics implements LoadMetricsSource {

    public static final int DEFAULT_SATURATION_CONNECTIONS = 100;

    static final String THREADS_CONNECTED_SQL = "SHOW STATUS LIKE 'Threads_connected'";

    private final SqlProbe probe;
    private final int saturationConnections;
    private final Clock clock;

    public MySqlLoadMetrics(SqlProbe probe) {
        this(probe, DEFAULT_SATURATION_CONNECTIONS, Clock.systemUTC());
    }

    public MySqlLoadMetrics(SqlProbe probe, int saturationConnections, Clock clock) {
        if (saturationConnections <= 0) {
            throw new IllegalArgumentException("saturationConnections must be positive, got: " + saturationConnections);
        }
        this.probe = Objects.requireNonNull(probe, "probe");
        this.saturationConnections = saturationConnections;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public LoadSnapshot sample() {
        Object row = probe.queryScalar(THREADS_CONNECTED_SQL);
        // (Variable_name, Value)
        Object value = row instanceof Object[] columns ? columns[columns.length - 1] : row;
        int connected = Integer.parseInt(String.valueOf(value).trim());
        double load = Math.min(1.0, (double) connected / saturationConnections);
        return new LoadSnapshot(connected, 1.0, LoadSnapshot.clampLoad(load), clock.instant());
    }
}
