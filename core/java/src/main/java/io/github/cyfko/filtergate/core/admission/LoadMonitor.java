package io.github.cyfko.filtergate.core.admission;

import io.github.cyfko.filtergate.core.spi.LoadMetricsSource;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Publishes backend load snapshots refreshed on a fixed interval.
 * <p>
 * Sampling runs on a single background thread. The admission path reads the last
 * published snapshot through {@link #get()}, which never blocks and never triggers a
 * measurement, so a slow or failing metrics source adds no latency to admission. A
 * failing sample keeps the previous snapshot and logs a warning. Until the first
 * successful sample the snapshot is {@link LoadSnapshot#idle()}.
 * </p>
 *
 * <pre>{@code
 * try (LoadMonitor monitor = new LoadMonitor(new PostgresLoadMetrics(emf), Duration.ofSeconds(5))) {
 *     monitor.start();
 *     AdmissionController controller = new AdmissionController(policy, analyzer, cache, monitor, listeners);
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class LoadMonitor implements Supplier<LoadSnapshot>, AutoCloseable {
    private static final Logger log = Logger.getLogger(LoadMonitor.class.getName());

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(5);

    private final LoadMetricsSource source;
    private final Duration interval;
    private final AtomicReference<LoadSnapshot> current = new AtomicReference<>(LoadSnapshot.idle());
    private final Object lifecycleLock = new Object();
    private ScheduledExecutorService scheduler;

    public LoadMonitor(LoadMetricsSource source) {
        this(source, DEFAULT_INTERVAL);
    }

    public LoadMonitor(LoadMetricsSource source, Duration interval) {
        this.source = Objects.requireNonNull(source, "source");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, got: " + interval);
        }
    }

    /**
     * Starts periodic sampling. Calling it again while running has no effect.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                return;
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "filtergate-load-monitor");
                thread.setDaemon(true);
                return thread;
            });
            scheduler.scheduleWithFixedDelay(this::refresh, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        }
        log.fine(() -> "Load monitor started, interval " + interval);
    }

    /**
     * Takes one sample now and publishes it. Failures keep the previous snapshot.
     *
     * @return the snapshot published after the attempt
     */
    public LoadSnapshot refresh() {
        try {
            LoadSnapshot sample = source.sample();
            if (sample != null) {
                current.set(sample);
                log.fine(() -> "Load sample: " + sample);
            }
        } catch (Exception e) {
            log.log(Level.WARNING, "Load sampling failed, keeping previous snapshot", e);
        }
        return current.get();
    }

    /**
     * @return the last published snapshot
     */
    @Override
    public LoadSnapshot get() {
        return current.get();
    }

    public Duration interval() {
        return interval;
    }

    @Override
    public void close() {
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                scheduler.shutdownNow();
                scheduler = null;
            }
        }
    }
}
