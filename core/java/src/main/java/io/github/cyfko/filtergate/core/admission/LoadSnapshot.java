package io.github.cyfko.filtergate.core.admission;

import java.time.Instant;
import java.util.Objects;

/**
 * Backend load at one point in time.
 *
 * @param activeConnections active backend connections
 * @param cacheHitRatio     buffer cache hit ratio in [0, 1], 1 when unknown
 * @param loadFactor        overall load in [0, 1]
 * @param sampledAt         when the sample was taken
 * @since 1.0.0
 */
public record LoadSnapshot(int activeConnections, double cacheHitRatio, double loadFactor, Instant sampledAt) {

    public LoadSnapshot {
        Objects.requireNonNull(sampledAt, "sampledAt");
        if (loadFactor < 0 || loadFactor > 1 || Double.isNaN(loadFactor)) {
            throw new IllegalArgumentException("loadFactor must be in [0, 1], got: " + loadFactor);
        }
        if (cacheHitRatio < 0 || cacheHitRatio > 1 || Double.isNaN(cacheHitRatio)) {
            throw new IllegalArgumentException("cacheHitRatio must be in [0, 1], got: " + cacheHitRatio);
        }
    }

    /**
     * @return the snapshot published before the first sample: no load
     */
    public static LoadSnapshot idle() {
        return new LoadSnapshot(0, 1.0, 0.0, Instant.EPOCH);
    }

    /**
     * Clamps a raw load value into [0, 1].
     */
    public static double clampLoad(double raw) {
        if (Double.isNaN(raw)) {
            return 0;
        }
        return Math.max(0, Math.min(1, raw));
    }
}
