package io.github.cyfko.filtergate.core.capability;

import java.util.Objects;
import java.util.Optional;

/**
 * Identifies a storage connection for capability detection.
 *
 * @param id            stable identity used as the capability cache key (e.g. a data source name)
 * @param connectorType connector type mapped to an adapter (e.g. {@code postgresql}), {@code null} when
 *                      the data is not persisted
 * @param probe         access used by detectors to query the backend, {@code null} if unavailable
 * @since 1.0.0
 */
public record ConnectionDescriptor(String id, String connectorType, SqlProbe probe) {

    public ConnectionDescriptor {
        Objects.requireNonNull(id, "id");
    }

    /**
     * Descriptor for in-process data with no connector.
     */
    public static ConnectionDescriptor none(String id) {
        return new ConnectionDescriptor(id, null, null);
    }

    /**
     * Descriptor for a connector that cannot be probed; detectors fall back to baseline capabilities.
     */
    public static ConnectionDescriptor unprobed(String id, String connectorType) {
        return new ConnectionDescriptor(id, connectorType, null);
    }

    public boolean hasConnector() {
        return connectorType != null && !connectorType.isBlank();
    }

    public Optional<SqlProbe> probeOptional() {
        return Optional.ofNullable(probe);
    }
}
