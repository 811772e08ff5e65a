package io.github.cyfko.filtergate.core.capability;

import io.github.cyfko.filtergate.core.spi.FilterAdapter;

import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * An adapter known to the {@link CapabilityRegistry}: how to detect its capabilities and
 * how to create it from them, plus the connector types it serves.
 *
 * @param adapterId      adapter identity
 * @param connectorTypes connector types routed to this adapter, matched case-insensitively
 * @param detector       capability detector
 * @param factory        creates the adapter for detected capabilities
 * @since 1.0.0
 */
public record AdapterRegistration(
        String adapterId,
        Set<String> connectorTypes,
        CapabilityDetector detector,
        Function<AdapterCapabilities, FilterAdapter<?>> factory
) {

    public AdapterRegistration {
        Objects.requireNonNull(adapterId, "adapterId");
        Objects.requireNonNull(detector, "detector");
        Objects.requireNonNull(factory, "factory");
        connectorTypes = connectorTypes == null ? Set.of() : Set.copyOf(connectorTypes);
    }
}
