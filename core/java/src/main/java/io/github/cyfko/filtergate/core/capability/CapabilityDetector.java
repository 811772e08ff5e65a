package io.github.cyfko.filtergate.core.capability;

/**
 * Computes the capabilities of one adapter for one connection.
 * <p>
 * Detection must degrade gracefully: when the connection cannot be probed, or a probe
 * fails, the detector returns baseline capabilities without the runtime-detected
 * features and logs why.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface CapabilityDetector {

    AdapterCapabilities detect(ConnectionDescriptor connection);
}
