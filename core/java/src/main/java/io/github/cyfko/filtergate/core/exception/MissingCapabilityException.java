package io.github.cyfko.filtergate.core.exception;

import io.github.cyfko.filtergate.core.capability.Feature;

/**
 * Thrown by {@link io.github.cyfko.filtergate.core.capability.AdapterCapabilities#require(Feature)}
 * when a backend feature is needed but was not detected.
 *
 * @since 1.0.0
 */
public class MissingCapabilityException extends FilterGateException {

    private final String adapterId;
    private final Feature feature;

    /**
     * @param adapterId the adapter whose capabilities were checked
     * @param feature   the missing feature
     * @param hint      how the feature can be made available (extension, version), may be empty
     */
    public MissingCapabilityException(String adapterId, Feature feature, String hint) {
        super("Adapter '" + adapterId + "' does not support " + feature.description()
                + (hint == null || hint.isBlank() ? "" : ". " + hint));
        this.adapterId = adapterId;
        this.feature = feature;
    }

    public String getAdapterId() {
        return adapterId;
    }

    public Feature getFeature() {
        return feature;
    }
}
