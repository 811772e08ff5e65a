package io.github.cyfko.filtergate.core.spi;

import io.github.cyfko.filtergate.core.admission.LoadSnapshot;

/**
 * Samples the current load of a backend. Called out-of-band by the
 * {@link io.github.cyfko.filtergate.core.admission.LoadMonitor}, never on the request path.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface LoadMetricsSource {

    LoadSnapshot sample() throws Exception;
}
