package io.github.cyfko.filtergate.core.capability;

import java.util.List;

/**
 * Minimal read access to a SQL connection, used by capability detectors to run
 * version and extension probes.
 * <p>
 * Implementations may throw any runtime exception; detectors treat a failing probe
 * as "feature not available" and log it.
 * </p>
 *
 * @since 1.0.0
 */
public interface SqlProbe {

    /**
     * @param sql a query returning one row with one column
     * @return the value of that column, possibly {@code null}
     */
    Object queryScalar(String sql);

    /**
     * @param sql a query returning one column
     * @return the column values, in row order
     */
    List<Object> queryColumn(String sql);
}
