package io.github.cyfko.filtergate.jpa.sqlite;

import io.github.cyfko.filtergate.core.api.ArrayOperator;
import io.github.cyfko.filtergate.core.capability.AdapterCapabilities;
import io.github.cyfko.filtergate.core.capability.CapabilityDetector;
import io.github.cyfko.filtergate.core.capability.ConnectionDescriptor;
import io.github.cyfko.filtergate.core.capability.Feature;
import io.github.cyfko.filtergate.core.capability.OperatorSets;
import io.github.cyfko.filtergate.core.capability.SqlProbe;
import io.github.cyfko.filtergate.jpa.DatabaseVersion;

import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Detects SQLite features. Compiled-in modules are discovered by trial queries: a query
 * that fails means the module is absent.
 * <p>
 * FTS5 and R*Tree only work through virtual tables, so they are reported as features but
 * add no column operator.
 * </p>
 *
 * @since 1.0.0
 */
public class SqliteCapabilityDetector implements CapabilityDetector {

    private static final Logger log = Logger.getLogger(SqliteCapabilityDetector.class.getName());

    static final String JSON1_PROBE = "SELECT json('{}')";
    static final String FTS5_PROBE = "SELECT fts5()";
    static final String RTREE_PROBE = "SELECT rtreenode(0, null)";

    @Override
    public AdapterCapabilities detect(ConnectionDescriptor connection) {
        SqlProbe probe = connection == null ? null : connection.probe();
        if (probe == null) {
            return capabilities(DatabaseVersion.UNKNOWN, false, false, false);
        }
        DatabaseVersion version;
        try {
            version = DatabaseVersion.parse(probe.queryScalar("SELECT sqlite_version()"));
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Failed to detect SQLite version", e);
            version = DatabaseVersion.UNKNOWN;
        }
        return capabilities(version, succeeds(probe, JSON1_PROBE), succeeds(probe, FTS5_PROBE),
                succeeds(probe, RTREE_PROBE));
    }

    public static AdapterCapabilities capabilities(DatabaseVersion version, boolean json1, boolean fts5, boolean rtree) {
        AdapterCapabilities.Builder builder = AdapterCapabilities.builder(SqliteFilterAdapter.ID)
                .version(version.toString())
                .feature(Feature.JSON_ARRAYS, json1, "Use a SQLite build with the JSON1 extension")
                .feature(Feature.FULL_TEXT_SEARCH, fts5, "Use a SQLite build with FTS5")
                .feature(Feature.GEO_SPATIAL, rtree, "Use a SQLite build with R*Tree");
        OperatorSets.scalarBaseline(builder);
        OperatorSets.arrays(builder, json1 ? OperatorSets.ARRAY_BASIC : Set.of(ArrayOperator.IS_NULL));
        return builder.build();
    }

    private static boolean succeeds(SqlProbe probe, String sql) {
        try {
            probe.queryScalar(sql);
            return true;
        } catch (RuntimeException e) {
            log.fine(() -> "SQLite probe failed: " + sql);
            return false;
        }
    }
}
