package io.github.cyfko.filtergate.jpa.mysql;

import io.github.cyfko.filtergate.core.api.ArrayOperator;
import io.github.cyfko.filtergate.core.api.GeoOperator;
import io.github.cyfko.filtergate.core.api.JsonOperator;
import io.github.cyfko.filtergate.core.api.OperatorCategory;
import io.github.cyfko.filtergate.core.api.ScalarOperator;
import io.github.cyfko.filtergate.core.capability.AdapterCapabilities;
import io.github.cyfko.filtergate.core.capability.CapabilityDetector;
import io.github.cyfko.filtergate.core.capability.ConnectionDescriptor;
import io.github.cyfko.filtergate.core.capability.Feature;
import io.github.cyfko.filtergate.core.capability.OperatorSets;
import io.github.cyfko.filtergate.core.model.FieldKind;
import io.github.cyfko.filtergate.jpa.DatabaseVersion;

import java.util.EnumSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Detects MySQL features from {@code VERSION()}.
 * <p>
 * JSON arrays and JSON operators need 5.7, {@code JSON_OVERLAPS} (any/all membership)
 * needs 8.0.17, FULLTEXT search needs 5.6.
 * </p>
 *
 * @since 1.0.0
 */
public class MySqlCapabilityDetector implements CapabilityDetector {

    private static final Logger log = Logger.getLogger(MySqlCapabilityDetector.class.getName());

    @Override
    public AdapterCapabilities detect(ConnectionDescriptor connection) {
        DatabaseVersion version = connection == null ? DatabaseVersion.UNKNOWN
                : connection.probeOptional().map(probe -> {
                    try {
                        return DatabaseVersion.parse(probe.queryScalar("SELECT VERSION()"));
                    } catch (RuntimeException e) {
                        log.log(Level.WARNING, "Failed to detect MySQL version", e);
                        return DatabaseVersion.UNKNOWN;
                    }
                }).orElse(DatabaseVersion.UNKNOWN);
        return capabilities(version);
    }

    public static AdapterCapabilities capabilities(DatabaseVersion version) {
        AdapterCapabilities.Builder builder = AdapterCapabilities.builder(MySqlFilterAdapter.ID)
                .version(version.toString())
                .feature(Feature.QUERY_EXPLAIN)
                .feature(Feature.FULL_TEXT_SEARCH, version.atLeast(5, 6), "Upgrade to MySQL 5.6 or later")
                .feature(Feature.JSON_ARRAYS, version.atLeast(5, 7), "Upgrade to MySQL 5.7 or later")
                .feature(Feature.JSON_OPERATIONS, version.atLeast(5, 7), "Upgrade to MySQL 5.7 or later")
                .feature(Feature.GEO_SPATIAL, version.atLeast(5, 7), "Upgrade to MySQL 5.7 or later")
                .feature(Feature.ARRAY_OVERLAP, version.atLeast(8, 0, 17), "Upgrade to MySQL 8.0.17 or later for JSON_OVERLAPS");
        OperatorSets.scalarBaseline(builder);
        OperatorSets.arrays(builder, Set.of(ArrayOperator.IS_NULL));
        if (builder.has(Feature.JSON_ARRAYS)) {
            OperatorSets.arrays(builder, OperatorSets.ARRAY_BASIC);
        }
        if (builder.has(Feature.ARRAY_OVERLAP)) {
            OperatorSets.arrays(builder, EnumSet.of(ArrayOperator.INCLUDES_ANY, ArrayOperator.EXCLUDES_ALL));
        }
        if (builder.has(Feature.FULL_TEXT_SEARCH)) {
            builder.operators(OperatorCategory.SCALAR, Set.of(ScalarOperator.SEARCH), FieldKind.STRING);
        }
        if (builder.has(Feature.JSON_OPERATIONS)) {
            builder.operators(OperatorCategory.JSON, EnumSet.of(JsonOperator.CONTAINS, JsonOperator.CONTAINED_BY,
                    JsonOperator.HAS_KEY, JsonOperator.HAS_KEYS, JsonOperator.HAS_ANY_KEYS), FieldKind.JSON);
        }
        if (builder.has(Feature.GEO_SPATIAL)) {
            builder.operators(OperatorCategory.GEO, Set.of(GeoOperator.ST_DWITHIN), FieldKind.GEO);
        }
        return builder.build();
    }
}
