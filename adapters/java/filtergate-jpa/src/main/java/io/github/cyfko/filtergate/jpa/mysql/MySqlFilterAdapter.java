package io.github.cyfko.filtergate.jpa.mysql;

import io.github.cyfko.filtergate.core.api.ArrayOperator;
import io.github.cyfko.filtergate.core.api.GeoDistance;
import io.github.cyfko.filtergate.core.api.JsonOperator;
import io.github.cyfko.filtergate.core.api.ScalarOperator;
import io.github.cyfko.filtergate.core.capability.AdapterCapabilities;
import io.github.cyfko.filtergate.core.model.FieldDescriptor;
import io.github.cyfko.filtergate.core.spi.OperatorOptions;
import io.github.cyfko.filtergate.jpa.JsonValues;
import io.github.cyfko.filtergate.jpa.SqlCondition;
import io.github.cyfko.filtergate.jpa.SqlDialect;
import io.github.cyfko.filtergate.jpa.SqlFilterAdapter;

import java.util.ArrayList;
import java.util.List;

/**
 * MySQL / MariaDB adapter.
 * <p>
 * MySQL has no array type: array fields are JSON arrays queried with
 * {@code JSON_CONTAINS} and, from 8.0.17, {@code JSON_OVERLAPS}. A {@code NULL} array
 * behaves like an empty one. {@code _search} needs a FULLTEXT index on the column.
 * </p>
 *
 * @since 1.0.0
 */
public class MySqlFilterAdapter extends SqlFilterAdapter {

    public static final String ID = "mysql";

    public MySqlFilterAdapter(AdapterCapabilities capabilities) {
        super(capabilities);
    }

    @Override
    public SqlDialect dialect() {
        return SqlDialect.MYSQL;
    }

    @Override
    protected SqlCondition advancedText(String column, ScalarOperator operator, String value, OperatorOptions options) {
        if (operator == ScalarOperator.SEARCH) {
            return SqlCondition.of("MATCH(" + column + ") AGAINST (? IN NATURAL LANGUAGE MODE)", value);
        }
        return super.advancedText(column, operator, value, options);
    }

    @Override
    protected SqlCondition array(FieldDescriptor field, String column, ArrayOperator operator, Object value) {
        return switch (operator) {
            case INCLUDES -> SqlCondition.of("JSON_CONTAINS(" + column + ", CAST(? AS JSON))", JsonValues.encode(value));
            case EXCLUDES -> SqlCondition.of("(" + column + " IS NULL OR NOT JSON_CONTAINS(" + column
                    + ", CAST(? AS JSON)))", JsonValues.encode(value));
            case INCLUDES_ANY -> SqlCondition.of("JSON_OVERLAPS(" + column + ", CAST(? AS JSON))", JsonValues.encode(value));
            case EXCLUDES_ALL -> SqlCondition.of("(" + column + " IS NULL OR NOT JSON_OVERLAPS(" + column
                    + ", CAST(? AS JSON)))", JsonValues.encode(value));
            case IS_EMPTY -> SqlCondition.of("COALESCE(JSON_LENGTH(" + column + "), 0)"
                    + (Boolean.TRUE.equals(value) ? " = 0" : " > 0"));
            case IS_NULL -> SqlCondition.of(column + (Boolean.TRUE.equals(value) ? " IS NULL" : " IS NOT NULL"));
            case INCLUDES_ALL, EXCLUDES_ANY -> throw new UnsupportedOperationException(
                    "Operator " + operator.symbol() + " is not rendered by adapter " + id());
        };
    }

    @Override
    protected SqlCondition json(FieldDescriptor field, String column, JsonOperator operator, Object value) {
        return switch (operator) {
            case CONTAINS -> SqlCondition.of("JSON_CONTAINS(" + column + ", CAST(? AS JSON))", JsonValues.encode(value));
            case CONTAINED_BY -> SqlCondition.of("JSON_CONTAINS(CAST(? AS JSON), " + column + ")", JsonValues.encode(value));
            case HAS_KEY -> SqlCondition.of("JSON_CONTAINS_PATH(" + column + ", 'one', ?)", keyPath(value));
            case HAS_KEYS -> keyPaths(column, "'all'", (List<?>) value);
            case HAS_ANY_KEYS -> keyPaths(column, "'one'", (List<?>) value);
            case PATH_MATCH -> throw new UnsupportedOperationException(
                    "Operator " + operator.symbol() + " is not rendered by adapter " + id());
        };
    }

    private static SqlCondition keyPaths(String column, String mode, List<?> keys) {
        List<Object> paths = new ArrayList<>(keys.size());
        for (Object key : keys) {
            paths.add(keyPath(key));
        }
        return new SqlCondition("JSON_CONTAINS_PATH(" + column + ", " + mode + ", " + placeholders(keys.size()) + ")", paths);
    }

    private static String keyPath(Object key) {
        return "$." + JsonValues.encode(key.toString());
    }

    @Override
    protected SqlCondition geo(FieldDescriptor field, String column, GeoDistance distance) {
        return SqlCondition.of("ST_Distance_Sphere(" + column + ", POINT(?, ?)) <= ?",
                distance.lon(), distance.lat(), distance.distanceMeters());
    }
}
