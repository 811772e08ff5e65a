package io.github.cyfko.filtergate.jpa.sqlite;

import io.github.cyfko.filtergate.core.api.ArrayOperator;
import io.github.cyfko.filtergate.core.capability.AdapterCapabilities;
import io.github.cyfko.filtergate.core.model.FieldDescriptor;
import io.github.cyfko.filtergate.jpa.SqlCondition;
import io.github.cyfko.filtergate.jpa.SqlDialect;
import io.github.cyfko.filtergate.jpa.SqlFilterAdapter;

/**
 * SQLite adapter. Array fields are JSON text queried through the JSON1 {@code json_each}
 * table-valued function; only single-element membership and emptiness are offered.
 *
 * @since 1.0.0
 */
public class SqliteFilterAdapter extends SqlFilterAdapter {

    public static final String ID = "sqlite";

    public SqliteFilterAdapter(AdapterCapabilities capabilities) {
        super(capabilities);
    }

    @Override
    public SqlDialect dialect() {
        return SqlDialect.SQLITE;
    }

    @Override
    protected SqlCondition array(FieldDescriptor field, String column, ArrayOperator operator, Object value) {
        return switch (operator) {
            case INCLUDES -> SqlCondition.of("EXISTS (SELECT 1 FROM json_each(" + column + ") WHERE json_each.value = ?)",
                    bind(field.type().kind(), value));
            case EXCLUDES -> SqlCondition.of("NOT EXISTS (SELECT 1 FROM json_each(" + column + ") WHERE json_each.value = ?)",
                    bind(field.type().kind(), value));
            case IS_EMPTY -> SqlCondition.of("COALESCE(json_array_length(" + column + "), 0)"
                    + (Boolean.TRUE.equals(value) ? " = 0" : " > 0"));
            case IS_NULL -> SqlCondition.of(column + (Boolean.TRUE.equals(value) ? " IS NULL" : " IS NOT NULL"));
            default -> throw new UnsupportedOperationException(
                    "Operator " + operator.symbol() + " is not rendered by adapter " + id());
        };
    }
}
