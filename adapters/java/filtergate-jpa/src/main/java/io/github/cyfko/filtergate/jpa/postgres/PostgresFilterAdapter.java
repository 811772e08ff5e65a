package io.github.cyfko.filtergate.jpa.postgres;

import io.github.cyfko.filtergate.core.api.ArrayOperator;
import io.github.cyfko.filtergate.core.api.GeoDistance;
import io.github.cyfko.filtergate.core.api.JsonOperator;
import io.github.cyfko.filtergate.core.api.ScalarOperator;
import io.github.cyfko.filtergate.core.capability.AdapterCapabilities;
import io.github.cyfko.filtergate.core.model.FieldDescriptor;
import io.github.cyfko.filtergate.core.model.FieldKind;
import io.github.cyfko.filtergate.core.spi.OperatorOptions;
import io.github.cyfko.filtergate.jpa.JsonValues;
import io.github.cyfko.filtergate.jpa.SqlCondition;
import io.github.cyfko.filtergate.jpa.SqlDialect;
import io.github.cyfko.filtergate.jpa.SqlFilterAdapter;

import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL adapter.
 * <p>
 * Arrays are native ({@code text[]}, {@code bigint[]}...) and use {@code ANY}/{@code ALL},
 * {@code @>} and {@code &&}. JSON columns are expected to be {@code jsonb}. Text search uses
 * the {@code simple} configuration; {@code _similar} requires {@code pg_trgm},
 * {@code _fuzzy} requires {@code fuzzystrmatch} and {@code _st_dwithin} requires PostGIS.
 * </p>
 *
 * @since 1.0.0
 */
public class PostgresFilterAdapter extends SqlFilterAdapter {

    public static final String ID = "postgres";

    public PostgresFilterAdapter(AdapterCapabilities capabilities) {
        super(capabilities);
    }

    @Override
    public SqlDialect dialect() {
        return SqlDialect.POSTGRESQL;
    }

    @Override
    protected SqlCondition caseInsensitiveLike(String column, String pattern, boolean negated, boolean escaped) {
        return SqlCondition.of(column + (negated ? " NOT ILIKE ?" : " ILIKE ?") + escapeClause(escaped), pattern);
    }

    @Override
    protected SqlCondition advancedText(String column, ScalarOperator operator, String value, OperatorOptions options) {
        return switch (operator) {
            case SEARCH -> SqlCondition.of("to_tsvector('simple', " + column + ") @@ plainto_tsquery('simple', ?)", value);
            case SIMILAR -> SqlCondition.of("similarity(" + column + ", ?) > ?", value, options.similarityThreshold());
            case FUZZY -> SqlCondition.of("levenshtein(" + column + ", ?) <= ?", value, options.maxEditDistance());
            default -> super.advancedText(column, operator, value, options);
        };
    }

    @Override
    protected SqlCondition array(FieldDescriptor field, String column, ArrayOperator operator, Object value) {
        FieldKind kind = field.type().kind();
        return switch (operator) {
            case INCLUDES -> SqlCondition.of("? = ANY(" + column + ")", bind(kind, value));
            case EXCLUDES -> SqlCondition.of("NOT (? = ANY(COALESCE(" + column + ", '{}')))", bind(kind, value));
            case INCLUDES_ALL -> arrayLiteral(column + " @> ", kind, (List<?>) value);
            case EXCLUDES_ALL -> arrayLiteral(column + " && ", kind, (List<?>) value).not()
                    .or(SqlCondition.of(column + " IS NULL"));
            case INCLUDES_ANY -> arrayLiteral(column + " && ", kind, (List<?>) value);
            case EXCLUDES_ANY -> arrayLiteral(column + " @> ", kind, (List<?>) value).not()
                    .or(SqlCondition.of(column + " IS NULL"));
            case IS_EMPTY -> SqlCondition.of("COALESCE(cardinality(" + column + "), 0)"
                    + (Boolean.TRUE.equals(value) ? " = 0" : " > 0"));
            case IS_NULL -> SqlCondition.of(column + (Boolean.TRUE.equals(value) ? " IS NULL" : " IS NOT NULL"));
        };
    }

    private static SqlCondition arrayLiteral(String prefix, FieldKind kind, List<?> items) {
        String sql = prefix + "CAST(ARRAY[" + placeholders(items.size()) + "] AS " + elementType(kind) + "[])";
        return new SqlCondition(sql, bindAll(kind, items));
    }

    static String elementType(FieldKind kind) {
        return switch (kind) {
            case INTEGER -> "bigint";
            case FLOAT -> "double precision";
            case DECIMAL -> "numeric";
            case BOOLEAN -> "boolean";
            case DATE -> "date";
            case DATETIME -> "timestamp";
            case TIME -> "time";
            default -> "text";
        };
    }

    @Override
    protected SqlCondition json(FieldDescriptor field, String column, JsonOperator operator, Object value) {
        return switch (operator) {
            case CONTAINS -> SqlCondition.of(column + " @> CAST(? AS jsonb)", JsonValues.encode(value));
            case CONTAINED_BY -> SqlCondition.of(column + " <@ CAST(? AS jsonb)", JsonValues.encode(value));
            case HAS_KEY -> SqlCondition.of("jsonb_exists(" + column + ", ?)", value.toString());
            case HAS_KEYS -> keys("jsonb_exists_all", column, (List<?>) value);
            case HAS_ANY_KEYS -> keys("jsonb_exists_any", column, (List<?>) value);
            case PATH_MATCH -> SqlCondition.of(column + " @@ CAST(? AS jsonpath)", value.toString());
        };
    }

    private static SqlCondition keys(String function, String column, List<?> keys) {
        List<Object> params = new ArrayList<>(keys.size());
        for (Object key : keys) {
            params.add(key.toString());
        }
        return new SqlCondition(function + "(" + column + ", CAST(ARRAY[" + placeholders(keys.size()) + "] AS text[]))", params);
    }

    @Override
    protected SqlCondition geo(FieldDescriptor field, String column, GeoDistance distance) {
        return SqlCondition.of("ST_DWithin(CAST(" + column + " AS geography), "
                        + "CAST(ST_SetSRID(ST_MakePoint(?, ?), 4326) AS geography), ?)",
                distance.lon(), distance.lat(), distance.distanceMeters());
    }
}
