package io.github.cyfko.filtergate.jpa;

import io.github.cyfko.filtergate.core.api.ArrayOperator;
import io.github.cyfko.filtergate.core.api.GeoDistance;
import io.github.cyfko.filtergate.core.api.GeoOperator;
import io.github.cyfko.filtergate.core.api.JsonOperator;
import io.github.cyfko.filtergate.core.api.Operator;
import io.github.cyfko.filtergate.core.api.ScalarOperator;
import io.github.cyfko.filtergate.core.capability.AdapterCapabilities;
import io.github.cyfko.filtergate.core.exception.FilterValidationException;
import io.github.cyfko.filtergate.core.model.FieldDescriptor;
import io.github.cyfko.filtergate.core.model.FieldKind;
import io.github.cyfko.filtergate.core.spi.FilterAdapter;
import io.github.cyfko.filtergate.core.spi.OperatorOptions;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Base class of the relational adapters, compiling operators into {@link SqlCondition}s.
 * <p>
 * The scalar operators shared by every SQL dialect are rendered here; subclasses supply
 * array, JSON, geo and advanced text operators in their dialect. Values are always bound
 * as parameters, never inlined. Column references are the field's
 * {@link FieldDescriptor#storagePath() storage path}.
 * </p>
 *
 * <h2>Pattern operators</h2>
 * <p>
 * {@code _like} and its variants pass the caller's pattern untouched. The
 * {@code _starts_with}, {@code _ends_with} and {@code _contains} families escape
 * {@code %}, {@code _} and the escape character itself so the value matches literally.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class SqlFilterAdapter implements FilterAdapter<SqlCondition> {

    /** Escape character used by the literal pattern operators. */
    protected static final char ESCAPE = '!';

    private final AdapterCapabilities capabilities;

    protected SqlFilterAdapter(AdapterCapabilities capabilities) {
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
    }

    /**
     * @return the SQL dialect rendered by this adapter
     */
    public abstract SqlDialect dialect();

    @Override
    public String id() {
        return capabilities.adapterId();
    }

    @Override
    public Class<SqlCondition> compiledType() {
        return SqlCondition.class;
    }

    @Override
    public AdapterCapabilities capabilities() {
        return capabilities;
    }

    @Override
    public SqlCondition applyOperator(FieldDescriptor field, Operator operator, Object value, OperatorOptions options) {
        String column = column(field);
        if (operator instanceof ScalarOperator scalar) {
            return scalar(field, column, scalar, value, options);
        }
        if (operator instanceof ArrayOperator array) {
            return array(field, column, array, value);
        }
        if (operator instanceof JsonOperator json) {
            return json(field, column, json, value);
        }
        if (operator instanceof GeoOperator) {
            return geo(field, column, (GeoDistance) value);
        }
        throw unsupported(operator);
    }

    private SqlCondition scalar(FieldDescriptor field, String column, ScalarOperator operator, Object value,
                                OperatorOptions options) {
        FieldKind kind = field.type().kind();
        return switch (operator) {
            case EQ -> SqlCondition.of(column + " = ?", bind(kind, value));
            case NEQ -> SqlCondition.of(column + " <> ?", bind(kind, value));
            case GT -> SqlCondition.of(column + " > ?", bind(kind, value));
            case GTE -> SqlCondition.of(column + " >= ?", bind(kind, value));
            case LT -> SqlCondition.of(column + " < ?", bind(kind, value));
            case LTE -> SqlCondition.of(column + " <= ?", bind(kind, value));
            case IN -> membership(column + " IN ", kind, (List<?>) value);
            case NIN -> membership(column + " NOT IN ", kind, (List<?>) value);
            case IS_NULL -> SqlCondition.of(column + (Boolean.TRUE.equals(value) ? " IS NULL" : " IS NOT NULL"));
            case LIKE -> SqlCondition.of(column + " LIKE ?", value.toString());
            case NLIKE -> SqlCondition.of(column + " NOT LIKE ?", value.toString());
            case ILIKE -> caseInsensitiveLike(column, value.toString(), false, false);
            case NILIKE -> caseInsensitiveLike(column, value.toString(), true, false);
            case STARTS_WITH -> escapedLike(column, escape(value) + "%");
            case ENDS_WITH -> escapedLike(column, "%" + escape(value));
            case CONTAINS -> escapedLike(column, "%" + escape(value) + "%");
            case ISTARTS_WITH -> caseInsensitiveLike(column, escape(value) + "%", false, true);
            case IENDS_WITH -> caseInsensitiveLike(column, "%" + escape(value), false, true);
            case ICONTAINS -> caseInsensitiveLike(column, "%" + escape(value) + "%", false, true);
            case SEARCH, SIMILAR, FUZZY -> advancedText(column, operator, value.toString(), options);
        };
    }

    private SqlCondition membership(String prefix, FieldKind kind, List<?> items) {
        return new SqlCondition(prefix + "(" + placeholders(items.size()) + ")", bindAll(kind, items));
    }

    private static SqlCondition escapedLike(String column, String pattern) {
        return SqlCondition.of(column + " LIKE ? ESCAPE '" + ESCAPE + "'", pattern);
    }

    /**
     * Renders a case-insensitive {@code LIKE}. The default lowers both sides, which every
     * supported dialect understands.
     *
     * @param column  column reference
     * @param pattern LIKE pattern
     * @param negated whether to render {@code NOT LIKE}
     * @param escaped whether the pattern uses {@link #ESCAPE}
     * @return the condition
     */
    protected SqlCondition caseInsensitiveLike(String column, String pattern, boolean negated, boolean escaped) {
        return SqlCondition.of("LOWER(" + column + ")" + (negated ? " NOT LIKE" : " LIKE") + " LOWER(?)"
                + escapeClause(escaped), pattern);
    }

    protected static String escapeClause(boolean escaped) {
        return escaped ? " ESCAPE '" + ESCAPE + "'" : "";
    }

    /**
     * Renders {@code _search}, {@code _similar} and {@code _fuzzy}. Dialects without these
     * operators keep the default, which is unreachable once capabilities are checked.
     */
    protected SqlCondition advancedText(String column, ScalarOperator operator, String value, OperatorOptions options) {
        throw unsupported(operator);
    }

    protected abstract SqlCondition array(FieldDescriptor field, String column, ArrayOperator operator, Object value);

    protected SqlCondition json(FieldDescriptor field, String column, JsonOperator operator, Object value) {
        throw unsupported(operator);
    }

    protected SqlCondition geo(FieldDescriptor field, String column, GeoDistance distance) {
        throw unsupported(GeoOperator.ST_DWITHIN);
    }

    protected String column(FieldDescriptor field) {
        return field.storagePath();
    }

    private UnsupportedOperationException unsupported(Operator operator) {
        return new UnsupportedOperationException("Operator " + operator.symbol() + " is not rendered by adapter " + id());
    }

    @Override
    public SqlCondition combineAnd(List<SqlCondition> parts) {
        return SqlCondition.allOf(parts);
    }

    @Override
    public SqlCondition combineOr(List<SqlCondition> parts) {
        return SqlCondition.anyOf(parts);
    }

    @Override
    public SqlCondition negate(SqlCondition query) {
        return query.complement();
    }

    @Override
    public SqlCondition matchAll() {
        return SqlCondition.TRUE;
    }

    @Override
    public SqlCondition matchNone() {
        return SqlCondition.FALSE;
    }

    /**
     * The SQL text is the signature: values are placeholders, so two queries differing
     * only in their values share a signature.
     */
    @Override
    public String signature(SqlCondition query) {
        return query.sql();
    }

    // ---------------------------------------------------------------------
    // Helpers for dialects
    // ---------------------------------------------------------------------

    protected static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    protected static List<Object> bindAll(FieldKind kind, List<?> items) {
        List<Object> bound = new ArrayList<>(items.size());
        for (Object item : items) {
            bound.add(bind(kind, item));
        }
        return bound;
    }

    /**
     * Escapes LIKE wildcards so the value matches literally with {@code ESCAPE '!'}.
     */
    protected static String escape(Object value) {
        String raw = value.toString();
        StringBuilder sb = new StringBuilder(raw.length() + 4);
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == ESCAPE || c == '%' || c == '_') {
                sb.append(ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Converts a decoded JSON value into the Java type the JDBC driver expects for a
     * column of the given kind.
     *
     * @throws FilterValidationException if a textual value does not parse for the kind
     */
    protected static Object bind(FieldKind kind, Object value) {
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (!(value instanceof String) && !(value instanceof Number)) {
            return value;
        }
        try {
            return switch (kind) {
                case INTEGER -> value instanceof Number n ? (Object) n.longValue() : Long.valueOf(value.toString());
                case FLOAT -> value instanceof Number n ? (Object) n.doubleValue() : Double.valueOf(value.toString());
                case DECIMAL -> new BigDecimal(value.toString());
                case DATE -> LocalDate.parse(value.toString());
                case DATETIME -> dateTime(value.toString());
                case TIME -> LocalTime.parse(value.toString());
                case BOOLEAN -> value instanceof String s ? (Object) Boolean.valueOf(s) : value;
                default -> value;
            };
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new FilterValidationException("Value '" + value + "' is not a valid " + kind.name().toLowerCase(Locale.ROOT), e);
        }
    }

    private static Object dateTime(String value) {
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(value);
        }
    }
}
