package io.github.cyfko.filtergate.jpa;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Compiled query of the relational adapters: a SQL boolean expression with positional
 * {@code ?} placeholders and their parameters, in order.
 * <p>
 * Instances are immutable. {@link #and}, {@link #or}, {@link #not} and {@link #complement}
 * return new conditions and never alter their operands, so fragments can be shared freely.
 * </p>
 *
 * <pre>{@code
 * SqlCondition adult = SqlCondition.of("age >= ?", 18);
 * SqlCondition active = SqlCondition.of("status = ?", "active");
 * SqlCondition both = adult.and(active.not());
 * both.sql();     // "(age >= ?) AND (NOT (status = ?))"
 * both.params();  // [18, active]
 * }</pre>
 *
 * @param sql    boolean SQL expression
 * @param params positional parameters, one per placeholder
 * @since 1.0.0
 */
public record SqlCondition(String sql, List<Object> params) {

    public static final SqlCondition TRUE = new SqlCondition("1 = 1", List.of());
    public static final SqlCondition FALSE = new SqlCondition("1 = 0", List.of());

    public SqlCondition {
        Objects.requireNonNull(sql, "sql");
        params = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(params, "params")));
        int placeholders = placeholderCount(sql);
        if (placeholders != params.size()) {
            throw new IllegalArgumentException("SQL has " + placeholders + " placeholder(s) but "
                    + params.size() + " parameter(s): " + sql);
        }
    }

    public static SqlCondition of(String sql, Object... params) {
        return new SqlCondition(sql, Arrays.asList(params));
    }

    public SqlCondition and(SqlCondition other) {
        return allOf(List.of(this, other));
    }

    public SqlCondition or(SqlCondition other) {
        return anyOf(List.of(this, other));
    }

    public SqlCondition not() {
        return new SqlCondition("NOT (" + sql + ")", params);
    }

    /**
     * Two-valued negation: matches every row this condition does not match, including rows
     * where it evaluates to NULL. {@code NOT (age >= ?)} drops rows whose age is NULL,
     * {@code (age >= ?) IS NOT TRUE} keeps them.
     *
     * @return the complement of this condition
     */
    public SqlCondition complement() {
        return new SqlCondition("(" + sql + ") IS NOT TRUE", params);
    }

    public static SqlCondition allOf(List<SqlCondition> parts) {
        return join(parts, " AND ");
    }

    public static SqlCondition anyOf(List<SqlCondition> parts) {
        return join(parts, " OR ");
    }

    private static SqlCondition join(List<SqlCondition> parts, String separator) {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        StringBuilder sql = new StringBuilder();
        List<Object> params = new ArrayList<>();
        for (SqlCondition part : parts) {
            if (sql.length() > 0) {
                sql.append(separator);
            }
            sql.append('(').append(part.sql()).append(')');
            params.addAll(part.params());
        }
        return new SqlCondition(sql.toString(), params);
    }

    /**
     * Counts {@code ?} placeholders outside single-quoted literals.
     *
     * @param sql SQL text
     * @return number of placeholders
     */
    public static int placeholderCount(String sql) {
        int count = 0;
        boolean quoted = false;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (c == '?' && !quoted) {
                count++;
            }
        }
        return count;
    }
}
