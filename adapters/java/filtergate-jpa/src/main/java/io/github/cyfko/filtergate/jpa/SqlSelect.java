package io.github.cyfko.filtergate.jpa;

import io.github.cyfko.filtergate.core.complexity.QueryWindow;
import io.github.cyfko.filtergate.core.complexity.SortField;
import io.github.cyfko.filtergate.core.exception.FilterValidationException;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A {@code SELECT} over one relation, filtered by a compiled condition and shaped by a
 * window. Used both to run filtered queries and to ask the planner for an estimate.
 *
 * <pre>{@code
 * SqlSelect select = new SqlSelect("users", condition, QueryWindow.of(20, 40, SortField.desc("created_at")));
 * select.toSql(SqlDialect.POSTGRESQL);
 * // SELECT * FROM users WHERE age >= ? ORDER BY created_at DESC LIMIT 20 OFFSET 40
 * }</pre>
 *
 * @param relation table or view name
 * @param where    compiled condition
 * @param window   limit, offset and sort
 * @since 1.0.0
 */
public record SqlSelect(String relation, SqlCondition where, QueryWindow window) {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    public SqlSelect {
        requireIdentifier(relation, "relation");
        Objects.requireNonNull(where, "where");
        window = window == null ? QueryWindow.unbounded() : window;
        for (SortField sort : window.sort()) {
            requireIdentifier(sort.field(), "sort field");
        }
    }

    private static void requireIdentifier(String name, String role) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new FilterValidationException("Invalid " + role + ": " + name);
        }
    }

    public String toSql(SqlDialect dialect) {
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(relation)
                .append(" WHERE ").append(where.sql());
        if (!window.sort().isEmpty()) {
            sql.append(" ORDER BY ");
            for (int i = 0; i < window.sort().size(); i++) {
                SortField sort = window.sort().get(i);
                if (i > 0) sql.append(", ");
                sql.append(sort.field()).append(sort.descending() ? " DESC" : " ASC");
            }
        }
        sql.append(dialect.limitClause(window.limit(), window.offset()));
        return sql.toString();
    }

    public List<Object> params() {
        return where.params();
    }
}
