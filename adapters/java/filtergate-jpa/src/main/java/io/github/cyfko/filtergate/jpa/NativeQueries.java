package io.github.cyfko.filtergate.jpa;

import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;

import java.util.List;

/**
 * Binds compiled SQL to JPA native queries.
 * <p>
 * JPA native queries use numbered {@code ?n} parameters; the anonymous {@code ?}
 * placeholders of a {@link SqlCondition} are renumbered in order, skipping quoted
 * literals.
 * </p>
 *
 * @since 1.0.0
 */
public final class NativeQueries {

    private NativeQueries() {
    }

    /**
     * Creates the native query selecting rows of {@code resultClass}.
     */
    public static Query select(EntityManager em, SqlSelect select, SqlDialect dialect, Class<?> resultClass) {
        Query query = em.createNativeQuery(numbered(select.toSql(dialect)), resultClass);
        return bind(query, select.params());
    }

    public static Query create(EntityManager em, String sql, List<Object> params) {
        return bind(em.createNativeQuery(numbered(sql)), params);
    }

    private static Query bind(Query query, List<Object> params) {
        for (int i = 0; i < params.size(); i++) {
            query.setParameter(i + 1, params.get(i));
        }
        return query;
    }

    /**
     * Rewrites {@code ?} placeholders outside single quotes to {@code ?1}, {@code ?2}...
     *
     * @param sql SQL with anonymous placeholders
     * @return SQL with numbered placeholders
     */
    public static String numbered(String sql) {
        StringBuilder sb = new StringBuilder(sql.length() + 16);
        boolean quoted = false;
        int index = 0;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            }
            sb.append(c);
            if (c == '?' && !quoted) {
                sb.append(++index);
            }
        }
        return sb.toString();
    }
}
