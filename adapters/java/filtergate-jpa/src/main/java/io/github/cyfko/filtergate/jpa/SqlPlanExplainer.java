package io.github.cyfko.filtergate.jpa;

import io.github.cyfko.filtergate.core.complexity.AnalysisOptions;
import io.github.cyfko.filtergate.core.complexity.PlanEstimate;
import io.github.cyfko.filtergate.core.spi.PlanExplainer;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs the dialect's {@code EXPLAIN} over the {@link SqlSelect} a filter would execute
 * and hands the JSON plan to {@link #parse(String)}.
 *
 * @since 1.0.0
 */
public abstract class SqlPlanExplainer implements PlanExplainer<SqlCondition> {

    private static final Logger log = Logger.getLogger(SqlPlanExplainer.class.getName());

    private final EntityManagerFactory entityManagerFactory;
    private final SqlDialect dialect;

    protected SqlPlanExplainer(EntityManagerFactory entityManagerFactory, SqlDialect dialect) {
        this.entityManagerFactory = Objects.requireNonNull(entityManagerFactory, "entityManagerFactory");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    @Override
    public PlanEstimate explain(SqlCondition query, AnalysisOptions options) {
        SqlSelect select = new SqlSelect(options.relation(), query, options.window());
        String sql = dialect.explainPrefix() + select.toSql(dialect);
        log.fine(() -> "Explaining: " + sql);
        EntityManager em = entityManagerFactory.createEntityManager();
        try {
            List<?> rows = NativeQueries.create(em, sql, select.params()).getResultList();
            if (rows.isEmpty()) {
                throw new IllegalStateException("EXPLAIN returned no rows");
            }
            return parse(planText(rows.get(0)));
        } finally {
            em.close();
        }
    }

    private static String planText(Object row) {
        Object value = row instanceof Object[] columns ? columns[columns.length - 1] : row;
        return String.valueOf(value);
    }

    /**
     * Turns the JSON plan text into an estimate.
     *
     * @param plan EXPLAIN output
     * @return the estimate
     */
    protected abstract PlanEstimate parse(String plan);
}
