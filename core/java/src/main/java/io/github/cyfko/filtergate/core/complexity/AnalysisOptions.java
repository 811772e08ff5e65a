package io.github.cyfko.filtergate.core.complexity;

import io.github.cyfko.filtergate.core.api.FilterExpression;
import io.github.cyfko.filtergate.core.model.FieldCatalog;

import java.util.Objects;

/**
 * Context of one analysis: what the compiled filter is applied to and how.
 * <p>
 * Plan explainers use the relation and window to build the plan-only request; the
 * heuristic scorer walks the original expression and resolves associations through the
 * catalog.
 * </p>
 *
 * @param expression the expression the compiled query was built from
 * @param catalog    fields of the target entity; its entity name is the relation queried
 * @param window     result window
 * @since 1.0.0
 */
public record AnalysisOptions(FilterExpression expression, FieldCatalog catalog, QueryWindow window) {

    public AnalysisOptions {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(catalog, "catalog");
        window = window == null ? QueryWindow.unbounded() : window;
    }

    /**
     * @return relation (table, index) the query targets
     */
    public String relation() {
        return catalog.entity();
    }
}
