package io.github.cyfko.filtergate.core;

import io.github.cyfko.filtergate.core.admission.AdmissionController;
import io.github.cyfko.filtergate.core.admission.AdmissionDecision;
import io.github.cyfko.filtergate.core.admission.AdmissionOptions;
import io.github.cyfko.filtergate.core.api.FilterExpression;
import io.github.cyfko.filtergate.core.capability.CapabilityRegistry;
import io.github.cyfko.filtergate.core.capability.ConnectionDescriptor;
import io.github.cyfko.filtergate.core.complexity.AnalysisOptions;
import io.github.cyfko.filtergate.core.complexity.QueryWindow;
import io.github.cyfko.filtergate.core.compile.QueryBuilder;
import io.github.cyfko.filtergate.core.model.AuthorizedFieldSet;
import io.github.cyfko.filtergate.core.model.FieldCatalog;
import io.github.cyfko.filtergate.core.parsing.FilterExpressionParser;
import io.github.cyfko.filtergate.core.spi.FilterAdapter;

import java.util.Map;
import java.util.Objects;

/**
 * Entry point running the whole pipeline for one request: parse, select adapter,
 * compile, then admission control.
 *
 * <pre>{@code
 * FilterGate gate = new FilterGate(parser, queryBuilder, registry, admission);
 *
 * PreparedQuery<?> prepared = gate.prepare(rawFilter, usersCatalog, visibleFields, connection,
 *         QueryWindow.of(50, 0));
 * if (prepared.decision() instanceof AdmissionDecision.Reject reject) {
 *     return errorResponse(reject.payload());
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class FilterGate {

    private final FilterExpressionParser parser;
    private final QueryBuilder queryBuilder;
    private final CapabilityRegistry registry;
    private final AdmissionController admission;

    public FilterGate(FilterExpressionParser parser, QueryBuilder queryBuilder, CapabilityRegistry registry,
                      AdmissionController admission) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.queryBuilder = Objects.requireNonNull(queryBuilder, "queryBuilder");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.admission = Objects.requireNonNull(admission, "admission");
    }

    /**
     * Runs the pipeline on raw input, selecting the adapter from the connection.
     *
     * @param raw        raw filter object
     * @param catalog    fields of the target entity
     * @param authorized fields the caller may filter on
     * @param connection connection, {@code null} for in-memory data
     * @param window     result window
     * @return the compiled query and its decision
     */
    public PreparedQuery<?> prepare(Map<String, ?> raw, FieldCatalog catalog, AuthorizedFieldSet authorized,
                                    ConnectionDescriptor connection, QueryWindow window) {
        FilterExpression expression = parser.parse(raw, catalog);
        FilterAdapter<?> adapter = registry.select(connection);
        return prepare(expression, catalog, authorized, adapter, window, null);
    }

    /**
     * Compiles and admits an expression for a given adapter.
     *
     * @param expression    parsed filter
     * @param catalog       fields of the target entity
     * @param authorized    fields the caller may filter on
     * @param adapter       target adapter
     * @param window        result window
     * @param overrideLimit per-query limit replacing the base limit, {@code null} for none
     * @param <Q>           compiled type
     * @return the compiled query and its decision
     */
    public <Q> PreparedQuery<Q> prepare(FilterExpression expression, FieldCatalog catalog,
                                        AuthorizedFieldSet authorized, FilterAdapter<Q> adapter,
                                        QueryWindow window, Integer overrideLimit) {
        Q compiled = queryBuilder.compile(expression, catalog, authorized, adapter);
        AdmissionOptions options = new AdmissionOptions(new AnalysisOptions(expression, catalog, window), overrideLimit);
        AdmissionDecision decision = admission.decide(compiled, adapter, options);
        return new PreparedQuery<>(compiled, adapter, decision);
    }

    public FilterExpressionParser parser() {
        return parser;
    }

    public CapabilityRegistry registry() {
        return registry;
    }
}
