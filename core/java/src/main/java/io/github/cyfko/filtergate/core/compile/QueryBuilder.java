package io.github.cyfko.filtergate.core.compile;

import io.github.cyfko.filtergate.core.api.ArrayOperator;
import io.github.cyfko.filtergate.core.api.FilterExpression;
import io.github.cyfko.filtergate.core.api.GeoDistance;
import io.github.cyfko.filtergate.core.api.GeoOperator;
import io.github.cyfko.filtergate.core.api.JsonOperator;
import io.github.cyfko.filtergate.core.api.Operator;
import io.github.cyfko.filtergate.core.api.ScalarOperator;
import io.github.cyfko.filtergate.core.capability.AdapterCapabilities;
import io.github.cyfko.filtergate.core.exception.FieldAuthorizationException;
import io.github.cyfko.filtergate.core.exception.FilterDefinitionException;
import io.github.cyfko.filtergate.core.exception.FilterSyntaxException;
import io.github.cyfko.filtergate.core.exception.FilterValidationException;
import io.github.cyfko.filtergate.core.exception.UnsupportedOperatorException;
import io.github.cyfko.filtergate.core.model.AuthorizedFieldSet;
import io.github.cyfko.filtergate.core.model.EnumDefinition;
import io.github.cyfko.filtergate.core.model.FieldCatalog;
import io.github.cyfko.filtergate.core.model.FieldDescriptor;
import io.github.cyfko.filtergate.core.spi.CustomFilter;
import io.github.cyfko.filtergate.core.spi.FilterAdapter;
import io.github.cyfko.filtergate.core.spi.OperatorOptions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Compiles a {@link FilterExpression} into an adapter's native query form.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Every leaf field is checked against the {@link AuthorizedFieldSet} first. All
 *       offending fields are reported together and no adapter call is made.</li>
 *   <li>The tree is then walked depth first. {@code And}, {@code Or} and {@code Not}
 *       compile their children and call the adapter's combinators.</li>
 *   <li>At each leaf, every operator is checked against the field's own restriction and
 *       the adapter's capabilities for the field's category and kind, its value is
 *       coerced, and the resulting fragments are combined with AND.</li>
 * </ol>
 *
 * <h2>Value coercion</h2>
 * <ul>
 *   <li>enum values are translated through the enum's external to internal mapping</li>
 *   <li>list operators require a collection no larger than the adapter's {@code maxInItems}</li>
 *   <li>{@code _is_null} and {@code _is_empty} require a boolean</li>
 *   <li>{@code _st_dwithin} values become a {@link GeoDistance}</li>
 * </ul>
 *
 * <h2>Empty lists</h2>
 * <p>
 * List operators given an empty list never reach the adapter; they compile to the
 * adapter's match-all or match-none fragment so every backend agrees:
 * </p>
 * <table>
 *   <caption>Empty list semantics</caption>
 *   <tr><th>Operator</th><th>Matches</th></tr>
 *   <tr><td>{@code _in []}</td><td>nothing</td></tr>
 *   <tr><td>{@code _nin []}</td><td>everything</td></tr>
 *   <tr><td>{@code _includes_all []}</td><td>everything</td></tr>
 *   <tr><td>{@code _includes_any []}</td><td>nothing</td></tr>
 *   <tr><td>{@code _excludes_all []}</td><td>everything</td></tr>
 *   <tr><td>{@code _excludes_any []}</td><td>nothing</td></tr>
 *   <tr><td>{@code _has_keys []}</td><td>everything</td></tr>
 *   <tr><td>{@code _has_any_keys []}</td><td>nothing</td></tr>
 * </table>
 *
 * <h2>Custom fields</h2>
 * <p>
 * Fields declared {@code custom} bypass the adapter: the function registered in the
 * {@link CustomFilterRegistry} receives the adapter's match-all fragment, the operator
 * and the raw value, and its result is used as is after a runtime type check.
 * </p>
 *
 * <p>
 * Compilation is pure: no I/O, no shared mutable state, and identical inputs yield equal
 * compiled queries. Instances are thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class QueryBuilder {
    private static final Logger log = Logger.getLogger(QueryBuilder.class.getName());

    private final CustomFilterRegistry customFilters;
    private final OperatorOptions options;

    public QueryBuilder() {
        this(new CustomFilterRegistry(), OperatorOptions.defaults());
    }

    public QueryBuilder(CustomFilterRegistry customFilters, OperatorOptions options) {
        this.customFilters = Objects.requireNonNull(customFilters, "customFilters");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Compiles an expression for an adapter.
     *
     * @param expression the parsed filter
     * @param catalog    fields of the target entity
     * @param authorized fields the caller may filter on
     * @param adapter    target adapter
     * @param <Q>        compiled type of the adapter
     * @return the compiled query
     * @throws FieldAuthorizationException   if any leaf references an unauthorized field
     * @throws FilterSyntaxException         if a leaf references a field missing from the catalog
     * @throws UnsupportedOperatorException  if the adapter or the field does not allow an operator
     * @throws FilterValidationException     if a value cannot be coerced
     */
    public <Q> Q compile(FilterExpression expression, FieldCatalog catalog, AuthorizedFieldSet authorized,
                         FilterAdapter<Q> adapter) {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(authorized, "authorized");
        Objects.requireNonNull(adapter, "adapter");

        Set<String> unauthorized = new LinkedHashSet<>();
        expression.forEachLeaf(leaf -> {
            if (!authorized.permits(leaf.field())) {
                unauthorized.add(leaf.field());
            }
        });
        if (!unauthorized.isEmpty()) {
            throw new FieldAuthorizationException(unauthorized);
        }

        Q compiled = compileNode(expression, catalog, adapter);
        log.fine(() -> "Compiled filter on " + catalog.entity() + " for " + adapter.id() + ": "
                + adapter.signature(compiled));
        return compiled;
    }

    private <Q> Q compileNode(FilterExpression node, FieldCatalog catalog, FilterAdapter<Q> adapter) {
        if (node instanceof FilterExpression.And and) {
            if (and.children().isEmpty()) {
                return adapter.matchAll();
            }
            return adapter.combineAnd(compileAll(and.children(), catalog, adapter));
        }
        if (node instanceof FilterExpression.Or or) {
            if (or.children().isEmpty()) {
                return adapter.matchNone();
            }
            return adapter.combineOr(compileAll(or.children(), catalog, adapter));
        }
        if (node instanceof FilterExpression.Not not) {
            return adapter.negate(compileNode(not.child(), catalog, adapter));
        }
        return compileLeaf((FilterExpression.Leaf) node, catalog, adapter);
    }

    private <Q> List<Q> compileAll(List<FilterExpression> children, FieldCatalog catalog, FilterAdapter<Q> adapter) {
        List<Q> parts = new ArrayList<>(children.size());
        for (FilterExpression child : children) {
            parts.add(compileNode(child, catalog, adapter));
        }
        return parts;
    }

    private <Q> Q compileLeaf(FilterExpression.Leaf leaf, FieldCatalog catalog, FilterAdapter<Q> adapter) {
        FieldDescriptor field = catalog.field(leaf.field())
                .orElseThrow(() -> new FilterSyntaxException("Unknown field '" + leaf.field() + "' for "
                        + catalog.entity()));
        AdapterCapabilities capabilities = adapter.capabilities();

        List<Q> parts = new ArrayList<>(leaf.operators().size());
        for (Map.Entry<Operator, Object> entry : leaf.operators().entrySet()) {
            Operator operator = entry.getKey();
            if (operator.category() != field.type().category()) {
                throw new FilterSyntaxException("Operator " + operator.symbol() + " does not apply to "
                        + field.type().category() + " field '" + field.name() + "'");
            }
            if (field.custom()) {
                if (!field.permits(operator)) {
                    throw new UnsupportedOperatorException(field.name(), operator, "custom");
                }
                parts.add(applyCustom(field, operator, entry.getValue(), adapter));
                continue;
            }
            if (!field.permits(operator)
                    || !capabilities.supports(field.type().category(), field.type().kind(), operator)) {
                throw new UnsupportedOperatorException(field.name(), operator, adapter.id());
            }
            Object value = coerce(field, operator, entry.getValue(), catalog, capabilities);
            if (value instanceof List<?> list && list.isEmpty()) {
                parts.add(emptyListMatchesAll(operator) ? adapter.matchAll() : adapter.matchNone());
            } else {
                parts.add(adapter.applyOperator(field, operator, value, options));
            }
        }
        return parts.size() == 1 ? parts.get(0) : adapter.combineAnd(parts);
    }

    private <Q> Q applyCustom(FieldDescriptor field, Operator operator, Object value, FilterAdapter<Q> adapter) {
        CustomFilter<Q> filter = customFilters.find(field.name(), adapter.compiledType())
                .orElseThrow(() -> new FilterDefinitionException(field.name(), "No custom filter registered for field '"
                        + field.name() + "' and " + adapter.compiledType().getSimpleName()));
        Q result = filter.apply(adapter.matchAll(), operator, value);
        if (!adapter.compiledType().isInstance(result)) {
            throw new FilterDefinitionException(field.name(), "Custom filter for field '" + field.name() + "' returned "
                    + (result == null ? "null" : result.getClass().getName()) + ", expected "
                    + adapter.compiledType().getName());
        }
        return result;
    }

    /**
     * Decides what an operator matches when given an empty list.
     *
     * @param operator a list-valued operator
     * @return {@code true} for match-all, {@code false} for match-none
     */
    static boolean emptyListMatchesAll(Operator operator) {
        if (operator instanceof ScalarOperator scalar) {
            return scalar == ScalarOperator.NIN;
        }
        if (operator instanceof ArrayOperator array) {
            return array == ArrayOperator.INCLUDES_ALL || array == ArrayOperator.EXCLUDES_ALL;
        }
        return operator == JsonOperator.HAS_KEYS;
    }

    private Object coerce(FieldDescriptor field, Operator operator, Object value, FieldCatalog catalog,
                          AdapterCapabilities capabilities) {
        String enumName = field.type().enumName();
        EnumDefinition enumDefinition = enumName == null ? null : catalog.enumDefinition(enumName)
                .orElseThrow(() -> new FilterDefinitionException(field.name(), "Enum " + enumName + " is not declared"));

        switch (operator.valueShape()) {
            case FLAG -> {
                if (!(value instanceof Boolean)) {
                    throw new FilterValidationException("Operator " + operator.symbol() + " on field '"
                            + field.name() + "' expects true or false, got: " + value);
                }
                return value;
            }
            case LIST -> {
                if (!(value instanceof Collection<?> items)) {
                    throw new FilterValidationException("Operator " + operator.symbol() + " on field '"
                            + field.name() + "' expects a list, got: " + value);
                }
                if (items.size() > capabilities.maxInItems()) {
                    throw new FilterValidationException("Operator " + operator.symbol() + " on field '"
                            + field.name() + "' accepts at most " + capabilities.maxInItems()
                            + " items, got " + items.size());
                }
                List<Object> coerced = new ArrayList<>(items.size());
                for (Object item : items) {
                    if (item == null) {
                        throw new FilterValidationException("Operator " + operator.symbol() + " on field '"
                                + field.name() + "' does not accept null items");
                    }
                    coerced.add(enumDefinition == null ? item : toInternal(enumDefinition, field, item));
                }
                return List.copyOf(coerced);
            }
            case SINGLE -> {
                if (value == null) {
                    throw new FilterValidationException("Operator " + operator.symbol() + " on field '"
                            + field.name() + "' requires a value; use _is_null to match missing values");
                }
                if (value instanceof Collection<?> || value instanceof Map<?, ?>) {
                    throw new FilterValidationException("Operator " + operator.symbol() + " on field '"
                            + field.name() + "' expects a single value, got: " + value);
                }
                return enumDefinition == null ? value : toInternal(enumDefinition, field, value);
            }
            case DOCUMENT -> {
                if (value == null) {
                    throw new FilterValidationException("Operator " + operator.symbol() + " on field '"
                            + field.name() + "' requires a value");
                }
                if (operator == GeoOperator.ST_DWITHIN) {
                    if (!(value instanceof Map<?, ?> raw)) {
                        throw new FilterValidationException("Operator _st_dwithin on field '" + field.name()
                                + "' expects {lat, lon, distance}, got: " + value);
                    }
                    try {
                        return GeoDistance.fromMap(raw);
                    } catch (IllegalArgumentException e) {
                        throw new FilterValidationException("Invalid _st_dwithin value on field '"
                                + field.name() + "': " + e.getMessage(), e);
                    }
                }
                return value;
            }
            default -> throw new IllegalStateException("Unhandled value shape " + operator.valueShape());
        }
    }

    private static Object toInternal(EnumDefinition definition, FieldDescriptor field, Object external) {
        return definition.toInternal(external)
                .orElseThrow(() -> new FilterValidationException("Value '" + external + "' is not a member of enum "
                        + definition.name() + " for field '" + field.name() + "'"));
    }
}
