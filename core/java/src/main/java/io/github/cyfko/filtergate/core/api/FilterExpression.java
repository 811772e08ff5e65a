package io.github.cyfko.filtergate.core.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Immutable filter tree.
 * <p>
 * A filter is either a combinator ({@link And}, {@link Or}, {@link Not}) or a
 * {@link Leaf} holding one field and one or more operators applied to it. Several
 * operators on the same leaf are implicitly combined with AND.
 * </p>
 *
 * <h2>Construction</h2>
 * <pre>{@code
 * FilterExpression adultAndActive = FilterExpression.and(
 *     FilterExpression.leaf("age", ScalarOperator.GTE, 18),
 *     FilterExpression.or(
 *         FilterExpression.leaf("status", ScalarOperator.EQ, "active"),
 *         FilterExpression.leaf("status", ScalarOperator.EQ, "trial")));
 * }</pre>
 *
 * <p>
 * Every variant defensively copies its inputs into unmodifiable collections, so a
 * tree is a pure value: it has no back-references and cannot change once built.
 * Trees are usually produced by
 * {@link io.github.cyfko.filtergate.core.parsing.FilterExpressionParser}.
 * </p>
 *
 * @since 1.0.0
 */
public sealed interface FilterExpression permits FilterExpression.And, FilterExpression.Or,
        FilterExpression.Not, FilterExpression.Leaf {

    /**
     * Conjunction of children. An empty conjunction matches everything.
     *
     * @param children child expressions
     */
    record And(List<FilterExpression> children) implements FilterExpression {
        public And {
            children = List.copyOf(Objects.requireNonNull(children, "children"));
        }
    }

    /**
     * Disjunction of children. An empty disjunction matches nothing.
     *
     * @param children child expressions
     */
    record Or(List<FilterExpression> children) implements FilterExpression {
        public Or {
            children = List.copyOf(Objects.requireNonNull(children, "children"));
        }
    }

    /**
     * Negation of a child.
     *
     * @param child negated expression
     */
    record Not(FilterExpression child) implements FilterExpression {
        public Not {
            Objects.requireNonNull(child, "child");
        }
    }

    /**
     * One field with its operators, kept in insertion order.
     * <p>
     * Values may be {@code null} only for operators that accept it. The map and any list
     * or map operands are copied into insertion-ordered unmodifiable views.
     * </p>
     *
     * @param field     field name
     * @param operators operator to value mapping, never empty
     */
    record Leaf(String field, Map<Operator, Object> operators) implements FilterExpression {
        public Leaf {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(operators, "operators");
            if (field.isBlank()) {
                throw new IllegalArgumentException("Leaf field name must not be blank");
            }
            if (operators.isEmpty()) {
                throw new IllegalArgumentException("Leaf '" + field + "' must carry at least one operator");
            }
            Map<Operator, Object> copy = new LinkedHashMap<>();
            operators.forEach((operator, value) -> copy.put(operator, copyOperand(value)));
            operators = Collections.unmodifiableMap(copy);
        }

        // Lists and maps may hold nulls, so List.copyOf and Map.copyOf do not fit.
        private static Object copyOperand(Object value) {
            if (value instanceof List<?> list) {
                List<Object> copy = new ArrayList<>(list.size());
                list.forEach(item -> copy.add(copyOperand(item)));
                return Collections.unmodifiableList(copy);
            }
            if (value instanceof Set<?> set) {
                Set<Object> copy = new LinkedHashSet<>();
                set.forEach(item -> copy.add(copyOperand(item)));
                return Collections.unmodifiableSet(copy);
            }
            if (value instanceof Map<?, ?> map) {
                Map<Object, Object> copy = new LinkedHashMap<>();
                map.forEach((key, item) -> copy.put(key, copyOperand(item)));
                return Collections.unmodifiableMap(copy);
            }
            return value;
        }
    }

    static FilterExpression and(FilterExpression... children) {
        return new And(List.of(children));
    }

    static FilterExpression or(FilterExpression... children) {
        return new Or(List.of(children));
    }

    static FilterExpression not(FilterExpression child) {
        return new Not(child);
    }

    /**
     * Single-operator leaf. Unlike {@code Map.of}, accepts a {@code null} value.
     */
    static FilterExpression leaf(String field, Operator operator, Object value) {
        Map<Operator, Object> ops = new LinkedHashMap<>();
        ops.put(operator, value);
        return new Leaf(field, ops);
    }

    /**
     * Visits every leaf of the tree, depth first, left to right.
     *
     * @param visitor leaf consumer
     */
    default void forEachLeaf(Consumer<Leaf> visitor) {
        if (this instanceof Leaf leaf) {
            visitor.accept(leaf);
        } else if (this instanceof And and) {
            and.children().forEach(child -> child.forEachLeaf(visitor));
        } else if (this instanceof Or or) {
            or.children().forEach(child -> child.forEachLeaf(visitor));
        } else if (this instanceof Not not) {
            not.child().forEachLeaf(visitor);
        }
    }

    /**
     * @return every leaf of the tree, depth first
     */
    default List<Leaf> leaves() {
        List<Leaf> result = new ArrayList<>();
        forEachLeaf(result::add);
        return result;
    }
}
