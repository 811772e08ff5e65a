package io.github.cyfko.filtergate.core.memory;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Compiled query of the in-memory adapter: a row predicate plus a deterministic
 * description of how it was built.
 * <p>
 * Equality, hashing and the structural signature are based on the description only, so
 * compiling the same expression twice yields equal predicates even though the underlying
 * lambdas are distinct objects.
 * </p>
 *
 * <pre>{@code
 * MemoryPredicate adult = adapter.applyOperator(age, ScalarOperator.GTE, 18, options);
 * adult.description();       // "age _gte 18"
 * adult.test(Map.of("age", 30)); // true
 * }</pre>
 *
 * @param description deterministic rendering of the predicate
 * @param predicate   row test
 * @since 1.0.0
 */
public record MemoryPredicate(String description, Predicate<Object> predicate) {

    static final MemoryPredicate ALL = new MemoryPredicate("true", row -> true);
    static final MemoryPredicate NONE = new MemoryPredicate("false", row -> false);

    public MemoryPredicate {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(predicate, "predicate");
    }

    public boolean test(Object row) {
        return predicate.test(row);
    }

    static MemoryPredicate allOf(List<MemoryPredicate> parts) {
        List<Predicate<Object>> tests = parts.stream().map(MemoryPredicate::predicate).toList();
        return new MemoryPredicate(render("and", parts), row -> {
            for (Predicate<Object> test : tests) {
                if (!test.test(row)) return false;
            }
            return true;
        });
    }

    static MemoryPredicate anyOf(List<MemoryPredicate> parts) {
        List<Predicate<Object>> tests = parts.stream().map(MemoryPredicate::predicate).toList();
        return new MemoryPredicate(render("or", parts), row -> {
            for (Predicate<Object> test : tests) {
                if (test.test(row)) return true;
            }
            return false;
        });
    }

    MemoryPredicate not() {
        return new MemoryPredicate("not(" + description + ")", predicate.negate());
    }

    private static String render(String combinator, List<MemoryPredicate> parts) {
        return parts.stream().map(MemoryPredicate::description)
                .collect(Collectors.joining(", ", combinator + "(", ")"));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MemoryPredicate other && description.equals(other.description);
    }

    @Override
    public int hashCode() {
        return description.hashCode();
    }

    @Override
    public String toString() {
        return "MemoryPredicate[" + description + "]";
    }
}
