package io.github.cyfko.filtergate.core.memory;

import io.github.cyfko.filtergate.core.api.ArrayOperator;
import io.github.cyfko.filtergate.core.api.Operator;
import io.github.cyfko.filtergate.core.api.ScalarOperator;
import io.github.cyfko.filtergate.core.capability.AdapterCapabilities;
import io.github.cyfko.filtergate.core.capability.AdapterRegistration;
import io.github.cyfko.filtergate.core.capability.Feature;
import io.github.cyfko.filtergate.core.capability.OperatorSets;
import io.github.cyfko.filtergate.core.model.FieldDescriptor;
import io.github.cyfko.filtergate.core.spi.FilterAdapter;
import io.github.cyfko.filtergate.core.spi.OperatorOptions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.IntPredicate;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Adapter filtering in-process collections of rows.
 * <p>
 * This is the fallback selected when no storage connector is present, which makes
 * filtering available over non-persisted data ({@code Map}s, records, JavaBeans). It
 * supports the scalar baseline and the full array operator set; advanced text, JSON and
 * geo operators are not offered.
 * </p>
 *
 * <h2>Null handling</h2>
 * <p>
 * Evaluation is two-valued: a comparison against a missing value is simply false, and
 * {@code Not} is an exact complement. A missing array is treated as an empty array by
 * every array operator, so {@code _is_empty true} and {@code _is_empty false} partition
 * any dataset.
 * </p>
 *
 * <pre>{@code
 * MemoryAdapter adapter = new MemoryAdapter();
 * MemoryPredicate filter = queryBuilder.compile(expression, catalog, AuthorizedFieldSet.all(), adapter);
 * List<Map<String, Object>> adults = MemoryAdapter.filter(rows, filter);
 * }</pre>
 *
 * @since 1.0.0
 */
public class MemoryAdapter implements FilterAdapter<MemoryPredicate> {

    public static final String ID = "memory";

    private final AdapterCapabilities capabilities;

    public MemoryAdapter() {
        this(defaultCapabilities());
    }

    public MemoryAdapter(AdapterCapabilities capabilities) {
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
    }

    /**
     * @return the static capabilities of the in-memory backend
     */
    public static AdapterCapabilities defaultCapabilities() {
        AdapterCapabilities.Builder builder = AdapterCapabilities.builder(ID).version("builtin")
                .feature(Feature.ARRAY_OVERLAP)
                .feature(Feature.ARRAY_CONTAINS_ALL);
        OperatorSets.scalarBaseline(builder);
        OperatorSets.arrays(builder, OperatorSets.ARRAY_FULL);
        return builder.build();
    }

    /**
     * @return the registration used by the capability registry for connector-less data
     */
    public static AdapterRegistration registration() {
        return new AdapterRegistration(ID, Set.of(), connection -> defaultCapabilities(), MemoryAdapter::new);
    }

    /**
     * Applies a compiled predicate to a collection, preserving iteration order.
     *
     * @param rows   rows to filter
     * @param filter compiled predicate
     * @param <T>    row type
     * @return matching rows
     */
    public static <T> List<T> filter(Collection<T> rows, MemoryPredicate filter) {
        List<T> result = new ArrayList<>();
        for (T row : rows) {
            if (filter.test(row)) {
                result.add(row);
            }
        }
        return result;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<MemoryPredicate> compiledType() {
        return MemoryPredicate.class;
    }

    @Override
    public AdapterCapabilities capabilities() {
        return capabilities;
    }

    @Override
    public MemoryPredicate applyOperator(FieldDescriptor field, Operator operator, Object value, OperatorOptions options) {
        String path = field.storagePath();
        String description = field.name() + " " + operator.symbol() + " " + render(value);
        Predicate<Object> test;
        if (operator instanceof ScalarOperator scalar) {
            test = scalar(path, scalar, value);
        } else if (operator instanceof ArrayOperator array) {
            test = array(path, array, value);
        } else {
            throw new IllegalArgumentException("Operator " + operator.symbol() + " is not supported in memory");
        }
        return new MemoryPredicate(description, test);
    }

    private Predicate<Object> scalar(String path, ScalarOperator operator, Object value) {
        return switch (operator) {
            case EQ -> row -> Values.equal(RowAccessor.read(row, path), value);
            case NEQ -> row -> {
                Object actual = RowAccessor.read(row, path);
                return actual != null && !Values.equal(actual, value);
            };
            case GT -> ordered(path, value, sign -> sign > 0);
            case GTE -> ordered(path, value, sign -> sign >= 0);
            case LT -> ordered(path, value, sign -> sign < 0);
            case LTE -> ordered(path, value, sign -> sign <= 0);
            case IN -> row -> {
                Object actual = RowAccessor.read(row, path);
                return actual != null && Values.contains((List<?>) value, actual);
            };
            case NIN -> row -> {
                Object actual = RowAccessor.read(row, path);
                return actual != null && !Values.contains((List<?>) value, actual);
            };
            case IS_NULL -> {
                boolean expectNull = (Boolean) value;
                yield row -> (RowAccessor.read(row, path) == null) == expectNull;
            }
            case LIKE -> matches(path, Values.likePattern(value.toString(), false), true);
            case NLIKE -> matches(path, Values.likePattern(value.toString(), false), false);
            case ILIKE -> matches(path, Values.likePattern(value.toString(), true), true);
            case NILIKE -> matches(path, Values.likePattern(value.toString(), true), false);
            case STARTS_WITH -> text(path, actual -> actual.startsWith(value.toString()));
            case ISTARTS_WITH -> text(path, actual -> Values.lower(actual).startsWith(Values.lower(value)));
            case ENDS_WITH -> text(path, actual -> actual.endsWith(value.toString()));
            case IENDS_WITH -> text(path, actual -> Values.lower(actual).endsWith(Values.lower(value)));
            case CONTAINS -> text(path, actual -> actual.contains(value.toString()));
            case ICONTAINS -> text(path, actual -> Values.lower(actual).contains(Values.lower(value)));
            case SEARCH, SIMILAR, FUZZY ->
                    throw new IllegalArgumentException("Operator " + operator.symbol() + " is not supported in memory");
        };
    }

    private Predicate<Object> array(String path, ArrayOperator operator, Object value) {
        return switch (operator) {
            case INCLUDES -> elements(path, elements -> Values.contains(elements, value));
            case EXCLUDES -> elements(path, elements -> !Values.contains(elements, value));
            case INCLUDES_ALL -> elements(path, elements -> containsAll(elements, (List<?>) value));
            case EXCLUDES_ALL -> elements(path, elements -> !containsAny(elements, (List<?>) value));
            case INCLUDES_ANY -> elements(path, elements -> containsAny(elements, (List<?>) value));
            case EXCLUDES_ANY -> elements(path, elements -> !containsAll(elements, (List<?>) value));
            case IS_EMPTY -> {
                boolean expectEmpty = (Boolean) value;
                yield elements(path, elements -> elements.isEmpty() == expectEmpty);
            }
            case IS_NULL -> {
                boolean expectNull = (Boolean) value;
                yield row -> (RowAccessor.read(row, path) == null) == expectNull;
            }
        };
    }

    private static Predicate<Object> ordered(String path, Object value, IntPredicate accept) {
        return row -> {
            OptionalInt sign = Values.compare(RowAccessor.read(row, path), value);
            return sign.isPresent() && accept.test(sign.getAsInt());
        };
    }

    private static Predicate<Object> matches(String path, Pattern pattern, boolean expected) {
        return text(path, actual -> pattern.matcher(actual).matches() == expected);
    }

    private static Predicate<Object> text(String path, Predicate<String> test) {
        return row -> {
            Object actual = RowAccessor.read(row, path);
            return actual != null && test.test(actual.toString());
        };
    }

    private static Predicate<Object> elements(String path, Predicate<List<Object>> test) {
        return row -> {
            List<Object> elements = Values.elements(RowAccessor.read(row, path));
            return test.test(elements == null ? List.of() : elements);
        };
    }

    private static boolean containsAll(List<Object> elements, List<?> wanted) {
        for (Object item : wanted) {
            if (!Values.contains(elements, item)) return false;
        }
        return true;
    }

    private static boolean containsAny(List<Object> elements, List<?> wanted) {
        for (Object item : wanted) {
            if (Values.contains(elements, item)) return true;
        }
        return false;
    }

    @Override
    public MemoryPredicate combineAnd(List<MemoryPredicate> parts) {
        return parts.size() == 1 ? parts.get(0) : MemoryPredicate.allOf(parts);
    }

    @Override
    public MemoryPredicate combineOr(List<MemoryPredicate> parts) {
        return parts.size() == 1 ? parts.get(0) : MemoryPredicate.anyOf(parts);
    }

    @Override
    public MemoryPredicate negate(MemoryPredicate query) {
        return query.not();
    }

    @Override
    public MemoryPredicate matchAll() {
        return MemoryPredicate.ALL;
    }

    @Override
    public MemoryPredicate matchNone() {
        return MemoryPredicate.NONE;
    }

    @Override
    public String signature(MemoryPredicate query) {
        return query.description();
    }

    private static String render(Object value) {
        if (value instanceof String s) {
            return "\"" + s + "\"";
        }
        return String.valueOf(value);
    }
}
