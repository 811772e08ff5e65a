package io.github.cyfko.filtergate.core.compile;

import io.github.cyfko.filtergate.core.spi.CustomFilter;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Custom filter functions, keyed by field name.
 * <p>
 * A field declared {@code custom} in its
 * {@link io.github.cyfko.filtergate.core.model.FieldDescriptor} is compiled by the
 * function registered here under the same name. Each function is registered with the
 * compiled type it produces; the compiler only calls it when that type matches the
 * selected adapter.
 * </p>
 *
 * <p><strong>Concurrency:</strong> backed by a {@link ConcurrentHashMap}; instances are
 * owned by the caller and injected into the {@link QueryBuilder}.</p>
 *
 * @since 1.0.0
 */
public final class CustomFilterRegistry {

    private final Map<String, Entry<?>> filters = new ConcurrentHashMap<>();

    /**
     * Registers a custom filter.
     *
     * @param field        field name
     * @param compiledType compiled type the function consumes and produces
     * @param filter       the function
     * @param <Q>          compiled type
     * @throws IllegalArgumentException if a filter is already registered for the field and type
     */
    public <Q> void register(String field, Class<Q> compiledType, CustomFilter<Q> filter) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(compiledType, "compiledType");
        Objects.requireNonNull(filter, "filter");
        Entry<Q> entry = new Entry<>(compiledType, filter);
        if (filters.putIfAbsent(key(field, compiledType), entry) != null) {
            throw new IllegalArgumentException("Custom filter [" + field + "] is already registered for "
                    + compiledType.getSimpleName() + ".");
        }
    }

    public void unregister(String field, Class<?> compiledType) {
        filters.remove(key(field, compiledType));
    }

    /**
     * @param field        field name
     * @param compiledType compiled type of the selected adapter
     * @param <Q>          compiled type
     * @return the custom filter, or empty if none is registered for this field and type
     */
    @SuppressWarnings("unchecked")
    public <Q> Optional<CustomFilter<Q>> find(String field, Class<Q> compiledType) {
        Entry<?> entry = filters.get(key(field, compiledType));
        return entry == null ? Optional.empty() : Optional.of((CustomFilter<Q>) entry.filter());
    }

    public Set<String> registeredKeys() {
        return Set.copyOf(filters.keySet());
    }

    private static String key(String field, Class<?> compiledType) {
        return field + "@" + compiledType.getName();
    }

    private record Entry<Q>(Class<Q> compiledType, CustomFilter<Q> filter) {
    }
}
