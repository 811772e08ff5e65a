package io.github.cyfko.filtergate.core.memory;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads a dotted property path from an in-memory row.
 * <p>
 * Rows may be {@link Map}s, records, JavaBeans (getters, including {@code isX} for
 * booleans) or plain objects with fields. Each path segment is resolved against the
 * value produced by the previous one; a {@code null} anywhere along the path yields
 * {@code null}.
 * </p>
 *
 * <p><strong>Caching:</strong> resolved accessors are cached per class and property name.</p>
 *
 * @since 1.0.0
 */
public final class RowAccessor {

    private static final Map<String, Optional<Accessor>> ACCESSOR_CACHE = new ConcurrentHashMap<>();

    private RowAccessor() {
        // Utility class - no instantiation allowed
    }

    /**
     * @param row  the row
     * @param path dotted property path, e.g. {@code author.company.name}
     * @return the value at the path, or {@code null} if any segment is missing or null
     */
    public static Object read(Object row, String path) {
        Objects.requireNonNull(path, "path");
        Object current = row;
        for (String segment : path.split("\\.")) {
            if (current == null) {
                return null;
            }
            current = readProperty(current, segment);
        }
        return current;
    }

    private static Object readProperty(Object target, String name) {
        if (target instanceof Map<?, ?> map) {
            return map.get(name);
        }
        Class<?> type = target.getClass();
        Optional<Accessor> accessor = ACCESSOR_CACHE.computeIfAbsent(type.getName() + "#" + name,
                key -> resolve(type, name));
        return accessor.map(a -> a.read(target)).orElse(null);
    }

    private static Optional<Accessor> resolve(Class<?> type, String name) {
        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                if (component.getName().equals(name)) {
                    return Optional.of(methodAccessor(component.getAccessor()));
                }
            }
        }
        String capitalized = name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1);
        for (String candidate : new String[]{"get" + capitalized, "is" + capitalized}) {
            try {
                Method getter = type.getMethod(candidate);
                if (getter.getReturnType() != void.class) {
                    return Optional.of(methodAccessor(getter));
                }
            } catch (NoSuchMethodException e) {
                // try the next naming convention
            }
        }
        Class<?> current = type;
        while (current != null && current != Object.class) {
            try {
                Field field = current.getDeclaredField(name);
                if (!Modifier.isStatic(field.getModifiers())) {
                    field.setAccessible(true);
                    return Optional.of(target -> {
                        try {
                            return field.get(target);
                        } catch (IllegalAccessException e) {
                            throw new IllegalStateException("Cannot read field " + name + " of " + type.getName(), e);
                        }
                    });
                }
            } catch (NoSuchFieldException e) {
                // look further up the hierarchy
            }
            current = current.getSuperclass();
        }
        return Optional.empty();
    }

    private static Accessor methodAccessor(Method method) {
        method.setAccessible(true);
        return target -> {
            try {
                return method.invoke(target);
            } catch (IllegalAccessException | InvocationTargetException e) {
                throw new IllegalStateException("Cannot invoke " + method, e);
            }
        };
    }

    /**
     * Clears the accessor cache. Intended for tests and class reloading scenarios.
     */
    public static void clearCache() {
        ACCESSOR_CACHE.clear();
    }

    @FunctionalInterface
    private interface Accessor {
        Object read(Object target);
    }
}
