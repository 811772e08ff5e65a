package io.github.cyfko.filtergate.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Declared enum with its external to internal value mapping.
 * <p>
 * Clients filter with external values (e.g. {@code "ACTIVE"}); adapters only ever
 * see the internal representation (e.g. {@code "active"} or {@code 1}). The compiler
 * performs the translation before dispatching a leaf to an adapter.
 * </p>
 *
 * @param name     enum name as referenced by {@link FieldType.EnumType}
 * @param mappings external value to internal value, in declaration order
 * @since 1.0.0
 */
public record EnumDefinition(String name, Map<String, Object> mappings) {

    public EnumDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(mappings, "mappings");
        mappings = Collections.unmodifiableMap(new LinkedHashMap<>(mappings));
    }

    /**
     * Enum whose internal values equal its external values.
     */
    public static EnumDefinition identity(String name, String... values) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String value : values) {
            map.put(value, value);
        }
        return new EnumDefinition(name, map);
    }

    /**
     * Enum mapping each Java constant name to the constant itself.
     */
    public static <E extends Enum<E>> EnumDefinition of(String name, Class<E> enumClass) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (E constant : enumClass.getEnumConstants()) {
            map.put(constant.name(), constant);
        }
        return new EnumDefinition(name, map);
    }

    /**
     * @param external external value as sent by the client
     * @return the internal value, or empty if {@code external} is not a member
     */
    public Optional<Object> toInternal(Object external) {
        if (external == null) {
            return Optional.empty();
        }
        String key = external instanceof Enum<?> e ? e.name() : external.toString();
        return Optional.ofNullable(mappings.get(key));
    }
}
