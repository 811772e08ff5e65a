package io.github.cyfko.filtergate.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The filterable fields of one entity, plus the enums they reference.
 * <p>
 * A catalog is immutable and can be shared across requests. It is normally produced
 * once per entity by the schema layer.
 * </p>
 *
 * <pre>{@code
 * FieldCatalog users = FieldCatalog.builder("users")
 *     .field(FieldDescriptor.of("id", FieldType.scalar(FieldKind.ID)))
 *     .field(FieldDescriptor.of("age", FieldType.scalar(FieldKind.INTEGER)))
 *     .field(FieldDescriptor.of("status", FieldType.enumType("Status")))
 *     .field(FieldDescriptor.of("tags", FieldType.array(FieldKind.STRING)))
 *     .enumDefinition(EnumDefinition.identity("Status", "active", "trial", "banned"))
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class FieldCatalog {

    private final String entity;
    private final Map<String, FieldDescriptor> fields;
    private final Map<String, EnumDefinition> enums;

    private FieldCatalog(String entity, Map<String, FieldDescriptor> fields, Map<String, EnumDefinition> enums) {
        this.entity = entity;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.enums = Collections.unmodifiableMap(new LinkedHashMap<>(enums));
    }

    public static Builder builder(String entity) {
        return new Builder(entity);
    }

    /**
     * @return entity (relation, index, collection) name the catalog describes
     */
    public String entity() {
        return entity;
    }

    public Optional<FieldDescriptor> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public Collection<FieldDescriptor> fields() {
        return fields.values();
    }

    public Optional<EnumDefinition> enumDefinition(String name) {
        return Optional.ofNullable(enums.get(name));
    }

    public static final class Builder {
        private final String entity;
        private final Map<String, FieldDescriptor> fields = new LinkedHashMap<>();
        private final Map<String, EnumDefinition> enums = new LinkedHashMap<>();

        private Builder(String entity) {
            this.entity = entity;
        }

        public Builder field(FieldDescriptor descriptor) {
            if (fields.putIfAbsent(descriptor.name(), descriptor) != null) {
                throw new IllegalArgumentException("Field [" + descriptor.name() + "] is already declared.");
            }
            return this;
        }

        public Builder enumDefinition(EnumDefinition definition) {
            enums.put(definition.name(), definition);
            return this;
        }

        public FieldCatalog build() {
            for (FieldDescriptor descriptor : fields.values()) {
                String enumName = descriptor.type().enumName();
                if (enumName != null && !enums.containsKey(enumName)) {
                    throw new IllegalStateException("Field [" + descriptor.name()
                            + "] references undeclared enum [" + enumName + "]");
                }
            }
            return new FieldCatalog(entity, fields, enums);
        }
    }
}
