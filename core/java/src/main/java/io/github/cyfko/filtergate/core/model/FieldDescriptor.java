package io.github.cyfko.filtergate.core.model;

import io.github.cyfko.filtergate.core.api.Operator;

import java.util.Objects;
import java.util.Set;

/**
 * Describes one filterable field of an entity.
 *
 * <ul>
 *   <li><strong>name</strong>: the name clients use in filter expressions</li>
 *   <li><strong>type</strong>: semantic type, which selects the operator category</li>
 *   <li><strong>association</strong>: dotted association path the field is reached through
 *       (e.g. {@code author.company}), or {@code null} for a field of the root entity</li>
 *   <li><strong>column</strong>: storage name (column, document property); defaults to {@code name}</li>
 *   <li><strong>custom</strong>: the field is backed by a registered
 *       {@link io.github.cyfko.filtergate.core.spi.CustomFilter} rather than by storage</li>
 *   <li><strong>allowedOperators</strong>: optional restriction of the operators clients may use
 *       on this field; empty means no restriction beyond the adapter's own</li>
 * </ul>
 *
 * <pre>{@code
 * FieldDescriptor age = FieldDescriptor.of("age", FieldType.scalar(FieldKind.INTEGER));
 * FieldDescriptor company = FieldDescriptor.builder("companyName", FieldType.scalar(FieldKind.STRING))
 *     .association("author.company")
 *     .column("name")
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public record FieldDescriptor(
        String name,
        FieldType type,
        String association,
        String column,
        boolean custom,
        Set<Operator> allowedOperators
) {

    public FieldDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
        if (association != null && association.isBlank()) {
            association = null;
        }
        if (column == null || column.isBlank()) {
            column = name;
        }
        allowedOperators = allowedOperators == null ? Set.of() : Set.copyOf(allowedOperators);
    }

    /**
     * Storage-backed field of the root entity.
     */
    public static FieldDescriptor of(String name, FieldType type) {
        return new FieldDescriptor(name, type, null, null, false, Set.of());
    }

    /**
     * Field backed by a custom filter function registered under the same name.
     */
    public static FieldDescriptor custom(String name, FieldType type) {
        return new FieldDescriptor(name, type, null, null, true, Set.of());
    }

    public static Builder builder(String name, FieldType type) {
        return new Builder(name, type);
    }

    /**
     * @return {@code true} if the field is reached through an association
     */
    public boolean isAssociated() {
        return association != null;
    }

    /**
     * @return the dotted storage path: association path followed by the column
     */
    public String storagePath() {
        return association == null ? column : association + "." + column;
    }

    /**
     * Checks the per-field operator restriction.
     *
     * @param operator operator to check
     * @return {@code true} if no restriction is declared or the operator is part of it
     */
    public boolean permits(Operator operator) {
        return allowedOperators.isEmpty() || allowedOperators.contains(operator);
    }

    public static final class Builder {
        private final String name;
        private final FieldType type;
        private String association;
        private String column;
        private boolean custom;
        private Set<Operator> allowedOperators = Set.of();

        private Builder(String name, FieldType type) {
            this.name = name;
            this.type = type;
        }

        public Builder association(String association) {
            this.association = association;
            return this;
        }

        public Builder column(String column) {
            this.column = column;
            return this;
        }

        public Builder custom(boolean custom) {
            this.custom = custom;
            return this;
        }

        public Builder allowedOperators(Set<Operator> allowedOperators) {
            this.allowedOperators = allowedOperators;
            return this;
        }

        public FieldDescriptor build() {
            return new FieldDescriptor(name, type, association, column, custom, allowedOperators);
        }
    }
}
