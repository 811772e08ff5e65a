package io.github.cyfko.filtergate.core.model;

import io.github.cyfko.filtergate.core.api.OperatorCategory;

import java.util.Objects;

/**
 * Semantic type of a filterable field.
 *
 * <pre>{@code
 * FieldType.scalar(FieldKind.INTEGER)   // age
 * FieldType.array(FieldKind.STRING)     // tags
 * FieldType.enumType("Status")          // status
 * FieldType.arrayOfEnum("Role")         // roles
 * FieldType.json()                      // metadata
 * FieldType.geo()                       // location
 * }</pre>
 *
 * @since 1.0.0
 */
public sealed interface FieldType permits FieldType.Scalar, FieldType.Array, FieldType.EnumType,
        FieldType.ArrayOfEnum, FieldType.Json, FieldType.Geo {

    /**
     * @return the operator category leaves on this field are looked up in
     */
    OperatorCategory category();

    /**
     * @return the kind of the value, or of the elements for array types
     */
    FieldKind kind();

    /**
     * @return the enum name for enum-backed types, {@code null} otherwise
     */
    default String enumName() {
        return null;
    }

    record Scalar(FieldKind kind) implements FieldType {
        public Scalar {
            Objects.requireNonNull(kind, "kind");
            if (kind == FieldKind.ENUM || kind == FieldKind.JSON || kind == FieldKind.GEO) {
                throw new IllegalArgumentException("Use the dedicated FieldType for kind " + kind);
            }
        }

        @Override
        public OperatorCategory category() {
            return OperatorCategory.SCALAR;
        }
    }

    record Array(FieldKind kind) implements FieldType {
        public Array {
            Objects.requireNonNull(kind, "kind");
            if (kind == FieldKind.ENUM || kind == FieldKind.JSON || kind == FieldKind.GEO) {
                throw new IllegalArgumentException("Use the dedicated FieldType for arrays of " + kind);
            }
        }

        @Override
        public OperatorCategory category() {
            return OperatorCategory.ARRAY;
        }
    }

    record EnumType(String name) implements FieldType {
        public EnumType {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public OperatorCategory category() {
            return OperatorCategory.SCALAR;
        }

        @Override
        public FieldKind kind() {
            return FieldKind.ENUM;
        }

        @Override
        public String enumName() {
            return name;
        }
    }

    record ArrayOfEnum(String name) implements FieldType {
        public ArrayOfEnum {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public OperatorCategory category() {
            return OperatorCategory.ARRAY;
        }

        @Override
        public FieldKind kind() {
            return FieldKind.ENUM;
        }

        @Override
        public String enumName() {
            return name;
        }
    }

    record Json() implements FieldType {
        @Override
        public OperatorCategory category() {
            return OperatorCategory.JSON;
        }

        @Override
        public FieldKind kind() {
            return FieldKind.JSON;
        }
    }

    record Geo() implements FieldType {
        @Override
        public OperatorCategory category() {
            return OperatorCategory.GEO;
        }

        @Override
        public FieldKind kind() {
            return FieldKind.GEO;
        }
    }

    static FieldType scalar(FieldKind kind) {
        return new Scalar(kind);
    }

    static FieldType array(FieldKind kind) {
        return new Array(kind);
    }

    static FieldType enumType(String name) {
        return new EnumType(name);
    }

    static FieldType arrayOfEnum(String name) {
        return new ArrayOfEnum(name);
    }

    static FieldType json() {
        return new Json();
    }

    static FieldType geo() {
        return new Geo();
    }
}
