package io.github.cyfko.filtergate.core.api;

/**
 * Operator families. A field's {@link io.github.cyfko.filtergate.core.model.FieldType}
 * determines which family its leaf operators are looked up in.
 *
 * @since 1.0.0
 */
public enum OperatorCategory {
    /** Single-valued fields, including enums. */
    SCALAR,
    /** Array-valued fields (native arrays, JSON arrays, collections, multi-valued documents). */
    ARRAY,
    /** JSON document fields. */
    JSON,
    /** Geographic point fields. */
    GEO
}
