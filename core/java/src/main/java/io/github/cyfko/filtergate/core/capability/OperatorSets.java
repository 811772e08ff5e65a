package io.github.cyfko.filtergate.core.capability;

import io.github.cyfko.filtergate.core.api.ArrayOperator;
import io.github.cyfko.filtergate.core.api.OperatorCategory;
import io.github.cyfko.filtergate.core.api.ScalarOperator;
import io.github.cyfko.filtergate.core.model.FieldKind;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Operator groups shared by adapter capability tables.
 *
 * @since 1.0.0
 */
public final class OperatorSets {

    public static final Set<ScalarOperator> EQUALITY = Set.copyOf(EnumSet.of(
            ScalarOperator.EQ, ScalarOperator.NEQ, ScalarOperator.IN, ScalarOperator.NIN, ScalarOperator.IS_NULL));

    public static final Set<ScalarOperator> ORDERING = Set.copyOf(EnumSet.of(
            ScalarOperator.GT, ScalarOperator.GTE, ScalarOperator.LT, ScalarOperator.LTE));

    public static final Set<ScalarOperator> PATTERN = Set.copyOf(EnumSet.of(
            ScalarOperator.LIKE, ScalarOperator.NLIKE, ScalarOperator.ILIKE, ScalarOperator.NILIKE,
            ScalarOperator.STARTS_WITH, ScalarOperator.ISTARTS_WITH,
            ScalarOperator.ENDS_WITH, ScalarOperator.IENDS_WITH,
            ScalarOperator.CONTAINS, ScalarOperator.ICONTAINS));

    public static final Set<ArrayOperator> ARRAY_FULL = Set.copyOf(EnumSet.allOf(ArrayOperator.class));

    public static final Set<ArrayOperator> ARRAY_BASIC = Set.copyOf(EnumSet.of(
            ArrayOperator.INCLUDES, ArrayOperator.EXCLUDES, ArrayOperator.IS_EMPTY, ArrayOperator.IS_NULL));

    private OperatorSets() {
        // constants only
    }

    /**
     * @return every kind a scalar or array field may have
     */
    public static FieldKind[] valueKinds() {
        return Arrays.stream(FieldKind.values())
                .filter(kind -> kind != FieldKind.JSON && kind != FieldKind.GEO)
                .toArray(FieldKind[]::new);
    }

    /**
     * @return kinds with a natural order
     */
    public static FieldKind[] orderedKinds() {
        return Arrays.stream(FieldKind.values()).filter(FieldKind::isOrdered).toArray(FieldKind[]::new);
    }

    /**
     * Registers the scalar baseline every backend offers: equality on every kind,
     * ordering on ordered kinds and pattern matching on text.
     *
     * @param builder capability builder to fill
     * @return the same builder
     */
    public static AdapterCapabilities.Builder scalarBaseline(AdapterCapabilities.Builder builder) {
        return builder
                .operators(OperatorCategory.SCALAR, EQUALITY, valueKinds())
                .operators(OperatorCategory.SCALAR, ORDERING, orderedKinds())
                .operators(OperatorCategory.SCALAR, PATTERN, FieldKind.STRING);
    }

    /**
     * Registers array operators on every element kind.
     */
    public static AdapterCapabilities.Builder arrays(AdapterCapabilities.Builder builder, Set<ArrayOperator> ops) {
        return builder.operators(OperatorCategory.ARRAY, ops, valueKinds());
    }
}
