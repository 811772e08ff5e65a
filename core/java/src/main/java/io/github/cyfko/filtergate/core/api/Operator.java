package io.github.cyfko.filtergate.core.api;

import java.util.Locale;
import java.util.Optional;

/**
 * A filter operator, closed per {@link OperatorCategory}.
 * <p>
 * Each category is an enum so adding a backend means handling a finite, known set of
 * operators; a {@code switch} over one of the enums is checked for exhaustiveness.
 * </p>
 *
 * <h2>Symbol matching</h2>
 * <p>
 * Symbols are matched case-insensitively and without regard to underscores, so
 * {@code _includes_all}, {@code _includesAll}, {@code includesall} and
 * {@code INCLUDES_ALL} all resolve to {@link ArrayOperator#INCLUDES_ALL}.
 * </p>
 *
 * <pre>{@code
 * Operator.lookup(OperatorCategory.ARRAY, "_includesAny");  // Optional[INCLUDES_ANY]
 * Operator.lookup(OperatorCategory.SCALAR, "_ne");          // Optional[NEQ] (alias)
 * Operator.lookup(OperatorCategory.SCALAR, "_includes");    // Optional.empty()
 * }</pre>
 *
 * @since 1.0.0
 */
public sealed interface Operator permits ScalarOperator, ArrayOperator, JsonOperator, GeoOperator {

    /**
     * @return the canonical symbol, e.g. {@code _includes_any}
     */
    String symbol();

    /**
     * @return the category this operator belongs to
     */
    OperatorCategory category();

    /**
     * @return the shape of value this operator expects
     */
    ValueShape valueShape();

    /**
     * Enum constant name, provided by every implementing enum.
     *
     * @return the constant name
     */
    String name();

    /**
     * Resolves a raw symbol within a category.
     *
     * @param category the category of the field the symbol is applied to
     * @param raw      the raw symbol as written by the client
     * @return the operator, or empty if the symbol is not known for this category
     */
    static Optional<Operator> lookup(OperatorCategory category, String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String key = normalize(raw);
        Operator[] candidates = switch (category) {
            case SCALAR -> ScalarOperator.values();
            case ARRAY -> ArrayOperator.values();
            case JSON -> JsonOperator.values();
            case GEO -> GeoOperator.values();
        };
        for (Operator op : candidates) {
            if (normalize(op.symbol()).equals(key)) {
                return Optional.of(op);
            }
        }
        if (category == OperatorCategory.SCALAR && key.equals("ne")) {
            return Optional.of(ScalarOperator.NEQ);
        }
        return Optional.empty();
    }

    /**
     * Strips underscores and lower-cases a symbol.
     *
     * @param raw raw symbol
     * @return the normalized key
     */
    static String normalize(String raw) {
        return raw.trim().replace("_", "").toLowerCase(Locale.ROOT);
    }

    /**
     * Value shapes accepted by operators.
     */
    enum ValueShape {
        /** A single comparable value. */
        SINGLE,
        /** A list of values. An empty list is legal and handled by the compiler. */
        LIST,
        /** A boolean flag ({@code _is_null}, {@code _is_empty}). */
        FLAG,
        /** A structured document (JSON containment, geo distance). */
        DOCUMENT
    }
}
