package io.github.cyfko.filtergate.core.memory;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Value comparison rules of the in-memory adapter.
 * <p>
 * Filter values arrive as decoded JSON (strings, {@code Integer}, {@code Long},
 * {@code Double}, booleans) while rows hold typed Java values. Comparison therefore
 * converts the filter value toward the row value's type:
 * </p>
 * <ul>
 *   <li>numbers compare by {@link BigDecimal} value, so {@code 18} equals {@code 18.0}</li>
 *   <li>{@code java.time} row values parse ISO strings</li>
 *   <li>enum row values compare by constant name</li>
 *   <li>anything else compares with {@code equals} / {@code compareTo}</li>
 * </ul>
 *
 * @since 1.0.0
 */
final class Values {

    private Values() {
        // Utility class - no instantiation allowed
    }

    static boolean equal(Object rowValue, Object filterValue) {
        if (rowValue == null || filterValue == null) {
            return rowValue == null && filterValue == null;
        }
        if (rowValue instanceof Enum<?> e) {
            return filterValue instanceof Enum<?> f ? e == f : e.name().equals(filterValue.toString());
        }
        Object converted = convertToward(rowValue, filterValue);
        if (rowValue instanceof Number && converted instanceof Number) {
            return compareNumbers((Number) rowValue, (Number) converted) == 0;
        }
        return Objects.equals(rowValue, converted);
    }

    /**
     * @return the comparison sign, or empty if the values are not comparable
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    static OptionalInt compare(Object rowValue, Object filterValue) {
        if (rowValue == null || filterValue == null) {
            return OptionalInt.empty();
        }
        Object converted = convertToward(rowValue, filterValue);
        if (rowValue instanceof Number && converted instanceof Number) {
            return OptionalInt.of(compareNumbers((Number) rowValue, (Number) converted));
        }
        if (rowValue instanceof Comparable c && rowValue.getClass().isInstance(converted)) {
            return OptionalInt.of(c.compareTo(converted));
        }
        return OptionalInt.empty();
    }

    static boolean contains(Collection<?> elements, Object filterValue) {
        for (Object element : elements) {
            if (equal(element, filterValue)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the elements of a collection or array row value; {@code null} for a missing value
     */
    static List<Object> elements(Object rowValue) {
        if (rowValue == null) {
            return null;
        }
        if (rowValue instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (rowValue.getClass().isArray()) {
            int length = Array.getLength(rowValue);
            List<Object> result = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                result.add(Array.get(rowValue, i));
            }
            return result;
        }
        return List.of(rowValue);
    }

    /**
     * Compiles a SQL {@code LIKE} pattern ({@code %} and {@code _} wildcards) to a regex.
     */
    static Pattern likePattern(String like, boolean caseInsensitive) {
        StringBuilder regex = new StringBuilder();
        for (char c : like.toCharArray()) {
            switch (c) {
                case '%' -> regex.append(".*");
                case '_' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        int flags = Pattern.DOTALL | (caseInsensitive ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0);
        return Pattern.compile(regex.toString(), flags);
    }

    static String lower(Object value) {
        return value.toString().toLowerCase(Locale.ROOT);
    }

    /**
     * NaN and infinities have no decimal form; they order as {@link Double#compare} does,
     * NaN above every other number.
     */
    private static int compareNumbers(Number left, Number right) {
        if (isNonFinite(left) || isNonFinite(right)) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
        return toBigDecimal(left).compareTo(toBigDecimal(right));
    }

    private static boolean isNonFinite(Number value) {
        return (value instanceof Double || value instanceof Float) && !Double.isFinite(value.doubleValue());
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal bd) return bd;
        return new BigDecimal(value.toString());
    }

    private static Object convertToward(Object rowValue, Object filterValue) {
        if (rowValue.getClass().isInstance(filterValue) || !(filterValue instanceof String s)) {
            return filterValue;
        }
        try {
            if (rowValue instanceof LocalDate) return LocalDate.parse(s);
            if (rowValue instanceof LocalDateTime) return LocalDateTime.parse(s);
            if (rowValue instanceof LocalTime) return LocalTime.parse(s);
            if (rowValue instanceof Instant) return Instant.parse(s);
            if (rowValue instanceof OffsetDateTime) return OffsetDateTime.parse(s);
            if (rowValue instanceof ZonedDateTime) return ZonedDateTime.parse(s);
            if (rowValue instanceof Boolean) return Boolean.valueOf(s);
            if (rowValue instanceof Number) return new BigDecimal(s);
        } catch (DateTimeParseException | NumberFormatException e) {
            // unparseable: compared as-is and therefore never equal
            return filterValue;
        }
        return filterValue;
    }
}
