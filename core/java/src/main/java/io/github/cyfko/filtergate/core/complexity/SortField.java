package io.github.cyfko.filtergate.core.complexity;

import java.util.Objects;

/**
 * One sort key of a query window.
 *
 * @param field      storage name to sort on
 * @param descending sort direction
 * @since 1.0.0
 */
public record SortField(String field, boolean descending) {

    public SortField {
        Objects.requireNonNull(field, "field");
    }

    public static SortField asc(String field) {
        return new SortField(field, false);
    }

    public static SortField desc(String field) {
        return new SortField(field, true);
    }
}
