package io.github.cyfko.filtergate.core.complexity;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result window of a query: limit, offset and sort order.
 *
 * @param limit  maximum number of rows, {@code null} when unbounded
 * @param offset rows skipped, not negative
 * @param sort   sort keys, in priority order
 * @since 1.0.0
 */
public record QueryWindow(Integer limit, int offset, List<SortField> sort) {

    public QueryWindow {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative, got: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative, got: " + offset);
        }
        sort = sort == null ? List.of() : List.copyOf(sort);
    }

    /**
     * @return a window with no limit, no offset and no sort
     */
    public static QueryWindow unbounded() {
        return new QueryWindow(null, 0, List.of());
    }

    public static QueryWindow of(int limit, int offset, SortField... sort) {
        return new QueryWindow(limit, offset, List.of(sort));
    }

    public boolean hasLimit() {
        return limit != null;
    }

    /**
     * @return deterministic rendering used in cache keys
     */
    public String signature() {
        return "limit=" + limit + ";offset=" + offset + ";sort="
                + sort.stream().map(s -> s.field() + (s.descending() ? ":desc" : ":asc"))
                .collect(Collectors.joining(","));
    }
}
