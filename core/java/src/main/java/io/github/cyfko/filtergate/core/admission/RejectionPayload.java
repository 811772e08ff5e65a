package io.github.cyfko.filtergate.core.admission;

import java.util.List;

/**
 * Machine-usable body of an admission rejection.
 *
 * @param code        always {@link #QUERY_TOO_COMPLEX}
 * @param score       normalized complexity score of the query
 * @param cost        raw estimated cost
 * @param limit       effective limit the score exceeded
 * @param suggestions at least one actionable suggestion
 * @since 1.0.0
 */
public record RejectionPayload(String code, int score, double cost, double limit, List<String> suggestions) {

    public static final String QUERY_TOO_COMPLEX = "QUERY_TOO_COMPLEX";

    public RejectionPayload {
        suggestions = List.copyOf(suggestions);
        if (suggestions.isEmpty()) {
            throw new IllegalArgumentException("A rejection must carry at least one suggestion");
        }
    }
}
