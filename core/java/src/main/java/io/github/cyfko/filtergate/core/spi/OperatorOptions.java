package io.github.cyfko.filtergate.core.spi;

/**
 * Tuning knobs passed to {@link FilterAdapter#applyOperator}.
 *
 * @param similarityThreshold minimum trigram similarity for {@code _similar}, in (0, 1]
 * @param maxEditDistance     maximum edit distance for {@code _fuzzy} on backends that take a number
 * @param fuzziness           fuzziness expression for search engines ({@code AUTO}, {@code 1}, ...)
 * @since 1.0.0
 */
public record OperatorOptions(double similarityThreshold, int maxEditDistance, String fuzziness) {

    public OperatorOptions {
        if (similarityThreshold <= 0 || similarityThreshold > 1) {
            throw new IllegalArgumentException("similarityThreshold must be in (0, 1], got: " + similarityThreshold);
        }
        if (maxEditDistance < 0) {
            throw new IllegalArgumentException("maxEditDistance must not be negative, got: " + maxEditDistance);
        }
        if (fuzziness == null || fuzziness.isBlank()) {
            fuzziness = "AUTO";
        }
    }

    public static OperatorOptions defaults() {
        return new OperatorOptions(0.3, 2, "AUTO");
    }
}
