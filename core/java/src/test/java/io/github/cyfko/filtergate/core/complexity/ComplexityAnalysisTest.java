package io.github.cyfko.filtergate.core.complexity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ComplexityAnalysis Tests")
class ComplexityAnalysisTest {

    @ParameterizedTest(name = "cost {0} scores {1}")
    @CsvSource({
            "0, 0",
            "-5, 0",
            "1, 6",
            "10, 21",
            "1000, 60",
            "100000, 100",
            "1e12, 100"
    })
    @DisplayName("Costs map to scores on a logarithmic scale")
    void normalize(double cost, int expected) {
        assertEquals(expected, ComplexityAnalysis.normalize(cost));
    }

    @Test
    @DisplayName("Normalization is monotonic")
    void monotonic() {
        int previous = 0;
        for (double cost = 0; cost < 200_000; cost = cost * 1.5 + 1) {
            int score = ComplexityAnalysis.normalize(cost);
            assertTrue(score >= previous, "score dropped at cost " + cost);
            previous = score;
        }
    }

    @Test
    @DisplayName("Special values do not escape the range")
    void specialValues() {
        assertEquals(0, ComplexityAnalysis.normalize(Double.NaN));
        assertEquals(100, ComplexityAnalysis.normalize(Double.POSITIVE_INFINITY));
    }

    @Test
    @DisplayName("Scores outside 0..100 are rejected")
    void scoreRange() {
        assertThrows(IllegalArgumentException.class,
                () -> new ComplexityAnalysis(1, 101, AnalysisMethod.HEURISTIC, List.of(), Map.of()));
    }

    @Test
    @DisplayName("The report lists details and suggestions")
    void format() {
        // Given
        ComplexityAnalysis analysis = new ComplexityAnalysis(1234.5, 62, AnalysisMethod.EXPLAIN,
                List.of("Add a LIMIT clause to bound the result size"), Map.of("joinCount", 2));

        // When
        String report = analysis.format();

        // Then
        assertTrue(report.startsWith("Query complexity: 62/100 (explain)"));
        assertTrue(report.contains("Estimated cost: 1234.50"));
        assertTrue(report.contains("  joinCount: 2"));
        assertTrue(report.endsWith("  - Add a LIMIT clause to bound the result size"));
    }
}
