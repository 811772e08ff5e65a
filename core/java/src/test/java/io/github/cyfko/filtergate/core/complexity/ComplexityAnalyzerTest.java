package io.github.cyfko.filtergate.core.complexity;

import io.github.cyfko.filtergate.core.TestCatalogs;
import io.github.cyfko.filtergate.core.api.FilterExpression;
import io.github.cyfko.filtergate.core.api.ScalarOperator;
import io.github.cyfko.filtergate.core.capability.AdapterCapabilities;
import io.github.cyfko.filtergate.core.capability.Feature;
import io.github.cyfko.filtergate.core.config.ComplexityPolicy;
import io.github.cyfko.filtergate.core.spi.FilterAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ComplexityAnalyzer Tests")
class ComplexityAnalyzerTest {

    private ComplexityAnalyzer analyzer;
    private AnalysisOptions options;

    @BeforeEach
    void setUp() {
        analyzer = new ComplexityAnalyzer(ComplexityPolicy.builder().explainTimeout(Duration.ofMillis(200)).build());
        options = new AnalysisOptions(FilterExpression.leaf("age", ScalarOperator.GT, 18), TestCatalogs.users(),
                QueryWindow.of(20, 0));
    }

    @AfterEach
    void tearDown() {
        analyzer.close();
    }

    @SuppressWarnings("unchecked")
    private static FilterAdapter<String> adapter(String id, boolean explain) {
        AdapterCapabilities.Builder builder = AdapterCapabilities.builder(id);
        if (explain) {
            builder.feature(Feature.QUERY_EXPLAIN);
        }
        FilterAdapter<String> adapter = mock(FilterAdapter.class);
        when(adapter.id()).thenReturn(id);
        when(adapter.capabilities()).thenReturn(builder.build());
        return adapter;
    }

    private static PlanEstimate plan(double cost) {
        return new PlanEstimate(cost, 120, 3, 0, List.of(), 1, false, false, Map.of());
    }

    // ============================================================================
    // Strategy selection
    // ============================================================================

    @Nested
    @DisplayName("Strategy selection")
    class StrategySelection {

        @Test
        @DisplayName("Uses the plan when the adapter can explain and an explainer is registered")
        void explainPath() {
            // Given
            AtomicReference<String> explained = new AtomicReference<>();
            analyzer.registerExplainer("pg", (String query, AnalysisOptions opts) -> {
                explained.set(query);
                return plan(1000);
            });

            // When
            ComplexityAnalysis analysis = analyzer.analyze("age > ?", adapter("pg", true), options);

            // Then
            assertEquals(AnalysisMethod.EXPLAIN, analysis.method());
            assertEquals(1000.0, analysis.cost());
            assertEquals(60, analysis.normalizedScore());
            assertEquals("age > ?", explained.get());
        }

        @Test
        @DisplayName("Falls back to heuristics without the explain feature")
        void heuristicWithoutFeature() {
            // Given
            analyzer.registerExplainer("pg", (String query, AnalysisOptions opts) -> plan(1000));

            // When
            ComplexityAnalysis analysis = analyzer.analyze("age > ?", adapter("pg", false), options);

            // Then
            assertEquals(AnalysisMethod.HEURISTIC, analysis.method());
        }

        @Test
        @DisplayName("Falls back to heuristics without a registered explainer")
        void heuristicWithoutExplainer() {
            ComplexityAnalysis analysis = analyzer.analyze("age > ?", adapter("pg", true), options);

            assertEquals(AnalysisMethod.HEURISTIC, analysis.method());
            assertEquals(HeuristicScorer.CONDITION, analysis.normalizedScore());
        }
    }

    // ============================================================================
    // Fail open
    // ============================================================================

    @Nested
    @DisplayName("Fail open")
    class FailOpen {

        @Test
        @DisplayName("A failing explainer yields an unknown analysis")
        void explainerFailure() {
            // Given
            analyzer.registerExplainer("pg", (String query, AnalysisOptions opts) -> {
                throw new IllegalStateException("connection refused");
            });

            // When
            ComplexityAnalysis analysis = analyzer.analyze("age > ?", adapter("pg", true), options);

            // Then
            assertTrue(analysis.isFailOpen());
            assertEquals(0, analysis.normalizedScore());
            assertTrue(String.valueOf(analysis.rawDetails().get("error")).contains("connection refused"));
        }

        @Test
        @DisplayName("A slow explainer is abandoned after the timeout")
        void explainerTimeout() {
            // Given
            analyzer.registerExplainer("pg", (String query, AnalysisOptions opts) -> {
                Thread.sleep(5_000);
                return plan(1);
            });

            // When
            long start = System.nanoTime();
            ComplexityAnalysis analysis = analyzer.analyze("age > ?", adapter("pg", true), options);
            long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

            // Then
            assertTrue(analysis.isFailOpen());
            assertTrue(elapsedMillis < 4_000, "analysis waited " + elapsedMillis + " ms");
        }
    }

    // ============================================================================
    // Plan scoring
    // ============================================================================

    @Test
    @DisplayName("Plan signals become suggestions and details")
    void fromPlan() {
        // Given
        PlanEstimate estimate = new PlanEstimate(50_000, 1_000_000, 9, 4, List.of("users", "orders"), 0,
                true, true, Map.of("nodeType", "Hash Join"));

        // When
        ComplexityAnalysis analysis = ComplexityAnalyzer.fromPlan(estimate, QueryWindow.unbounded());

        // Then
        assertEquals(AnalysisMethod.EXPLAIN, analysis.method());
        assertEquals(ComplexityAnalysis.normalize(50_000), analysis.normalizedScore());
        assertEquals(List.of(
                "Consider adding indexes to: users, orders",
                "Add a LIMIT clause to bound the result size",
                "Query cost is very high; narrow the filter or add selective indexes",
                "Query joins more than 3 relations; consider a materialized view",
                "Add an index covering the ORDER BY columns to avoid a filesort",
                "Optimize GROUP BY to avoid a temporary table"), analysis.suggestions());
        assertEquals("Hash Join", analysis.rawDetails().get("nodeType"));
    }

    @Test
    @DisplayName("A cheap bounded plan has no suggestions")
    void cheapPlan() {
        ComplexityAnalysis analysis = ComplexityAnalyzer.fromPlan(plan(8.5), QueryWindow.of(10, 0));

        assertTrue(analysis.suggestions().isEmpty());
    }
}
