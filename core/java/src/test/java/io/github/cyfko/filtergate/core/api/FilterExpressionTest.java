package io.github.cyfko.filtergate.core.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FilterExpression Tests")
class FilterExpressionTest {

    @Test
    @DisplayName("List operands are copied and cannot be modified afterwards")
    void listOperandCopied() {
        // Given
        List<Object> values = new ArrayList<>(List.of("a", "b"));
        FilterExpression.Leaf leaf = (FilterExpression.Leaf) FilterExpression.leaf("tags", ArrayOperator.INCLUDES_ANY, values);

        // When
        values.add("c");

        // Then
        List<?> kept = (List<?>) leaf.operators().get(ArrayOperator.INCLUDES_ANY);
        assertEquals(List.of("a", "b"), kept);
        assertThrows(UnsupportedOperationException.class, () -> kept.clear());
    }

    @Test
    @DisplayName("Map operands are copied deeply and may hold nulls")
    void mapOperandCopied() {
        // Given
        List<Object> inner = new ArrayList<>(Arrays.asList("x", null));
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("labels", inner);
        FilterExpression.Leaf leaf = (FilterExpression.Leaf) FilterExpression.leaf("meta", JsonOperator.CONTAINS, document);

        // When
        document.put("extra", 1);
        inner.add("y");

        // Then
        Map<?, ?> kept = (Map<?, ?>) leaf.operators().get(JsonOperator.CONTAINS);
        assertEquals(1, kept.size());
        assertEquals(Arrays.asList("x", null), kept.get("labels"));
    }

    @Test
    @DisplayName("Leaves need a field and at least one operator")
    void leafValidation() {
        assertThrows(IllegalArgumentException.class, () -> new FilterExpression.Leaf(" ", Map.of(ScalarOperator.EQ, 1)));
        assertThrows(IllegalArgumentException.class, () -> new FilterExpression.Leaf("age", Map.of()));
    }

    @Test
    @DisplayName("Leaves are collected depth first")
    void leavesInOrder() {
        FilterExpression tree = FilterExpression.and(
                FilterExpression.leaf("age", ScalarOperator.GTE, 18),
                FilterExpression.not(FilterExpression.leaf("name", ScalarOperator.EQ, "Bob")));

        assertEquals(List.of("age", "name"), tree.leaves().stream().map(FilterExpression.Leaf::field).toList());
    }
}
