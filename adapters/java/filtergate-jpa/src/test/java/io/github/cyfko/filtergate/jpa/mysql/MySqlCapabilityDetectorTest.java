package io.github.cyfko.filtergate.jpa.mysql;

import io.github.cyfko.filtergate.core.api.ArrayOperator;
import io.github.cyfko.filtergate.core.api.JsonOperator;
import io.github.cyfko.filtergate.core.api.OperatorCategory;
import io.github.cyfko.filtergate.core.api.ScalarOperator;
import io.github.cyfko.filtergate.core.capability.AdapterCapabilities;
import io.github.cyfko.filtergate.core.capability.ConnectionDescriptor;
import io.github.cyfko.filtergate.core.capability.Feature;
import io.github.cyfko.filtergate.core.capability.SqlProbe;
import io.github.cyfko.filtergate.core.model.FieldKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("MySqlCapabilityDetector Tests")
class MySqlCapabilityDetectorTest {

    private static AdapterCapabilities detect(Object banner) {
        SqlProbe probe = mock(SqlProbe.class);
        when(probe.queryScalar("SELECT VERSION()")).thenReturn(banner);
        return new MySqlCapabilityDetector().detect(new ConnectionDescriptor("orders", "mysql", probe));
    }

    @Test
    @DisplayName("MySQL 8.0.33 offers JSON arrays with overlap")
    void modernServer() {
        // When
        AdapterCapabilities caps = detect("8.0.33-0ubuntu0.22.04.2");

        // Then
        assertEquals("8.0.33", caps.version());
        assertTrue(caps.supports(Feature.JSON_ARRAYS));
        assertTrue(caps.supports(Feature.ARRAY_OVERLAP));
        assertFalse(caps.supports(Feature.NATIVE_ARRAYS));
        assertFalse(caps.supports(Feature.ARRAY_CONTAINS_ALL));
        assertEquals(Set.of(ArrayOperator.INCLUDES, ArrayOperator.EXCLUDES, ArrayOperator.IS_EMPTY,
                        ArrayOperator.IS_NULL, ArrayOperator.INCLUDES_ANY, ArrayOperator.EXCLUDES_ALL),
                caps.supportedOperators(OperatorCategory.ARRAY, FieldKind.STRING));
        assertEquals(5, caps.supportedOperators(OperatorCategory.JSON, FieldKind.JSON).size());
        assertFalse(caps.supports(OperatorCategory.JSON, FieldKind.JSON, JsonOperator.PATH_MATCH));
        assertTrue(caps.supports(OperatorCategory.SCALAR, FieldKind.STRING, ScalarOperator.SEARCH));
    }

    @Test
    @DisplayName("MySQL 5.5 keeps only the baseline")
    void legacyServer() {
        // When
        AdapterCapabilities caps = detect("5.5.62-log");

        // Then
        assertTrue(caps.supports(Feature.QUERY_EXPLAIN));
        assertFalse(caps.supports(Feature.FULL_TEXT_SEARCH));
        assertFalse(caps.supports(Feature.GEO_SPATIAL));
        assertEquals(Set.of(ArrayOperator.IS_NULL), caps.supportedOperators(OperatorCategory.ARRAY, FieldKind.STRING));
        assertTrue(caps.supportedOperators(OperatorCategory.JSON, FieldKind.JSON).isEmpty());
        assertTrue(caps.report().contains("Upgrade to MySQL 5.7 or later"));
    }

    @Test
    @DisplayName("A failing version probe falls back to the unknown version")
    void failingProbe() {
        SqlProbe probe = mock(SqlProbe.class);
        when(probe.queryScalar(anyString())).thenThrow(new IllegalStateException("access denied"));

        AdapterCapabilities caps = new MySqlCapabilityDetector().detect(new ConnectionDescriptor("orders", "mysql", probe));

        assertEquals("0.0.0", caps.version());
        assertFalse(caps.supports(Feature.JSON_ARRAYS));
    }
}
