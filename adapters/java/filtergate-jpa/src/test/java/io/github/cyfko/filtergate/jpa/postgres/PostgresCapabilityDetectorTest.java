package io.github.cyfko.filtergate.jpa.postgres;

import io.github.cyfko.filtergate.core.api.ArrayOperator;
import io.github.cyfko.filtergate.core.api.GeoOperator;
import io.github.cyfko.filtergate.core.api.JsonOperator;
import io.github.cyfko.filtergate.core.api.OperatorCategory;
import io.github.cyfko.filtergate.core.api.ScalarOperator;
import io.github.cyfko.filtergate.core.capability.AdapterCapabilities;
import io.github.cyfko.filtergate.core.capability.ConnectionDescriptor;
import io.github.cyfko.filtergate.core.capability.Feature;
import io.github.cyfko.filtergate.core.capability.SqlProbe;
import io.github.cyfko.filtergate.core.exception.MissingCapabilityException;
import io.github.cyfko.filtergate.core.model.FieldKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("PostgresCapabilityDetector Tests")
class PostgresCapabilityDetectorTest {

    private SqlProbe probe;
    private PostgresCapabilityDetector detector;

    @BeforeEach
    void setUp() {
        probe = mock(SqlProbe.class);
        detector = new PostgresCapabilityDetector();
    }

    private AdapterCapabilities detect() {
        return detector.detect(new ConnectionDescriptor("main", "postgresql", probe));
    }

    @Test
    @DisplayName("A recent server with every extension offers every operator")
    void fullyEquipped() {
        // Given
        when(probe.queryScalar("SELECT version()"))
                .thenReturn("PostgreSQL 15.3 on x86_64-pc-linux-gnu, compiled by gcc");
        when(probe.queryColumn("SELECT extname FROM pg_extension"))
                .thenReturn(List.of("plpgsql", "pg_trgm", "fuzzystrmatch", "postgis"));

        // When
        AdapterCapabilities caps = detect();

        // Then
        assertEquals("postgres", caps.adapterId());
        assertEquals("15.3.0", caps.version());
        assertEquals(PostgresCapabilityDetector.MAX_IN_ITEMS, caps.maxInItems());
        for (Feature feature : Feature.values()) {
            if (feature != Feature.JSON_ARRAYS) {
                assertTrue(caps.supports(feature), feature.name());
            }
        }
        assertTrue(caps.supports(OperatorCategory.SCALAR, FieldKind.STRING, ScalarOperator.SIMILAR));
        assertTrue(caps.supports(OperatorCategory.ARRAY, FieldKind.INTEGER, ArrayOperator.EXCLUDES_ANY));
        assertTrue(caps.supports(OperatorCategory.JSON, FieldKind.JSON, JsonOperator.PATH_MATCH));
        assertTrue(caps.supports(OperatorCategory.GEO, FieldKind.GEO, GeoOperator.ST_DWITHIN));
    }

    @Test
    @DisplayName("Missing extensions leave hints")
    void missingExtensions() {
        // Given
        when(probe.queryScalar("SELECT version()")).thenReturn("PostgreSQL 11.20");
        when(probe.queryColumn("SELECT extname FROM pg_extension")).thenReturn(List.of("plpgsql"));

        // When
        AdapterCapabilities caps = detect();

        // Then
        assertTrue(caps.supports(Feature.JSON_OPERATIONS));
        assertFalse(caps.supports(Feature.JSON_PATH));
        assertFalse(caps.supports(OperatorCategory.SCALAR, FieldKind.STRING, ScalarOperator.FUZZY));
        MissingCapabilityException ex = assertThrows(MissingCapabilityException.class,
                () -> caps.require(Feature.TRIGRAM_SIMILARITY));
        assertTrue(ex.getMessage().contains("CREATE EXTENSION pg_trgm"));
        assertTrue(caps.report().contains("CREATE EXTENSION postgis"));
    }

    @Test
    @DisplayName("Failing probes degrade to the always-available operators")
    void failingProbes() {
        // Given
        when(probe.queryScalar(anyString())).thenThrow(new IllegalStateException("permission denied"));
        when(probe.queryColumn(anyString())).thenThrow(new IllegalStateException("permission denied"));

        // When
        AdapterCapabilities caps = detect();

        // Then
        assertEquals("0.0.0", caps.version());
        assertTrue(caps.supports(Feature.NATIVE_ARRAYS));
        assertTrue(caps.supports(OperatorCategory.ARRAY, FieldKind.STRING, ArrayOperator.INCLUDES_ALL));
        assertFalse(caps.supports(Feature.FULL_TEXT_SEARCH));
        assertFalse(caps.supports(OperatorCategory.JSON, FieldKind.JSON, JsonOperator.HAS_KEY));
    }

    @Test
    @DisplayName("Connections without a probe are not queried")
    void unprobed() {
        AdapterCapabilities caps = detector.detect(ConnectionDescriptor.unprobed("main", "postgresql"));

        assertEquals("0.0.0", caps.version());
        assertTrue(caps.supports(OperatorCategory.SCALAR, FieldKind.INTEGER, ScalarOperator.GTE));
    }
}
