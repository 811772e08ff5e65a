package io.github.cyfko.filtergate.jpa;

import io.github.cyfko.filtergate.core.api.OperatorCategory;
import io.github.cyfko.filtergate.core.api.ScalarOperator;
import io.github.cyfko.filtergate.core.capability.CapabilityRegistry;
import io.github.cyfko.filtergate.core.capability.ConnectionDescriptor;
import io.github.cyfko.filtergate.core.capability.SqlProbe;
import io.github.cyfko.filtergate.core.model.FieldKind;
import io.github.cyfko.filtergate.core.spi.FilterAdapter;
import io.github.cyfko.filtergate.jpa.mysql.MySqlFilterAdapter;
import io.github.cyfko.filtergate.jpa.postgres.PostgresFilterAdapter;
import io.github.cyfko.filtergate.jpa.sqlite.SqliteFilterAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("SqlAdapters Tests")
class SqlAdaptersTest {

    private CapabilityRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CapabilityRegistry(new ConcurrentHashMap<>(), null);
        SqlAdapters.registerAll(registry);
    }

    @Test
    @DisplayName("Every relational adapter is registered next to the in-memory one")
    void registered() {
        assertTrue(registry.registeredAdapters().containsAll(Set.of("postgres", "mysql", "sqlite")));
        assertEquals(4, registry.registeredAdapters().size());
    }

    @Test
    @DisplayName("Connector types route to the matching adapter with detected capabilities")
    void routing() {
        // Given
        SqlProbe probe = mock(SqlProbe.class);
        when(probe.queryScalar("SELECT version()")).thenReturn("PostgreSQL 16.2");
        when(probe.queryColumn("SELECT extname FROM pg_extension")).thenReturn(List.of("pg_trgm"));

        // When
        FilterAdapter<?> adapter = registry.select(new ConnectionDescriptor("main", "postgres", probe));

        // Then
        assertInstanceOf(PostgresFilterAdapter.class, adapter);
        assertEquals("16.2.0", adapter.capabilities().version());
        assertTrue(adapter.capabilities().supports(OperatorCategory.SCALAR, FieldKind.STRING, ScalarOperator.SIMILAR));
    }

    @Test
    @DisplayName("Aliases route to MySQL and SQLite")
    void aliases() {
        assertInstanceOf(MySqlFilterAdapter.class, registry.select(ConnectionDescriptor.unprobed("a", "MariaDB")));
        assertInstanceOf(SqliteFilterAdapter.class, registry.select(ConnectionDescriptor.unprobed("b", "sqlite3")));
    }

    @Test
    @DisplayName("Registering twice is rejected")
    void duplicate() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(SqlAdapters.postgres()));
    }
}
