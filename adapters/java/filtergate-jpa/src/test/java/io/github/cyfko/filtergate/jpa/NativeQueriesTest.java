package io.github.cyfko.filtergate.jpa;

import io.github.cyfko.filtergate.core.complexity.QueryWindow;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("NativeQueries Tests")
class NativeQueriesTest {

    @Test
    @DisplayName("Placeholders are numbered outside quoted literals")
    void numbered() {
        assertEquals("a = ?1 AND b = '?'", NativeQueries.numbered("a = ? AND b = '?'"));
        assertEquals("x IN (?1, ?2, ?3)", NativeQueries.numbered("x IN (?, ?, ?)"));
        assertEquals("1 = 1", NativeQueries.numbered("1 = 1"));
    }

    @Test
    @DisplayName("Selects bind every parameter in order")
    void select() {
        // Given
        EntityManager em = mock(EntityManager.class);
        Query query = mock(Query.class);
        when(em.createNativeQuery(anyString(), eq(String.class))).thenReturn(query);
        SqlSelect select = new SqlSelect("users",
                SqlCondition.of("age >= ?", 18L).and(SqlCondition.of("name LIKE ?", "A%")), QueryWindow.of(5, 0));

        // When
        Query result = NativeQueries.select(em, select, SqlDialect.SQLITE, String.class);

        // Then
        assertSame(query, result);
        verify(em).createNativeQuery("SELECT * FROM users WHERE (age >= ?1) AND (name LIKE ?2) LIMIT 5", String.class);
        verify(query).setParameter(1, 18L);
        verify(query).setParameter(2, "A%");
    }

    @Test
    @DisplayName("Raw statements without parameters are created as is")
    void create() {
        EntityManager em = mock(EntityManager.class);
        Query query = mock(Query.class);
        when(em.createNativeQuery("SELECT 1")).thenReturn(query);

        assertSame(query, NativeQueries.create(em, "SELECT 1", List.of()));
        verify(query, never()).setParameter(anyInt(), any());
    }
}
