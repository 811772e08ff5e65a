package io.github.cyfko.filtergate.jpa;

import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.Query;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("JpaSqlProbe Tests")
class JpaSqlProbeTest {

    private EntityManager em;
    private Query query;
    private JpaSqlProbe probe;

    @BeforeEach
    void setUp() {
        EntityManagerFactory emf = mock(EntityManagerFactory.class);
        em = mock(EntityManager.class);
        query = mock(Query.class);
        when(emf.createEntityManager()).thenReturn(em);
        when(em.createNativeQuery(anyString())).thenReturn(query);
        probe = new JpaSqlProbe(emf);
    }

    @Test
    @DisplayName("Scalars come from the first row")
    void scalar() {
        when(query.getResultList()).thenReturn(List.of("PostgreSQL 16.2", "ignored"));

        assertEquals("PostgreSQL 16.2", probe.queryScalar("SELECT version()"));
        verify(em).close();
    }

    @Test
    @DisplayName("An empty result is a null scalar")
    void emptyScalar() {
        when(query.getResultList()).thenReturn(List.of());

        assertNull(probe.queryScalar("SELECT 1 WHERE 1 = 0"));
    }

    @Test
    @DisplayName("Columns are returned in row order")
    void column() {
        when(query.getResultList()).thenReturn(List.of("plpgsql", "pg_trgm"));

        assertEquals(List.of("plpgsql", "pg_trgm"), probe.queryColumn("SELECT extname FROM pg_extension"));
    }

    @Test
    @DisplayName("The entity manager is closed when the query fails")
    void closesOnFailure() {
        when(query.getResultList()).thenThrow(new PersistenceException("relation does not exist"));

        assertThrows(PersistenceException.class, () -> probe.queryColumn("SELECT x FROM missing"));
        verify(em).close();
    }
}
