package io.github.cyfko.filtergate.jpa;

import io.github.cyfko.filtergate.core.capability.SqlProbe;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link SqlProbe} running native queries through a short-lived {@link EntityManager}.
 *
 * @since 1.0.0
 */
public class JpaSqlProbe implements SqlProbe {

    private final EntityManagerFactory entityManagerFactory;

    public JpaSqlProbe(EntityManagerFactory entityManagerFactory) {
        this.entityManagerFactory = Objects.requireNonNull(entityManagerFactory, "entityManagerFactory");
    }

    @Override
    public Object queryScalar(String sql) {
        EntityManager em = entityManagerFactory.createEntityManager();
        try {
            List<?> rows = em.createNativeQuery(sql).getResultList();
            return rows.isEmpty() ? null : rows.get(0);
        } finally {
            em.close();
        }
    }

    @Override
    public List<Object> queryColumn(String sql) {
        EntityManager em = entityManagerFactory.createEntityManager();
        try {
            List<?> rows = em.createNativeQuery(sql).getResultList();
            return new ArrayList<>(rows);
        } finally {
            em.close();
        }
    }
}
