package io.github.cyfko.filtergate.jpa;

import io.github.cyfko.filtergate.core.capability.AdapterRegistration;
import io.github.cyfko.filtergate.core.capability.CapabilityRegistry;
import io.github.cyfko.filtergate.core.complexity.ComplexityAnalyzer;
import io.github.cyfko.filtergate.jpa.mysql.MySqlCapabilityDetector;
import io.github.cyfko.filtergate.jpa.mysql.MySqlFilterAdapter;
import io.github.cyfko.filtergate.jpa.mysql.MySqlPlanExplainer;
import io.github.cyfko.filtergate.jpa.postgres.PostgresCapabilityDetector;
import io.github.cyfko.filtergate.jpa.postgres.PostgresFilterAdapter;
import io.github.cyfko.filtergate.jpa.postgres.PostgresPlanExplainer;
import io.github.cyfko.filtergate.jpa.sqlite.SqliteCapabilityDetector;
import io.github.cyfko.filtergate.jpa.sqlite.SqliteFilterAdapter;
import jakarta.persistence.EntityManagerFactory;

import java.util.List;
import java.util.Set;

/**
 * Registrations of the relational adapters, keyed by the connector types that route to
 * them.
 *
 * <pre>{@code
 * CapabilityRegistry registry = new CapabilityRegistry(new ConcurrentHashMap<>(), null);
 * SqlAdapters.registerAll(registry);
 * SqlAdapters.registerExplainers(analyzer, entityManagerFactory);
 *
 * ConnectionDescriptor pg = new ConnectionDescriptor("main", "postgresql", new JpaSqlProbe(entityManagerFactory));
 * FilterAdapter<?> adapter = registry.select(pg);   // PostgresFilterAdapter
 * }</pre>
 *
 * @since 1.0.0
 */
public final class SqlAdapters {

    private SqlAdapters() {
    }

    public static AdapterRegistration postgres() {
        return new AdapterRegistration(PostgresFilterAdapter.ID, Set.of("postgresql", "postgres"),
                new PostgresCapabilityDetector(), PostgresFilterAdapter::new);
    }

    public static AdapterRegistration mysql() {
        return new AdapterRegistration(MySqlFilterAdapter.ID, Set.of("mysql", "mariadb"),
                new MySqlCapabilityDetector(), MySqlFilterAdapter::new);
    }

    public static AdapterRegistration sqlite() {
        return new AdapterRegistration(SqliteFilterAdapter.ID, Set.of("sqlite", "sqlite3"),
                new SqliteCapabilityDetector(), SqliteFilterAdapter::new);
    }

    public static List<AdapterRegistration> all() {
        return List.of(postgres(), mysql(), sqlite());
    }

    public static void registerAll(CapabilityRegistry registry) {
        all().forEach(registry::register);
    }

    /**
     * Registers the EXPLAIN-based estimators of the dialects that have one.
     */
    public static void registerExplainers(ComplexityAnalyzer analyzer, EntityManagerFactory entityManagerFactory) {
        analyzer.registerExplainer(PostgresFilterAdapter.ID, new PostgresPlanExplainer(entityManagerFactory));
        analyzer.registerExplainer(MySqlFilterAdapter.ID, new MySqlPlanExplainer(entityManagerFactory));
    }
}
