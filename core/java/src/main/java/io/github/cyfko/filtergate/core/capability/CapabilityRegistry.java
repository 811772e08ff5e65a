package io.github.cyfko.filtergate.core.capability;

import io.github.cyfko.filtergate.core.api.Operator;
import io.github.cyfko.filtergate.core.api.OperatorCategory;
import io.github.cyfko.filtergate.core.exception.AdapterSelectionException;
import io.github.cyfko.filtergate.core.memory.MemoryAdapter;
import io.github.cyfko.filtergate.core.model.FieldKind;
import io.github.cyfko.filtergate.core.spi.FilterAdapter;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Selects the adapter for a connection and caches its detected capabilities.
 * <p>
 * Adapter selection follows a fixed cascade, first match wins:
 * </p>
 * <ol>
 *   <li>an explicit per-request override naming a registered adapter</li>
 *   <li>the adapter registered for the connection's connector type</li>
 *   <li>the in-memory adapter when the connection has no connector at all</li>
 * </ol>
 * <p>
 * A connector type with no registered adapter uses the configured fallback adapter if
 * there is one, and otherwise raises {@link AdapterSelectionException}. The in-memory
 * fallback for connector-less data is a normal outcome, not an error.
 * </p>
 *
 * <h2>Capability cache</h2>
 * <p>
 * Capabilities are detected once per {@code (connection, adapter)} pair and stored in
 * the concurrent map given at construction, so the owner decides its scope and tests
 * can use an isolated instance. {@link #invalidate(String)} forces re-detection after a
 * schema or extension change.
 * </p>
 *
 * <pre>{@code
 * CapabilityRegistry registry = new CapabilityRegistry(new ConcurrentHashMap<>(), null);
 * registry.register(SqlAdapters.postgres());
 *
 * ConnectionDescriptor main = new ConnectionDescriptor("main", "postgresql", new JpaSqlProbe(emf));
 * FilterAdapter<?> adapter = registry.select(main);         // postgres, capabilities detected once
 * FilterAdapter<?> inMemory = registry.select(null);        // memory
 * registry.invalidate("main");                              // next select re-detects
 * }</pre>
 *
 * @since 1.0.0
 */
public final class CapabilityRegistry {
    private static final Logger log = Logger.getLogger(CapabilityRegistry.class.getName());

    private static final String NO_CONNECTION = "<none>";

    private final ConcurrentMap<String, AdapterCapabilities> cache;
    private final Map<String, AdapterRegistration> registrations = new ConcurrentHashMap<>();
    private final Map<String, String> connectorRoutes = new ConcurrentHashMap<>();
    private final String fallbackAdapterId;

    /**
     * @param cache             capability cache owned by the caller
     * @param fallbackAdapterId adapter used for unmapped connector types, {@code null} for none
     */
    public CapabilityRegistry(ConcurrentMap<String, AdapterCapabilities> cache, String fallbackAdapterId) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.fallbackAdapterId = fallbackAdapterId == null || fallbackAdapterId.isBlank() ? null : fallbackAdapterId;
        register(MemoryAdapter.registration());
    }

    /**
     * Registers an adapter and routes its connector types to it.
     *
     * @param registration adapter registration
     * @throws IllegalArgumentException if the adapter id or one of its connector types is already registered
     */
    public void register(AdapterRegistration registration) {
        Objects.requireNonNull(registration, "registration");
        if (registrations.putIfAbsent(registration.adapterId(), registration) != null) {
            throw new IllegalArgumentException("Adapter [" + registration.adapterId() + "] is already registered.");
        }
        for (String connectorType : registration.connectorTypes()) {
            String key = connectorType.trim().toLowerCase(Locale.ROOT);
            String previous = connectorRoutes.putIfAbsent(key, registration.adapterId());
            if (previous != null) {
                throw new IllegalArgumentException("Connector type [" + key + "] is already routed to adapter ["
                        + previous + "].");
            }
        }
        log.fine(() -> "Registered adapter " + registration.adapterId() + " for " + registration.connectorTypes());
    }

    /**
     * @return identities of all registered adapters, sorted
     */
    public Set<String> registeredAdapters() {
        return Collections.unmodifiableSet(new TreeSet<>(registrations.keySet()));
    }

    /**
     * Detects (or returns cached) capabilities of the adapter selected for a connection.
     *
     * @param connection the connection, {@code null} for connector-less data
     * @return capabilities of the selected adapter
     * @throws AdapterSelectionException if no adapter can be selected
     */
    public AdapterCapabilities detect(ConnectionDescriptor connection) {
        return capabilities(connection, resolve(connection, null));
    }

    /**
     * Selects the adapter for a connection without override.
     *
     * @param connection the connection, {@code null} for connector-less data
     * @return the adapter, created for the connection's capabilities
     */
    public FilterAdapter<?> select(ConnectionDescriptor connection) {
        return select(connection, null);
    }

    /**
     * Selects the adapter for a connection.
     *
     * @param connection        the connection, {@code null} for connector-less data
     * @param overrideAdapterId explicit adapter, {@code null} to use the cascade
     * @return the adapter, created for the connection's capabilities
     * @throws AdapterSelectionException if no adapter can be selected
     */
    public FilterAdapter<?> select(ConnectionDescriptor connection, String overrideAdapterId) {
        AdapterRegistration registration = resolve(connection, overrideAdapterId);
        AdapterCapabilities capabilities = capabilities(connection, registration);
        return registration.factory().apply(capabilities);
    }

    /**
     * Forces a specific adapter without a connection; detection runs unprobed and yields
     * the adapter's baseline capabilities.
     *
     * @param adapterId registered adapter identity
     * @return the adapter
     */
    public FilterAdapter<?> override(String adapterId) {
        return select(null, adapterId);
    }

    /**
     * @return operators the selected adapter offers for a field category and kind
     */
    public Set<Operator> supportedOperators(ConnectionDescriptor connection, OperatorCategory category, FieldKind kind) {
        return detect(connection).supportedOperators(category, kind);
    }

    /**
     * Drops cached capabilities of a connection, for every adapter.
     *
     * @param connectionId connection identity
     */
    public void invalidate(String connectionId) {
        String prefix = connectionId + "|";
        cache.keySet().removeIf(key -> key.startsWith(prefix));
        log.fine(() -> "Invalidated capabilities of connection " + connectionId);
    }

    public void invalidateAll() {
        cache.clear();
        log.fine("Invalidated all cached capabilities");
    }

    /**
     * Logs the capability report of the adapter selected for a connection at {@code INFO}.
     *
     * @param connection the connection, {@code null} for connector-less data
     */
    public void logReport(ConnectionDescriptor connection) {
        AdapterCapabilities capabilities = detect(connection);
        log.info(() -> "Capabilities of " + (connection == null ? NO_CONNECTION : connection.id()) + ":\n"
                + capabilities.report());
    }

    private AdapterRegistration resolve(ConnectionDescriptor connection, String overrideAdapterId) {
        if (overrideAdapterId != null) {
            AdapterRegistration forced = registrations.get(overrideAdapterId);
            if (forced == null) {
                throw new AdapterSelectionException("Adapter override [" + overrideAdapterId
                        + "] is not registered. Known adapters: " + registeredAdapters());
            }
            return forced;
        }
        if (connection == null || !connection.hasConnector()) {
            return registrations.get(MemoryAdapter.ID);
        }
        String connectorType = connection.connectorType().trim().toLowerCase(Locale.ROOT);
        String adapterId = connectorRoutes.get(connectorType);
        if (adapterId == null && fallbackAdapterId != null) {
            log.fine(() -> "No adapter for connector " + connectorType + ", using fallback " + fallbackAdapterId);
            adapterId = fallbackAdapterId;
        }
        if (adapterId == null) {
            throw new AdapterSelectionException("No adapter registered for connector type [" + connectorType
                    + "] and no fallback adapter configured");
        }
        AdapterRegistration registration = registrations.get(adapterId);
        if (registration == null) {
            throw new AdapterSelectionException("Adapter [" + adapterId + "] for connector type [" + connectorType
                    + "] is not registered");
        }
        return registration;
    }

    private AdapterCapabilities capabilities(ConnectionDescriptor connection, AdapterRegistration registration) {
        String connectionId = connection == null ? NO_CONNECTION : connection.id();
        String key = connectionId + "|" + registration.adapterId();
        AdapterCapabilities cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        AdapterCapabilities detected = registration.detector().detect(
                connection == null ? ConnectionDescriptor.none(NO_CONNECTION) : connection);
        AdapterCapabilities previous = cache.putIfAbsent(key, detected);
        if (previous != null) {
            return previous;
        }
        if (log.isLoggable(Level.INFO)) {
            log.info("Detected " + registration.adapterId() + " capabilities for " + connectionId
                    + " (version " + detected.version() + ", features " + detected.features() + ")");
        }
        return detected;
    }
}
