package io.github.cyfko.filtergate.spring.autoconfigure;

import io.github.cyfko.filtergate.core.FilterGate;
import io.github.cyfko.filtergate.core.PreparedQuery;
import io.github.cyfko.filtergate.core.admission.AdmissionController;
import io.github.cyfko.filtergate.core.admission.AdmissionDecision;
import io.github.cyfko.filtergate.core.admission.LoadMonitor;
import io.github.cyfko.filtergate.core.admission.LoadSnapshot;
import io.github.cyfko.filtergate.core.capability.AdapterCapabilities;
import io.github.cyfko.filtergate.core.capability.AdapterRegistration;
import io.github.cyfko.filtergate.core.capability.CapabilityRegistry;
import io.github.cyfko.filtergate.core.capability.ConnectionDescriptor;
import io.github.cyfko.filtergate.core.complexity.QueryWindow;
import io.github.cyfko.filtergate.core.config.ComplexityPolicy;
import io.github.cyfko.filtergate.core.exception.AdapterSelectionException;
import io.github.cyfko.filtergate.core.memory.MemoryAdapter;
import io.github.cyfko.filtergate.core.model.AuthorizedFieldSet;
import io.github.cyfko.filtergate.core.model.FieldCatalog;
import io.github.cyfko.filtergate.core.model.FieldDescriptor;
import io.github.cyfko.filtergate.core.model.FieldKind;
import io.github.cyfko.filtergate.core.model.FieldType;
import io.github.cyfko.filtergate.core.spi.LoadMetricsSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FilterGateAutoConfiguration Tests")
class FilterGateAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(FilterGateAutoConfiguration.class));

    @Configuration(proxyBeanMethods = false)
    static class LoadConfig {
        @Bean
        LoadMetricsSource loadMetricsSource() {
            return LoadSnapshot::idle;
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class PolicyConfig {
        @Bean
        ComplexityPolicy complexityPolicy() {
            return ComplexityPolicy.builder().baseLimit(42).build();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class RegistrationConfig {
        @Bean
        AdapterRegistration archiveRegistration() {
            return new AdapterRegistration("archive", Set.of("archive"),
                    connection -> MemoryAdapter.registration().detector().detect(connection),
                    MemoryAdapter::new);
        }
    }

    @Test
    @DisplayName("The pipeline is wired with default settings")
    void defaults() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(FilterGate.class);
            assertThat(context).hasSingleBean(AdmissionController.class);
            assertThat(context).doesNotHaveBean(LoadMonitor.class);
            assertEquals(ComplexityPolicy.defaults(), context.getBean(ComplexityPolicy.class));
        });
    }

    @Test
    @DisplayName("Complexity properties override the chosen preset")
    void properties() {
        runner.withPropertyValues(
                        "filtergate.complexity.preset=strict",
                        "filtergate.complexity.base-limit=70",
                        "filtergate.complexity.cache-ttl=30s")
                .run(context -> {
                    ComplexityPolicy policy = context.getBean(ComplexityPolicy.class);

                    assertEquals(70, policy.baseLimit());
                    assertEquals(Duration.ofSeconds(30), policy.cacheTtl());
                    assertEquals(ComplexityPolicy.strict().warnThreshold(), policy.warnThreshold());
                    assertEquals(ComplexityPolicy.strict().largeOffsetThreshold(), policy.largeOffsetThreshold());
                });
    }

    @Test
    @DisplayName("Invalid settings fail the context")
    void invalidProperties() {
        runner.withPropertyValues("filtergate.complexity.base-limit=150")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("A load metrics source enables the load monitor")
    void loadMonitor() {
        runner.withUserConfiguration(LoadConfig.class)
                .withPropertyValues("filtergate.load.refresh-interval=250ms")
                .run(context -> {
                    assertThat(context).hasSingleBean(LoadMonitor.class);
                    assertEquals(Duration.ofMillis(250), context.getBean(LoadMonitor.class).interval());
                });
    }

    @Test
    @DisplayName("Application beans take precedence")
    void backsOff() {
        runner.withUserConfiguration(PolicyConfig.class)
                .withPropertyValues("filtergate.complexity.base-limit=70")
                .run(context -> assertEquals(42, context.getBean(ComplexityPolicy.class).baseLimit()));
    }

    @Test
    @DisplayName("Adapter registrations and the fallback adapter reach the registry")
    void registry() {
        runner.withUserConfiguration(RegistrationConfig.class)
                .withPropertyValues("filtergate.capabilities.fallback-adapter=memory")
                .run(context -> {
                    CapabilityRegistry registry = context.getBean(CapabilityRegistry.class);

                    assertEquals(Set.of("archive", "memory"), registry.registeredAdapters());
                    assertInstanceOf(MemoryAdapter.class,
                            registry.select(ConnectionDescriptor.unprobed("legacy", "cassandra")));
                });
    }

    @Test
    @DisplayName("Without a fallback unknown connectors are refused")
    void noFallback() {
        runner.run(context -> assertThrows(AdapterSelectionException.class,
                () -> context.getBean(CapabilityRegistry.class).select(ConnectionDescriptor.unprobed("x", "cassandra"))));
    }

    @Test
    @DisplayName("The wired gate prepares in-memory filters")
    void prepare() {
        runner.run(context -> {
            // Given
            FilterGate gate = context.getBean(FilterGate.class);
            FieldCatalog catalog = FieldCatalog.builder("books")
                    .field(FieldDescriptor.of("title", FieldType.scalar(FieldKind.STRING)))
                    .build();

            // When
            PreparedQuery<?> prepared = gate.prepare(Map.of("title", Map.of("_eq", "Dune")), catalog,
                    AuthorizedFieldSet.all(), null, QueryWindow.of(10, 0));

            // Then
            assertInstanceOf(AdmissionDecision.Accept.class, prepared.decision());
        });
    }
}
