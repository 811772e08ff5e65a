package io.github.cyfko.filtergate.spring.autoconfigure;

import io.github.cyfko.filtergate.core.FilterGate;
import io.github.cyfko.filtergate.core.admission.AdmissionController;
import io.github.cyfko.filtergate.core.admission.LoadMonitor;
import io.github.cyfko.filtergate.core.admission.LoadSnapshot;
import io.github.cyfko.filtergate.core.capability.AdapterRegistration;
import io.github.cyfko.filtergate.core.capability.CapabilityRegistry;
import io.github.cyfko.filtergate.core.compile.CustomFilterRegistry;
import io.github.cyfko.filtergate.core.compile.QueryBuilder;
import io.github.cyfko.filtergate.core.complexity.ComplexityAnalyzer;
import io.github.cyfko.filtergate.core.complexity.ComplexityCache;
import io.github.cyfko.filtergate.core.config.ComplexityPolicy;
import io.github.cyfko.filtergate.core.parsing.FilterExpressionParser;
import io.github.cyfko.filtergate.core.spi.LoadMetricsSource;
import io.github.cyfko.filtergate.core.spi.OperatorOptions;
import io.github.cyfko.filtergate.core.telemetry.ComplexityEventListener;
import io.github.cyfko.filtergate.core.telemetry.LoggingComplexityListener;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Wires the filter pipeline. Every bean backs off when the application defines its own.
 * {@link AdapterRegistration} beans are added to the capability registry; a
 * {@link LoadMetricsSource} bean enables the background {@link LoadMonitor}.
 */
@AutoConfiguration
@EnableConfigurationProperties(FilterGateProperties.class)
public class FilterGateAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ComplexityPolicy complexityPolicy(FilterGateProperties properties) {
        return properties.getComplexity().toPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public CapabilityRegistry capabilityRegistry(FilterGateProperties properties,
                                                 ObjectProvider<AdapterRegistration> registrations) {
        CapabilityRegistry registry = new CapabilityRegistry(new ConcurrentHashMap<>(),
                properties.getCapabilities().getFallbackAdapter());
        registrations.orderedStream().forEach(registry::register);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public CustomFilterRegistry customFilterRegistry() {
        return new CustomFilterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryBuilder queryBuilder(CustomFilterRegistry customFilters) {
        return new QueryBuilder(customFilters, OperatorOptions.defaults());
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterExpressionParser filterExpressionParser() {
        return new FilterExpressionParser();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ComplexityAnalyzer complexityAnalyzer(ComplexityPolicy policy) {
        return new ComplexityAnalyzer(policy);
    }

    @Bean
    @ConditionalOnMissingBean
    public ComplexityCache complexityCache(ComplexityPolicy policy) {
        return new ComplexityCache(new ConcurrentHashMap<>(), policy.cacheTtl(), Clock.systemUTC());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean(LoadMetricsSource.class)
    public LoadMonitor loadMonitor(LoadMetricsSource source, FilterGateProperties properties) {
        return new LoadMonitor(source, properties.getLoad().getRefreshInterval());
    }

    @Bean
    @ConditionalOnMissingBean
    public LoggingComplexityListener loggingComplexityListener() {
        return new LoggingComplexityListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public AdmissionController admissionController(ComplexityPolicy policy, ComplexityAnalyzer analyzer,
                                                   ComplexityCache cache, ObjectProvider<LoadMonitor> loadMonitor,
                                                   ObjectProvider<ComplexityEventListener> listeners) {
        LoadMonitor monitor = loadMonitor.getIfAvailable();
        Supplier<LoadSnapshot> load = monitor != null ? monitor : LoadSnapshot::idle;
        List<ComplexityEventListener> all = listeners.orderedStream().collect(Collectors.toList());
        return new AdmissionController(policy, analyzer, cache, load, all);
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterGate filterGate(FilterExpressionParser parser, QueryBuilder queryBuilder,
                                 CapabilityRegistry registry, AdmissionController admission) {
        return new FilterGate(parser, queryBuilder, registry, admission);
    }
}
