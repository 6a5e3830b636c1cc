package com.hookline.hooks.config;

import com.hookline.eventmodel.EventCatalog;
import com.hookline.eventmodel.EventFactory;
import com.hookline.eventmodel.view.RecordViews;
import com.hookline.hooks.HookDispatcher;
import com.hookline.hooks.HookModule;
import com.hookline.hooks.HookRegistry;
import com.hookline.hooks.Hookline;
import com.hookline.observability.DispatchMetrics;
import com.hookline.observability.DispatchTracer;
import com.hookline.recordmodel.DescriptorLoader;

import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires a {@link Hookline} into a Spring Boot application.
 *
 * <p>Every {@link HookModule} bean is installed into the registry. Metrics and tracing attach to the
 * application's {@link MeterRegistry} and {@link OpenTelemetry} beans when present and enabled,
 * otherwise no-op instruments are used. Any bean declared by the application takes precedence.
 */
@AutoConfiguration
@EnableConfigurationProperties(HooklineProperties.class)
@ConditionalOnProperty(prefix = "hookline", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HooklineAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(HooklineAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public EventCatalog hooklineEventCatalog(HooklineProperties properties) {
        EventCatalog catalog = EventCatalog.github();
        if (!properties.descriptorResources().isEmpty()) {
            // bundled documents are loaded again so extra descriptors may extend them
            DescriptorLoader loader = new DescriptorLoader();
            loader.addResource(EventCatalog.RECORDS_RESOURCE);
            loader.addResource(EventCatalog.EVENTS_RESOURCE);
            properties.descriptorResources().forEach(loader::addResource);
            catalog = catalog.withDescriptors(loader.load());
            log.info("Loaded extra descriptor resources: {}", properties.descriptorResources());
        }
        for (var entry : properties.events().entrySet()) {
            catalog = catalog.withEvent(entry.getKey(), entry.getValue());
        }
        return catalog;
    }

    @Bean
    @ConditionalOnMissingBean
    public RecordViews hooklineRecordViews() {
        return RecordViews.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventFactory hooklineEventFactory(EventCatalog catalog, RecordViews views) {
        return new EventFactory(catalog, views);
    }

    @Bean
    @ConditionalOnMissingBean
    public HookRegistry hooklineHookRegistry(ObjectProvider<HookModule> modules) {
        HookRegistry registry = new HookRegistry();
        modules.orderedStream().forEach(registry::install);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchMetrics hooklineDispatchMetrics(
            HooklineProperties properties, ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = properties.metricsEnabled() ? meterRegistry.getIfAvailable() : null;
        return registry != null
                ? new DispatchMetrics(registry, properties.serviceName())
                : DispatchMetrics.noop();
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchTracer hooklineDispatchTracer(
            HooklineProperties properties, ObjectProvider<OpenTelemetry> openTelemetry) {
        OpenTelemetry otel = properties.tracingEnabled() ? openTelemetry.getIfAvailable() : null;
        return otel != null ? DispatchTracer.of(otel) : DispatchTracer.noop();
    }

    @Bean
    @ConditionalOnMissingBean
    public HookDispatcher hooklineHookDispatcher(
            EventFactory factory, HookRegistry registry, DispatchMetrics metrics, DispatchTracer tracer) {
        return new HookDispatcher(factory, registry, metrics, tracer);
    }

    @Bean
    @ConditionalOnMissingBean
    public Hookline hookline(HookDispatcher dispatcher) {
        return new Hookline(dispatcher);
    }
}
