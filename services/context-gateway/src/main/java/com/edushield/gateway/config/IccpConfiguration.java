package com.edushield.gateway.config;

import com.edushield.access.PolicyConfiguration;
import com.edushield.access.PolicyEngine;
import com.edushield.access.ResourceRegistry;
import com.edushield.access.freshness.FreshnessTracker;
import com.edushield.audit.AuditPipeline;
import com.edushield.audit.AuditSanitizer;
import com.edushield.audit.sink.DiagnosticAuditSink;
import com.edushield.audit.sink.InMemoryAuditSink;
import com.edushield.audit.sink.JsonLinesAuditSink;
import com.edushield.context.ContextPacketBuilder;
import com.edushield.gateway.domain.ContextControlEngine;
import com.edushield.gateway.domain.ContextPacketStore;
import com.edushield.observability.MetricFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the ICCP engine from {@link IccpProperties}.
 *
 * <p>Policy tables are loaded once here and shared read-only. The audit pipeline is
 * started when its bean is created and drained by {@link AuditPipeline#close()} when the
 * context closes.
 */
@Configuration
public class IccpConfiguration {

    private static final Logger log = LoggerFactory.getLogger(IccpConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, IccpProperties properties) {
        return new MetricFactory(meterRegistry, properties.serviceName());
    }

    @Bean
    public ResourceRegistry resourceRegistry() {
        return ResourceRegistry.institutionDefaults();
    }

    @Bean
    public PolicyConfiguration policyConfiguration(IccpProperties properties) {
        PolicyConfiguration configuration = PolicyConfiguration.defaults(properties.policyVersion());
        log.info("Loaded policy tables: version={}, prohibited={}, institutionMasks={}",
                configuration.policyVersion(), configuration.prohibited(), configuration.institutionMaskFields());
        return configuration;
    }

    @Bean
    public PolicyEngine policyEngine(ResourceRegistry registry, PolicyConfiguration configuration) {
        return new PolicyEngine(registry, configuration);
    }

    @Bean
    public ContextPacketBuilder contextPacketBuilder(PolicyConfiguration configuration, Clock clock) {
        return new ContextPacketBuilder(configuration, clock);
    }

    @Bean
    public FreshnessTracker freshnessTracker(Clock clock) {
        return new FreshnessTracker(clock);
    }

    @Bean
    public InMemoryAuditSink inMemoryAuditSink(IccpProperties properties) {
        return new InMemoryAuditSink(properties.audit().memoryCapacity());
    }

    @Bean(destroyMethod = "close")
    public AuditPipeline auditPipeline(IccpProperties properties, InMemoryAuditSink memorySink,
                                       MetricFactory metricFactory) {
        IccpProperties.Audit audit = properties.audit();
        AuditPipeline pipeline = new AuditPipeline(
                List.of(new JsonLinesAuditSink(audit.filePath()), memorySink, new DiagnosticAuditSink()),
                new AuditSanitizer(),
                metricFactory,
                audit.toOptions());
        pipeline.start();
        return pipeline;
    }

    @Bean
    public ContextPacketStore contextPacketStore(IccpProperties properties) {
        return new ContextPacketStore(properties.packetStore().capacity());
    }

    @Bean
    public ContextControlEngine contextControlEngine(PolicyEngine policyEngine,
                                                     ContextPacketBuilder packetBuilder,
                                                     FreshnessTracker freshnessTracker,
                                                     AuditPipeline auditPipeline,
                                                     InMemoryAuditSink memorySink,
                                                     ContextPacketStore packetStore,
                                                     MetricFactory metricFactory,
                                                     IccpProperties properties,
                                                     Clock clock) {
        return new ContextControlEngine(policyEngine, packetBuilder, freshnessTracker, auditPipeline,
                memorySink, packetStore, metricFactory, properties.model().toDescriptor(), clock);
    }
}
