package com.edushield.gateway.domain;

import com.edushield.access.AuthorizationResult;
import com.edushield.access.IdentityScope;
import com.edushield.access.PolicyEngine;
import com.edushield.access.ResourceDescriptor;
import com.edushield.access.ResourceRegistry;
import com.edushield.access.filter.DataFilter;
import com.edushield.access.filter.FilteredView;
import com.edushield.access.filter.FilteredViewRenderer;
import com.edushield.access.freshness.FreshnessTracker;
import com.edushield.access.freshness.TtlStatus;
import com.edushield.audit.AuditLogEntry;
import com.edushield.audit.AuditPipeline;
import com.edushield.audit.AuditRecord;
import com.edushield.audit.sink.InMemoryAuditSink;
import com.edushield.context.ContextPacket;
import com.edushield.context.ContextPacketBuilder;
import com.edushield.context.ModelDescriptor;
import com.edushield.observability.MetricFactory;
import com.edushield.observability.TraceContext;
import com.edushield.observability.TraceContextHolder;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Integrated Context Control engine: the single entry point every context request
 * passes through.
 *
 * <p>Per request it evaluates policy, filters and masks the supplied rows, builds the
 * context packet, records resource freshness and queues exactly one audit entry. It
 * returns without waiting for the audit entry to be written.
 */
public class ContextControlEngine {

    private static final Logger log = LoggerFactory.getLogger(ContextControlEngine.class);

    private final ResourceRegistry registry;
    private final PolicyEngine policyEngine;
    private final DataFilter dataFilter;
    private final FilteredViewRenderer renderer;
    private final ContextPacketBuilder packetBuilder;
    private final FreshnessTracker freshnessTracker;
    private final AuditPipeline auditPipeline;
    private final InMemoryAuditSink auditBuffer;
    private final ContextPacketStore packetStore;
    private final MetricFactory metrics;
    private final ModelDescriptor defaultModel;
    private final Clock clock;
    private final Timer requestTimer;

    public ContextControlEngine(PolicyEngine policyEngine,
                                ContextPacketBuilder packetBuilder,
                                FreshnessTracker freshnessTracker,
                                AuditPipeline auditPipeline,
                                InMemoryAuditSink auditBuffer,
                                ContextPacketStore packetStore,
                                MetricFactory metrics,
                                ModelDescriptor defaultModel,
                                Clock clock) {
        this.registry = policyEngine.registry();
        this.policyEngine = policyEngine;
        this.dataFilter = new DataFilter(registry);
        this.renderer = new FilteredViewRenderer(registry);
        this.packetBuilder = packetBuilder;
        this.freshnessTracker = freshnessTracker;
        this.auditPipeline = auditPipeline;
        this.auditBuffer = auditBuffer;
        this.packetStore = packetStore;
        this.metrics = metrics;
        this.defaultModel = defaultModel;
        this.clock = clock;
        this.requestTimer = metrics.timer("iccp.request.duration", "Time to process one context request");
    }

    /**
     * Processes one request under a fresh trace id.
     *
     * @param request the request
     * @return the filtered context, packet and queued audit entry
     */
    public IccpResponse process(IccpRequest request) {
        IdentityScope identity = request.identity();
        TraceContext trace = new TraceContext(TraceContext.newTraceId(), identity.userId(),
                identity.role().label(), identity.session().sessionId());
        return TraceContextHolder.callWithContext(trace,
                () -> requestTimer.record(() -> handle(trace.traceId(), request)));
    }

    private IccpResponse handle(String traceId, IccpRequest request) {
        IdentityScope identity = request.identity();
        ModelDescriptor model = request.model() != null ? request.model() : defaultModel;

        AuthorizationResult authorization = policyEngine.evaluate(identity, request.requestedResources());

        FilteredView view = dataFilter.apply(request.records(), authorization, identity);
        String text = renderer.render(view);
        ContextPacket packet = packetBuilder.build(traceId, identity, model, authorization);
        Map<String, TtlStatus> ttlStatus = freshnessTracker.accessAll(authorizedDescriptors(authorization));

        AuditLogEntry entry = AuditLogEntry.of(traceId, identity, model.modelId(), authorization,
                ttlStatus, clock.instant());
        boolean queued = auditPipeline.submit(entry);
        packetStore.put(packet);

        String accessLevel = authorization.decision().accessLevel();
        metrics.counter("iccp.requests", "Context requests processed", "decision", accessLevel).increment();
        log.info("Processed context request: decision={}, authorized={}, denied={}, masked={}",
                authorization.decision(), authorization.authorized(), authorization.denied(),
                authorization.maskedFields());
        if (!queued) {
            log.error("Audit entry for {} was not queued", traceId);
        }

        return new IccpResponse(traceId, view, text, packet, accessLevel, entry, queued);
    }

    private List<ResourceDescriptor> authorizedDescriptors(AuthorizationResult authorization) {
        List<ResourceDescriptor> descriptors = new ArrayList<>();
        for (String resourceId : authorization.authorized()) {
            descriptors.add(registry.describe(resourceId));
        }
        return descriptors;
    }

    /** The context packet built for a trace id, while it is retained. */
    public Optional<ContextPacket> packet(String traceId) {
        return packetStore.find(traceId);
    }

    /** The delivered, sanitized audit record for a trace id. */
    public Optional<AuditRecord> auditEntry(String traceId) {
        return auditBuffer.find(traceId);
    }

    /** Every delivered audit record, oldest first. */
    public List<AuditRecord> auditEntries() {
        return auditBuffer.records();
    }

    /**
     * The most recent delivered audit records, oldest first.
     *
     * @param limit maximum records returned
     */
    public List<AuditRecord> auditSample(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        List<AuditRecord> all = auditBuffer.records();
        return all.subList(Math.max(0, all.size() - limit), all.size());
    }
}
