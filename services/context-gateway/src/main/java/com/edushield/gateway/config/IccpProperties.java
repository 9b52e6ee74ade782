package com.edushield.gateway.config;

import com.edushield.access.PolicyConfiguration;
import com.edushield.audit.AuditPipelineOptions;
import com.edushield.audit.sink.InMemoryAuditSink;
import com.edushield.context.ModelDescriptor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the context gateway.
 *
 * <p>Bound from the {@code edushield.iccp.*} prefix and validated at startup:
 *
 * <pre>
 * edushield:
 *   iccp:
 *     service-name: context-gateway
 *     policy-version: "1.0"
 *     audit:
 *       file: logs/audit_log.jsonl
 *       queue-capacity: 10000
 *       max-write-attempts: 3
 *       retry-backoff: 50ms
 *       shutdown-timeout: 10s
 *       memory-capacity: 10000
 *     packet-store:
 *       capacity: 10000
 *     model:
 *       model-id: claude-sonnet-4-20250514
 *       provider: Anthropic
 * </pre>
 *
 * @param serviceName   service name used as the metric service tag. Required.
 * @param policyVersion version label folded into every policy hash
 * @param audit         audit pipeline settings
 * @param packetStore   context packet correlation store settings
 * @param model         downstream model used when a request names none
 */
@ConfigurationProperties(prefix = "edushield.iccp")
@Validated
public record IccpProperties(
        @NotBlank String serviceName,
        String policyVersion,
        @Valid Audit audit,
        @Valid PacketStore packetStore,
        @Valid Model model) {

    /**
     * Compact constructor: applies defaults for optional fields. Runs before Bean
     * Validation, so defaults satisfy constraints.
     */
    public IccpProperties {
        if (policyVersion == null || policyVersion.isBlank()) {
            policyVersion = PolicyConfiguration.DEFAULT_POLICY_VERSION;
        }
        if (audit == null) {
            audit = new Audit(null, 0, 0, null, null, 0);
        }
        if (packetStore == null) {
            packetStore = new PacketStore(0);
        }
        if (model == null) {
            model = new Model(null, null, null, null);
        }
    }

    /**
     * @param file             append-only JSON-lines audit file
     * @param queueCapacity    entries the audit queue holds before rejecting
     * @param maxWriteAttempts attempts per sink before a write is reported as failed
     * @param retryBackoff     pause between write attempts
     * @param shutdownTimeout  how long shutdown waits for the queue to drain
     * @param memoryCapacity   delivered records kept for trace-id lookup before the eldest is evicted
     */
    public record Audit(
            @NotBlank String file,
            @Positive int queueCapacity,
            @Positive int maxWriteAttempts,
            Duration retryBackoff,
            Duration shutdownTimeout,
            @Positive int memoryCapacity) {

        public Audit {
            if (file == null || file.isBlank()) {
                file = "logs/audit_log.jsonl";
            }
            if (queueCapacity <= 0) {
                queueCapacity = AuditPipelineOptions.DEFAULT_QUEUE_CAPACITY;
            }
            if (maxWriteAttempts <= 0) {
                maxWriteAttempts = AuditPipelineOptions.DEFAULT_MAX_WRITE_ATTEMPTS;
            }
            if (retryBackoff == null || retryBackoff.isNegative()) {
                retryBackoff = AuditPipelineOptions.DEFAULT_RETRY_BACKOFF;
            }
            if (shutdownTimeout == null || shutdownTimeout.isNegative() || shutdownTimeout.isZero()) {
                shutdownTimeout = AuditPipelineOptions.DEFAULT_SHUTDOWN_TIMEOUT;
            }
            if (memoryCapacity <= 0) {
                memoryCapacity = InMemoryAuditSink.DEFAULT_CAPACITY;
            }
        }

        public Path filePath() {
            return Path.of(file);
        }

        public AuditPipelineOptions toOptions() {
            return new AuditPipelineOptions(queueCapacity, maxWriteAttempts, retryBackoff, shutdownTimeout);
        }
    }

    /**
     * @param capacity packets retained for trace-id lookup before the eldest is evicted
     */
    public record PacketStore(@Positive int capacity) {

        public PacketStore {
            if (capacity <= 0) {
                capacity = 10_000;
            }
        }
    }

    /**
     * @param modelId                  model identifier
     * @param provider                 model provider
     * @param complianceClassification compliance classification
     * @param riskLevel                risk level
     */
    public record Model(String modelId, String provider, String complianceClassification, String riskLevel) {

        public Model {
            if (modelId == null || modelId.isBlank()) {
                modelId = "claude-sonnet-4-20250514";
                if (provider == null || provider.isBlank()) {
                    provider = "Anthropic";
                }
                if (complianceClassification == null || complianceClassification.isBlank()) {
                    complianceClassification = "SOC2-certified";
                }
            }
            if (riskLevel == null || riskLevel.isBlank()) {
                riskLevel = "low";
            }
        }

        public ModelDescriptor toDescriptor() {
            return new ModelDescriptor(modelId, provider, complianceClassification, riskLevel);
        }
    }
}
