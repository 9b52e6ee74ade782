package com.edushield.audit.sink;

import com.edushield.audit.AuditRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a human-readable summary of each record to the {@code edushield.audit} logger.
 * <p>
 * The summary is rendered from the sanitized payload only. Fallback records are logged
 * at WARN as raw JSON.
 */
public class DiagnosticAuditSink implements AuditSink {

    public static final String NAME = "log";

    /** Logger name the records are written under. */
    public static final String LOGGER_NAME = "edushield.audit";

    private static final String RULE = "=".repeat(60);

    private final Logger logger;

    public DiagnosticAuditSink() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    public DiagnosticAuditSink(Logger logger) {
        if (logger == null) {
            throw new IllegalArgumentException("logger must not be null");
        }
        this.logger = logger;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void write(AuditRecord record) {
        if (record.fallback()) {
            logger.warn("AUDIT (fallback) {}", record.toJsonLine());
            return;
        }
        if (logger.isInfoEnabled()) {
            logger.info(summary(record));
        }
    }

    /**
     * Multi-line summary of a sanitized record.
     */
    static String summary(AuditRecord record) {
        ObjectNode p = record.payload();
        return "\n" + RULE
                + "\n  AUDIT LOG - " + record.traceId()
                + "\n" + RULE
                + "\n  Timestamp : " + text(p, "timestamp")
                + "\n  User      : " + text(p, "user_id") + " | Role: " + role(p)
                + " | Clearance: " + text(p, "clearance")
                + "\n  Session   : " + text(p.path("session_context"), "session_id")
                + "\n  Model     : " + text(p, "model_invoked")
                + "\n  Decision  : " + text(p, "policy_decision")
                + "\n  Accessed  : " + p.path("resources_accessed")
                + "\n  Denied    : " + p.path("resources_denied")
                + "\n  Masked    : " + p.path("fields_masked")
                + "\n  TTL       : " + p.path("ttl_status")
                + "\n  Explain   : " + text(p, "explanation")
                + "\n" + RULE;
    }

    private static String role(JsonNode payload) {
        String role = text(payload, "role");
        JsonNode presented = payload.get("presented_role");
        if (presented == null || presented.isNull() || presented.asText().equals(role)) {
            return role;
        }
        return role + " (presented: " + presented.asText() + ")";
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "N/A" : value.asText();
    }
}
