package com.edushield.audit;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A sanitized audit entry as delivered to sinks.
 *
 * @param traceId  trace id of the originating request
 * @param payload  sanitized JSON body
 * @param fallback whether sanitization failed and the payload is the minimal fallback record
 */
public record AuditRecord(String traceId, ObjectNode payload, boolean fallback) {

    public AuditRecord {
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        payload = payload.deepCopy();
    }

    /** The payload as one JSON line. */
    public String toJsonLine() {
        return AuditEntrySerializer.toJsonLine(payload);
    }

    /** Returns a copy of the payload. */
    @Override
    public ObjectNode payload() {
        return payload.deepCopy();
    }
}
