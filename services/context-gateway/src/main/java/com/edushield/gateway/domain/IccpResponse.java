package com.edushield.gateway.domain;

import com.edushield.access.filter.FilteredView;
import com.edushield.audit.AuditLogEntry;
import com.edushield.context.ContextPacket;

/**
 * Result of processing one request. Returned before the audit entry is durable.
 *
 * @param traceId         request trace id
 * @param filteredView    per-resource filtered rows and denial markers
 * @param filteredContext flattened text rendering of the filtered view
 * @param contextPacket   the request's context packet
 * @param accessLevel     {@code full}, {@code partial} or {@code denied}
 * @param auditEntry      the audit entry queued for this request
 * @param auditQueued     whether the audit pipeline accepted the entry
 */
public record IccpResponse(
        String traceId,
        FilteredView filteredView,
        String filteredContext,
        ContextPacket contextPacket,
        String accessLevel,
        AuditLogEntry auditEntry,
        boolean auditQueued) {
}
