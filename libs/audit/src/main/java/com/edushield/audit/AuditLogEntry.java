package com.edushield.audit;

import com.edushield.access.AuthorizationResult;
import com.edushield.access.IdentityScope;
import com.edushield.access.PolicyDecision;
import com.edushield.access.SessionContext;
import com.edushield.access.freshness.TtlStatus;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only record of one processed request.
 * <p>
 * Built once per request, never mutated, and sanitized again by {@link AuditSanitizer}
 * before any sink sees it.
 *
 * @param traceId           request trace id
 * @param userId            requester's user id
 * @param role              requester's role label
 * @param presentedRole     role label as the caller presented it, kept for unrecognized roles
 * @param clearance         clearance label derived from the role
 * @param sessionContext    requester's session
 * @param modelInvoked      id of the downstream model the context was prepared for
 * @param resourcesAccessed authorized resource ids
 * @param resourcesDenied   denied resource ids
 * @param fieldsMasked      withheld field names
 * @param policyDecision    overall decision
 * @param explanation       human-readable account of the decision
 * @param ttlStatus         freshness status per authorized resource
 * @param timestamp         when the entry was built
 */
public record AuditLogEntry(
        String traceId,
        String userId,
        String role,
        String presentedRole,
        String clearance,
        SessionContext sessionContext,
        String modelInvoked,
        List<String> resourcesAccessed,
        List<String> resourcesDenied,
        List<String> fieldsMasked,
        PolicyDecision policyDecision,
        String explanation,
        Map<String, TtlStatus> ttlStatus,
        Instant timestamp
) {

    public AuditLogEntry {
        if (traceId == null || traceId.isBlank()) {
            throw new IllegalArgumentException("traceId must not be null or blank");
        }
        if (policyDecision == null) {
            throw new IllegalArgumentException("policyDecision must not be null");
        }
        resourcesAccessed = resourcesAccessed == null ? List.of() : List.copyOf(resourcesAccessed);
        resourcesDenied = resourcesDenied == null ? List.of() : List.copyOf(resourcesDenied);
        fieldsMasked = fieldsMasked == null ? List.of() : List.copyOf(fieldsMasked);
        ttlStatus = ttlStatus == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(ttlStatus));
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    /**
     * Builds the entry for a request from its identity, authorization result and
     * freshness statuses.
     */
    public static AuditLogEntry of(String traceId, IdentityScope identity, String modelInvoked,
                                   AuthorizationResult authorization, Map<String, TtlStatus> ttlStatus,
                                   Instant timestamp) {
        return new AuditLogEntry(
                traceId,
                identity.userId(),
                identity.role().label(),
                identity.presentedRole(),
                identity.clearance(),
                identity.session(),
                modelInvoked,
                List.copyOf(authorization.authorized()),
                List.copyOf(authorization.denied()),
                List.copyOf(authorization.maskedFields()),
                authorization.decision(),
                authorization.explanation(),
                ttlStatus,
                timestamp);
    }
}
