package com.edushield.context;

import com.edushield.access.IdentityScope;
import com.edushield.access.PolicyDecision;
import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of the authorization decision made for one request.
 * <p>
 * Exactly one packet exists per request, correlated with the audit entry by
 * {@code traceId}. Lists are defensive copies; nothing in a packet can change after it
 * is built.
 *
 * @param protocolVersion     context control protocol version
 * @param traceId             request trace id
 * @param identity            the requester
 * @param selectedModel       the downstream model the context is prepared for
 * @param authorizedResources authorized resource ids, in section order
 * @param deniedResources     denied resource ids, in section order
 * @param maskedFields        withheld field names, sorted
 * @param constraints         row restrictions and prohibited combinations
 * @param policyDecision      overall decision
 * @param policyHash          correlation fingerprint of (role, authorized set, policy version)
 * @param createdAt           when the packet was built
 */
public record ContextPacket(
        String protocolVersion,
        String traceId,
        IdentityScope identity,
        ModelDescriptor selectedModel,
        List<String> authorizedResources,
        List<String> deniedResources,
        List<String> maskedFields,
        ContextConstraints constraints,
        PolicyDecision policyDecision,
        String policyHash,
        Instant createdAt
) {

    /** Current context control protocol version. */
    public static final String PROTOCOL_VERSION = "1.0";

    public ContextPacket {
        if (traceId == null || traceId.isBlank()) {
            throw new IllegalArgumentException("traceId must not be null or blank");
        }
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        if (policyDecision == null) {
            throw new IllegalArgumentException("policyDecision must not be null");
        }
        if (protocolVersion == null || protocolVersion.isBlank()) {
            protocolVersion = PROTOCOL_VERSION;
        }
        authorizedResources = List.copyOf(authorizedResources);
        deniedResources = List.copyOf(deniedResources);
        maskedFields = List.copyOf(maskedFields);
        if (constraints == null) {
            constraints = new ContextConstraints(List.of(), List.of());
        }
    }
}
