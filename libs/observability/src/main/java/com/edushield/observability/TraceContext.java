package com.edushield.observability;

import java.util.UUID;

/**
 * Immutable per-request trace context.
 * <p>
 * Every request handled by the context gateway establishes a {@code TraceContext} whose
 * values are injected into SLF4J MDC, so each log line written while the request is
 * processed carries them. The same trace id correlates the request's context packet and
 * audit entry.
 *
 * @param traceId   request trace id ({@code tr-} followed by 8 hex characters)
 * @param userId    requester's user id (nullable before identity is resolved)
 * @param role      requester's role label (nullable before identity is resolved)
 * @param sessionId requester's session id (nullable)
 */
public record TraceContext(
        String traceId,
        String userId,
        String role,
        String sessionId
) {

    /** MDC key for trace ID. */
    public static final String MDC_TRACE_ID = "traceId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for role. */
    public static final String MDC_ROLE = "role";

    /** MDC key for session ID. */
    public static final String MDC_SESSION_ID = "sessionId";

    /** Prefix of generated trace ids. */
    public static final String TRACE_ID_PREFIX = "tr-";

    public TraceContext {
        if (traceId == null || traceId.isBlank()) {
            throw new IllegalArgumentException("traceId must not be null or blank");
        }
    }

    /**
     * Generates a fresh trace id.
     */
    public static String newTraceId() {
        return TRACE_ID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    /**
     * Creates a context with a fresh trace id.
     */
    public static TraceContext start(String userId, String role, String sessionId) {
        return new TraceContext(newTraceId(), userId, role, sessionId);
    }
}
