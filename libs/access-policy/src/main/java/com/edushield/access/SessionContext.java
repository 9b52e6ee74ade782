package com.edushield.access;

import java.time.Instant;
import java.util.UUID;

/**
 * Session details attached to an identity by the authentication layer.
 *
 * @param sessionId        session identifier for traceability
 * @param originAddress    network address the request came from
 * @param requestTimestamp when the request was received
 * @param clientLabel      client/user-agent label
 */
public record SessionContext(
        String sessionId,
        String originAddress,
        Instant requestTimestamp,
        String clientLabel
) {

    /** Origin used when the transport did not supply one. */
    public static final String UNKNOWN_ORIGIN = "0.0.0.0";

    /** Client label used when the transport did not supply one. */
    public static final String DEFAULT_CLIENT_LABEL = "EduShield/1.0";

    /**
     * Compact constructor: fills in defaults for anything the caller left blank.
     */
    public SessionContext {
        if (sessionId == null || sessionId.isBlank()) {
            sessionId = newSessionId();
        }
        if (originAddress == null || originAddress.isBlank()) {
            originAddress = UNKNOWN_ORIGIN;
        }
        if (requestTimestamp == null) {
            requestTimestamp = Instant.now();
        }
        if (clientLabel == null || clientLabel.isBlank()) {
            clientLabel = DEFAULT_CLIENT_LABEL;
        }
    }

    /**
     * Creates a session context with a generated id and default origin and client label.
     */
    public static SessionContext anonymous() {
        return new SessionContext(null, null, null, null);
    }

    private static String newSessionId() {
        return "sess-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
