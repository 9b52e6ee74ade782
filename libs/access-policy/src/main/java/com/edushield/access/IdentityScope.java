package com.edushield.access;

/**
 * The authenticated requester: who is asking, in which role, from which session.
 * <p>
 * Produced by the external authentication layer and immutable for the lifetime of a
 * request. The clearance label is always derived from the role so the two can never
 * disagree.
 *
 * @param userId        unique user identifier (also the owner id matched by row filtering)
 * @param role          the requester's role; unknown labels arrive as {@link Role#UNRECOGNIZED}
 * @param clearance     clearance label derived from {@code role}
 * @param session       session details for traceability
 * @param presentedRole the role label exactly as the caller presented it; defaults to the
 *                      role's canonical label
 */
public record IdentityScope(
        String userId,
        Role role,
        String clearance,
        SessionContext session,
        String presentedRole
) {

    public IdentityScope {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (role == null) {
            role = Role.UNRECOGNIZED;
        }
        clearance = role.clearance();
        if (session == null) {
            session = SessionContext.anonymous();
        }
        if (presentedRole == null || presentedRole.isBlank()) {
            presentedRole = role.label();
        }
    }

    /**
     * Creates an identity for the given role with a fresh anonymous session.
     */
    public static IdentityScope of(String userId, Role role) {
        return new IdentityScope(userId, role, null, SessionContext.anonymous(), null);
    }

    /**
     * Creates an identity from a free-form role label, failing closed on unknown labels.
     * The label is kept as presented so a denied attempt can be traced.
     */
    public static IdentityScope of(String userId, String roleLabel, SessionContext session) {
        return new IdentityScope(userId, Role.parse(roleLabel), null, session,
                roleLabel == null ? null : roleLabel.strip());
    }
}
