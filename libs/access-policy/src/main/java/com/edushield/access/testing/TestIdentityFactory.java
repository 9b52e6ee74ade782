package com.edushield.access.testing;

import com.edushield.access.IdentityScope;
import com.edushield.access.Role;
import com.edushield.access.SessionContext;
import java.time.Instant;

/**
 * Factory for {@link IdentityScope} instances in tests.
 * <p>
 * Lives in src/main so other modules can use it from their test scope through a regular
 * Maven dependency. User ids match the owners in {@link TestInstitutionRecords}.
 */
public final class TestIdentityFactory {

    public static final String ADMIN_ID = "u101";
    public static final String TEACHER_ID = "u202";
    public static final String STUDENT_ID = "u303";

    private TestIdentityFactory() {
        // utility class
    }

    public static IdentityScope admin() {
        return create(ADMIN_ID, Role.ADMIN);
    }

    public static IdentityScope teacher() {
        return create(TEACHER_ID, Role.TEACHER);
    }

    public static IdentityScope student() {
        return create(STUDENT_ID, Role.STUDENT);
    }

    /**
     * Creates an identity whose role label is not one the institution knows.
     */
    public static IdentityScope unrecognized(String roleLabel) {
        return IdentityScope.of("u999", roleLabel, session("sess-unknown"));
    }

    public static IdentityScope create(String userId, Role role) {
        return new IdentityScope(userId, role, null, session("sess-" + userId), null);
    }

    private static SessionContext session(String sessionId) {
        return new SessionContext(sessionId, "10.0.0.7", Instant.parse("2026-01-15T09:30:00Z"), "EduShield-Test/1.0");
    }
}
