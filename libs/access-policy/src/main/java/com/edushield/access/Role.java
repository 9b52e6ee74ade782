package com.edushield.access;

import java.util.Optional;

/**
 * Institutional roles recognised by the access policy.
 * <p>
 * The set is closed. Any label that does not match a known role resolves to
 * {@link #UNRECOGNIZED}, which every policy lookup treats as "no grants" so an
 * unknown caller always ends up with a DENY decision.
 */
public enum Role {

    ADMIN("Admin", "Full-Access"),
    TEACHER("Teacher", "Department-Scoped"),
    STUDENT("Student", "Self-Scoped"),
    UNRECOGNIZED("Unrecognized", "Unauthorized");

    private final String label;
    private final String clearance;

    Role(String label, String clearance) {
        this.label = label;
        this.clearance = clearance;
    }

    /** The canonical label (e.g., "Teacher"). */
    public String label() {
        return label;
    }

    /** The clearance label derived from this role (e.g., "Department-Scoped"). */
    public String clearance() {
        return clearance;
    }

    /**
     * Returns true when the role is one of the institution's real roles.
     */
    public boolean isRecognized() {
        return this != UNRECOGNIZED;
    }

    /**
     * Looks up a Role by label or enum name, ignoring case.
     *
     * @param value the string to match (e.g., "teacher", "Teacher", "TEACHER")
     * @return the matching Role, or empty if not found; never {@link #UNRECOGNIZED}
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String candidate = value.strip();
        for (Role role : values()) {
            if (role.isRecognized()
                    && (role.label.equalsIgnoreCase(candidate) || role.name().equalsIgnoreCase(candidate))) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a free-form role label, mapping anything unknown to {@link #UNRECOGNIZED}.
     */
    public static Role parse(String value) {
        return fromString(value).orElse(UNRECOGNIZED);
    }
}
