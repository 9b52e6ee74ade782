package com.edushield.access;

/**
 * Overall outcome of evaluating a request against the policy tables.
 */
public enum PolicyDecision {

    /** Nothing requested was authorized. */
    DENY("denied"),

    /** Some requested resources were authorized, some denied. */
    ALLOW_PARTIAL("partial"),

    /** Every requested resource was authorized. */
    ALLOW_FULL("full");

    private final String accessLevel;

    PolicyDecision(String accessLevel) {
        this.accessLevel = accessLevel;
    }

    /** Short access-level label reported to callers ("full", "partial", "denied"). */
    public String accessLevel() {
        return accessLevel;
    }
}
