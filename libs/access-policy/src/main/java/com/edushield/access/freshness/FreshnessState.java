package com.edushield.access.freshness;

import java.util.Locale;

/**
 * Whether an access found a resource's cached copy still inside its TTL.
 */
public enum FreshnessState {
    REFRESHED,
    CACHED;

    /** Lower-case label as written to the audit trail ("refreshed", "cached"). */
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
