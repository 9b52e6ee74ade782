package com.edushield.access;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Registry entry declaring where a resource comes from, how sensitive it is, how long a
 * fetched copy stays fresh, and which roles the institution permits to see it at all.
 *
 * @param resourceId   stable resource identifier (e.g., "financial_information")
 * @param origin       source system label (e.g., "MockSIS")
 * @param sensitivity  sensitivity classification (e.g., "FERPA-Financial")
 * @param ttlSeconds   freshness window in seconds; zero means always refresh
 * @param allowedRoles roles permitted at the institution level
 * @param category     kind of data, drives section order and masking eligibility
 * @param fields       field names carried by rows of this resource, in display order
 * @param ownerField   row field holding the owning user id, or null when rows have no owner
 */
public record ResourceDescriptor(
        String resourceId,
        String origin,
        String sensitivity,
        long ttlSeconds,
        Set<Role> allowedRoles,
        ResourceCategory category,
        List<String> fields,
        String ownerField
) {

    public ResourceDescriptor {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceId must not be null or blank");
        }
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("ttlSeconds must not be negative: " + ttlSeconds);
        }
        if (category == null) {
            throw new IllegalArgumentException("category must not be null");
        }
        allowedRoles = allowedRoles == null || allowedRoles.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(allowedRoles));
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    /** Whether the institution allows the role to see this resource at all. */
    public boolean permits(Role role) {
        return allowedRoles.contains(role);
    }

    /** Whether rows of this resource carry the given field. */
    public boolean hasField(String field) {
        return fields.contains(field);
    }

    /** Whether rows of this resource can be filtered by owner. */
    public boolean isOwned() {
        return ownerField != null && !ownerField.isBlank();
    }
}
