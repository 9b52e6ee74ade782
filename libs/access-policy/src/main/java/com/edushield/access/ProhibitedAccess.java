package com.edushield.access;

/**
 * An institution-level (role, resource) pair that is always denied, whatever the role grant says.
 *
 * @param role       the role the prohibition applies to
 * @param resourceId the resource that role may never receive
 */
public record ProhibitedAccess(Role role, String resourceId) {

    public ProhibitedAccess {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceId must not be null or blank");
        }
    }

    /** Rendered as {@code Role+resource}, the form carried in context constraints. */
    public String render() {
        return role.label() + "+" + resourceId;
    }
}
