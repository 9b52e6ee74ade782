package com.edushield.access;

/**
 * Thrown when a resource id has no descriptor in the {@link ResourceRegistry}.
 * <p>
 * The policy engine catches this and treats the id as denied; callers outside the
 * engine see it only when they ask the registry directly.
 */
public class UnknownResourceException extends RuntimeException {

    private final String resourceId;

    public UnknownResourceException(String resourceId) {
        super("Unknown resource '%s'".formatted(resourceId));
        this.resourceId = resourceId;
    }

    public String resourceId() {
        return resourceId;
    }
}
