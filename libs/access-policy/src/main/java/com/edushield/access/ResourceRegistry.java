package com.edushield.access;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only catalog of {@link ResourceDescriptor}s.
 * <p>
 * Built once at process start and never mutated afterwards, so lookups need no locking.
 * Descriptors are kept in section order (by {@link ResourceCategory}, then in the order
 * they were supplied) and {@link #universe()} reports ids in that order.
 */
public final class ResourceRegistry {

    private final Map<String, ResourceDescriptor> descriptors;

    /**
     * Creates a registry from the given descriptors.
     *
     * @param descriptors descriptor table; ids must be unique
     * @throws IllegalArgumentException if the table is null or contains a duplicate id
     */
    public ResourceRegistry(Collection<ResourceDescriptor> descriptors) {
        if (descriptors == null) {
            throw new IllegalArgumentException("descriptors must not be null");
        }
        List<ResourceDescriptor> ordered = new ArrayList<>(descriptors);
        ordered.sort(Comparator.comparing(ResourceDescriptor::category));

        Map<String, ResourceDescriptor> byId = new LinkedHashMap<>();
        for (ResourceDescriptor descriptor : ordered) {
            if (byId.putIfAbsent(descriptor.resourceId(), descriptor) != null) {
                throw new IllegalArgumentException("Duplicate resource id: " + descriptor.resourceId());
            }
        }
        this.descriptors = Collections.unmodifiableMap(byId);
    }

    /**
     * Builds the registry from the institution's fixed descriptor table.
     */
    public static ResourceRegistry institutionDefaults() {
        return new ResourceRegistry(InstitutionResources.descriptors());
    }

    /**
     * Returns the descriptor for a resource id.
     *
     * @throws UnknownResourceException if no descriptor exists
     */
    public ResourceDescriptor describe(String resourceId) {
        ResourceDescriptor descriptor = resourceId == null ? null : descriptors.get(resourceId);
        if (descriptor == null) {
            throw new UnknownResourceException(resourceId);
        }
        return descriptor;
    }

    /**
     * Returns the descriptor for a resource id, or empty when absent.
     */
    public Optional<ResourceDescriptor> find(String resourceId) {
        return Optional.ofNullable(resourceId == null ? null : descriptors.get(resourceId));
    }

    /** Whether a descriptor exists for the id. */
    public boolean contains(String resourceId) {
        return find(resourceId).isPresent();
    }

    /**
     * All known resource ids, in section order.
     */
    public List<String> universe() {
        return List.copyOf(descriptors.keySet());
    }

    /**
     * All descriptors, in section order.
     */
    public List<ResourceDescriptor> descriptors() {
        return List.copyOf(descriptors.values());
    }

    /** Number of registered resources. */
    public int size() {
        return descriptors.size();
    }
}
