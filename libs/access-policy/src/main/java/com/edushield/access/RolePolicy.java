package com.edushield.access;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Role-level grant: the resources a role sees by default, the fields it additionally
 * masks, and the resources it may only see its own rows of.
 *
 * @param grantedResources    resource ids the role is granted
 * @param maskFields          role-level mask list, added to the institution's list
 * @param selfScopedResources granted resources restricted to rows the requester owns,
 *                            mapped to the note shown alongside the filtered rows
 */
public record RolePolicy(
        Set<String> grantedResources,
        Set<String> maskFields,
        Map<String, String> selfScopedResources
) {

    public RolePolicy {
        grantedResources = grantedResources == null ? Set.of() : Set.copyOf(grantedResources);
        maskFields = maskFields == null ? Set.of() : Set.copyOf(maskFields);
        selfScopedResources = selfScopedResources == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(selfScopedResources));
    }

    /** A policy that grants nothing. */
    public static RolePolicy none() {
        return new RolePolicy(Set.of(), Set.of(), Map.of());
    }

    /** Whether the role is granted the resource. */
    public boolean grants(String resourceId) {
        return grantedResources.contains(resourceId);
    }

    /** Whether the role only sees its own rows of the resource. */
    public boolean isSelfScoped(String resourceId) {
        return selfScopedResources.containsKey(resourceId);
    }
}
