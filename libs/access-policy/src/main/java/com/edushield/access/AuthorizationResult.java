package com.edushield.access;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Output of {@link PolicyEngine#evaluate}: which requested resources the requester may see,
 * which fields are withheld, and which resources are limited to the requester's own rows.
 * <p>
 * {@code authorized} and {@code denied} partition {@code requested} exactly; the compact
 * constructor rejects any result that breaks that.
 *
 * @param role            role the decision was made for
 * @param requested       requested resource universe, in section order
 * @param authorized      authorized resource ids, in section order
 * @param denied          denied resource ids, in section order
 * @param denialReasons   why each denied resource was removed
 * @param maskedFields    field names to withhold on authorized rows, sorted
 * @param rowRestrictions authorized resources limited to the requester's own rows, with notes
 * @param decision        overall decision
 * @param explanation     human-readable account of the decision, for the audit trail
 */
public record AuthorizationResult(
        Role role,
        List<String> requested,
        Set<String> authorized,
        Set<String> denied,
        Map<String, DenialReason> denialReasons,
        Set<String> maskedFields,
        Map<String, String> rowRestrictions,
        PolicyDecision decision,
        String explanation
) {

    public AuthorizationResult {
        requested = List.copyOf(requested);
        authorized = Collections.unmodifiableSet(new LinkedHashSet<>(authorized));
        denied = Collections.unmodifiableSet(new LinkedHashSet<>(denied));
        denialReasons = Collections.unmodifiableMap(new LinkedHashMap<>(denialReasons));
        maskedFields = Collections.unmodifiableSet(new TreeSet<>(maskedFields));
        rowRestrictions = Collections.unmodifiableMap(new LinkedHashMap<>(rowRestrictions));

        for (String id : authorized) {
            if (denied.contains(id)) {
                throw new IllegalArgumentException("Resource both authorized and denied: " + id);
            }
        }
        if (authorized.size() + denied.size() != requested.size()
                || !requested.containsAll(authorized) || !requested.containsAll(denied)) {
            throw new IllegalArgumentException("authorized and denied must partition the requested resources");
        }
        if (!authorized.containsAll(rowRestrictions.keySet())) {
            throw new IllegalArgumentException("row restrictions may only apply to authorized resources");
        }
    }

    /** Whether the resource was authorized. */
    public boolean isAuthorized(String resourceId) {
        return authorized.contains(resourceId);
    }

    /** Whether rows of the resource are limited to those the requester owns. */
    public boolean isRowRestricted(String resourceId) {
        return rowRestrictions.containsKey(resourceId);
    }
}
