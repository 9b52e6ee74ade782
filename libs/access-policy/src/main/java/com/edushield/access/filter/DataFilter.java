package com.edushield.access.filter;

import com.edushield.access.AuthorizationResult;
import com.edushield.access.DenialReason;
import com.edushield.access.IdentityScope;
import com.edushield.access.ResourceCategory;
import com.edushield.access.ResourceDescriptor;
import com.edushield.access.ResourceRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies an {@link AuthorizationResult} to raw record collections.
 * <p>
 * For each requested resource, in the result's order:
 * <ul>
 *   <li>denied resources become an access-denied marker</li>
 *   <li>row-restricted resources keep only rows whose owner field equals the requester's
 *       user id; rows without an owner field are dropped</li>
 *   <li>other authorized resources keep every row</li>
 *   <li>masked fields are then replaced by a placeholder, keeping the key present</li>
 * </ul>
 * Raw input is copied, never modified.
 */
public final class DataFilter {

    private static final Logger log = LoggerFactory.getLogger(DataFilter.class);

    /** Placeholder for withheld non-financial values. */
    public static final String MASKED = "[MASKED]";

    /** Placeholder for withheld financial values. */
    public static final String MASKED_FINANCIAL = "[MASKED-FINANCIAL]";

    private final ResourceRegistry registry;

    public DataFilter(ResourceRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /**
     * Filters raw records down to what the requester may see.
     *
     * @param records       raw rows keyed by resource id, as fetched by the storage layer
     * @param authorization the policy engine's result for this request
     * @param identity      the requester
     * @return the filtered view, one entry per requested resource
     */
    public FilteredView apply(Map<String, ? extends Collection<? extends Map<String, ?>>> records,
                              AuthorizationResult authorization,
                              IdentityScope identity) {
        Objects.requireNonNull(authorization, "authorization");
        Objects.requireNonNull(identity, "identity");

        List<ResourceView> views = new ArrayList<>();
        for (String resourceId : authorization.requested()) {
            Optional<ResourceDescriptor> descriptor = registry.find(resourceId);
            ResourceCategory category = descriptor.map(ResourceDescriptor::category).orElse(null);

            if (!authorization.isAuthorized(resourceId)) {
                DenialReason reason = authorization.denialReasons().get(resourceId);
                views.add(ResourceView.denied(resourceId, category, denialMarker(identity, resourceId, reason)));
                continue;
            }

            List<Map<String, Object>> rows = copyRows(records == null ? null : records.get(resourceId));
            String note = null;
            if (authorization.isRowRestricted(resourceId)) {
                rows = ownedRows(rows, descriptor.orElseThrow(), identity.userId());
                note = authorization.rowRestrictions().get(resourceId);
            }
            if (category != null && category.maskable()) {
                List<Map<String, Object>> masked = new ArrayList<>(rows.size());
                for (Map<String, Object> row : rows) {
                    masked.add(mask(row, authorization.maskedFields(), category));
                }
                rows = masked;
            }
            views.add(ResourceView.granted(resourceId, category, rows, note));
        }
        return new FilteredView(views);
    }

    /**
     * Replaces each masked field present on the row with the placeholder for its category.
     * Absent fields stay absent. Applying this to an already-masked row returns an equal row.
     */
    public static Map<String, Object> mask(Map<String, ?> row, Collection<String> maskedFields,
                                           ResourceCategory category) {
        Map<String, Object> copy = new LinkedHashMap<>(row);
        String placeholder = category == ResourceCategory.FINANCIAL ? MASKED_FINANCIAL : MASKED;
        for (String field : maskedFields) {
            if (copy.containsKey(field)) {
                copy.put(field, placeholder);
            }
        }
        return copy;
    }

    private static List<Map<String, Object>> ownedRows(List<Map<String, Object>> rows,
                                                       ResourceDescriptor descriptor,
                                                       String userId) {
        if (!descriptor.isOwned()) {
            log.warn("Resource '{}' is row-restricted but declares no owner field; withholding all rows",
                    descriptor.resourceId());
            return List.of();
        }
        String ownerField = descriptor.ownerField();
        List<Map<String, Object>> owned = new ArrayList<>();
        int withoutOwner = 0;
        for (Map<String, Object> row : rows) {
            Object owner = row.get(ownerField);
            if (owner == null) {
                withoutOwner++;
            } else if (userId.equals(String.valueOf(owner))) {
                owned.add(row);
            }
        }
        if (withoutOwner > 0) {
            log.debug("Excluded {} row(s) of '{}' with no '{}' field", withoutOwner,
                    descriptor.resourceId(), ownerField);
        }
        return owned;
    }

    private static List<Map<String, Object>> copyRows(Collection<? extends Map<String, ?>> raw) {
        List<Map<String, Object>> rows = new ArrayList<>();
        if (raw != null) {
            for (Map<String, ?> row : raw) {
                if (row != null) {
                    rows.add(new LinkedHashMap<>(row));
                }
            }
        }
        return rows;
    }

    private static String denialMarker(IdentityScope identity, String resourceId, DenialReason reason) {
        String why = reason == null ? "not authorized" : reason.description();
        return "[ACCESS DENIED: %s cannot access %s (%s).]"
                .formatted(identity.role().label(), resourceId, why);
    }
}
