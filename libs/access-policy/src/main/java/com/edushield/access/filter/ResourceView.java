package com.edushield.access.filter;

import com.edushield.access.ResourceCategory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Filtered data for one requested resource: either the rows the requester may see, or an
 * explicit access-denied marker. Denied resources are never silently dropped.
 *
 * @param resourceId resource identifier
 * @param category   resource category, or null when the registry does not know the id
 * @param denied     whether access was denied
 * @param rows       visible rows after ownership filtering and masking (empty when denied)
 * @param note       restriction note for row-limited resources, the denial marker for
 *                   denied ones, otherwise null
 */
public record ResourceView(
        String resourceId,
        ResourceCategory category,
        boolean denied,
        List<Map<String, Object>> rows,
        String note
) {

    public ResourceView {
        List<Map<String, Object>> copy = new ArrayList<>();
        if (rows != null) {
            for (Map<String, Object> row : rows) {
                copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
            }
        }
        rows = Collections.unmodifiableList(copy);
    }

    /** A view for an authorized resource. */
    public static ResourceView granted(String resourceId, ResourceCategory category,
                                       List<Map<String, Object>> rows, String note) {
        return new ResourceView(resourceId, category, false, rows, note);
    }

    /** An access-denied marker for a resource. */
    public static ResourceView denied(String resourceId, ResourceCategory category, String marker) {
        return new ResourceView(resourceId, category, true, List.of(), marker);
    }
}
