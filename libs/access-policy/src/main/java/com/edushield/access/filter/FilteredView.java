package com.edushield.access.filter;

import java.util.List;
import java.util.Optional;

/**
 * Per-resource filtered data for one request, in section order.
 *
 * @param resources one view per requested resource
 */
public record FilteredView(List<ResourceView> resources) {

    public FilteredView {
        resources = List.copyOf(resources);
    }

    /** Looks up the view for a resource id. */
    public Optional<ResourceView> resource(String resourceId) {
        return resources.stream()
                .filter(view -> view.resourceId().equals(resourceId))
                .findFirst();
    }

    /** Views that carry data (not denied). */
    public List<ResourceView> granted() {
        return resources.stream().filter(view -> !view.denied()).toList();
    }

    /** Denial markers. */
    public List<ResourceView> denied() {
        return resources.stream().filter(ResourceView::denied).toList();
    }
}
