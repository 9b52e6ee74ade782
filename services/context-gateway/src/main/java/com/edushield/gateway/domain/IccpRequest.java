package com.edushield.gateway.domain;

import com.edushield.access.IdentityScope;
import com.edushield.context.ModelDescriptor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One request for context.
 *
 * @param identity           the authenticated requester
 * @param requestedResources resource ids asked for; empty means every known resource
 * @param records            raw rows per resource id, as fetched by the record store
 * @param model              downstream model; {@code null} selects the configured default
 */
public record IccpRequest(
        IdentityScope identity,
        List<String> requestedResources,
        Map<String, List<Map<String, Object>>> records,
        ModelDescriptor model) {

    public IccpRequest {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        requestedResources = requestedResources == null ? List.of() : List.copyOf(requestedResources);
        records = records == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(records));
    }

    public static IccpRequest of(IdentityScope identity, List<String> requestedResources,
                                 Map<String, List<Map<String, Object>>> records) {
        return new IccpRequest(identity, requestedResources, records, null);
    }
}
