package com.edushield.context;

import java.util.List;

/**
 * Constraints the downstream consumer must respect when using a packet's data.
 *
 * @param rowRestrictedResources  authorized resources limited to the requester's own rows
 * @param prohibitedCombinations  institution-wide prohibited pairs, rendered as {@code Role+resource}
 */
public record ContextConstraints(
        List<String> rowRestrictedResources,
        List<String> prohibitedCombinations
) {

    public ContextConstraints {
        rowRestrictedResources = rowRestrictedResources == null ? List.of() : List.copyOf(rowRestrictedResources);
        prohibitedCombinations = prohibitedCombinations == null ? List.of() : List.copyOf(prohibitedCombinations);
    }
}
