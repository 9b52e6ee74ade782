package com.edushield.context;

/**
 * The downstream language model a request's context is prepared for. Informational only:
 * carried in context packets and audit entries, never consulted by policy.
 *
 * @param modelId                  model identifier
 * @param provider                 model provider
 * @param complianceClassification compliance classification (e.g., "SOC2-certified")
 * @param riskLevel                risk level (e.g., "low")
 */
public record ModelDescriptor(
        String modelId,
        String provider,
        String complianceClassification,
        String riskLevel
) {

    public ModelDescriptor {
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("modelId must not be null or blank");
        }
        if (provider == null || provider.isBlank()) {
            provider = "local";
        }
        if (complianceClassification == null || complianceClassification.isBlank()) {
            complianceClassification = "internal";
        }
        if (riskLevel == null || riskLevel.isBlank()) {
            riskLevel = "low";
        }
    }
}
