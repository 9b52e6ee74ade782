package com.edushield.context;

import com.edushield.access.AuthorizationResult;
import com.edushield.access.IdentityScope;
import com.edushield.access.PolicyConfiguration;
import com.edushield.access.ProhibitedAccess;
import java.time.Clock;
import java.util.List;

/**
 * Builds the {@link ContextPacket} for a request from the policy engine's result.
 */
public final class ContextPacketBuilder {

    private final PolicyConfiguration configuration;
    private final Clock clock;

    public ContextPacketBuilder(PolicyConfiguration configuration) {
        this(configuration, Clock.systemUTC());
    }

    public ContextPacketBuilder(PolicyConfiguration configuration, Clock clock) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.configuration = configuration;
        this.clock = clock;
    }

    /**
     * Builds the packet.
     *
     * @param traceId       request trace id
     * @param identity      the requester
     * @param model         the downstream model
     * @param authorization the policy engine's result
     * @return the immutable packet
     */
    public ContextPacket build(String traceId, IdentityScope identity, ModelDescriptor model,
                               AuthorizationResult authorization) {
        List<String> prohibited = configuration.prohibited().stream()
                .map(ProhibitedAccess::render)
                .sorted()
                .toList();
        ContextConstraints constraints = new ContextConstraints(
                List.copyOf(authorization.rowRestrictions().keySet()), prohibited);

        return new ContextPacket(
                ContextPacket.PROTOCOL_VERSION,
                traceId,
                identity,
                model,
                List.copyOf(authorization.authorized()),
                List.copyOf(authorization.denied()),
                List.copyOf(authorization.maskedFields()),
                constraints,
                authorization.decision(),
                PolicyHasher.hash(identity.role(), authorization.authorized(), configuration.policyVersion()),
                clock.instant());
    }
}
