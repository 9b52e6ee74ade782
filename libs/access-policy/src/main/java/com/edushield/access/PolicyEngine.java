package com.edushield.access;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a request against the layered policy tables.
 * <p>
 * Precedence is Institution &gt; Role &gt; User, and every level can only narrow what the
 * level above it granted:
 * <ol>
 *   <li>Institution: the resource must exist and list the role among its allowed roles.</li>
 *   <li>Role: the role grant must include the resource.</li>
 *   <li>Institution prohibitions: prohibited (role, resource) pairs are struck even when
 *       the role grant included them.</li>
 *   <li>User: self-scoped resources stay authorized but are marked for row filtering by
 *       owner (applied later by the data filter).</li>
 * </ol>
 * Evaluation is side-effect free; a single engine is shared by all requests.
 */
public final class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    private final ResourceRegistry registry;
    private final PolicyConfiguration configuration;

    public PolicyEngine(ResourceRegistry registry, PolicyConfiguration configuration) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (configuration == null) {
            throw new IllegalArgumentException("configuration must not be null");
        }
        this.registry = registry;
        this.configuration = configuration;
    }

    /**
     * Evaluates which of the requested resources the identity may see.
     * <p>
     * An empty or null request means "everything the registry knows". Unknown resource ids
     * and unrecognized roles never raise; they end up denied.
     *
     * @param identity  the requester
     * @param requested requested resource ids
     * @return the authorization result
     */
    public AuthorizationResult evaluate(IdentityScope identity, Collection<String> requested) {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        Role role = identity.role();
        RolePolicy rolePolicy = configuration.rolePolicy(role);
        List<String> universe = requestUniverse(requested);

        Set<String> authorized = new LinkedHashSet<>();
        Map<String, DenialReason> denials = new LinkedHashMap<>();
        for (String resourceId : universe) {
            DenialReason reason = denialReason(role, rolePolicy, resourceId);
            if (reason == null) {
                authorized.add(resourceId);
            } else {
                denials.put(resourceId, reason);
            }
        }

        Set<String> maskedFields = maskedFields(rolePolicy, authorized);

        Map<String, String> rowRestrictions = new LinkedHashMap<>();
        for (String resourceId : authorized) {
            if (rolePolicy.isSelfScoped(resourceId)) {
                rowRestrictions.put(resourceId, rolePolicy.selfScopedResources().get(resourceId));
            }
        }

        PolicyDecision decision = decide(authorized, denials.keySet());
        String explanation = explain(identity, universe, authorized, denials, maskedFields,
                rowRestrictions, decision);

        log.debug("Policy evaluated: role={}, authorized={}, denied={}, decision={}",
                role, authorized, denials.keySet(), decision);

        return new AuthorizationResult(role, universe, authorized, denials.keySet(), denials,
                maskedFields, rowRestrictions, decision, explanation);
    }

    /** Returns the configuration this engine evaluates against. */
    public PolicyConfiguration configuration() {
        return configuration;
    }

    /** Returns the registry this engine resolves resources from. */
    public ResourceRegistry registry() {
        return registry;
    }

    /**
     * Deduplicated request in section order; ids the registry does not know follow, sorted.
     */
    private List<String> requestUniverse(Collection<String> requested) {
        if (requested == null || requested.isEmpty()) {
            return registry.universe();
        }
        Set<String> wanted = new LinkedHashSet<>(requested);
        wanted.remove(null);
        List<String> ordered = new ArrayList<>();
        for (String resourceId : registry.universe()) {
            if (wanted.remove(resourceId)) {
                ordered.add(resourceId);
            }
        }
        ordered.addAll(new TreeSet<>(wanted));
        return ordered;
    }

    private DenialReason denialReason(Role role, RolePolicy rolePolicy, String resourceId) {
        ResourceDescriptor descriptor;
        try {
            descriptor = registry.describe(resourceId);
        } catch (UnknownResourceException e) {
            log.debug("Denying unknown resource '{}'", e.resourceId());
            return DenialReason.UNKNOWN_RESOURCE;
        }
        if (!descriptor.permits(role)) {
            return DenialReason.INSTITUTION_RESTRICTED;
        }
        if (!rolePolicy.grants(resourceId)) {
            return DenialReason.NOT_GRANTED;
        }
        if (configuration.isProhibited(role, resourceId)) {
            return DenialReason.PROHIBITED_COMBINATION;
        }
        return null;
    }

    /**
     * Institution and role mask lists, kept only where an authorized, mask-eligible
     * resource actually carries the field.
     */
    private Set<String> maskedFields(RolePolicy rolePolicy, Set<String> authorized) {
        Set<String> candidates = new TreeSet<>(configuration.institutionMaskFields());
        candidates.addAll(rolePolicy.maskFields());

        Set<String> masked = new TreeSet<>();
        for (String resourceId : authorized) {
            ResourceDescriptor descriptor = registry.describe(resourceId);
            if (!descriptor.category().maskable()) {
                continue;
            }
            for (String field : candidates) {
                if (descriptor.hasField(field)) {
                    masked.add(field);
                }
            }
        }
        return masked;
    }

    static PolicyDecision decide(Set<String> authorized, Set<String> denied) {
        if (authorized.isEmpty()) {
            return PolicyDecision.DENY;
        }
        if (!denied.isEmpty()) {
            return PolicyDecision.ALLOW_PARTIAL;
        }
        return PolicyDecision.ALLOW_FULL;
    }

    private static String explain(
            IdentityScope identity,
            List<String> universe,
            Set<String> authorized,
            Map<String, DenialReason> denials,
            Set<String> maskedFields,
            Map<String, String> rowRestrictions,
            PolicyDecision decision
    ) {
        Role role = identity.role();
        StringJoiner text = new StringJoiner(" ");
        text.add("%s (%s) requested %s.".formatted(role.label(), role.clearance(), joinOrNone(universe)));
        if (!role.isRecognized()) {
            text.add("Role not recognized; access fails closed.");
        }
        text.add("Granted: %s.".formatted(joinOrNone(authorized)));
        if (!denials.isEmpty()) {
            StringJoiner denied = new StringJoiner(", ");
            denials.forEach((id, reason) -> denied.add(id + " (" + reason.description() + ")"));
            text.add("Denied: " + denied + ".");
        }
        if (!rowRestrictions.isEmpty()) {
            text.add("Own rows only: %s.".formatted(String.join(", ", rowRestrictions.keySet())));
        }
        if (!maskedFields.isEmpty()) {
            text.add("Masked: %s.".formatted(String.join(", ", maskedFields)));
        }
        text.add("Decision: " + decision + ".");
        return text.toString();
    }

    private static String joinOrNone(Collection<String> ids) {
        return ids.isEmpty() ? "none" : String.join(", ", ids);
    }
}
