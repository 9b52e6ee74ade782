package com.edushield.access;

import static com.edushield.access.InstitutionResources.CLASSES;
import static com.edushield.access.InstitutionResources.DOCUMENTS;
import static com.edushield.access.InstitutionResources.FINANCIAL_INFORMATION;
import static com.edushield.access.InstitutionResources.GRADES;
import static com.edushield.access.InstitutionResources.PERSONS;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable policy tables, loaded once at process start and handed to every component
 * that needs them.
 *
 * @param policyVersion          version label folded into the policy hash
 * @param institutionMaskFields  fields masked for every role
 * @param prohibited             (role, resource) pairs the institution always denies
 * @param rolePolicies           role-level grants; roles without an entry are granted nothing
 */
public record PolicyConfiguration(
        String policyVersion,
        Set<String> institutionMaskFields,
        Set<ProhibitedAccess> prohibited,
        Map<Role, RolePolicy> rolePolicies
) {

    /** Version label of the built-in tables. */
    public static final String DEFAULT_POLICY_VERSION = "1.0";

    public PolicyConfiguration {
        if (policyVersion == null || policyVersion.isBlank()) {
            policyVersion = DEFAULT_POLICY_VERSION;
        }
        institutionMaskFields = institutionMaskFields == null ? Set.of() : Set.copyOf(institutionMaskFields);
        prohibited = prohibited == null ? Set.of() : Set.copyOf(prohibited);
        EnumMap<Role, RolePolicy> copy = new EnumMap<>(Role.class);
        if (rolePolicies != null) {
            copy.putAll(rolePolicies);
        }
        copy.remove(Role.UNRECOGNIZED);
        rolePolicies = Collections.unmodifiableMap(copy);
    }

    /**
     * The institution's built-in tables.
     * <ul>
     *   <li>Admin: every resource, unmasked, unrestricted rows</li>
     *   <li>Teacher: everything but only their own salary rows</li>
     *   <li>Student: persons, classes, documents and only their own tuition rows; never grades</li>
     *   <li>Social security numbers are masked for every role</li>
     * </ul>
     */
    public static PolicyConfiguration defaults() {
        return defaults(DEFAULT_POLICY_VERSION);
    }

    /**
     * The built-in tables under a different version label.
     */
    public static PolicyConfiguration defaults(String policyVersion) {
        Map<Role, RolePolicy> roles = new EnumMap<>(Role.class);
        roles.put(Role.ADMIN, new RolePolicy(
                Set.of(PERSONS, FINANCIAL_INFORMATION, GRADES, CLASSES, DOCUMENTS),
                Set.of(),
                Map.of()));
        roles.put(Role.TEACHER, new RolePolicy(
                Set.of(PERSONS, FINANCIAL_INFORMATION, GRADES, CLASSES, DOCUMENTS),
                Set.of(),
                Map.of(FINANCIAL_INFORMATION, "Restricted to your own salary only.")));
        roles.put(Role.STUDENT, new RolePolicy(
                Set.of(PERSONS, FINANCIAL_INFORMATION, CLASSES, DOCUMENTS),
                Set.of(),
                Map.of(FINANCIAL_INFORMATION, "Restricted to your own tuition info only.")));

        return new PolicyConfiguration(
                policyVersion,
                Set.of("ssn"),
                Set.of(new ProhibitedAccess(Role.STUDENT, GRADES)),
                roles);
    }

    /**
     * Returns the role-level grant. Unrecognized roles always get {@link RolePolicy#none()}.
     */
    public RolePolicy rolePolicy(Role role) {
        return switch (role) {
            case ADMIN, TEACHER, STUDENT -> rolePolicies.getOrDefault(role, RolePolicy.none());
            case UNRECOGNIZED -> RolePolicy.none();
        };
    }

    /** Whether the institution prohibits the role from ever receiving the resource. */
    public boolean isProhibited(Role role, String resourceId) {
        return prohibited.contains(new ProhibitedAccess(role, resourceId));
    }

    /**
     * Returns a copy of this configuration with a different version label.
     */
    public PolicyConfiguration withPolicyVersion(String version) {
        return new PolicyConfiguration(version, institutionMaskFields, prohibited, rolePolicies);
    }
}
