package com.edushield.context;

import com.edushield.access.Role;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.TreeSet;

/**
 * Deterministic fingerprint of a decision, for correlating packets and audit entries.
 * <p>
 * The hash depends only on the role, the authorized resource set and the policy version,
 * never on request content or order. It identifies a decision; it does not protect anything.
 */
public final class PolicyHasher {

    /** Prefix naming the digest algorithm. */
    public static final String PREFIX = "sha256:";

    private static final int HEX_LENGTH = 16;

    private PolicyHasher() {
        // utility class
    }

    /**
     * Computes {@code sha256:} followed by the first 16 hex characters of
     * SHA-256({@code role:sorted,ids@version}).
     *
     * @param role          role the decision was made for
     * @param authorized    authorized resource ids (any order)
     * @param policyVersion version of the policy tables
     * @return the policy hash
     */
    public static String hash(Role role, Collection<String> authorized, String policyVersion) {
        String digest = HexFormat.of().formatHex(sha256(canonical(role, authorized, policyVersion)));
        return PREFIX + digest.substring(0, HEX_LENGTH);
    }

    /**
     * The canonical string the hash is computed over.
     */
    static String canonical(Role role, Collection<String> authorized, String policyVersion) {
        return role.name() + ":" + String.join(",", new TreeSet<>(authorized)) + "@" + policyVersion;
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
