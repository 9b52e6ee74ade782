package com.edushield.observability;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Redacts personally identifiable and financial data before it is written to logs or
 * audit storage.
 * <p>
 * Two rules apply. Values under a sensitive key are replaced whole; keys match exactly,
 * ignoring case. Any social security number appearing inside free text is replaced
 * in place, under any key.
 */
public final class SensitiveDataRedactor {

    /** Replacement for identity values. */
    public static final String REDACTED = "[REDACTED]";

    /** Replacement for financial values. */
    public static final String REDACTED_FINANCIAL = "[REDACTED-FINANCIAL]";

    /** Replacement for social security numbers found in text. */
    public static final String REDACTED_SSN = "[REDACTED-SSN]";

    /** Default key table, lower case. */
    public static final Map<String, String> DEFAULT_KEY_REPLACEMENTS = Map.of(
            "ssn", REDACTED,
            "social_security", REDACTED,
            "annual_salary", REDACTED_FINANCIAL,
            "salary", REDACTED_FINANCIAL,
            "amount_due", REDACTED_FINANCIAL,
            "amount_paid", REDACTED_FINANCIAL,
            "balance", REDACTED_FINANCIAL
    );

    private static final Pattern SSN = Pattern.compile("\\d{3}-\\d{2}-\\d{4}");

    private final Map<String, String> keyReplacements;

    /**
     * Creates a redactor with the default key table.
     */
    public SensitiveDataRedactor() {
        this(DEFAULT_KEY_REPLACEMENTS);
    }

    /**
     * Creates a redactor with a custom key table (keys are matched ignoring case).
     *
     * @param keyReplacements field name to replacement text
     */
    public SensitiveDataRedactor(Map<String, String> keyReplacements) {
        Map<String, String> normalized = new LinkedHashMap<>();
        keyReplacements.forEach((key, value) -> normalized.put(key.toLowerCase(Locale.ROOT), value));
        this.keyReplacements = Map.copyOf(normalized);
    }

    /**
     * Returns the replacement for a sensitive key, or empty if the key is not sensitive.
     */
    public Optional<String> replacementFor(String fieldName) {
        if (fieldName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keyReplacements.get(fieldName.toLowerCase(Locale.ROOT)));
    }

    /**
     * Replaces every social security number in {@code text}.
     */
    public String redactText(String text) {
        if (text == null) {
            return null;
        }
        return SSN.matcher(text).replaceAll(REDACTED_SSN);
    }
}
