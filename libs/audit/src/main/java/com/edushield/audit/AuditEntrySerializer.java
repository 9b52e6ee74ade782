package com.edushield.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON mapping of audit entries.
 * <p>
 * Field names are snake_case, instants are ISO-8601 strings and enums use their
 * {@code toString()} form (freshness states read {@code refreshed}/{@code cached}).
 */
public final class AuditEntrySerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private AuditEntrySerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.WRITE_ENUMS_USING_TO_STRING);
    }

    /**
     * Converts an entry to a mutable JSON tree.
     *
     * @throws AuditSerializationException if the entry cannot be mapped
     */
    public static ObjectNode toTree(AuditLogEntry entry) {
        try {
            return MAPPER.valueToTree(entry);
        } catch (IllegalArgumentException e) {
            throw new AuditSerializationException("Failed to map audit entry: " + entry.traceId(), e);
        }
    }

    /**
     * Renders a JSON tree as a single line.
     *
     * @throws AuditSerializationException if rendering fails
     */
    public static String toJsonLine(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to render audit record", e);
        }
    }

    /**
     * Parses one JSON line back into a tree.
     *
     * @throws AuditSerializationException if the line is not valid JSON
     */
    public static JsonNode parse(String line) {
        try {
            return MAPPER.readTree(line);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to parse audit record", e);
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /**
     * Exception thrown when an audit entry cannot be mapped to or from JSON.
     */
    public static class AuditSerializationException extends RuntimeException {
        public AuditSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
