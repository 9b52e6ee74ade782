package com.edushield.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON rendering of {@link ContextPacket}s for correlation lookups and diagnostics.
 * <p>
 * Field names are snake_case and instants are ISO-8601 strings.
 */
public final class ContextPacketSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private ContextPacketSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Serializes a packet to a JSON string.
     *
     * @throws ContextPacketSerializationException if serialization fails
     */
    public static String serialize(ContextPacket packet) {
        try {
            return MAPPER.writeValueAsString(packet);
        } catch (JsonProcessingException e) {
            throw new ContextPacketSerializationException(
                    "Failed to serialize context packet: " + packet.traceId(), e);
        }
    }

    /**
     * Converts a packet to a JSON tree.
     */
    public static JsonNode toTree(ContextPacket packet) {
        return MAPPER.valueToTree(packet);
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /**
     * Exception thrown when a context packet cannot be serialized.
     */
    public static class ContextPacketSerializationException extends RuntimeException {
        public ContextPacketSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
