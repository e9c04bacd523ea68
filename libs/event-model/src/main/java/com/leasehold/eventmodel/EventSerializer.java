package com.leasehold.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON serialization and deserialization for {@link EventEnvelope}.
 *
 * <p>{@code Instant} values are written as ISO 8601 strings, and unknown properties are ignored
 * on read so older consumers can still parse newer event versions.
 */
public final class EventSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private EventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Serializes an event envelope to a JSON string.
     *
     * @throws EventSerializationException if serialization fails
     */
    public static String serialize(EventEnvelope<?> event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize event: " + event.eventId(), e);
        }
    }

    /**
     * Deserializes a JSON string to an event envelope with a known payload type.
     *
     * @param json        the JSON string
     * @param payloadType the class of the payload
     * @throws EventSerializationException if deserialization fails or JSON is malformed
     */
    public static <T> EventEnvelope<T> deserialize(String json, Class<T> payloadType) {
        try {
            JavaType type = MAPPER.getTypeFactory()
                    .constructParametricType(EventEnvelope.class, payloadType);
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize event", e);
        }
    }

    /**
     * Exception thrown when event serialization/deserialization fails.
     */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
