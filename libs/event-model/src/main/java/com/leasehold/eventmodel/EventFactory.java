package com.leasehold.eventmodel;

import java.time.Instant;
import java.util.UUID;

/**
 * Factory methods for creating {@link EventEnvelope} instances.
 *
 * <p>Fills in the event ID, version and correlation defaults so callers only supply what is
 * specific to the event.
 */
public final class EventFactory {

    private EventFactory() {
        // utility class
    }

    /**
     * Creates a new event envelope with an auto-generated eventId and correlationId.
     */
    public static <T> EventEnvelope<T> create(
            EventType eventType,
            String producer,
            Instant occurredAt,
            EventEntity entity,
            T payload
    ) {
        return new EventEnvelope<>(
                UUID.randomUUID().toString(),
                eventType.value(),
                1,
                occurredAt,
                producer,
                UUID.randomUUID().toString(),
                "direct",
                entity,
                payload
        );
    }

    /**
     * Creates a new event envelope bound to an existing correlation ID.
     */
    public static <T> EventEnvelope<T> create(
            EventType eventType,
            String producer,
            Instant occurredAt,
            String correlationId,
            EventEntity entity,
            T payload
    ) {
        return new EventEnvelope<>(
                UUID.randomUUID().toString(),
                eventType.value(),
                1,
                occurredAt,
                producer,
                correlationId,
                "direct",
                entity,
                payload
        );
    }
}
