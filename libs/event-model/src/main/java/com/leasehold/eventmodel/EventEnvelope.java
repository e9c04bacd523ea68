package com.leasehold.eventmodel;

import java.time.Instant;

/**
 * Canonical envelope for every audit event emitted by Leasehold.
 *
 * <p>The envelope carries identification, correlation and ordering metadata alongside the
 * event-specific payload. Events are records and never change once created.
 *
 * @param <T> the type of the event-specific payload
 */
public record EventEnvelope<T>(
        /** Unique identifier for this event instance (UUID v4). */
        String eventId,

        /** The type/name of this event (e.g. "ActionExecuted"). */
        String eventType,

        /** Schema version of this event type, starting at 1. */
        int eventVersion,

        /** When the event occurred. */
        Instant occurredAt,

        /** Component that produced this event (e.g. "access-router"). */
        String producer,

        /** Correlation ID linking the event to the request that caused it. */
        String correlationId,

        /** ID of the command or event that directly caused this event. */
        String causationId,

        /** The entity this event relates to. */
        EventEntity entity,

        /** Event-specific data. */
        T payload) {}
