package com.leasehold.eventmodel;

/**
 * Destination for audit events.
 *
 * <p>Implementations must not throw for a well-formed event; audit delivery never decides
 * whether an action succeeds.
 */
@FunctionalInterface
public interface EventSink {

    /**
     * Publishes one audit event.
     *
     * @param event a validated event envelope
     */
    void publish(EventEnvelope<?> event);
}
