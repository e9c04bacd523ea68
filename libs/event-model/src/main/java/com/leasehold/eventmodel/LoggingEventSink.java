package com.leasehold.eventmodel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventSink} that writes each event as one JSON line to the {@code leasehold.audit} logger.
 *
 * <p>Invalid envelopes are logged at ERROR with their validation errors and dropped.
 */
public final class LoggingEventSink implements EventSink {

    public static final String AUDIT_LOGGER = "leasehold.audit";

    private static final Logger audit = LoggerFactory.getLogger(AUDIT_LOGGER);
    private static final Logger log = LoggerFactory.getLogger(LoggingEventSink.class);

    @Override
    public void publish(EventEnvelope<?> event) {
        ValidationResult result = EventValidator.validate(event);
        if (!result.valid()) {
            log.error("Dropping invalid audit event {}: {}", event.eventType(), result.summary());
            return;
        }
        try {
            audit.info(EventSerializer.serialize(event));
        } catch (EventSerializer.EventSerializationException e) {
            log.error("Failed to write audit event {}", event.eventId(), e);
        }
    }
}
