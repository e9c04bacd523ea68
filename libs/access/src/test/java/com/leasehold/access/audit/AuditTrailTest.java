package com.leasehold.access.audit;

import com.leasehold.eventmodel.EntityType;
import com.leasehold.eventmodel.EventEnvelope;
import com.leasehold.eventmodel.EventType;
import com.leasehold.eventmodel.testing.InMemoryEventSink;
import com.leasehold.observability.CorrelationContext;
import com.leasehold.observability.CorrelationContextHolder;
import com.leasehold.policy.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AuditTrailTest {

    private final MutableClock clock = MutableClock.startingAt("2026-05-01T00:00:00Z");
    private final InMemoryEventSink sink = new InMemoryEventSink();
    private final AuditTrail audit = new AuditTrail(sink, clock);

    @AfterEach
    void clearContext() {
        CorrelationContextHolder.clear();
    }

    @Test
    void sequencesArePerEntity() {
        audit.record(EventType.ENTITY_PAUSED, 1L, new AuditPayloads.StatusChanged("0xa", "PAUSED"));
        audit.record(EventType.ENTITY_UNPAUSED, 1L, new AuditPayloads.StatusChanged("0xa", "ACTIVE"));
        EventEnvelope<?> other = audit.record(EventType.ENTITY_PAUSED, 2L,
                new AuditPayloads.StatusChanged("0xb", "PAUSED"));

        assertThat(audit.sequenceOf(1L)).isEqualTo(2L);
        assertThat(other.entity().sequence()).isEqualTo(1L);
        assertThat(audit.sequenceOf(3L)).isZero();
    }

    @Test
    void envelopeCarriesTrackedEntityTypeAndClockTime() {
        audit.track(5L, EntityType.INSTANCE);

        EventEnvelope<?> event = audit.record(EventType.LEASE_ASSIGNED, 5L,
                new AuditPayloads.LeaseAssigned("0xa", clock.instant()));

        assertThat(event.entity().entityType()).isEqualTo("Instance");
        assertThat(event.occurredAt()).isEqualTo(clock.instant());
        assertThat(event.producer()).isEqualTo(AuditTrail.PRODUCER);
        assertThat(sink.events()).containsExactly(event);
    }

    @Test
    void usesTheActiveCorrelationId() {
        CorrelationContext context = CorrelationContextHolder.deriveFor("9", "0xa");

        EventEnvelope<?> event = CorrelationContextHolder.callWithContext(context, () ->
                audit.record(EventType.ENTITY_PAUSED, 9L, new AuditPayloads.StatusChanged("0xa", "PAUSED")));

        assertThat(event.correlationId()).isEqualTo(context.correlationId());
    }

    @Test
    void failingSinkDoesNotPropagate() {
        AuditTrail broken = new AuditTrail(event -> {
            throw new IllegalStateException("sink down");
        }, clock);

        EventEnvelope<?> event = broken.record(EventType.ENTITY_PAUSED, 1L,
                new AuditPayloads.StatusChanged("0xa", "PAUSED"));

        assertThat(event).isNotNull();
        assertThat(broken.sequenceOf(1L)).isEqualTo(1L);
    }

    @Test
    void commitFailuresBecomeEvents() {
        audit.onCommitFailure(4L, "cooldown", "store unavailable");

        assertThat(sink.last(EventType.POLICY_COMMIT_FAILED).payload())
                .isEqualTo(new AuditPayloads.PolicyCommitFailed("cooldown", "store unavailable"));
    }
}
