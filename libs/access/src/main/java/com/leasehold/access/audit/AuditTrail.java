package com.leasehold.access.audit;

import com.leasehold.eventmodel.EntityType;
import com.leasehold.eventmodel.EventEntity;
import com.leasehold.eventmodel.EventEnvelope;
import com.leasehold.eventmodel.EventFactory;
import com.leasehold.eventmodel.EventSink;
import com.leasehold.eventmodel.EventType;
import com.leasehold.observability.CorrelationContext;
import com.leasehold.observability.CorrelationContextHolder;
import com.leasehold.policy.engine.CommitFailureListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wraps audit payloads in envelopes carrying a per-entity sequence and the active correlation ID,
 * and hands them to the configured {@link EventSink}.
 *
 * <p>Publishing happens after state has changed, so a failing sink is logged and never propagated.
 */
public final class AuditTrail implements CommitFailureListener {

    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

    public static final String PRODUCER = "leasehold-access";

    private final EventSink sink;
    private final Clock clock;
    private final Map<Long, AtomicLong> sequences = new ConcurrentHashMap<>();
    private final Map<Long, EntityType> entityTypes = new ConcurrentHashMap<>();

    public AuditTrail(EventSink sink, Clock clock) {
        this.sink = sink;
        this.clock = clock;
    }

    /** Records what kind of entity {@code entityId} is, for the envelopes that follow. */
    public void track(long entityId, EntityType type) {
        entityTypes.put(entityId, type);
    }

    public <T> EventEnvelope<T> record(EventType type, long entityId, T payload) {
        long sequence = sequences.computeIfAbsent(entityId, id -> new AtomicLong()).incrementAndGet();
        EventEntity entity = new EventEntity(
                entityTypes.getOrDefault(entityId, EntityType.ENTITY).value(),
                String.valueOf(entityId),
                sequence);
        Optional<String> correlationId = CorrelationContextHolder.get().map(CorrelationContext::correlationId);
        EventEnvelope<T> event = correlationId
                .map(id -> EventFactory.create(type, PRODUCER, clock.instant(), id, entity, payload))
                .orElseGet(() -> EventFactory.create(type, PRODUCER, clock.instant(), entity, payload));
        try {
            sink.publish(event);
        } catch (RuntimeException e) {
            log.error("Failed to publish {} for entity {}", type.value(), entityId, e);
        }
        return event;
    }

    /** Sequence number of the last event recorded for {@code entityId}, 0 if none. */
    public long sequenceOf(long entityId) {
        AtomicLong sequence = sequences.get(entityId);
        return sequence == null ? 0L : sequence.get();
    }

    @Override
    public void onCommitFailure(long entityId, String policyType, String diagnostic) {
        record(EventType.POLICY_COMMIT_FAILED, entityId,
                new AuditPayloads.PolicyCommitFailed(policyType, diagnostic));
    }
}
