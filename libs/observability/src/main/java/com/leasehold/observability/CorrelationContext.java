package com.leasehold.observability;

/**
 * Immutable correlation context that flows with a single submitted action or admin request.
 * <p>
 * Each request establishes a {@code CorrelationContext} whose identifiers are injected into
 * SLF4J MDC, so every log line written while the action is processed carries the entity and the
 * caller it concerns.
 *
 * @param correlationId unique ID for the business flow (e.g. one HTTP call and the action it submits)
 * @param entityId      rentable entity the request targets (nullable for non-entity requests)
 * @param caller        address of the party submitting the request (nullable before it is resolved)
 * @param requestId     unique ID for this specific request
 * @param spanId        current OpenTelemetry span ID (nullable if tracing is not active)
 * @param traceId       current OpenTelemetry trace ID (nullable if tracing is not active)
 */
public record CorrelationContext(
        String correlationId,
        String entityId,
        String caller,
        String requestId,
        String spanId,
        String traceId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_ENTITY_ID = "entityId";
    public static final String MDC_CALLER = "caller";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_SPAN_ID = "spanId";
    public static final String MDC_TRACE_ID = "traceId";

    /**
     * Compact constructor: ensures correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy of this context scoped to the given entity and caller, keeping the
     * correlation and tracing identifiers.
     */
    public CorrelationContext forEntity(String entityId, String caller) {
        return new CorrelationContext(correlationId, entityId, caller, requestId, spanId, traceId);
    }
}
