package com.leasehold.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that attaches the current
 * {@link CorrelationContext} (correlation ID, entity, caller) to every span it starts.
 * <p>
 * It does not configure the SDK; the hosting application supplies a configured tracer.
 */
public final class SpanHelper {

    public static final String ATTR_CORRELATION_ID = "correlation.id";
    public static final String ATTR_ENTITY_ID = "leasehold.entity.id";
    public static final String ATTR_CALLER = "leasehold.caller";

    private final Tracer tracer;

    /**
     * @param tracer the OpenTelemetry tracer (typically obtained from {@code GlobalOpenTelemetry})
     */
    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside a new INTERNAL span.
     */
    public <T> T inSpan(String spanName, Supplier<T> work) {
        return inSpan(spanName, SpanKind.INTERNAL, Map.of(), work);
    }

    /**
     * Runs {@code work} inside a new span with explicit kind and attributes. Any exception is
     * recorded on the span, marks it as an error and is rethrown unchanged.
     *
     * @param spanName   name for the span
     * @param kind       span kind
     * @param attributes additional span attributes
     * @param work       the work to execute within the span
     * @return the result of {@code work}
     */
    public <T> T inSpan(String spanName, SpanKind kind, Map<String, String> attributes,
                        Supplier<T> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(spanBuilder::setAttribute);

        Span span = spanBuilder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            if (ctx.entityId() != null) {
                span.setAttribute(ATTR_ENTITY_ID, ctx.entityId());
            }
            if (ctx.caller() != null) {
                span.setAttribute(ATTR_CALLER, ctx.caller());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Void variant of {@link #inSpan(String, Supplier)}.
     */
    public void inSpan(String spanName, Runnable runnable) {
        inSpan(spanName, () -> {
            runnable.run();
            return null;
        });
    }

    public Tracer tracer() {
        return tracer;
    }
}
