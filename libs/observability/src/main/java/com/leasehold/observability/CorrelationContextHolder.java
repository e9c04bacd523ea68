package com.leasehold.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * When a correlation context is set, all MDC keys (correlationId, entityId, caller,
 * requestId, spanId, traceId) are populated so that every log statement on this thread
 * automatically includes them. When cleared, all MDC keys are removed.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @param context the correlation context to set (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's correlation context, if set.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Clears the correlation context and removes all MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Returns a context for the given entity and caller that continues the current correlation,
     * or starts a new one when none is active on this thread.
     */
    public static CorrelationContext deriveFor(String entityId, String caller) {
        return get()
                .map(ctx -> ctx.forEntity(entityId, caller))
                .orElseGet(() -> new CorrelationContext(
                        UUID.randomUUID().toString(), entityId, caller,
                        UUID.randomUUID().toString(), null, null));
    }

    /**
     * Executes a {@link Runnable} with the given correlation context set, then restores
     * the previous context (or clears if there was none).
     *
     * @param context the correlation context for the duration of the runnable
     * @param runnable the work to execute
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        callWithContext(context, () -> {
            runnable.run();
            return null;
        });
    }

    /**
     * Value-returning variant of {@link #runWithContext(CorrelationContext, Runnable)}.
     */
    public static <T> T callWithContext(CorrelationContext context, Supplier<T> supplier) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return supplier.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_ENTITY_ID, ctx.entityId());
        setMdc(CorrelationContext.MDC_CALLER, ctx.caller());
        setMdc(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
        setMdc(CorrelationContext.MDC_SPAN_ID, ctx.spanId());
        setMdc(CorrelationContext.MDC_TRACE_ID, ctx.traceId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_ENTITY_ID);
        MDC.remove(CorrelationContext.MDC_CALLER);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        MDC.remove(CorrelationContext.MDC_SPAN_ID);
        MDC.remove(CorrelationContext.MDC_TRACE_ID);
    }
}
