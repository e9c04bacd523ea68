package com.leasehold.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CorrelationContextHolder}: ThreadLocal storage, MDC bridge and scoped
 * execution.
 */
@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when no context is set")
        void shouldReturnEmptyWhenNoContext() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should store and retrieve context")
        void shouldStoreAndRetrieveContext() {
            var ctx = new CorrelationContext("corr-1", "7", "0xabc", "req-1", null, null);
            CorrelationContextHolder.set(ctx);

            assertThat(CorrelationContextHolder.get()).contains(ctx);
        }

        @Test
        @DisplayName("should reject null context")
        void shouldRejectNullContext() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }

        @Test
        @DisplayName("should reject blank correlation id")
        void shouldRejectBlankCorrelationId() {
            assertThatThrownBy(() -> new CorrelationContext(" ", null, null, null, null, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("correlationId");
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("should populate MDC keys when context is set")
        void shouldPopulateMdcOnSet() {
            var ctx = new CorrelationContext("corr-1", "7", "0xabc", "req-1", "span-1", "trace-1");
            CorrelationContextHolder.set(ctx);

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("entityId")).isEqualTo("7");
            assertThat(MDC.get("caller")).isEqualTo("0xabc");
            assertThat(MDC.get("requestId")).isEqualTo("req-1");
            assertThat(MDC.get("spanId")).isEqualTo("span-1");
            assertThat(MDC.get("traceId")).isEqualTo("trace-1");
        }

        @Test
        @DisplayName("should clear MDC keys when context is cleared")
        void shouldClearMdcOnClear() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "7", "0xabc", "req-1", null, null));
            CorrelationContextHolder.clear();

            assertThat(MDC.get("correlationId")).isNull();
            assertThat(MDC.get("entityId")).isNull();
            assertThat(MDC.get("caller")).isNull();
        }
    }

    @Nested
    @DisplayName("deriveFor")
    class DeriveFor {

        @Test
        @DisplayName("continues the active correlation id")
        void continuesActiveCorrelation() {
            CorrelationContextHolder.set(new CorrelationContext("http-corr", null, null, "req-9", null, null));

            var derived = CorrelationContextHolder.deriveFor("12", "0xdef");

            assertThat(derived.correlationId()).isEqualTo("http-corr");
            assertThat(derived.requestId()).isEqualTo("req-9");
            assertThat(derived.entityId()).isEqualTo("12");
            assertThat(derived.caller()).isEqualTo("0xdef");
        }

        @Test
        @DisplayName("starts a fresh correlation when none is active")
        void startsFreshCorrelation() {
            var derived = CorrelationContextHolder.deriveFor("12", "0xdef");

            assertThat(derived.correlationId()).isNotBlank();
            assertThat(derived.entityId()).isEqualTo("12");
        }
    }

    @Nested
    @DisplayName("callWithContext / runWithContext")
    class ScopedExecution {

        @Test
        @DisplayName("should set context for the duration of the call and restore afterwards")
        void shouldSetContextAndRestore() {
            var outer = new CorrelationContext("outer-corr", "1", null, null, null, null);
            var inner = new CorrelationContext("inner-corr", "2", null, null, null, null);
            CorrelationContextHolder.set(outer);

            String seen = CorrelationContextHolder.callWithContext(inner,
                    () -> CorrelationContextHolder.get().map(CorrelationContext::correlationId).orElse(null));

            assertThat(seen).isEqualTo("inner-corr");
            assertThat(CorrelationContextHolder.get().map(CorrelationContext::correlationId))
                    .contains("outer-corr");
            assertThat(MDC.get("entityId")).isEqualTo("1");
        }

        @Test
        @DisplayName("should clear context afterwards when no previous context existed")
        void shouldClearWhenNoPreviousContext() {
            var ctx = new CorrelationContext("temp-corr", "1", null, null, null, null);

            CorrelationContextHolder.runWithContext(ctx,
                    () -> assertThat(CorrelationContextHolder.get()).isPresent());

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should restore context even if the work throws")
        void shouldRestoreOnException() {
            var outer = new CorrelationContext("outer-corr", "1", null, null, null, null);
            var inner = new CorrelationContext("inner-corr", "2", null, null, null, null);
            CorrelationContextHolder.set(outer);

            assertThatThrownBy(() -> CorrelationContextHolder.runWithContext(inner, () -> {
                throw new IllegalStateException("boom");
            })).isInstanceOf(IllegalStateException.class);

            assertThat(CorrelationContextHolder.get().map(CorrelationContext::correlationId))
                    .contains("outer-corr");
        }

        @Test
        @DisplayName("should not leak context across threads")
        void shouldNotLeakAcrossThreads() throws InterruptedException {
            CorrelationContextHolder.set(new CorrelationContext("main-corr", "1", null, null, null, null));

            AtomicReference<Boolean> otherThreadHasContext = new AtomicReference<>();
            Thread other = new Thread(() ->
                    otherThreadHasContext.set(CorrelationContextHolder.get().isPresent()));
            other.start();
            other.join();

            assertThat(otherThreadHasContext.get()).isFalse();
        }
    }
}
