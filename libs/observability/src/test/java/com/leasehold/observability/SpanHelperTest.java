package com.leasehold.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SpanHelper}. Uses {@link InMemorySpanExporter} to collect finished spans.
 */
@DisplayName("SpanHelper")
class SpanHelperTest {

    private InMemorySpanExporter spanExporter;
    private SpanHelper spanHelper;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        OpenTelemetrySdk otelSdk = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .build();
        spanHelper = new SpanHelper(otelSdk.getTracer("test-tracer"));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
        spanExporter.reset();
    }

    @Test
    @DisplayName("should reject null tracer")
    void shouldRejectNullTracer() {
        assertThatThrownBy(() -> new SpanHelper(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tracer");
    }

    @Test
    @DisplayName("should create a span and return the result")
    void shouldCreateSpanAndReturnResult() {
        String result = spanHelper.inSpan("leasehold.execute", () -> "done");

        assertThat(result).isEqualTo("done");
        List<SpanData> spans = spanExporter.getFinishedSpanItems();
        assertThat(spans).hasSize(1);
        assertThat(spans.get(0).getName()).isEqualTo("leasehold.execute");
        assertThat(spans.get(0).getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
    }

    @Test
    @DisplayName("should record the exception and rethrow it unchanged")
    void shouldRecordErrorOnException() {
        assertThatThrownBy(() -> spanHelper.inSpan("leasehold.execute", () -> {
            throw new IllegalStateException("rejected");
        })).isInstanceOf(IllegalStateException.class).hasMessage("rejected");

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(span.getStatus().getDescription()).contains("rejected");
        assertThat(span.getEvents()).isNotEmpty();
    }

    @Test
    @DisplayName("should attach entity and caller from the correlation context")
    void shouldAttachCorrelationContext() {
        CorrelationContextHolder.set(new CorrelationContext("corr-abc", "42", "0xfeed", null, null, null));

        spanHelper.inSpan("leasehold.execute", () -> "ok");

        var attributes = spanExporter.getFinishedSpanItems().get(0).getAttributes();
        assertThat(attributes.get(AttributeKey.stringKey(SpanHelper.ATTR_CORRELATION_ID))).isEqualTo("corr-abc");
        assertThat(attributes.get(AttributeKey.stringKey(SpanHelper.ATTR_ENTITY_ID))).isEqualTo("42");
        assertThat(attributes.get(AttributeKey.stringKey(SpanHelper.ATTR_CALLER))).isEqualTo("0xfeed");
    }

    @Test
    @DisplayName("should set kind and custom attributes")
    void shouldSetKindAndAttributes() {
        spanHelper.inSpan("leasehold.http", SpanKind.SERVER, Map.of("http.route", "/actions"), () -> "ok");

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getKind()).isEqualTo(SpanKind.SERVER);
        assertThat(span.getAttributes().get(AttributeKey.stringKey("http.route"))).isEqualTo("/actions");
    }

    @Test
    @DisplayName("runnable variant creates a span")
    void runnableVariant() {
        spanHelper.inSpan("void-op", () -> { });

        assertThat(spanExporter.getFinishedSpanItems()).hasSize(1);
    }
}
