package com.tenantguard.observability;

import io.opentelemetry.api.common.AttributeKey;
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

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SpanHelper")
class SpanHelperTest {

    private InMemorySpanExporter exporter;
    private SpanHelper helper;

    @BeforeEach
    void setUp() {
        exporter = InMemorySpanExporter.create();
        var provider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(exporter))
                .build();
        var sdk = OpenTelemetrySdk.builder().setTracerProvider(provider).build();
        helper = new SpanHelper(sdk.getTracer("test"));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
        exporter.reset();
    }

    @Test
    @DisplayName("rejects a null tracer")
    void rejectsNullTracer() {
        assertThatThrownBy(() -> new SpanHelper(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tracer");
    }

    @Test
    @DisplayName("returns the result and ends an OK span with custom attributes")
    void okSpan() {
        String result = helper.inSpan("query.list.contracts", Map.of("resource", "contracts"), () -> "ok");

        assertThat(result).isEqualTo("ok");
        SpanData span = exporter.getFinishedSpanItems().get(0);
        assertThat(span.getName()).isEqualTo("query.list.contracts");
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
        assertThat(span.getAttributes().get(AttributeKey.stringKey("resource"))).isEqualTo("contracts");
    }

    @Test
    @DisplayName("copies tenant and user from the correlation context")
    void copiesCorrelation() {
        CorrelationContextHolder.set(new CorrelationContext("corr-1", "req-1", null, "tenant-a", "user-1"));

        helper.inSpan("op", Map.of(), () -> null);

        var attrs = exporter.getFinishedSpanItems().get(0).getAttributes();
        assertThat(attrs.get(AttributeKey.stringKey(SpanHelper.ATTR_CORRELATION_ID))).isEqualTo("corr-1");
        assertThat(attrs.get(AttributeKey.stringKey(SpanHelper.ATTR_TENANT_ID))).isEqualTo("tenant-a");
        assertThat(attrs.get(AttributeKey.stringKey(SpanHelper.ATTR_USER_ID))).isEqualTo("user-1");
    }

    @Test
    @DisplayName("records the exception, marks ERROR and rethrows")
    void errorSpan() {
        assertThatThrownBy(() -> helper.inSpan("op", Map.of(), () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        SpanData span = exporter.getFinishedSpanItems().get(0);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(span.getEvents()).anyMatch(e -> e.getName().equals("exception"));
    }
}
