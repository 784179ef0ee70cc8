package com.p14n.amqpsub.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.ContextPropagators;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OpenTelemetryFunctionsTest {

    private static final String TRACE_ID = "4bf92f3577b34da6a3ce929d0e0e4736";
    private static final String SPAN_ID = "00f067aa0ba902b7";

    private final OpenTelemetry ot = OpenTelemetry.propagating(
            ContextPropagators.create(W3CTraceContextPropagator.getInstance()));

    @Test
    void shouldCarryTraceContextThroughHeaders() {
        SpanContext spanContext = SpanContext.create(TRACE_ID, SPAN_ID, TraceFlags.getSampled(),
                TraceState.getDefault());
        Map<String, Object> headers = new HashMap<>();

        try (Scope scope = Span.wrap(spanContext).makeCurrent()) {
            OpenTelemetryFunctions.injectTraceContext(ot, headers);
        }

        assertEquals("00-" + TRACE_ID + "-" + SPAN_ID + "-01", headers.get("traceparent"));

        Context extracted = OpenTelemetryFunctions.extractTraceContext(ot, headers);
        SpanContext remote = Span.fromContext(extracted).getSpanContext();
        assertEquals(TRACE_ID, remote.getTraceId());
        assertEquals(SPAN_ID, remote.getSpanId());
        assertTrue(remote.isRemote());
    }

    @Test
    void shouldReadNonStringHeaderValues() {
        HeadersTextMapGetter getter = new HeadersTextMapGetter();
        Map<String, Object> headers = new HashMap<>();
        headers.put("traceparent", new StringBuilder("00-abc"));

        assertEquals("00-abc", getter.get(headers, "traceparent"));
        assertNull(getter.get(headers, "missing"));
        assertNull(getter.get(null, "traceparent"));
    }

    @Test
    void shouldRethrowFromTracedAction() {
        IllegalStateException failure = new IllegalStateException("boom");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> OpenTelemetryFunctions.processWithTelemetry(ot.getTracer("test"), "publish_message",
                        SpanKind.PRODUCER, "orders", null, () -> {
                            throw failure;
                        }));
        assertSame(failure, thrown);
        assertEquals("done", OpenTelemetryFunctions.processWithTelemetry(ot.getTracer("test"), "deliver_message",
                SpanKind.CONSUMER, "orders", Context.root(), () -> "done"));
    }
}
