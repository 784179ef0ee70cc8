package com.p14n.amqpsub.telemetry;

import java.util.Map;
import java.util.function.Supplier;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapSetter;

public class OpenTelemetryFunctions {

        private static final HeadersTextMapGetter getter = new HeadersTextMapGetter();

        private OpenTelemetryFunctions() {
        }

        /**
         * Writes the current trace context (the W3C {@code traceparent}) into
         * outgoing message headers.
         */
        public static void injectTraceContext(OpenTelemetry ot, Map<String, Object> headers) {
                TextMapSetter<Map<String, Object>> setter = Map::put;
                ot.getPropagators().getTextMapPropagator().inject(Context.current(), headers, setter);
        }

        /**
         * Restores the trace context carried by a delivery's headers.
         */
        public static Context extractTraceContext(OpenTelemetry ot, Map<String, Object> headers) {
                return ot.getPropagators().getTextMapPropagator().extract(Context.current(), headers, getter);
        }

        public static <T> T processWithTelemetry(Tracer tracer, String spanName, SpanKind kind, String trigger,
                        Context parentContext, Supplier<T> action) {

                SpanBuilder sb = tracer.spanBuilder(spanName)
                                .setSpanKind(kind)
                                .setAttribute("trigger", trigger);
                if (parentContext != null) {
                        sb.setParent(parentContext);
                }
                Span span = sb.startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }
}
