package com.p14n.amqpsub.telemetry;

import io.opentelemetry.context.propagation.TextMapGetter;

import java.util.Map;

/**
 * Reads trace context from AMQP message headers. String header values arrive
 * as the client's own string type, so values are read through
 * {@link String#valueOf(Object)}.
 */
public class HeadersTextMapGetter implements TextMapGetter<Map<String, Object>> {
    @Override
    public String get(Map<String, Object> carrier, String key) {
        if (carrier == null) {
            return null;
        }
        Object value = carrier.get(key);
        return value == null ? null : String.valueOf(value);
    }

    @Override
    public Iterable<String> keys(Map<String, Object> carrier) {
        return carrier.keySet();
    }
}
