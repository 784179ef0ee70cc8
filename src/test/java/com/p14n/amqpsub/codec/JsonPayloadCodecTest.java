package com.p14n.amqpsub.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.p14n.amqpsub.errors.PayloadCodecException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonPayloadCodecTest {

    public record OrderPlaced(String id, int quantity, List<String> tags) {
    }

    @Test
    void shouldDecodeWhatItEncodes() {
        JsonPayloadCodec<OrderPlaced> codec = JsonPayloadCodec.of(OrderPlaced.class);
        OrderPlaced order = new OrderPlaced("o-1", 3, List.of("eu", "priority"));

        assertEquals(order, codec.decode(codec.encode(order)));
        assertEquals("application/json", codec.contentType());
    }

    @Test
    void shouldEncodeMapsAsJsonObjects() {
        JsonPayloadCodec<Map<String, Object>> codec = JsonPayloadCodec.map();

        String json = new String(codec.encode(Map.of("id", 42)), StandardCharsets.UTF_8);

        assertEquals("{\"id\":42}", json);
        assertEquals(Map.of("id", 42), codec.decode(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void shouldDecodeAnyJsonAsTree() {
        JsonNode node = JsonPayloadCodec.tree().decode("{\"a\":[1,2]}".getBytes(StandardCharsets.UTF_8));

        assertEquals(2, node.get("a").size());
    }

    @Test
    void shouldWrapMalformedBody() {
        JsonPayloadCodec<Map<String, Object>> codec = JsonPayloadCodec.map();

        PayloadCodecException e = assertThrows(PayloadCodecException.class,
                () -> codec.decode("not json".getBytes(StandardCharsets.UTF_8)));
        assertNotNull(e.getCause());
        assertThrows(PayloadCodecException.class, () -> codec.decode(null));
    }

    @Test
    void shouldWrapUnserializablePayload() {
        JsonPayloadCodec<Object> codec = JsonPayloadCodec.of(Object.class);

        assertThrows(PayloadCodecException.class, () -> codec.encode(new Object()));
    }
}
