package com.p14n.amqpsub.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.amqpsub.errors.PayloadCodecException;

import java.io.IOException;
import java.util.Map;

/**
 * JSON codec backed by a Jackson {@link ObjectMapper}.
 *
 * <pre>{@code
 * PayloadCodec<OrderPlaced> codec = JsonPayloadCodec.of(OrderPlaced.class);
 * PayloadCodec<Map<String, Object>> maps = JsonPayloadCodec.map();
 * }</pre>
 *
 * @param <T> the payload type
 */
public class JsonPayloadCodec<T> implements PayloadCodec<T> {

    private static final ObjectMapper mapper = new ObjectMapper();

    private final ObjectMapper objectMapper;
    private final JavaType type;

    public JsonPayloadCodec(ObjectMapper objectMapper, JavaType type) {
        if (objectMapper == null || type == null) {
            throw new IllegalArgumentException("objectMapper and type are required");
        }
        this.objectMapper = objectMapper;
        this.type = type;
    }

    public static <T> JsonPayloadCodec<T> of(Class<T> type) {
        return new JsonPayloadCodec<>(mapper, mapper.constructType(type));
    }

    public static <T> JsonPayloadCodec<T> of(TypeReference<T> type) {
        return new JsonPayloadCodec<>(mapper, mapper.constructType(type));
    }

    public static JsonPayloadCodec<Map<String, Object>> map() {
        return of(new TypeReference<Map<String, Object>>() {
        });
    }

    public static JsonPayloadCodec<JsonNode> tree() {
        return of(JsonNode.class);
    }

    @Override
    public byte[] encode(T payload) {
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new PayloadCodecException("Failed to encode payload as " + type, e);
        }
    }

    @Override
    public T decode(byte[] body) {
        if (body == null) {
            throw new PayloadCodecException("Cannot decode a null body", null);
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (IOException e) {
            throw new PayloadCodecException("Failed to decode payload as " + type, e);
        }
    }
}
