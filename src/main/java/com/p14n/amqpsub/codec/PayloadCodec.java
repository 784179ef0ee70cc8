package com.p14n.amqpsub.codec;

/**
 * Converts payloads to and from message bodies. Implementations must be
 * symmetric: {@code decode(encode(x))} equals {@code x} for every supported
 * payload.
 *
 * @param <T> the payload type
 */
public interface PayloadCodec<T> {

    /**
     * @throws com.p14n.amqpsub.errors.PayloadCodecException if the payload cannot be encoded
     */
    byte[] encode(T payload);

    /**
     * @throws com.p14n.amqpsub.errors.PayloadCodecException if the body cannot be decoded
     */
    T decode(byte[] body);

    /**
     * @return the content type recorded on published messages
     */
    default String contentType() {
        return "application/json";
    }
}
