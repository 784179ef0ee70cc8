package com.p14n.amqpsub.errors;

/**
 * Thrown when a payload cannot be encoded for publishing or decoded on delivery.
 */
public class PayloadCodecException extends PubSubException {

    public PayloadCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
