package com.p14n.amqpsub.errors;

/**
 * Base exception for all publish/subscribe engine errors.
 */
public class PubSubException extends RuntimeException {

    /**
     * Creates a new PubSubException with a message.
     *
     * @param message the error message
     */
    public PubSubException(String message) {
        super(message);
    }

    /**
     * Creates a new PubSubException with a message and cause.
     *
     * @param message the error message
     * @param cause   the underlying cause
     */
    public PubSubException(String message, Throwable cause) {
        super(message, cause);
    }
}
