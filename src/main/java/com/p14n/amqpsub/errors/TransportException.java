package com.p14n.amqpsub.errors;

/**
 * Thrown when the broker is unreachable or the connection dropped while an
 * operation was in flight. The engine never retries; the caller decides.
 */
public class TransportException extends PubSubException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
