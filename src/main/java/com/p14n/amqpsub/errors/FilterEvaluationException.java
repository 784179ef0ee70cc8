package com.p14n.amqpsub.errors;

/**
 * Wraps a failure raised by a subscription filter while evaluating a payload.
 */
public class FilterEvaluationException extends PubSubException {

    public FilterEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
