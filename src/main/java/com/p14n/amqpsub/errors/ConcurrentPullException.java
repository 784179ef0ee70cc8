package com.p14n.amqpsub.errors;

/**
 * Thrown when a pull is issued on an iterator that already has one outstanding.
 */
public class ConcurrentPullException extends PubSubException {

    public ConcurrentPullException() {
        super("a pull is already pending on this iterator");
    }
}
