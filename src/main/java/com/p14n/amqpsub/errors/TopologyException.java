package com.p14n.amqpsub.errors;

/**
 * Thrown when declaring, binding or deleting an exchange or queue fails.
 * Carries the broker's reply code when the broker reported one.
 */
public class TopologyException extends PubSubException {

    /** Reply code for a missing exchange or queue. */
    public static final int NOT_FOUND = 404;

    private final int replyCode;

    public TopologyException(String message) {
        this(message, 0, null);
    }

    public TopologyException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public TopologyException(String message, int replyCode, Throwable cause) {
        super(message, cause);
        this.replyCode = replyCode;
    }

    /**
     * @return the broker reply code, or 0 if unknown
     */
    public int getReplyCode() {
        return replyCode;
    }

    public boolean isNotFound() {
        return replyCode == NOT_FOUND;
    }
}
