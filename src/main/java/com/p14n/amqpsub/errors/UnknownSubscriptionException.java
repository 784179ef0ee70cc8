package com.p14n.amqpsub.errors;

/**
 * Thrown when a subscription id is not (or no longer) registered.
 * Usually means a subscription was unsubscribed twice.
 */
public class UnknownSubscriptionException extends PubSubException {

    private final long subscriptionId;

    /**
     * Creates a new UnknownSubscriptionException.
     *
     * @param subscriptionId the id that was not found
     */
    public UnknownSubscriptionException(long subscriptionId) {
        super("unknown subscription: " + subscriptionId);
        this.subscriptionId = subscriptionId;
    }

    /**
     * Returns the id that was not found.
     *
     * @return the subscription id
     */
    public long getSubscriptionId() {
        return subscriptionId;
    }
}
