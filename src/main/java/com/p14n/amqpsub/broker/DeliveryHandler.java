package com.p14n.amqpsub.broker;

/**
 * Callback installed by {@link BrokerChannel#consume}. Called on the broker
 * client's dispatch threads; implementations must not block.
 */
public interface DeliveryHandler {

    /**
     * Called for every message delivered to the consumer.
     *
     * @param delivery the delivery
     */
    void onDelivery(BrokerDelivery delivery);

    /**
     * Called when the consumer is cancelled by anything other than
     * {@link BrokerChannel#cancelConsume}: the queue was deleted, or the
     * channel or connection shut down.
     *
     * @param consumerTag the cancelled consumer
     */
    void onCancel(String consumerTag);
}
