package com.p14n.amqpsub.data;

import com.p14n.amqpsub.broker.BrokerConnection;

/**
 * Configuration for an {@link com.p14n.amqpsub.AmqpPubSub} engine.
 * The connection is owned by the caller and shared by every engine built
 * from it.
 */
public interface PubSubConfig {

    /**
     * Gets the broker connection the engine opens its channels on.
     *
     * @return the connection handle
     */
    BrokerConnection connection();

    /**
     * Gets the exchange all triggers are routed through.
     *
     * @return the exchange options
     */
    ExchangeOptions exchange();

    /**
     * Gets the options used when declaring each subscription queue.
     *
     * @return the queue options
     */
    QueueOptions queue();

    /**
     * Gets the maximum number of unacknowledged deliveries per subscription.
     * This is also the most a subscription will ever buffer.
     * Default is 100.
     *
     * @return the prefetch count
     */
    default int prefetch() {
        return 100;
    }
}
