package com.p14n.amqpsub.broker;

import com.p14n.amqpsub.data.ExchangeOptions;
import com.p14n.amqpsub.data.QueueOptions;

import java.util.Map;

/**
 * The broker operations the engine depends on. Implementations translate
 * connection-level failures into
 * {@link com.p14n.amqpsub.errors.TransportException} and declare/bind/delete
 * failures into {@link com.p14n.amqpsub.errors.TopologyException}.
 */
public interface BrokerChannel extends AutoCloseable {

    /**
     * Declares an exchange. Declaring an existing exchange with the same
     * options is a no-op on the broker.
     *
     * @param options the exchange to declare
     */
    void declareExchange(ExchangeOptions options);

    /**
     * Declares a queue with a broker-assigned name.
     *
     * @param options the queue options
     * @return the name the broker assigned
     */
    String declareQueue(QueueOptions options);

    /**
     * Binds a queue to an exchange.
     *
     * @param queue      the queue name
     * @param exchange   the exchange name
     * @param routingKey the routing key or topic pattern
     */
    void bindQueue(String queue, String exchange, String routingKey);

    /**
     * Deletes a queue. Deleting a queue that no longer exists succeeds.
     *
     * @param queue the queue name
     */
    void deleteQueue(String queue);

    /**
     * Publishes a message.
     *
     * @param exchange    the exchange name
     * @param routingKey  the routing key
     * @param headers     message headers, may be empty
     * @param contentType the body's content type
     * @param body        the encoded payload
     */
    void publish(String exchange, String routingKey, Map<String, Object> headers, String contentType, byte[] body);

    /**
     * Limits the number of unacknowledged deliveries per consumer.
     *
     * @param prefetch the limit
     */
    void basicQos(int prefetch);

    /**
     * Starts consuming a queue with manual acknowledgement.
     *
     * @param queue   the queue name
     * @param handler receives deliveries and cancellation
     * @return the broker-assigned consumer tag
     */
    String consume(String queue, DeliveryHandler handler);

    /**
     * Cancels a consumer. Cancelling a consumer that is already gone succeeds.
     *
     * @param consumerTag the tag returned by {@link #consume}
     */
    void cancelConsume(String consumerTag);

    /**
     * Acknowledges a single delivery.
     *
     * @param deliveryTag the delivery tag
     */
    void ack(long deliveryTag);

    /**
     * Rejects a single delivery without requeueing it.
     *
     * @param deliveryTag the delivery tag
     */
    void reject(long deliveryTag);

    boolean isOpen();

    @Override
    void close();
}
