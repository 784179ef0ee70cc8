package com.p14n.amqpsub.broker;

import java.util.Map;

/**
 * A single message delivered to a consumer.
 *
 * @param consumerTag the consumer it was delivered to
 * @param deliveryTag the channel-scoped tag used to acknowledge it
 * @param routingKey  the routing key it was published with
 * @param headers     message headers, never null
 * @param body        the encoded payload
 */
public record BrokerDelivery(String consumerTag,
        long deliveryTag,
        String routingKey,
        Map<String, Object> headers,
        byte[] body) {

    public BrokerDelivery {
        headers = headers == null ? Map.of() : headers;
    }
}
