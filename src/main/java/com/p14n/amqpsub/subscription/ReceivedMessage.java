package com.p14n.amqpsub.subscription;

/**
 * A decoded delivery waiting to be pulled. The delivery stays unacknowledged
 * on the broker until it is pulled.
 *
 * @param payload     the decoded payload
 * @param deliveryTag the tag to acknowledge it with
 * @param routingKey  the routing key it was published with
 * @param <T>         the payload type
 */
public record ReceivedMessage<T>(T payload, long deliveryTag, String routingKey) {
}
