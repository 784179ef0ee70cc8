package com.p14n.amqpsub.subscription;

import com.p14n.amqpsub.iterator.PullIterator;

/**
 * A live association between a trigger, its private queue, the broker
 * consumer reading that queue and the iterator the consumer feeds.
 *
 * @param id          engine-assigned id
 * @param trigger     the routing key the queue is bound with
 * @param queueName   broker-assigned queue name
 * @param consumerTag broker-assigned consumer tag
 * @param iterator    receives every delivery for this subscription
 * @param <T>         the payload type
 */
public record Subscription<T>(long id,
        String trigger,
        String queueName,
        String consumerTag,
        PullIterator<ReceivedMessage<T>> iterator) {
}
