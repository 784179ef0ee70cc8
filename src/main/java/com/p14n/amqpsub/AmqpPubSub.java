package com.p14n.amqpsub;

import com.p14n.amqpsub.broker.BrokerChannel;
import com.p14n.amqpsub.broker.BrokerDelivery;
import com.p14n.amqpsub.broker.BrokerTopology;
import com.p14n.amqpsub.broker.DeliveryHandler;
import com.p14n.amqpsub.codec.PayloadCodec;
import com.p14n.amqpsub.data.PubSubConfig;
import com.p14n.amqpsub.errors.PayloadCodecException;
import com.p14n.amqpsub.errors.PubSubException;
import com.p14n.amqpsub.errors.UnknownSubscriptionException;
import com.p14n.amqpsub.iterator.Next;
import com.p14n.amqpsub.iterator.PullIterator;
import com.p14n.amqpsub.subscription.ReceivedMessage;
import com.p14n.amqpsub.subscription.Subscription;
import com.p14n.amqpsub.subscription.SubscriptionRegistry;
import com.p14n.amqpsub.telemetry.BrokerMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.p14n.amqpsub.telemetry.OpenTelemetryFunctions.extractTraceContext;
import static com.p14n.amqpsub.telemetry.OpenTelemetryFunctions.injectTraceContext;
import static com.p14n.amqpsub.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Publish/subscribe engine routing named triggers through an AMQP topic
 * exchange.
 *
 * <p>
 * Every subscription gets its own exclusive, auto-deleting queue bound with
 * the trigger as routing key, so the broker fans each publish out to every
 * live subscription. A consumer on that queue decodes deliveries into the
 * subscription's {@link PullIterator}; callers read them with
 * {@link #pull(long)} or through an {@link AsyncEventIterator}.
 * </p>
 *
 * <p>
 * Deliveries are acknowledged when they are pulled. Together with the
 * configured prefetch this bounds how much any subscription buffers.
 * </p>
 *
 * <pre>{@code
 * AmqpPubSub<Map<String, Object>> pubSub = new AmqpPubSub<>(new ConfigData(connection), JsonPayloadCodec.map());
 * try (AsyncEventIterator<Map<String, Object>> events = pubSub.asyncIterator("orders.created")) {
 *     pubSub.publish("orders.created", Map.of("id", 42));
 *     Next<Map<String, Object>> next = events.next().join();
 * }
 * }</pre>
 *
 * @param <T> the payload type
 */
public class AmqpPubSub<T> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AmqpPubSub.class);

    private final PubSubConfig config;
    private final PayloadCodec<T> codec;
    private final BrokerTopology topology;
    private final BrokerChannel consumeChannel;
    private final SubscriptionRegistry<T> registry = new SubscriptionRegistry<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final BrokerMetrics metrics;

    public AmqpPubSub(PubSubConfig config, PayloadCodec<T> codec) {
        this(config, codec, OpenTelemetry.noop());
    }

    public AmqpPubSub(PubSubConfig config, PayloadCodec<T> codec, OpenTelemetry ot) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("Codec cannot be null");
        }
        if (ot == null) {
            throw new IllegalArgumentException("OpenTelemetry cannot be null");
        }
        this.config = config;
        this.codec = codec;
        this.openTelemetry = ot;
        this.tracer = ot.getTracer("amqp_pubsub");
        this.metrics = new BrokerMetrics(ot.getMeter("amqp_pubsub"));
        this.topology = new BrokerTopology(config.connection(), config.exchange(), config.queue());
        this.consumeChannel = config.connection().openChannel();
        try {
            consumeChannel.basicQos(config.prefetch());
        } catch (RuntimeException e) {
            consumeChannel.close();
            throw e;
        }
    }

    /**
     * Publishes a payload to every subscription whose binding matches the
     * trigger. Messages published with no matching subscription are dropped
     * by the broker. Failures are not retried.
     *
     * @param trigger the routing key
     * @param payload the payload
     * @throws com.p14n.amqpsub.errors.TransportException    if the broker is unavailable
     * @throws com.p14n.amqpsub.errors.PayloadCodecException if the payload cannot be encoded
     */
    public void publish(String trigger, T payload) {
        checkOpen();
        checkTrigger(trigger);
        if (payload == null) {
            throw new IllegalArgumentException("Payload cannot be null");
        }
        byte[] body = codec.encode(payload);

        processWithTelemetry(tracer, "publish_message", SpanKind.PRODUCER, trigger, null, () -> {
            Map<String, Object> headers = new HashMap<>();
            injectTraceContext(openTelemetry, headers);
            topology.ensureExchange();
            topology.channel().publish(topology.exchange().name(), trigger, headers, codec.contentType(), body);
            return null;
        });

        metrics.recordPublished(trigger);
        logger.atDebug()
                .addArgument(trigger)
                .addArgument(body.length)
                .log("Published to {} ({} bytes)");
    }

    /**
     * Creates a new subscription with its own queue bound for the trigger.
     * The subscription is live once this returns.
     *
     * @param trigger the routing key or topic pattern
     * @return the subscription id
     * @throws com.p14n.amqpsub.errors.TopologyException  if the queue could not be set up;
     *                                                    nothing is left behind
     * @throws com.p14n.amqpsub.errors.TransportException if the broker is unavailable
     */
    public long subscribe(String trigger) {
        checkOpen();
        checkTrigger(trigger);

        topology.ensureExchange();
        String queue = topology.declareAndBind(trigger);

        long id = registry.reserve();
        PullIterator<ReceivedMessage<T>> iterator = new PullIterator<>(config.prefetch());
        String consumerTag;
        try {
            consumerTag = consumeChannel.consume(queue, new SubscriptionHandler(id, trigger, iterator));
        } catch (RuntimeException e) {
            iterator.close();
            try {
                topology.unbindAndDelete(queue);
            } catch (RuntimeException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        registry.register(id, trigger, queue, consumerTag, iterator);
        metrics.recordSubscriptionAdded(trigger);

        logger.atInfo()
                .addArgument(id)
                .addArgument(trigger)
                .addArgument(queue)
                .log("Subscription {} to {} on queue {}");
        return id;
    }

    /**
     * Pulls the next payload for a subscription, acknowledging its delivery.
     *
     * @param subscriptionId the id returned by {@link #subscribe(String)}
     * @return the next payload, or {@link Next#end()} once the subscription
     *         has been unsubscribed. Fails with
     *         {@link UnknownSubscriptionException} for an unknown id and with
     *         {@link com.p14n.amqpsub.errors.ConcurrentPullException} if a pull
     *         is already pending.
     */
    public CompletableFuture<Next<T>> pull(long subscriptionId) {
        Optional<Subscription<T>> subscription = registry.lookup(subscriptionId);
        if (subscription.isEmpty()) {
            return CompletableFuture.failedFuture(new UnknownSubscriptionException(subscriptionId));
        }
        return pull(subscription.get());
    }

    private CompletableFuture<Next<T>> pull(Subscription<T> subscription) {
        PullIterator<ReceivedMessage<T>> iterator = subscription.iterator();
        CompletableFuture<Next<ReceivedMessage<T>>> source = iterator.pull();
        AtomicBoolean claimed = new AtomicBoolean(false);

        CompletableFuture<Next<T>> result = source.thenApply(next -> {
            if (next.done() || !claimed.compareAndSet(false, true)) {
                return Next.end();
            }
            ReceivedMessage<T> message = next.value();
            acknowledge(subscription, message);
            metrics.recordDelivered(subscription.trigger());
            return Next.of(message.payload());
        });

        // a caller that cancels or times out the pull gives up its place
        result.whenComplete((next, error) -> {
            if (error == null || source.cancel(false) || source.isCompletedExceptionally()) {
                return;
            }
            Next<ReceivedMessage<T>> unclaimed = source.join();
            if (!unclaimed.done() && claimed.compareAndSet(false, true)) {
                ReceivedMessage<T> message = unclaimed.value();
                if (!iterator.restore(message)) {
                    release(subscription.id(), message.deliveryTag());
                }
            }
        });
        return result;
    }

    /**
     * Settles a delivery that will never reach a caller. Rejected without
     * requeue; its queue is going away.
     */
    private void release(long subscriptionId, long deliveryTag) {
        try {
            consumeChannel.reject(deliveryTag);
        } catch (PubSubException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(deliveryTag)
                    .addArgument(subscriptionId)
                    .log("Failed to release delivery {} on subscription {}");
        }
    }

    private void releaseAll(long subscriptionId, List<ReceivedMessage<T>> discarded) {
        for (ReceivedMessage<T> message : discarded) {
            release(subscriptionId, message.deliveryTag());
        }
    }

    private void acknowledge(Subscription<T> subscription, ReceivedMessage<T> message) {
        try {
            consumeChannel.ack(message.deliveryTag());
        } catch (PubSubException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(message.deliveryTag())
                    .addArgument(subscription.id())
                    .log("Failed to ack delivery {} on subscription {}");
        }
    }

    /**
     * Tears a subscription down: closes its iterator (a pending pull resolves
     * with {@link Next#end()} straight away), cancels its consumer and
     * deletes its queue.
     *
     * @param subscriptionId the id returned by {@link #subscribe(String)}
     * @throws UnknownSubscriptionException if the id is unknown or was already
     *                                      unsubscribed
     * @throws PubSubException              if the broker side could not be cleaned
     *                                      up; the subscription is gone regardless
     */
    public void unsubscribe(long subscriptionId) {
        Subscription<T> subscription = registry.remove(subscriptionId);
        releaseAll(subscriptionId, subscription.iterator().close());
        metrics.recordSubscriptionRemoved(subscription.trigger());

        PubSubException failure = null;
        try {
            consumeChannel.cancelConsume(subscription.consumerTag());
        } catch (PubSubException e) {
            failure = e;
        }
        try {
            topology.unbindAndDelete(subscription.queueName());
        } catch (PubSubException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }
        if (registry.isEmpty() && topology.exchange().autoDelete()) {
            topology.forgetExchange();
        }

        logger.atInfo()
                .addArgument(subscriptionId)
                .addArgument(subscription.trigger())
                .log("Unsubscribed {} from {}");
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Subscribes to the trigger and wraps the subscription as a cancellable
     * sequence. Cancelling the sequence unsubscribes exactly once.
     *
     * @param trigger the routing key or topic pattern
     * @return the sequence
     */
    public AsyncEventIterator<T> asyncIterator(String trigger) {
        return new AsyncEventIterator<>(this, subscribe(trigger));
    }

    public Set<Long> activeSubscriptions() {
        return registry.activeIds();
    }

    /**
     * Unsubscribes everything and closes this engine's channels. The shared
     * connection stays open.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (Long id : registry.activeIds()) {
            try {
                unsubscribe(id);
            } catch (UnknownSubscriptionException e) {
                logger.atDebug().addArgument(id).log("Subscription {} was removed concurrently");
            } catch (PubSubException e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(id)
                        .log("Error unsubscribing {} on close");
            }
        }
        consumeChannel.close();
        topology.close();
        logger.atInfo().log("PubSub engine closed");
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new IllegalStateException("PubSub engine is closed");
        }
    }

    private static void checkTrigger(String trigger) {
        if (trigger == null || trigger.isEmpty()) {
            throw new IllegalArgumentException("Trigger cannot be null or empty");
        }
    }

    private class SubscriptionHandler implements DeliveryHandler {

        private final long id;
        private final String trigger;
        private final PullIterator<ReceivedMessage<T>> iterator;

        SubscriptionHandler(long id, String trigger, PullIterator<ReceivedMessage<T>> iterator) {
            this.id = id;
            this.trigger = trigger;
            this.iterator = iterator;
        }

        @Override
        public void onDelivery(BrokerDelivery delivery) {
            Context parent = extractTraceContext(openTelemetry, delivery.headers());
            processWithTelemetry(tracer, "deliver_message", SpanKind.CONSUMER, trigger, parent, () -> {
                accept(delivery);
                return null;
            });
        }

        private void accept(BrokerDelivery delivery) {
            T payload;
            try {
                payload = codec.decode(delivery.body());
            } catch (PayloadCodecException e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(delivery.routingKey())
                        .addArgument(id)
                        .log("Rejecting undecodable message from {} on subscription {}");
                reject(delivery);
                return;
            }
            try {
                if (!iterator.push(new ReceivedMessage<>(payload, delivery.deliveryTag(), delivery.routingKey()))) {
                    logger.atDebug()
                            .addArgument(id)
                            .log("Subscription {} is closed, releasing delivery");
                    release(id, delivery.deliveryTag());
                }
            } catch (IllegalStateException e) {
                logger.atError()
                        .setCause(e)
                        .addArgument(id)
                        .log("Subscription {} buffer overflow, rejecting delivery");
                reject(delivery);
            }
        }

        private void reject(BrokerDelivery delivery) {
            metrics.recordRejected(trigger);
            release(id, delivery.deliveryTag());
        }

        @Override
        public void onCancel(String consumerTag) {
            if (iterator.isClosed()) {
                return;
            }
            logger.atWarn()
                    .addArgument(consumerTag)
                    .addArgument(id)
                    .log("Consumer {} for subscription {} was cancelled by the broker");
            List<ReceivedMessage<T>> discarded = iterator.close();
            if (consumeChannel.isOpen()) {
                releaseAll(id, discarded);
            }
        }
    }
}
