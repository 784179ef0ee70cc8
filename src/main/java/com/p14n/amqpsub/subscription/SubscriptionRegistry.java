package com.p14n.amqpsub.subscription;

import com.p14n.amqpsub.errors.UnknownSubscriptionException;
import com.p14n.amqpsub.iterator.PullIterator;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe map of live subscriptions by id.
 *
 * <p>
 * Ids are handed out in increasing order and never reused. An id can be
 * {@link #reserve() reserved} before the broker consumer exists, so the
 * consumer can be set up knowing its id and registered afterwards.
 * </p>
 *
 * @param <T> the payload type
 */
public class SubscriptionRegistry<T> {

    private final AtomicLong nextId = new AtomicLong(1);
    private final ConcurrentHashMap<Long, Subscription<T>> subscriptions = new ConcurrentHashMap<>();

    /**
     * Allocates a fresh id without registering anything.
     *
     * @return the id
     */
    public long reserve() {
        return nextId.getAndIncrement();
    }

    /**
     * Allocates an id and registers the subscription under it.
     *
     * @return the new id
     */
    public long register(String trigger, String queueName, String consumerTag,
            PullIterator<ReceivedMessage<T>> iterator) {
        long id = reserve();
        register(id, trigger, queueName, consumerTag, iterator);
        return id;
    }

    /**
     * Registers a subscription under a previously reserved id.
     *
     * @return the registered subscription
     * @throws IllegalArgumentException if the id was never reserved
     * @throws IllegalStateException    if the id already has a consumer registered
     */
    public Subscription<T> register(long id, String trigger, String queueName, String consumerTag,
            PullIterator<ReceivedMessage<T>> iterator) {
        if (id <= 0 || id >= nextId.get()) {
            throw new IllegalArgumentException("Subscription id " + id + " was not reserved");
        }
        if (trigger == null || queueName == null || consumerTag == null || iterator == null) {
            throw new IllegalArgumentException("trigger, queueName, consumerTag and iterator are required");
        }
        Subscription<T> subscription = new Subscription<>(id, trigger, queueName, consumerTag, iterator);
        if (subscriptions.putIfAbsent(id, subscription) != null) {
            throw new IllegalStateException("Subscription " + id + " already has a consumer registered");
        }
        return subscription;
    }

    public Optional<Subscription<T>> lookup(long id) {
        return Optional.ofNullable(subscriptions.get(id));
    }

    /**
     * @throws UnknownSubscriptionException if the id is not registered
     */
    public Subscription<T> get(long id) {
        Subscription<T> subscription = subscriptions.get(id);
        if (subscription == null) {
            throw new UnknownSubscriptionException(id);
        }
        return subscription;
    }

    /**
     * Removes a subscription.
     *
     * @return the removed subscription
     * @throws UnknownSubscriptionException if the id is not registered, which
     *                                      includes a second removal of the same id
     */
    public Subscription<T> remove(long id) {
        Subscription<T> removed = subscriptions.remove(id);
        if (removed == null) {
            throw new UnknownSubscriptionException(id);
        }
        return removed;
    }

    public Set<Long> activeIds() {
        return Set.copyOf(subscriptions.keySet());
    }

    public int size() {
        return subscriptions.size();
    }

    public boolean isEmpty() {
        return subscriptions.isEmpty();
    }
}
