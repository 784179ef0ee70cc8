package com.p14n.amqpsub;

import com.p14n.amqpsub.errors.PubSubException;
import com.p14n.amqpsub.errors.UnknownSubscriptionException;
import com.p14n.amqpsub.iterator.Next;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellable, lazily produced sequence of payloads for one subscription.
 * Created by {@link AmqpPubSub#asyncIterator(String)}.
 *
 * <p>
 * {@link #cancel()} unsubscribes exactly once and may be called any number of
 * times; every call resolves with {@link Next#end()}. A {@link #next()} that
 * is waiting when the sequence is cancelled resolves with
 * {@link Next#end()} as well.
 * </p>
 *
 * @param <T> the payload type
 */
public class AsyncEventIterator<T> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AsyncEventIterator.class);

    private final AmqpPubSub<T> pubSub;
    private final long subscriptionId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CompletableFuture<Next<T>> cancellation = new CompletableFuture<>();

    AsyncEventIterator(AmqpPubSub<T> pubSub, long subscriptionId) {
        this.pubSub = pubSub;
        this.subscriptionId = subscriptionId;
    }

    /**
     * Requests the next payload.
     *
     * @return the next payload, or {@link Next#end()} once cancelled or once
     *         the engine has been closed
     */
    public CompletableFuture<Next<T>> next() {
        if (cancelled.get()) {
            return CompletableFuture.completedFuture(Next.end());
        }
        CompletableFuture<Next<T>> pulled = pubSub.pull(subscriptionId);
        CompletableFuture<Next<T>> result = pulled.handle((next, error) -> {
            if (error == null) {
                return next;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            if (cause instanceof UnknownSubscriptionException) {
                return Next.end();
            }
            if (error instanceof CompletionException) {
                throw (CompletionException) error;
            }
            throw new CompletionException(cause);
        });
        result.whenComplete((next, error) -> {
            if (error != null) {
                pulled.cancel(false);
            }
        });
        return result;
    }

    /**
     * Ends the sequence and unsubscribes. Resolves once the broker side has
     * been torn down.
     *
     * @return a future completed with {@link Next#end()}
     */
    public CompletableFuture<Next<T>> cancel() {
        if (cancelled.compareAndSet(false, true)) {
            try {
                pubSub.unsubscribe(subscriptionId);
            } catch (UnknownSubscriptionException e) {
                logger.atDebug()
                        .addArgument(subscriptionId)
                        .log("Subscription {} was already removed");
            } catch (PubSubException e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(subscriptionId)
                        .log("Subscription {} cancelled, broker cleanup failed");
            }
            cancellation.complete(Next.end());
        }
        return cancellation;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public long subscriptionId() {
        return subscriptionId;
    }

    /**
     * Cancels and waits for the teardown to finish.
     */
    @Override
    public void close() {
        cancel().join();
    }
}
