package com.p14n.amqpsub.broker;

import com.p14n.amqpsub.data.ExchangeOptions;
import com.p14n.amqpsub.data.QueueOptions;
import com.p14n.amqpsub.errors.TopologyException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares the shared exchange and the private queue behind each subscription.
 *
 * <p>
 * Topology calls run on a control channel owned by this class. A broker
 * closes a channel when a declare or bind fails, so the control channel is
 * reopened on next use. It never carries consumers, which keeps live
 * subscriptions unaffected by a failed declare.
 * </p>
 */
public class BrokerTopology implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BrokerTopology.class);

    private final BrokerConnection connection;
    private final ExchangeOptions exchange;
    private final QueueOptions queueOptions;
    private final Object lock = new Object();
    private volatile boolean exchangeDeclared;
    private BrokerChannel channel;
    private boolean closed;

    public BrokerTopology(BrokerConnection connection, ExchangeOptions exchange, QueueOptions queueOptions) {
        if (connection == null) {
            throw new IllegalArgumentException("Connection cannot be null");
        }
        this.connection = connection;
        this.exchange = exchange == null ? ExchangeOptions.defaults() : exchange;
        this.queueOptions = queueOptions == null ? QueueOptions.defaults() : queueOptions;
    }

    /**
     * Returns the control channel, opening a new one if the broker closed the
     * previous one.
     *
     * @return an open channel
     */
    public BrokerChannel channel() {
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Topology is closed");
            }
            if (channel == null || !channel.isOpen()) {
                if (channel != null) {
                    logger.atWarn().log("Control channel was closed, opening a new one");
                }
                channel = connection.openChannel();
            }
            return channel;
        }
    }

    public ExchangeOptions exchange() {
        return exchange;
    }

    /**
     * Declares the exchange the first time it is called. Later calls return
     * immediately until {@link #forgetExchange()} is called.
     */
    public void ensureExchange() {
        if (exchangeDeclared) {
            return;
        }
        synchronized (lock) {
            if (exchangeDeclared) {
                return;
            }
            channel().declareExchange(exchange);
            exchangeDeclared = true;
            logger.atInfo()
                    .addArgument(exchange.name())
                    .addArgument(exchange.type())
                    .log("Declared exchange {} ({})");
        }
    }

    /**
     * Drops the cached declaration, so the next {@link #ensureExchange()}
     * declares again. Used once an auto-delete exchange may have been removed.
     */
    public void forgetExchange() {
        exchangeDeclared = false;
    }

    public boolean isExchangeDeclared() {
        return exchangeDeclared;
    }

    /**
     * Declares a new broker-named queue. Every call returns a different queue.
     *
     * @return the queue name
     */
    public String declareSubscriberQueue() {
        String queue = channel().declareQueue(queueOptions);
        logger.atDebug().addArgument(queue).log("Declared queue {}");
        return queue;
    }

    /**
     * Binds a queue to the exchange so it receives messages published with
     * the trigger as routing key. Topic patterns are passed through as given.
     */
    public void bind(String queue, String trigger) {
        channel().bindQueue(queue, exchange.name(), trigger);
        logger.atDebug()
                .addArgument(queue)
                .addArgument(exchange.name())
                .addArgument(trigger)
                .log("Bound queue {} to {} with {}");
    }

    /**
     * Declares a queue and binds it for the trigger. If binding fails the
     * queue is deleted before the failure is rethrown.
     *
     * <p>
     * An auto-delete exchange disappears when its last queue is deleted,
     * which can happen between {@link #ensureExchange()} and the bind. A bind
     * that fails with not-found is retried once after declaring the exchange
     * again.
     * </p>
     *
     * @return the bound queue
     */
    public String declareAndBind(String trigger) {
        String queue = declareSubscriberQueue();
        try {
            bindRedeclaringExchange(queue, trigger);
        } catch (RuntimeException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(trigger)
                    .addArgument(queue)
                    .log("Failed to bind {}, deleting queue {}");
            try {
                unbindAndDelete(queue);
            } catch (RuntimeException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        return queue;
    }

    private void bindRedeclaringExchange(String queue, String trigger) {
        try {
            bind(queue, trigger);
        } catch (TopologyException e) {
            if (!e.isNotFound()) {
                throw e;
            }
            logger.atWarn()
                    .addArgument(exchange.name())
                    .addArgument(queue)
                    .log("Exchange {} not found binding {}, declaring it again");
            forgetExchange();
            ensureExchange();
            bind(queue, trigger);
        }
    }

    /**
     * Deletes a queue along with its bindings. Deleting a queue that no longer
     * exists succeeds.
     */
    public void unbindAndDelete(String queue) {
        channel().deleteQueue(queue);
        logger.atDebug().addArgument(queue).log("Deleted queue {}");
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            if (channel != null && channel.isOpen()) {
                channel.close();
            }
            channel = null;
        }
    }
}
