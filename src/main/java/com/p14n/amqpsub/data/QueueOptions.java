package com.p14n.amqpsub.data;

/**
 * Options for the private queue declared for each subscription. The queue name
 * is always assigned by the broker.
 *
 * @param exclusive  only usable by the declaring connection
 * @param durable    survive a broker restart
 * @param autoDelete removed by the broker once its last consumer is cancelled
 */
public record QueueOptions(boolean exclusive, boolean durable, boolean autoDelete) {

    /**
     * Exclusive, non-durable, auto-deleting queue.
     *
     * @return default options
     */
    public static QueueOptions defaults() {
        return new QueueOptions(true, false, true);
    }
}
