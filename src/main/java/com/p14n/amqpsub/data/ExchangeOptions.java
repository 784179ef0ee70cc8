package com.p14n.amqpsub.data;

/**
 * Exchange declaration options.
 *
 * @param name       exchange name
 * @param type       exchange type, normally {@code topic}
 * @param durable    survive a broker restart
 * @param autoDelete removed by the broker once the last queue is unbound
 */
public record ExchangeOptions(String name, String type, boolean durable, boolean autoDelete) {

    /** Exchange name used when none is configured. */
    public static final String DEFAULT_NAME = "amqp-pubsub";

    /** Exchange type used when none is configured. */
    public static final String DEFAULT_TYPE = "topic";

    public ExchangeOptions {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("exchange name cannot be null or empty");
        }
        if (type == null || type.trim().isEmpty()) {
            throw new IllegalArgumentException("exchange type cannot be null or empty");
        }
    }

    public ExchangeOptions(String name) {
        this(name, DEFAULT_TYPE, false, true);
    }

    /**
     * Non-durable, auto-deleting topic exchange with the default name.
     *
     * @return default options
     */
    public static ExchangeOptions defaults() {
        return new ExchangeOptions(DEFAULT_NAME);
    }
}
