package com.p14n.amqpsub.data;

import com.p14n.amqpsub.broker.BrokerConnection;

public record ConfigData(BrokerConnection connection,
        ExchangeOptions exchange,
        QueueOptions queue,
        int prefetch) implements PubSubConfig {

    public ConfigData {
        if (connection == null) {
            throw new IllegalArgumentException("connection cannot be null");
        }
        if (exchange == null) {
            exchange = ExchangeOptions.defaults();
        }
        if (queue == null) {
            queue = QueueOptions.defaults();
        }
        if (prefetch <= 0) {
            throw new IllegalArgumentException("prefetch must be positive");
        }
    }

    public ConfigData(BrokerConnection connection,
                      ExchangeOptions exchange,
                      QueueOptions queue) {
        this(connection, exchange, queue, 100);
    }

    public ConfigData(BrokerConnection connection) {
        this(connection, ExchangeOptions.defaults(), QueueOptions.defaults(), 100);
    }
}
