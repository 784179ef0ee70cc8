package com.p14n.amqpsub.data;

import com.p14n.amqpsub.broker.BrokerConnection;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import static org.junit.jupiter.api.Assertions.*;

class ConfigDataTest {

    private final BrokerConnection connection = Mockito.mock(BrokerConnection.class);

    @Test
    void shouldApplyDefaults() {
        ConfigData config = new ConfigData(connection);

        assertEquals("amqp-pubsub", config.exchange().name());
        assertEquals("topic", config.exchange().type());
        assertTrue(config.exchange().autoDelete());
        assertFalse(config.exchange().durable());
        assertEquals(QueueOptions.defaults(), config.queue());
        assertTrue(config.queue().exclusive());
        assertEquals(100, config.prefetch());
    }

    @Test
    void shouldFillMissingOptions() {
        ConfigData config = new ConfigData(connection, null, null, 10);

        assertEquals(ExchangeOptions.defaults(), config.exchange());
        assertEquals(QueueOptions.defaults(), config.queue());
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new ConfigData(null));
        assertThrows(IllegalArgumentException.class, () -> new ConfigData(connection, null, null, 0));
        assertThrows(IllegalArgumentException.class, () -> new ExchangeOptions(" "));
        assertThrows(IllegalArgumentException.class, () -> new ExchangeOptions("events", null, false, true));
    }
}
