package com.p14n.amqpsub.broker;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryBrokerTest {

    @Test
    void shouldMatchTopicPatterns() {
        assertTrue(InMemoryBroker.topicMatches("orders", "orders"));
        assertTrue(InMemoryBroker.topicMatches("orders.*", "orders.created"));
        assertFalse(InMemoryBroker.topicMatches("orders.*", "orders.eu.created"));
        assertFalse(InMemoryBroker.topicMatches("orders.*", "orders"));
        assertTrue(InMemoryBroker.topicMatches("orders.#", "orders"));
        assertTrue(InMemoryBroker.topicMatches("orders.#", "orders.eu.created"));
        assertTrue(InMemoryBroker.topicMatches("#.created", "orders.eu.created"));
        assertTrue(InMemoryBroker.topicMatches("#", "anything.at.all"));
        assertFalse(InMemoryBroker.topicMatches("orders", "invoices"));
    }
}
