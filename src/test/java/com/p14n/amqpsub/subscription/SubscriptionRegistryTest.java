package com.p14n.amqpsub.subscription;

import com.p14n.amqpsub.errors.UnknownSubscriptionException;
import com.p14n.amqpsub.iterator.PullIterator;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionRegistryTest {

    private final SubscriptionRegistry<String> registry = new SubscriptionRegistry<>();

    @Test
    void shouldAssignIncreasingIdsThatAreNeverReused() {
        long first = registry.register("a", "q1", "c1", new PullIterator<>());
        long second = registry.register("b", "q2", "c2", new PullIterator<>());
        registry.remove(first);
        long third = registry.register("a", "q3", "c3", new PullIterator<>());

        assertTrue(second > first);
        assertTrue(third > second);
        assertEquals(Set.of(second, third), registry.activeIds());
    }

    @Test
    void shouldRegisterUnderReservedId() {
        long id = registry.reserve();
        Subscription<String> subscription = registry.register(id, "orders", "q", "tag", new PullIterator<>());

        assertEquals(id, subscription.id());
        assertEquals("orders", registry.get(id).trigger());
        assertEquals(1, registry.size());
    }

    @Test
    void shouldRejectIdThatWasNotReserved() {
        assertThrows(IllegalArgumentException.class,
                () -> registry.register(42, "orders", "q", "tag", new PullIterator<>()));
        assertTrue(registry.isEmpty());
    }

    @Test
    void shouldRejectSecondConsumerForSameId() {
        long id = registry.reserve();
        registry.register(id, "orders", "q", "tag", new PullIterator<>());

        assertThrows(IllegalStateException.class,
                () -> registry.register(id, "orders", "q2", "tag2", new PullIterator<>()));
        assertEquals("q", registry.get(id).queueName());
    }

    @Test
    void shouldRejectMissingFields() {
        long id = registry.reserve();
        assertThrows(IllegalArgumentException.class,
                () -> registry.register(id, "orders", null, "tag", new PullIterator<>()));
    }

    @Test
    void removeShouldSucceedOnlyOnce() {
        long id = registry.register("orders", "q", "tag", new PullIterator<>());

        assertEquals("q", registry.remove(id).queueName());
        UnknownSubscriptionException e = assertThrows(UnknownSubscriptionException.class,
                () -> registry.remove(id));
        assertEquals(id, e.getSubscriptionId());
        assertTrue(registry.lookup(id).isEmpty());
    }

    @Test
    void getShouldFailForUnknownId() {
        assertThrows(UnknownSubscriptionException.class, () -> registry.get(7));
    }
}
