package com.p14n.amqpsub.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * OpenTelemetry metrics for the publish/subscribe engine, all tagged with the
 * trigger.
 *
 * <ul>
 * <li>messages_published: messages handed to the broker</li>
 * <li>messages_delivered: messages pulled by a subscriber</li>
 * <li>messages_rejected: deliveries rejected because they could not be
 * decoded or buffered</li>
 * <li>active_subscriptions: live subscriptions</li>
 * </ul>
 */
public class BrokerMetrics {

        private static final AttributeKey<String> TRIGGER = AttributeKey.stringKey("trigger");

        private final LongCounter publishedMessages;
        private final LongCounter deliveredMessages;
        private final LongCounter rejectedMessages;
        private final LongUpDownCounter activeSubscriptions;

        public BrokerMetrics(Meter meter) {
                publishedMessages = meter.counterBuilder("messages_published")
                                .setDescription("Number of messages published")
                                .build();

                deliveredMessages = meter.counterBuilder("messages_delivered")
                                .setDescription("Number of messages pulled by subscribers")
                                .build();

                rejectedMessages = meter.counterBuilder("messages_rejected")
                                .setDescription("Number of deliveries rejected by subscriptions")
                                .build();

                activeSubscriptions = meter.upDownCounterBuilder("active_subscriptions")
                                .setDescription("Number of active subscriptions")
                                .build();
        }

        public void recordPublished(String trigger) {
                publishedMessages.add(1, Attributes.of(TRIGGER, trigger));
        }

        public void recordDelivered(String trigger) {
                deliveredMessages.add(1, Attributes.of(TRIGGER, trigger));
        }

        public void recordRejected(String trigger) {
                rejectedMessages.add(1, Attributes.of(TRIGGER, trigger));
        }

        public void recordSubscriptionAdded(String trigger) {
                activeSubscriptions.add(1, Attributes.of(TRIGGER, trigger));
        }

        public void recordSubscriptionRemoved(String trigger) {
                activeSubscriptions.add(-1, Attributes.of(TRIGGER, trigger));
        }
}
