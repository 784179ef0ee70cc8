package com.p14n.amqpsub.broker.rabbitmq;

import com.p14n.amqpsub.broker.BrokerChannel;
import com.p14n.amqpsub.broker.BrokerDelivery;
import com.p14n.amqpsub.broker.DeliveryHandler;
import com.p14n.amqpsub.data.ExchangeOptions;
import com.p14n.amqpsub.data.QueueOptions;
import com.p14n.amqpsub.errors.TopologyException;
import com.p14n.amqpsub.errors.TransportException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link BrokerChannel} over an AMQP 0-9-1 channel from the RabbitMQ Java
 * client.
 *
 * <p>
 * Connection-level failures (hard errors, a closed connection or channel)
 * surface as {@link TransportException}. Channel errors raised by a declare,
 * bind or delete surface as {@link TopologyException}; the broker closes the
 * channel when that happens.
 * </p>
 */
public class RabbitBrokerChannel implements BrokerChannel {
    private static final Logger logger = LoggerFactory.getLogger(RabbitBrokerChannel.class);

    private final Channel channel;

    public RabbitBrokerChannel(Channel channel) {
        if (channel == null) {
            throw new IllegalArgumentException("Channel cannot be null");
        }
        this.channel = channel;
    }

    @Override
    public void declareExchange(ExchangeOptions options) {
        try {
            channel.exchangeDeclare(options.name(), options.type(), options.durable(), options.autoDelete(), null);
        } catch (IOException | AlreadyClosedException e) {
            throw topologyFailure("Failed to declare exchange " + options.name(), e);
        }
    }

    @Override
    public String declareQueue(QueueOptions options) {
        try {
            return channel.queueDeclare("", options.durable(), options.exclusive(), options.autoDelete(), null)
                    .getQueue();
        } catch (IOException | AlreadyClosedException e) {
            throw topologyFailure("Failed to declare queue", e);
        }
    }

    @Override
    public void bindQueue(String queue, String exchange, String routingKey) {
        try {
            channel.queueBind(queue, exchange, routingKey);
        } catch (IOException | AlreadyClosedException e) {
            throw topologyFailure("Failed to bind queue " + queue + " to " + exchange + " with " + routingKey, e);
        }
    }

    @Override
    public void deleteQueue(String queue) {
        try {
            channel.queueDelete(queue);
        } catch (IOException | AlreadyClosedException e) {
            if (isNotFound(e)) {
                logger.atDebug().addArgument(queue).log("Queue {} was already deleted");
                return;
            }
            throw topologyFailure("Failed to delete queue " + queue, e);
        }
    }

    @Override
    public void publish(String exchange, String routingKey, Map<String, Object> headers, String contentType,
            byte[] body) {
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .contentType(contentType)
                .headers(headers == null || headers.isEmpty() ? null : new HashMap<>(headers))
                .timestamp(new Date())
                .build();
        try {
            channel.basicPublish(exchange, routingKey, properties, body);
        } catch (IOException | AlreadyClosedException e) {
            throw new TransportException("Failed to publish to " + exchange + " with " + routingKey, e);
        }
    }

    @Override
    public void basicQos(int prefetch) {
        try {
            channel.basicQos(prefetch);
        } catch (IOException | AlreadyClosedException e) {
            throw new TransportException("Failed to set prefetch to " + prefetch, e);
        }
    }

    @Override
    public String consume(String queue, DeliveryHandler handler) {
        try {
            return channel.basicConsume(queue, false, new DefaultConsumer(channel) {
                @Override
                public void handleDelivery(String consumerTag, Envelope envelope,
                        AMQP.BasicProperties properties, byte[] body) {
                    Map<String, Object> headers = properties == null ? null : properties.getHeaders();
                    handler.onDelivery(new BrokerDelivery(consumerTag, envelope.getDeliveryTag(),
                            envelope.getRoutingKey(), headers, body));
                }

                @Override
                public void handleCancel(String consumerTag) {
                    handler.onCancel(consumerTag);
                }

                @Override
                public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
                    handler.onCancel(consumerTag);
                }
            });
        } catch (IOException | AlreadyClosedException e) {
            throw topologyFailure("Failed to consume from " + queue, e);
        }
    }

    @Override
    public void cancelConsume(String consumerTag) {
        try {
            channel.basicCancel(consumerTag);
        } catch (AlreadyClosedException e) {
            // consumers die with their channel
            logger.atDebug().addArgument(consumerTag).log("Channel already closed, consumer {} is gone");
        } catch (IOException e) {
            throw new TransportException("Failed to cancel consumer " + consumerTag, e);
        }
    }

    @Override
    public void ack(long deliveryTag) {
        try {
            channel.basicAck(deliveryTag, false);
        } catch (IOException | AlreadyClosedException e) {
            throw new TransportException("Failed to ack delivery " + deliveryTag, e);
        }
    }

    @Override
    public void reject(long deliveryTag) {
        try {
            channel.basicReject(deliveryTag, false);
        } catch (IOException | AlreadyClosedException e) {
            throw new TransportException("Failed to reject delivery " + deliveryTag, e);
        }
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() {
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (IOException | TimeoutException | AlreadyClosedException e) {
            logger.atWarn().setCause(e).log("Error closing channel");
        }
    }

    private static ShutdownSignalException shutdownCause(Exception e) {
        if (e instanceof ShutdownSignalException) {
            return (ShutdownSignalException) e;
        }
        if (e.getCause() instanceof ShutdownSignalException) {
            return (ShutdownSignalException) e.getCause();
        }
        return null;
    }

    private static boolean isNotFound(Exception e) {
        return channelReplyCode(e) == AMQP.NOT_FOUND;
    }

    /**
     * @return the reply code of the channel close behind the failure, or 0 if
     *         the channel was not closed by a channel error
     */
    private static int channelReplyCode(Exception e) {
        ShutdownSignalException sse = shutdownCause(e);
        if (sse == null || sse.isHardError() || !(sse.getReason() instanceof AMQP.Channel.Close)) {
            return 0;
        }
        return ((AMQP.Channel.Close) sse.getReason()).getReplyCode();
    }

    private static RuntimeException topologyFailure(String message, Exception e) {
        ShutdownSignalException sse = shutdownCause(e);
        if (e instanceof AlreadyClosedException || sse == null || sse.isHardError()) {
            return new TransportException(message, e);
        }
        return new TopologyException(message, channelReplyCode(e), e);
    }
}
