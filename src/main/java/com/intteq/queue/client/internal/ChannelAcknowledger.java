package com.intteq.queue.client.internal;

import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Objects;

/**
 * Settles deliveries on the listener container channel they arrived on.
 *
 * <p>Used from the container thread and from the requeue scheduler; the client library
 * serializes frames written to a channel.
 */
@Slf4j
class ChannelAcknowledger implements DeliveryAcknowledger {

    private final Channel channel;

    ChannelAcknowledger(Channel channel) {
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
    }

    @Override
    public void ack(long deliveryTag) throws IOException {
        channel.basicAck(deliveryTag, false);
        log.debug("RabbitMQ ack successful (tag={})", deliveryTag);
    }

    @Override
    public void reject(long deliveryTag) throws IOException {
        channel.basicReject(deliveryTag, false);
        log.debug("RabbitMQ reject issued (tag={})", deliveryTag);
    }
}
