package com.intteq.queue.client.internal;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * A message received from a queue, as handed to the consumption pipeline.
 */
@Getter
@Builder
@ToString(exclude = {"body", "headers"})
public class InboundDelivery {

    private final String queue;
    private final String exchange;
    private final String routingKey;
    private final long deliveryTag;
    private final boolean redelivered;
    private final String messageId;
    private final String contentType;
    private final byte[] body;

    @Builder.Default
    private final Map<String, Object> headers = Map.of();

    public static InboundDelivery of(String queue, Message message) {
        MessageProperties properties = message.getMessageProperties();
        Map<String, Object> headers = properties.getHeaders() != null
                ? new HashMap<>(properties.getHeaders())
                : new HashMap<>();
        return InboundDelivery.builder()
                .queue(queue)
                .exchange(properties.getReceivedExchange())
                .routingKey(properties.getReceivedRoutingKey())
                .deliveryTag(properties.getDeliveryTag())
                .redelivered(Boolean.TRUE.equals(properties.getRedelivered()))
                .messageId(properties.getMessageId())
                .contentType(properties.getContentType())
                .body(message.getBody() != null ? message.getBody() : new byte[0])
                .headers(headers)
                .build();
    }
}
