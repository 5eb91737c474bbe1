package com.intteq.queue.client;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only metadata of the delivery a handler is currently processing.
 *
 * <p>Usage:
 * <pre>
 * {@code
 * public void handle(OrderCreated payload, MessageContext ctx) {
 *     log.info("order {} from {} (attempt {})", payload.id(), ctx.routingKey(), ctx.retryCount() + 1);
 * }
 * }
 * </pre>
 *
 * <p>Notes:
 * <ul>
 *     <li>Instances are immutable and thread-safe.</li>
 *     <li>Acknowledgement is owned by the consumption pipeline; handlers signal failure by
 *     throwing (or by completing their future exceptionally).</li>
 *     <li>{@link #retryCount()} is informational. Business logic must not depend on it.</li>
 * </ul>
 */
@Getter
@Accessors(fluent = true)
@ToString(exclude = "headers")
public class MessageContext {

    private final String queue;
    private final String exchange;
    private final String routingKey;
    private final long deliveryTag;
    private final boolean redelivered;
    private final String messageId;
    private final int retryCount;
    private final Map<String, Object> headers;

    @Builder
    private MessageContext(String queue,
                           String exchange,
                           String routingKey,
                           long deliveryTag,
                           boolean redelivered,
                           String messageId,
                           int retryCount,
                           Map<String, Object> headers) {
        this.queue = queue;
        this.exchange = exchange;
        this.routingKey = routingKey;
        this.deliveryTag = deliveryTag;
        this.redelivered = redelivered;
        this.messageId = messageId;
        this.retryCount = retryCount;
        this.headers = headers == null ? Map.of() : Collections.unmodifiableMap(headers);
    }

    public Optional<Object> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }
}
