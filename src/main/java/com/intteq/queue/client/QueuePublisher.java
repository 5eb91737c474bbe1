package com.intteq.queue.client;

import com.intteq.queue.client.exception.PublishConfirmationException;
import com.intteq.queue.client.exception.SerializationException;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.Map;

/**
 * Publishes messages to an exchange.
 *
 * <p>Every publish waits for the broker confirm. A negative confirm, a missing confirm or a
 * send that still fails after the configured attempts raises
 * {@link PublishConfirmationException}.
 */
public interface QueuePublisher {

    /**
     * Serializes {@code payload} and publishes it.
     *
     * @throws SerializationException       if the payload cannot be serialized
     * @throws PublishConfirmationException if the broker does not confirm the message
     */
    default void publish(Object payload, String exchange, String routingKey) {
        publish(payload, exchange, routingKey, Map.of());
    }

    void publish(Object payload, String exchange, String routingKey, Map<String, Object> headers);

    /**
     * Publishes {@code text} as a UTF-8 body without structured serialization.
     */
    void publishString(String text, String exchange, String routingKey, Map<String, Object> headers);

    /**
     * Publishes a pre-serialized body unchanged.
     */
    void publishBytes(byte[] body, String exchange, String routingKey, Map<String, Object> headers);

    /**
     * Publishes a copy of a consumed message. The body, content type and message id are kept as
     * received; a {@code null} content type or message id falls back to the publisher's defaults.
     */
    void publishCopy(byte[] body, String exchange, String routingKey, Map<String, Object> headers,
                     @Nullable String contentType, @Nullable String messageId);

    /**
     * Publishes {@code payload} so that it reaches {@code exchange} only after {@code delay}.
     *
     * <p>The message waits in a broker-side delay queue whose TTL dead-letters it back to the
     * target exchange with the given routing key.
     *
     * @throws IllegalArgumentException if the delay does not fit the broker's 32-bit TTL
     */
    void publishDelayed(Object payload, String exchange, String routingKey, Duration delay);
}
