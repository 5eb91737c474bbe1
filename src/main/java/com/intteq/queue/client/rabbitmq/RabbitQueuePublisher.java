package com.intteq.queue.client.rabbitmq;

import com.intteq.queue.client.MessageSerializer;
import com.intteq.queue.client.QueueClientProperties.PublisherSettings;
import com.intteq.queue.client.QueuePublisher;
import com.intteq.queue.client.exception.PublishConfirmationException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.AmqpIOException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.lang.Nullable;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link QueuePublisher} on top of {@link RabbitTemplate} with correlated publisher confirms.
 *
 * <p>Every message is persistent and carries a fresh message id unless it is a copy of a
 * consumed message. The calling thread blocks until
 * the broker confirms (or the confirm timeout elapses). Connection-level send failures are
 * retried up to {@code max-attempts} with a fixed backoff; a nack or a missing confirm is not
 * retried, because the broker may already hold the message.
 */
@Slf4j
public class RabbitQueuePublisher implements QueuePublisher {

    static final String TEXT_CONTENT_TYPE = "text/plain";
    static final String DELAY_QUEUE_INFIX = ".delayed.";

    /** Delay queues outlive their last declaration by TTL plus this much before the broker expires them. */
    static final long DELAY_QUEUE_EXPIRY_GRACE_MS = 60_000L;

    private final RabbitTemplate template;
    private final AmqpAdmin admin;
    private final MessageSerializer serializer;
    private final PublisherSettings settings;

    /** Optional Micrometer registry (null-safe). */
    @Nullable
    private final MeterRegistry meterRegistry;

    public RabbitQueuePublisher(RabbitTemplate template,
                                AmqpAdmin admin,
                                MessageSerializer serializer,
                                PublisherSettings settings,
                                @Nullable MeterRegistry meterRegistry) {
        this.template = template;
        this.admin = admin;
        this.serializer = serializer;
        this.settings = settings;
        this.meterRegistry = meterRegistry;
    }

    // =====================================================================
    // PUBLISHING
    // =====================================================================

    @Override
    public void publish(Object payload, String exchange, String routingKey, Map<String, Object> headers) {
        send(serializer.serialize(payload), serializer.contentType(), null, exchange, routingKey, headers);
    }

    @Override
    public void publishString(String text, String exchange, String routingKey, Map<String, Object> headers) {
        send(text.getBytes(StandardCharsets.UTF_8), TEXT_CONTENT_TYPE, null, exchange, routingKey, headers);
    }

    @Override
    public void publishBytes(byte[] body, String exchange, String routingKey, Map<String, Object> headers) {
        send(body, serializer.contentType(), null, exchange, routingKey, headers);
    }

    @Override
    public void publishCopy(byte[] body, String exchange, String routingKey, Map<String, Object> headers,
                            @Nullable String contentType, @Nullable String messageId) {
        send(body, contentType != null ? contentType : serializer.contentType(), messageId,
                exchange, routingKey, headers);
    }

    @Override
    public void publishDelayed(Object payload, String exchange, String routingKey, Duration delay) {
        long delayMs = delay.toMillis();
        if (delayMs <= 0) {
            publish(payload, exchange, routingKey);
            return;
        }

        if (delayMs + DELAY_QUEUE_EXPIRY_GRACE_MS > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Delay " + delay + " exceeds the maximum of "
                    + Duration.ofMillis(Integer.MAX_VALUE - DELAY_QUEUE_EXPIRY_GRACE_MS));
        }

        String delayQueue = delayQueueName(exchange, routingKey, delayMs);
        declareDelayQueue(delayQueue, exchange, routingKey, (int) delayMs);

        // the default exchange routes straight to the queue of the same name
        send(serializer.serialize(payload), serializer.contentType(), null, "", delayQueue, Map.of());
        log.debug("Delayed publish → exchange={} routingKey={} delay={}ms via {}",
                exchange, routingKey, delayMs, delayQueue);
    }

    static String delayQueueName(String exchange, String routingKey, long delayMs) {
        return exchange + "." + routingKey + DELAY_QUEUE_INFIX + delayMs;
    }

    /**
     * Declared on every delayed publish: publishing alone does not reset {@code x-expires}, only a
     * redeclare does. The declaration is idempotent.
     */
    private void declareDelayQueue(String name, String exchange, String routingKey, int delayMs) {
        try {
            admin.declareQueue(QueueBuilder.durable(name)
                    .ttl(delayMs)
                    .deadLetterExchange(exchange)
                    .deadLetterRoutingKey(routingKey)
                    .expires(delayMs + (int) DELAY_QUEUE_EXPIRY_GRACE_MS)
                    .build());
        } catch (AmqpException e) {
            throw new PublishConfirmationException("Failed to declare delay queue " + name, e);
        }
        log.debug("Declared delay queue: {} → exchange={} routingKey={}", name, exchange, routingKey);
    }

    // =====================================================================
    // SEND + CONFIRM
    // =====================================================================

    private void send(byte[] body, String contentType, @Nullable String messageId,
                      String exchange, String routingKey, Map<String, Object> headers) {
        MessageProperties props = new MessageProperties();
        props.setContentType(contentType);
        props.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
        props.setMessageId(messageId != null ? messageId : UUID.randomUUID().toString());
        if (headers != null) {
            headers.forEach(props::setHeader);
        }
        Message message = new Message(body, props);

        int maxAttempts = Math.max(1, settings.getMaxAttempts());
        int attempt = 1;

        while (true) {
            CorrelationData correlation = new CorrelationData(UUID.randomUUID().toString());
            try {
                template.send(exchange, routingKey, message, correlation);
            } catch (AmqpConnectException | AmqpIOException e) {
                if (attempt >= maxAttempts) {
                    recordPublish(exchange, "failure");
                    throw new PublishConfirmationException("Failed to publish to exchange=" + exchange
                            + " routingKey=" + routingKey + " after " + attempt + " attempt(s)", e);
                }
                log.warn("Publish attempt {}/{} failed → exchange={} routingKey={}: {}",
                        attempt, maxAttempts, exchange, routingKey, e.getMessage());
                attempt++;
                sleep(settings.getRetryBackoff());
                continue;
            } catch (AmqpException e) {
                recordPublish(exchange, "failure");
                throw new PublishConfirmationException("Failed to publish to exchange=" + exchange
                        + " routingKey=" + routingKey, e);
            }

            awaitConfirm(correlation, exchange, routingKey);
            recordPublish(exchange, "success");
            log.debug("Published → exchange={} routingKey={} messageId={}", exchange, routingKey, props.getMessageId());
            return;
        }
    }

    private void awaitConfirm(CorrelationData correlation, String exchange, String routingKey) {
        Duration timeout = settings.getConfirmTimeout();
        try {
            CorrelationData.Confirm confirm = correlation.getFuture().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!confirm.isAck()) {
                recordPublish(exchange, "nack");
                throw new PublishConfirmationException("Broker nacked message for exchange=" + exchange
                        + " routingKey=" + routingKey + ": " + confirm.getReason());
            }
        } catch (TimeoutException e) {
            recordPublish(exchange, "timeout");
            throw new PublishConfirmationException("No publisher confirm within " + timeout
                    + " for exchange=" + exchange + " routingKey=" + routingKey, e);
        } catch (ExecutionException e) {
            recordPublish(exchange, "failure");
            throw new PublishConfirmationException("Publisher confirm failed for exchange=" + exchange
                    + " routingKey=" + routingKey, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishConfirmationException("Interrupted while awaiting publisher confirm", e);
        }
    }

    private static void sleep(Duration backoff) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishConfirmationException("Interrupted during publish retry backoff", e);
        }
    }

    // =====================================================================
    // METRICS
    // =====================================================================

    private void recordPublish(String exchange, String result) {
        if (meterRegistry == null) return;

        meterRegistry.counter(
                        "queue.client.publish",
                        "exchange", exchange.isEmpty() ? "(default)" : exchange,
                        "result", result
                )
                .increment();
    }
}
