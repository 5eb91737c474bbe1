package com.intteq.queue.client;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Configuration properties for the queue client.
 *
 * <p>Prefix: {@code queue-client.*}. Connection parameters (host, port, credentials,
 * virtual host) are read from the standard {@code spring.rabbitmq.*} properties.
 *
 * <p>Example:
 * <pre>
 * queue-client:
 *   consumer:
 *     prefetch-count: 10
 *   exchanges:
 *     - name: exchange.name
 *       type: direct
 *       dead-letter-exchange: exchange.dlx
 *       requeue-attempts: 4
 *       requeue-timeout-milliseconds: 50
 *       queues:
 *         - name: test.queue
 *           routing-keys: [first.routing.key, second.routing.key]
 * </pre>
 *
 * <p>These properties are validated at startup. Invalid configurations will cause
 * the application to fail fast.
 */
@Getter
@Setter
@Validated
@ToString
@ConfigurationProperties(prefix = "queue-client")
public class QueueClientProperties {

    /**
     * Master switch for the whole library.
     */
    private boolean enabled = true;

    @Valid
    private final ConsumerSettings consumer = new ConsumerSettings();

    @Valid
    private final PublisherSettings publisher = new PublisherSettings();

    /**
     * Exchange declarations, in declaration order.
     */
    @Valid
    private List<ExchangeOptions> exchanges = new ArrayList<>();

    public Optional<ExchangeOptions> findExchange(String name) {
        return exchanges.stream()
                .filter(e -> e.getName().equals(name))
                .findFirst();
    }

    // ========================================================================
    // Consumer
    // ========================================================================

    @Getter
    @Setter
    @ToString
    public static class ConsumerSettings {

        /** Start consumers together with the application context. */
        private boolean autoStartup = true;

        /** Unacknowledged deliveries a single queue consumer may hold. */
        @Min(value = 1, message = "queue-client.consumer.prefetch-count must be >= 1")
        private int prefetchCount = 10;

        /** Listener container consumers per queue. 1 keeps a queue's delivery order. */
        @Min(value = 1, message = "queue-client.consumer.concurrency must be >= 1")
        private int concurrency = 1;

        /** How long shutdown waits for in-flight deliveries to be settled. */
        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        /** Pause between attempts to re-subscribe after the consumer channel or connection is lost. */
        @NotNull
        private Duration recoveryInterval = Duration.ofSeconds(3);

        /** Upper bound for a single async handler; unset means wait indefinitely. */
        private Duration handlerTimeout;
    }

    // ========================================================================
    // Publisher
    // ========================================================================

    @Getter
    @Setter
    @ToString
    public static class PublisherSettings {

        /** How long a publish waits for the broker confirm. */
        @NotNull
        private Duration confirmTimeout = Duration.ofSeconds(5);

        /** Send attempts on transient connection failures. */
        @Min(value = 1, message = "queue-client.publisher.max-attempts must be >= 1")
        private int maxAttempts = 3;

        @NotNull
        private Duration retryBackoff = Duration.ofMillis(200);
    }

    // ========================================================================
    // Topology
    // ========================================================================

    @Getter
    @Setter
    @ToString
    public static class ExchangeOptions {

        @NotBlank(message = "exchange.name must not be blank")
        private String name;

        @NotBlank
        @Pattern(regexp = "direct|topic|fanout|headers",
                message = "exchange.type must be one of: direct, topic, fanout, headers")
        private String type = "direct";

        private boolean durable = true;

        private boolean autoDelete = false;

        /** {@code false} declares the exchange for publishing only; no consumers are started. */
        private boolean consumption = true;

        /** Exchange receiving messages that exhausted their requeue attempts. */
        private String deadLetterExchange;

        @Pattern(regexp = "fanout|topic",
                message = "exchange.deadLetterExchangeType must be one of: fanout, topic")
        private String deadLetterExchangeType = "fanout";

        /** Queue bound to the dead-letter exchange; defaults to {@code <deadLetterExchange>.queue}. */
        private String deadLetterQueue;

        @Min(value = 0, message = "exchange.requeueAttempts must be >= 0")
        private int requeueAttempts = 2;

        @Min(value = 0, message = "exchange.requeueTimeoutMilliseconds must be >= 0")
        private int requeueTimeoutMilliseconds = 200;

        private Map<String, Object> arguments = new HashMap<>();

        @Valid
        private List<QueueOptions> queues = new ArrayList<>();

        public boolean hasDeadLetterExchange() {
            return deadLetterExchange != null && !deadLetterExchange.isBlank();
        }

        public String getDeadLetterQueueOrDefault() {
            return deadLetterQueue != null && !deadLetterQueue.isBlank()
                    ? deadLetterQueue
                    : deadLetterExchange + ".queue";
        }

        public boolean isFanout() {
            return "fanout".equalsIgnoreCase(type);
        }
    }

    @Getter
    @Setter
    @ToString
    public static class QueueOptions {

        @NotBlank(message = "queue.name must not be blank")
        private String name;

        /** Binding keys; may only be empty on fanout exchanges. */
        private Set<String> routingKeys = new LinkedHashSet<>();

        private boolean durable = true;

        private boolean exclusive = false;

        private boolean autoDelete = false;

        private Map<String, Object> arguments = new HashMap<>();
    }
}
