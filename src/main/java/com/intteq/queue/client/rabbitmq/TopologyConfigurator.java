package com.intteq.queue.client.rabbitmq;

import com.intteq.queue.client.QueueClientProperties;
import com.intteq.queue.client.QueueClientProperties.ExchangeOptions;
import com.intteq.queue.client.QueueClientProperties.QueueOptions;
import com.intteq.queue.client.exception.TopologyDeclarationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.*;
import org.springframework.amqp.core.Queue;

import java.util.*;

/**
 * Declares the configured exchanges, queues and bindings on the broker.
 *
 * <p>For every exchange:
 * <ul>
 *     <li>the exchange itself, with its type, durability and arguments</li>
 *     <li>each of its queues, without {@code x-dead-letter-exchange}: rejected deliveries are
 *     dropped by the broker and only the consumption pipeline copies to the dead-letter
 *     exchange</li>
 *     <li>one binding per (queue, routing key); fanout queues without keys are bound with
 *     {@code ""}</li>
 *     <li>the dead-letter exchange and its queue, bound with the catch-all key {@code #}</li>
 * </ul>
 *
 * <p>Declaring is idempotent: running it again against the same broker with the same
 * configuration changes nothing and never duplicates a binding.
 */
@Slf4j
@RequiredArgsConstructor
public class TopologyConfigurator {

    static final String DEAD_LETTER_BINDING_KEY = "#";

    private final AmqpAdmin admin;
    private final QueueClientProperties properties;

    /**
     * Declares the topology of every configured exchange.
     *
     * @return everything that was declared, in declaration order
     * @throws TopologyDeclarationException if the configuration is invalid or the broker
     *                                      refuses a declaration
     */
    public List<Declarable> declare() {
        Map<String, Declarable> unique = new LinkedHashMap<>();
        for (ExchangeOptions exchange : properties.getExchanges()) {
            for (Declarable declarable : build(exchange).getDeclarables()) {
                unique.putIfAbsent(identity(declarable), declarable);
            }
        }

        List<Declarable> declared = new ArrayList<>(unique.values());
        declared.forEach(this::declareOne);

        log.info("Topology declared → {} exchange(s), {} declarable(s)",
                properties.getExchanges().size(), declared.size());
        return declared;
    }

    // -------------------------------------------------------------------------
    // Building
    // -------------------------------------------------------------------------

    /**
     * Builds, without touching the broker, the declarables of one exchange.
     */
    public Declarables build(ExchangeOptions options) {
        validate(options);

        List<Declarable> declarables = new ArrayList<>();

        Exchange exchange = exchange(options.getName(), options.getType(), options.isDurable(),
                options.isAutoDelete(), options.getArguments());
        declarables.add(exchange);

        for (QueueOptions queueOptions : options.getQueues()) {
            Queue queue = queue(queueOptions);
            declarables.add(queue);

            Set<String> keys = queueOptions.getRoutingKeys().isEmpty()
                    ? Set.of("")
                    : queueOptions.getRoutingKeys();

            for (String key : keys) {
                declarables.add(new Binding(queue.getName(), Binding.DestinationType.QUEUE,
                        exchange.getName(), key, null));
                log.debug("Binding: queue={} exchange={} routingKey={}", queue.getName(), exchange.getName(), key);
            }
        }

        if (options.hasDeadLetterExchange()) {
            String dlxName = options.getDeadLetterExchange();
            String dlqName = options.getDeadLetterQueueOrDefault();

            declarables.add(exchange(dlxName, options.getDeadLetterExchangeType(), true, false, Map.of()));
            declarables.add(QueueBuilder.durable(dlqName).build());
            declarables.add(new Binding(dlqName, Binding.DestinationType.QUEUE,
                    dlxName, DEAD_LETTER_BINDING_KEY, null));

            log.debug("Dead-letter topology → exchange={} dlx={} dlq={}", options.getName(), dlxName, dlqName);
        }

        return new Declarables(declarables);
    }

    private static Exchange exchange(String name, String type, boolean durable, boolean autoDelete,
                                     Map<String, Object> arguments) {
        ExchangeBuilder builder = new ExchangeBuilder(name, type).durable(durable);
        if (autoDelete) {
            builder.autoDelete();
        }
        if (arguments != null && !arguments.isEmpty()) {
            builder.withArguments(arguments);
        }
        return builder.build();
    }

    private static Queue queue(QueueOptions queue) {
        QueueBuilder builder = queue.isDurable()
                ? QueueBuilder.durable(queue.getName())
                : QueueBuilder.nonDurable(queue.getName());

        if (queue.isExclusive()) {
            builder.exclusive();
        }
        if (queue.isAutoDelete()) {
            builder.autoDelete();
        }
        if (queue.getArguments() != null && !queue.getArguments().isEmpty()) {
            builder.withArguments(queue.getArguments());
        }
        return builder.build();
    }

    // -------------------------------------------------------------------------
    // Validation
    // -------------------------------------------------------------------------

    private static void validate(ExchangeOptions options) {
        if (options.getName() == null || options.getName().isBlank()) {
            throw new TopologyDeclarationException("Exchange name must not be blank");
        }
        if (options.getRequeueAttempts() < 0) {
            throw new TopologyDeclarationException(
                    "requeueAttempts must be >= 0 for exchange=" + options.getName());
        }
        if (options.getRequeueTimeoutMilliseconds() < 0) {
            throw new TopologyDeclarationException(
                    "requeueTimeoutMilliseconds must be >= 0 for exchange=" + options.getName());
        }
        if (options.hasDeadLetterExchange() && options.getDeadLetterExchange().equals(options.getName())) {
            throw new TopologyDeclarationException(
                    "Exchange " + options.getName() + " cannot be its own dead-letter exchange");
        }
        for (QueueOptions queue : options.getQueues()) {
            if (queue.getName() == null || queue.getName().isBlank()) {
                throw new TopologyDeclarationException(
                        "Queue name must not be blank (exchange=" + options.getName() + ")");
            }
            if (queue.getRoutingKeys().isEmpty() && !options.isFanout()) {
                throw new TopologyDeclarationException("Queue " + queue.getName()
                        + " has no routing keys; only fanout exchanges may omit them (exchange="
                        + options.getName() + ", type=" + options.getType() + ")");
            }
        }
    }

    // -------------------------------------------------------------------------
    // Declaring
    // -------------------------------------------------------------------------

    private void declareOne(Declarable declarable) {
        try {
            if (declarable instanceof Exchange) {
                Exchange exchange = (Exchange) declarable;
                admin.declareExchange(exchange);
                log.info("Declared exchange: name={} type={}", exchange.getName(), exchange.getType());
            } else if (declarable instanceof Queue) {
                Queue queue = (Queue) declarable;
                admin.declareQueue(queue);
                log.info("Declared queue: {}", queue.getName());
            } else if (declarable instanceof Binding) {
                Binding binding = (Binding) declarable;
                admin.declareBinding(binding);
                log.info("Binding created: queue={} exchange={} routingKey={}",
                        binding.getDestination(), binding.getExchange(), binding.getRoutingKey());
            }
        } catch (AmqpException e) {
            throw new TopologyDeclarationException("Failed to declare " + identity(declarable), e);
        }
    }

    private static String identity(Declarable declarable) {
        if (declarable instanceof Exchange) {
            return "exchange:" + ((Exchange) declarable).getName();
        }
        if (declarable instanceof Queue) {
            return "queue:" + ((Queue) declarable).getName();
        }
        if (declarable instanceof Binding) {
            Binding binding = (Binding) declarable;
            return "binding:" + binding.getExchange() + "→" + binding.getDestination() + ":" + binding.getRoutingKey();
        }
        return declarable.toString();
    }
}
