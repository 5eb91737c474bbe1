package com.intteq.queue.client.internal;

import com.intteq.queue.client.QueueClientProperties;
import com.intteq.queue.client.QueueClientProperties.ExchangeOptions;
import com.intteq.queue.client.QueueClientProperties.QueueOptions;
import com.intteq.queue.client.exception.QueueClientException;
import com.intteq.queue.client.handler.MessageHandlerRegistry;
import com.intteq.queue.client.rabbitmq.TopologyConfigurator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.context.SmartLifecycle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the queue consumers and ties them to the application lifecycle.
 *
 * <p><b>Start:</b></p>
 * <ul>
 *     <li>Declares the configured topology</li>
 *     <li>Freezes the handler registry</li>
 *     <li>Starts one {@link QueueConsumer} per queue of every consumption exchange</li>
 * </ul>
 *
 * <p><b>Stop:</b> consumers are stopped in reverse start order, each draining its in-flight
 * deliveries first.</p>
 *
 * <p>Runs in a late phase so that the rest of the application is up before the first delivery
 * arrives, and goes down before it.</p>
 */
@Slf4j
public class QueueConsumerManager implements SmartLifecycle {

    static final int PHASE = Integer.MAX_VALUE - 1000;

    private final QueueClientProperties properties;
    private final TopologyConfigurator topology;
    private final MessageHandlerRegistry registry;
    private final ConsumptionPipeline pipeline;
    private final ConnectionFactory connectionFactory;

    /** Active consumers keyed by queue name. */
    private final Map<String, QueueConsumer> consumers = new LinkedHashMap<>();

    private volatile boolean running;

    public QueueConsumerManager(QueueClientProperties properties,
                                TopologyConfigurator topology,
                                MessageHandlerRegistry registry,
                                ConsumptionPipeline pipeline,
                                ConnectionFactory connectionFactory) {
        this.properties = properties;
        this.topology = topology;
        this.registry = registry;
        this.pipeline = pipeline;
        this.connectionFactory = connectionFactory;
    }

    // =====================================================================
    // START
    // =====================================================================

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        log.info("Starting queue consumers...");

        topology.declare();
        registry.freeze();

        if (registry.isEmpty()) {
            log.warn("No message handlers registered → every consumed message will be acknowledged and dropped");
        }

        try {
            for (ExchangeOptions exchange : properties.getExchanges()) {
                if (!exchange.isConsumption()) {
                    log.debug("Exchange {} is publish-only → no consumers", exchange.getName());
                    continue;
                }
                for (QueueOptions queue : exchange.getQueues()) {
                    startConsumer(exchange, queue);
                }
            }
        } catch (QueueClientException e) {
            stopConsumers();
            throw e;
        }

        running = true;
        log.info("Queue consumers started → {}", consumers.keySet());
    }

    private void startConsumer(ExchangeOptions exchange, QueueOptions queue) {
        if (consumers.containsKey(queue.getName())) {
            log.warn("Queue {} is already consumed; ignoring duplicate declaration on exchange {}",
                    queue.getName(), exchange.getName());
            return;
        }
        QueueConsumer consumer = createConsumer(queue.getName(), exchange);
        consumer.start();
        consumers.put(queue.getName(), consumer);
    }

    QueueConsumer createConsumer(String queueName, ExchangeOptions exchange) {
        return new QueueConsumer(queueName, exchange, connectionFactory, pipeline, properties.getConsumer());
    }

    // =====================================================================
    // STOP
    // =====================================================================

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("Stopping queue consumers...");
        stopConsumers();
        running = false;
    }

    private void stopConsumers() {
        List<QueueConsumer> ordered = new ArrayList<>(consumers.values());
        Collections.reverse(ordered);

        for (QueueConsumer consumer : ordered) {
            try {
                consumer.stop();
            } catch (RuntimeException e) {
                log.warn("Failed to stop consumer → queue={}", consumer.getQueueName(), e);
            }
        }
        consumers.clear();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getConsumer().isAutoStartup();
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    public synchronized List<String> consumedQueues() {
        return List.copyOf(consumers.keySet());
    }
}
