package com.intteq.queue.client.internal;

import com.intteq.queue.client.QueueClientProperties.ConsumerSettings;
import com.intteq.queue.client.QueueClientProperties.ExchangeOptions;
import com.intteq.queue.client.exception.ConnectionException;
import com.rabbitmq.client.Channel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;

import java.util.concurrent.CompletableFuture;

/**
 * Consumes one queue through a {@link SimpleMessageListenerContainer} configured for MANUAL
 * acknowledgment.
 *
 * <p>The container owns the channels, prefetch, concurrency and re-subscription after a lost
 * channel or connection. Each delivery is handed to the {@link ConsumptionPipeline} on the
 * container thread; settlement may complete later on the requeue scheduler, so unsettled
 * deliveries are counted here.
 *
 * <p>{@link #stop()} stops accepting deliveries, waits for in-flight ones (including pending
 * requeues) to be settled, then stops the container. Deliveries that arrive meanwhile are left
 * unacknowledged and return to the queue when the container closes its channels.
 */
@Slf4j
public class QueueConsumer {

    @Getter
    private final String queueName;
    private final ExchangeOptions exchange;
    private final ConnectionFactory connectionFactory;
    private final ConsumptionPipeline pipeline;
    private final ConsumerSettings settings;

    private volatile InFlightDeliveries inFlight = new InFlightDeliveries();

    private SimpleMessageListenerContainer container;

    public QueueConsumer(String queueName,
                         ExchangeOptions exchange,
                         ConnectionFactory connectionFactory,
                         ConsumptionPipeline pipeline,
                         ConsumerSettings settings) {
        this.queueName = queueName;
        this.exchange = exchange;
        this.connectionFactory = connectionFactory;
        this.pipeline = pipeline;
        this.settings = settings;
    }

    // =====================================================================
    // LIFECYCLE
    // =====================================================================

    /**
     * Creates and starts the listener container for this queue.
     *
     * @throws ConnectionException if the container cannot be started
     */
    public synchronized void start() {
        if (container != null) {
            return;
        }
        inFlight = new InFlightDeliveries();
        SimpleMessageListenerContainer created = createContainer();
        try {
            created.afterPropertiesSet();
            created.start();
        } catch (AmqpException e) {
            created.stop();
            throw new ConnectionException("Failed to start consumer for queue=" + queueName, e);
        }
        container = created;

        log.info("RabbitMQ listener started → queue={} exchange={} prefetch={} concurrency={}",
                queueName, exchange.getName(), settings.getPrefetchCount(), settings.getConcurrency());
    }

    SimpleMessageListenerContainer createContainer() {
        SimpleMessageListenerContainer listenerContainer = new SimpleMessageListenerContainer(connectionFactory);

        listenerContainer.setQueueNames(queueName);
        listenerContainer.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        listenerContainer.setPrefetchCount(settings.getPrefetchCount());
        listenerContainer.setConcurrentConsumers(settings.getConcurrency());
        listenerContainer.setMissingQueuesFatal(false);
        listenerContainer.setRecoveryInterval(settings.getRecoveryInterval().toMillis());
        listenerContainer.setShutdownTimeout(settings.getShutdownTimeout().toMillis());
        listenerContainer.setAutoStartup(false);
        listenerContainer.setBeanName("queue-client-" + queueName);
        listenerContainer.setMessageListener((ChannelAwareMessageListener) this::onMessage);

        return listenerContainer;
    }

    /**
     * Stops accepting deliveries, lets in-flight ones finish, then stops the container.
     */
    public synchronized void stop() {
        if (container == null) {
            return;
        }
        InFlightDeliveries draining = inFlight;
        draining.close();

        try {
            if (!draining.awaitEmpty(settings.getShutdownTimeout())) {
                log.warn("Shutdown timeout → queue={} still has {} unsettled deliveries",
                        queueName, draining.count());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for in-flight deliveries → queue={}", queueName);
        }

        try {
            container.stop();
        } finally {
            container = null;
        }
        log.info("Stopped RabbitMQ listener → queue={}", queueName);
    }

    public synchronized boolean isRunning() {
        return container != null && container.isRunning();
    }

    int inFlightCount() {
        return inFlight.count();
    }

    // =====================================================================
    // DELIVERY
    // =====================================================================

    void onMessage(Message message, Channel channel) {
        long tag = message.getMessageProperties().getDeliveryTag();
        InFlightDeliveries tracker = inFlight;

        if (!tracker.tryAcquire()) {
            log.debug("Consumer stopping → leaving tag={} unacknowledged (queue={})", tag, queueName);
            return;
        }

        boolean handedOff = false;
        try {
            CompletableFuture<DeliveryOutcome> outcome =
                    pipeline.process(InboundDelivery.of(queueName, message), exchange, new ChannelAcknowledger(channel));

            outcome.whenComplete((result, error) -> {
                tracker.release();
                if (error != null) {
                    log.error("Delivery tag={} could not be settled (queue={})", tag, queueName, error);
                } else {
                    log.debug("Delivery tag={} → {} (queue={})", tag, result, queueName);
                }
            });
            handedOff = true;
        } catch (RuntimeException e) {
            log.error("Pipeline failed for tag={} (queue={}) → leaving it unacknowledged", tag, queueName, e);
        } finally {
            if (!handedOff) {
                tracker.release();
            }
        }
    }
}
