package com.intteq.queue.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.queue.client.handler.MessageHandlerRegistry;
import com.intteq.queue.client.internal.ConsumptionPipeline;
import com.intteq.queue.client.internal.JacksonMessageSerializer;
import com.intteq.queue.client.internal.MessageHandlerRegistrar;
import com.intteq.queue.client.internal.QueueConsumerManager;
import com.intteq.queue.client.internal.RetryPolicy;
import com.intteq.queue.client.rabbitmq.RabbitMQConfig;
import com.intteq.queue.client.rabbitmq.RabbitQueuePublisher;
import com.intteq.queue.client.rabbitmq.TopologyConfigurator;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.concurrent.ConcurrentTaskScheduler;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Auto-configuration for the queue client.
 *
 * <p>Enabled by default; disable with:
 *
 * <pre>
 *   queue-client.enabled = false
 * </pre>
 *
 * <p>The application's {@link ObjectMapper} and {@link MeterRegistry} are used when present.
 * Without a MeterRegistry metrics are simply not recorded.
 */
@AutoConfiguration(before = RabbitAutoConfiguration.class)
@EnableConfigurationProperties({QueueClientProperties.class, RabbitProperties.class})
@ConditionalOnProperty(prefix = "queue-client", name = "enabled", havingValue = "true", matchIfMissing = true)
@Import(RabbitMQConfig.class)
public class QueueClientAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public MessageSerializer queueClientMessageSerializer(ObjectProvider<ObjectMapper> objectMapper) {
        // If the application does not provide an ObjectMapper, create a default one internally.
        return new JacksonMessageSerializer(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy queueClientRetryPolicy() {
        return new RetryPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageHandlerRegistry messageHandlerRegistry() {
        return new MessageHandlerRegistry();
    }

    @Bean
    public MessageHandlerRegistrar messageHandlerRegistrar(ListableBeanFactory beanFactory,
                                                           MessageHandlerRegistry registry) {
        return new MessageHandlerRegistrar(beanFactory, registry);
    }

    @Bean
    @ConditionalOnMissingBean(QueuePublisher.class)
    public RabbitQueuePublisher queuePublisher(RabbitTemplate rabbitTemplate,
                                               AmqpAdmin amqpAdmin,
                                               MessageSerializer serializer,
                                               QueueClientProperties properties,
                                               ObjectProvider<MeterRegistry> meterRegistry) {
        return new RabbitQueuePublisher(rabbitTemplate, amqpAdmin, serializer,
                properties.getPublisher(), meterRegistry.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public TopologyConfigurator topologyConfigurator(AmqpAdmin amqpAdmin, QueueClientProperties properties) {
        return new TopologyConfigurator(amqpAdmin, properties);
    }

    /**
     * Runs delayed requeues so that no listener container thread sleeps through a requeue delay.
     *
     * <p>A plain executor rather than a lifecycle-managed scheduler: it must keep running
     * until the consumers have drained, and is only shut down when the context is destroyed.
     */
    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService queueClientRequeueExecutor(QueueClientProperties properties) {
        return Executors.newScheduledThreadPool(
                Math.max(2, properties.getConsumer().getConcurrency()),
                new CustomizableThreadFactory("queue-client-requeue-"));
    }

    @Bean
    public ConsumptionPipeline consumptionPipeline(MessageHandlerRegistry registry,
                                                   MessageSerializer serializer,
                                                   RetryPolicy retryPolicy,
                                                   QueuePublisher publisher,
                                                   ScheduledExecutorService queueClientRequeueExecutor,
                                                   QueueClientProperties properties,
                                                   ObjectProvider<MeterRegistry> meterRegistry) {
        return new ConsumptionPipeline(registry, serializer, retryPolicy, publisher,
                new ConcurrentTaskScheduler(queueClientRequeueExecutor), properties.getConsumer().getHandlerTimeout(),
                meterRegistry.getIfAvailable());
    }

    @Bean
    public QueueConsumerManager queueConsumerManager(QueueClientProperties properties,
                                                     TopologyConfigurator topologyConfigurator,
                                                     MessageHandlerRegistry registry,
                                                     ConsumptionPipeline pipeline,
                                                     ConnectionFactory connectionFactory) {
        return new QueueConsumerManager(properties, topologyConfigurator, registry, pipeline, connectionFactory);
    }
}
