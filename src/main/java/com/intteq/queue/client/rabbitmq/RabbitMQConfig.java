package com.intteq.queue.client.rabbitmq;

import com.intteq.queue.client.exception.ConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory.CacheMode;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.connection.RabbitConnectionFactoryBean;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.amqp.RabbitProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.PropertyMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;


/**
 * RabbitMQ connectivity for the queue client.
 *
 * <p>Connection parameters come from the standard {@code spring.rabbitmq.*} properties.
 * Publisher confirms are always enabled (correlated) and unroutable messages are returned,
 * since the publisher relies on both.
 *
 * <p>Every bean backs off when the application defines its own.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class RabbitMQConfig {

    private final RabbitProperties rabbitProps;

    public RabbitMQConfig(RabbitProperties rabbitProps) {
        this.rabbitProps = rabbitProps;
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionFactory.class)
    public CachingConnectionFactory queueClientConnectionFactory() {
        CachingConnectionFactory factory = new CachingConnectionFactory(rabbitConnectionFactory());

        factory.setHost(rabbitProps.determineHost());
        factory.setPort(rabbitProps.determinePort());
        factory.setUsername(rabbitProps.determineUsername());
        factory.setPassword(rabbitProps.determinePassword());
        factory.setVirtualHost(rabbitProps.determineVirtualHost());

        var timeout = rabbitProps.getConnectionTimeout();
        factory.setConnectionTimeout(timeout != null ? (int) timeout.toMillis() : 10000);

        var heartbeat = rabbitProps.getRequestedHeartbeat();
        factory.setRequestedHeartBeat(heartbeat != null ? (int) heartbeat.getSeconds() : 60);

        factory.setCacheMode(CacheMode.CHANNEL);
        factory.setChannelCacheSize(50);
        factory.setChannelCheckoutTimeout(10_000);

        // Publisher confirms
        factory.setPublisherConfirmType(CachingConnectionFactory.ConfirmType.CORRELATED);
        factory.setPublisherReturns(true);

        log.info("RabbitMQ ConnectionFactory initialized: host={} port={} vhost={}",
                factory.getHost(), factory.getPort(), factory.getVirtualHost());

        return factory;
    }

    /**
     * Client connection factory with TLS from {@code spring.rabbitmq.ssl.*}: key store, trust
     * store, their types and passwords, protocol and server certificate validation.
     * Client-side automatic recovery stays off; listener containers re-subscribe themselves.
     */
    private com.rabbitmq.client.ConnectionFactory rabbitConnectionFactory() {
        RabbitConnectionFactoryBean bean = new RabbitConnectionFactoryBean();
        bean.setAutomaticRecoveryEnabled(false);

        RabbitProperties.Ssl ssl = rabbitProps.getSsl();
        if (Boolean.TRUE.equals(ssl.getEnabled())) {
            PropertyMapper map = PropertyMapper.get().alwaysApplyingWhenNonNull();
            bean.setUseSSL(true);
            map.from(ssl::getAlgorithm).to(bean::setSslAlgorithm);
            map.from(ssl::getKeyStore).to(bean::setKeyStore);
            map.from(ssl::getKeyStoreType).to(bean::setKeyStoreType);
            map.from(ssl::getKeyStorePassword).to(bean::setKeyStorePassphrase);
            map.from(ssl::getTrustStore).to(bean::setTrustStore);
            map.from(ssl::getTrustStoreType).to(bean::setTrustStoreType);
            map.from(ssl::getTrustStorePassword).to(bean::setTrustStorePassphrase);
            bean.setSkipServerCertificateValidation(!ssl.isValidateServerCertificate());
            log.info("RabbitMQ SSL enabled by application properties (keyStore={}, trustStore={})",
                    ssl.getKeyStore(), ssl.getTrustStore());
        }

        try {
            bean.afterPropertiesSet();
            return bean.getObject();
        } catch (Exception e) {
            throw new ConnectionException("Failed to create the RabbitMQ client connection factory", e);
        }
    }

    @Bean
    @ConditionalOnMissingBean(RabbitTemplate.class)
    public RabbitTemplate queueClientRabbitTemplate(ConnectionFactory connectionFactory) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMandatory(true);

        template.setConfirmCallback((CorrelationData cd, boolean ack, String cause) -> {
            if (ack) {
                log.debug("Publish confirmed: correlationId={}", cd != null ? cd.getId() : null);
            } else {
                log.error("Publish nacked: correlationId={} cause={}",
                        cd != null ? cd.getId() : null, cause);
            }
        });

        // Unroutable messages are not an error for the publisher; log and move on.
        template.setReturnsCallback(returned ->
                log.warn("Returned message: exchange={} routingKey={} replyCode={} replyText={}",
                        returned.getExchange(),
                        returned.getRoutingKey(),
                        returned.getReplyCode(),
                        returned.getReplyText())
        );

        return template;
    }

    @Bean
    @ConditionalOnMissingBean(AmqpAdmin.class)
    public RabbitAdmin queueClientAmqpAdmin(ConnectionFactory connectionFactory) {
        return new RabbitAdmin(connectionFactory);
    }
}
