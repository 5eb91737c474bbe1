package com.intteq.queue.client.internal;

import com.intteq.queue.client.MessageContext;
import com.intteq.queue.client.QueuePublisher;
import com.intteq.queue.client.annotation.MessageHandlerBinding;
import com.intteq.queue.client.handler.HandlerDescriptor;
import com.intteq.queue.client.handler.HandlerKind;
import com.intteq.queue.client.handler.MessageHandler;
import com.intteq.queue.client.handler.MessageHandlerRegistry;
import com.intteq.queue.client.handler.NonCyclicMessageHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("MessageHandlerRegistrar - annotation driven handler discovery")
class MessageHandlerRegistrarTest {

    static final AtomicInteger ORDER_HANDLERS_CREATED = new AtomicInteger();

    public static class OrderCreated {
        public String id;
    }

    @MessageHandlerBinding(routingKeys = {"orders.created", "orders.*.v2"})
    static class OrderHandler implements MessageHandler<OrderCreated> {
        OrderHandler() {
            ORDER_HANDLERS_CREATED.incrementAndGet();
        }

        @Override
        public void handle(OrderCreated message, MessageContext context) {
        }
    }

    @MessageHandlerBinding(routingKeys = "orders.created", order = -1, description = "audit trail")
    static class AuditHandler implements NonCyclicMessageHandler<String> {
        @Override
        public void handle(String message, MessageContext context, QueuePublisher publisher) {
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class HandlerConfig {

        @Bean
        MessageHandlerRegistry messageHandlerRegistry() {
            return new MessageHandlerRegistry();
        }

        @Bean
        MessageHandlerRegistrar messageHandlerRegistrar(ListableBeanFactory beanFactory,
                                                        MessageHandlerRegistry registry) {
            return new MessageHandlerRegistrar(beanFactory, registry);
        }

        @Bean
        @Scope("prototype")
        OrderHandler orderHandler() {
            return new OrderHandler();
        }

        @Bean
        AuditHandler auditHandler() {
            return new AuditHandler();
        }
    }

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(HandlerConfig.class);

    @BeforeEach
    void setUp() {
        ORDER_HANDLERS_CREATED.set(0);
    }

    @Test
    @DisplayName("registers beans for every routing key, ordered by their binding order")
    void testRegistration() {
        runner.run(context -> {
            MessageHandlerRegistry registry = context.getBean(MessageHandlerRegistry.class);

            List<HandlerDescriptor> created = registry.resolve("orders.created");
            assertEquals(List.of("auditHandler", "orderHandler"),
                    created.stream().map(HandlerDescriptor::name).toList());
            assertEquals(HandlerKind.NON_CYCLIC, created.get(0).kind());
            assertEquals(String.class, created.get(0).payloadType());
            assertEquals(HandlerKind.SYNC, created.get(1).kind());
            assertEquals(OrderCreated.class, created.get(1).payloadType());

            assertEquals(1, registry.resolve("orders.shipped.v2").size());
        });
    }

    @Test
    @DisplayName("prototype handlers are created per delivery, not at startup")
    void testPrototypePerDelivery() {
        runner.run(context -> {
            assertEquals(0, ORDER_HANDLERS_CREATED.get());

            HandlerDescriptor descriptor = context.getBean(MessageHandlerRegistry.class)
                    .resolve("orders.created").get(1);
            MessageContext messageContext = MessageContext.builder().routingKey("orders.created").build();
            QueuePublisher publisher = mock(QueuePublisher.class);

            descriptor.invoke(new OrderCreated(), messageContext, publisher).join();
            descriptor.invoke(new OrderCreated(), messageContext, publisher).join();

            assertEquals(2, ORDER_HANDLERS_CREATED.get());
        });
    }
}
