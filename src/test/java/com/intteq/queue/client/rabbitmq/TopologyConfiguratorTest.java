package com.intteq.queue.client.rabbitmq;

import com.intteq.queue.client.QueueClientProperties;
import com.intteq.queue.client.QueueClientProperties.ExchangeOptions;
import com.intteq.queue.client.QueueClientProperties.QueueOptions;
import com.intteq.queue.client.exception.TopologyDeclarationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.amqp.AmqpIOException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.Queue;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("TopologyConfigurator - exchange, queue and binding declaration")
class TopologyConfiguratorTest {

    private AmqpAdmin admin;
    private QueueClientProperties properties;
    private TopologyConfigurator configurator;

    @BeforeEach
    void setUp() {
        admin = mock(AmqpAdmin.class);
        properties = new QueueClientProperties();
        configurator = new TopologyConfigurator(admin, properties);
    }

    private static ExchangeOptions exchange(String name, String type) {
        ExchangeOptions options = new ExchangeOptions();
        options.setName(name);
        options.setType(type);
        return options;
    }

    private static QueueOptions queue(String name, String... keys) {
        QueueOptions options = new QueueOptions();
        options.setName(name);
        options.setRoutingKeys(new LinkedHashSet<>(List.of(keys)));
        return options;
    }

    @Test
    @DisplayName("declare - exchange, queue, one binding per key and DLX + DLQ")
    void testDeclare() {
        // Given
        ExchangeOptions options = exchange("exchange.name", "direct");
        options.setDeadLetterExchange("exchange.dlx");
        options.getQueues().add(queue("test.queue", "first.routing.key", "second.routing.key"));
        properties.getExchanges().add(options);

        // When
        configurator.declare();

        // Then
        ArgumentCaptor<Exchange> exchanges = ArgumentCaptor.forClass(Exchange.class);
        verify(admin, times(2)).declareExchange(exchanges.capture());
        assertEquals("exchange.name", exchanges.getAllValues().get(0).getName());
        assertEquals("direct", exchanges.getAllValues().get(0).getType());
        assertEquals("exchange.dlx", exchanges.getAllValues().get(1).getName());
        assertEquals("fanout", exchanges.getAllValues().get(1).getType());

        ArgumentCaptor<Queue> queues = ArgumentCaptor.forClass(Queue.class);
        verify(admin, times(2)).declareQueue(queues.capture());
        Queue main = queues.getAllValues().get(0);
        assertEquals("test.queue", main.getName());
        assertTrue(main.isDurable());
        assertFalse(main.getArguments().containsKey("x-dead-letter-exchange"));
        assertEquals("exchange.dlx.queue", queues.getAllValues().get(1).getName());

        ArgumentCaptor<Binding> bindings = ArgumentCaptor.forClass(Binding.class);
        verify(admin, times(3)).declareBinding(bindings.capture());
        assertEquals(List.of("first.routing.key", "second.routing.key", "#"),
                bindings.getAllValues().stream().map(Binding::getRoutingKey).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("declare - consumed queues never dead-letter natively, so a reject cannot reach the DLQ")
    void testConsumedQueueHasNoDeadLetterArgument() {
        // Given
        ExchangeOptions options = exchange("orders", "topic");
        options.setDeadLetterExchange("orders.dlx");
        QueueOptions queue = queue("orders.q", "order.*");
        queue.getArguments().put("x-max-length", 1000);
        options.getQueues().add(queue);

        // When
        Declarables declarables = configurator.build(options);

        // Then
        Queue consumed = declarables.getDeclarablesByType(Queue.class).stream()
                .filter(q -> q.getName().equals("orders.q"))
                .findFirst()
                .orElseThrow();
        assertEquals(1000, consumed.getArguments().get("x-max-length"));
        assertFalse(consumed.getArguments().containsKey("x-dead-letter-exchange"));
        assertFalse(consumed.getArguments().containsKey("x-dead-letter-routing-key"));
    }

    @Test
    @DisplayName("declare - running twice declares the same set again, never a duplicate binding")
    void testIdempotent() {
        // Given
        ExchangeOptions options = exchange("exchange.name", "topic");
        options.getQueues().add(queue("q", "a.*", "a.*", "b.#"));
        properties.getExchanges().add(options);

        // When
        List<Declarable> first = configurator.declare();
        List<Declarable> second = configurator.declare();

        // Then
        assertEquals(first.size(), second.size());
        verify(admin, times(4)).declareBinding(any(Binding.class));
    }

    @Test
    @DisplayName("declare - a dead-letter exchange shared by two exchanges is declared once per run")
    void testSharedDeadLetterExchange() {
        // Given
        ExchangeOptions orders = exchange("orders", "direct");
        orders.setDeadLetterExchange("shared.dlx");
        orders.getQueues().add(queue("orders.q", "k"));
        ExchangeOptions payments = exchange("payments", "direct");
        payments.setDeadLetterExchange("shared.dlx");
        payments.getQueues().add(queue("payments.q", "k"));
        properties.getExchanges().add(orders);
        properties.getExchanges().add(payments);

        // When
        configurator.declare();

        // Then
        verify(admin, times(3)).declareExchange(any(Exchange.class));
        verify(admin, times(3)).declareQueue(any(Queue.class));
    }

    @Test
    @DisplayName("declare - fanout queues without routing keys are bound with an empty key")
    void testFanoutWithoutKeys() {
        // Given
        ExchangeOptions options = exchange("broadcast", "fanout");
        options.getQueues().add(queue("listener.q"));
        properties.getExchanges().add(options);

        // When
        configurator.declare();

        // Then
        ArgumentCaptor<Binding> binding = ArgumentCaptor.forClass(Binding.class);
        verify(admin).declareBinding(binding.capture());
        assertEquals("", binding.getValue().getRoutingKey());
    }

    @Test
    @DisplayName("declare - non-fanout queue without routing keys is rejected before touching the broker")
    void testMissingRoutingKeys() {
        // Given
        ExchangeOptions options = exchange("exchange.name", "direct");
        options.getQueues().add(queue("q"));
        properties.getExchanges().add(options);

        // When / Then
        assertThrows(TopologyDeclarationException.class, configurator::declare);
        verifyNoInteractions(admin);
    }

    @Test
    @DisplayName("declare - exchange cannot dead-letter into itself")
    void testSelfDeadLetter() {
        ExchangeOptions options = exchange("loop", "direct");
        options.setDeadLetterExchange("loop");
        properties.getExchanges().add(options);

        assertThrows(TopologyDeclarationException.class, configurator::declare);
    }

    @Test
    @DisplayName("declare - broker refusal surfaces as TopologyDeclarationException")
    void testBrokerRefusal() {
        // Given
        ExchangeOptions options = exchange("exchange.name", "direct");
        options.getQueues().add(queue("q", "k"));
        properties.getExchanges().add(options);
        doThrow(new AmqpIOException(new IOException("PRECONDITION_FAILED")))
                .when(admin).declareQueue(any(Queue.class));

        // When
        TopologyDeclarationException ex = assertThrows(TopologyDeclarationException.class, configurator::declare);

        // Then
        assertTrue(ex.getMessage().contains("queue:q"));
        assertInstanceOf(AmqpIOException.class, ex.getCause());
    }
}
