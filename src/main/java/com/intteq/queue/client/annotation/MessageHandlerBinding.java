package com.intteq.queue.client.annotation;

import java.lang.annotation.*;

/**
 * Binds a handler bean to one or more routing keys.
 *
 * <p>The annotated class must implement exactly one of the handler interfaces
 * ({@code MessageHandler}, {@code AsyncMessageHandler}, {@code NonCyclicMessageHandler},
 * {@code AsyncNonCyclicMessageHandler}); the payload type is taken from its generic
 * parameter.
 *
 * <p>Example:
 * <pre>
 * {@code
 * @Component
 * @Scope("prototype")
 * @MessageHandlerBinding(routingKeys = {"orders.created", "orders.*.v2"})
 * public class OrderCreatedHandler implements MessageHandler<OrderCreated> {
 *
 *     public void handle(OrderCreated payload, MessageContext ctx) {
 *         // business logic...
 *     }
 * }
 * }
 * </pre>
 *
 * <p>The bean is looked up once per delivery, so prototype-scoped beans give a fresh handler
 * instance for every message; singleton beans are shared.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface MessageHandlerBinding {

    /**
     * Routing keys or topic patterns ({@code *} one word, {@code #} zero or more words).
     * Must not be empty.
     */
    String[] routingKeys();

    /**
     * Order among the handlers of the same routing key; lower runs first. Handlers with the
     * same order run in bean definition order.
     */
    int order() default 0;

    /**
     * Optional human-readable description for logs.
     */
    String description() default "";
}
