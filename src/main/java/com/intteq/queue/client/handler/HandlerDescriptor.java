package com.intteq.queue.client.handler;

import com.intteq.queue.client.MessageContext;
import com.intteq.queue.client.QueuePublisher;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * A registered handler: its flavour, the payload type it consumes and the factory producing
 * the instance that handles a delivery.
 *
 * <p>The factory is called once per delivery, so a factory returning fresh objects gives
 * transient handlers.
 */
@Getter
@Accessors(fluent = true)
@ToString(exclude = "factory")
public final class HandlerDescriptor {

    private final String name;
    private final HandlerKind kind;
    private final Class<?> payloadType;
    private final Supplier<?> factory;

    private HandlerDescriptor(String name, HandlerKind kind, Class<?> payloadType, Supplier<?> factory) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.payloadType = Objects.requireNonNull(payloadType, "payloadType must not be null");
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    // -----------------------
    // Factory methods
    // -----------------------

    public static <T> HandlerDescriptor sync(String name, Class<T> payloadType,
                                             Supplier<? extends MessageHandler<T>> factory) {
        return new HandlerDescriptor(name, HandlerKind.SYNC, payloadType, factory);
    }

    public static <T> HandlerDescriptor async(String name, Class<T> payloadType,
                                              Supplier<? extends AsyncMessageHandler<T>> factory) {
        return new HandlerDescriptor(name, HandlerKind.ASYNC, payloadType, factory);
    }

    public static <T> HandlerDescriptor nonCyclic(String name, Class<T> payloadType,
                                                  Supplier<? extends NonCyclicMessageHandler<T>> factory) {
        return new HandlerDescriptor(name, HandlerKind.NON_CYCLIC, payloadType, factory);
    }

    public static <T> HandlerDescriptor asyncNonCyclic(String name, Class<T> payloadType,
                                                       Supplier<? extends AsyncNonCyclicMessageHandler<T>> factory) {
        return new HandlerDescriptor(name, HandlerKind.ASYNC_NON_CYCLIC, payloadType, factory);
    }

    /**
     * Descriptor for handler instances whose flavour is only known at runtime, such as
     * discovered beans. The kind is derived from the interface {@code handlerType} implements.
     */
    public static HandlerDescriptor forType(String name, Class<?> handlerType, Class<?> payloadType,
                                            Supplier<?> factory) {
        return new HandlerDescriptor(name, HandlerKind.of(handlerType), payloadType, factory);
    }

    public boolean nonCyclic() {
        return kind.isNonCyclic();
    }

    // -----------------------
    // Invocation
    // -----------------------

    /**
     * Creates a handler instance and invokes it.
     *
     * <p>Never throws: synchronous failures (errors such as {@link AssertionError} included), a
     * failing factory and a {@code null} stage from an async handler are all reported through the
     * returned future.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public CompletableFuture<Void> invoke(Object payload, MessageContext context, QueuePublisher publisher) {
        try {
            Object handler = factory.get();
            CompletionStage<Void> stage = switch (kind) {
                case SYNC -> {
                    ((MessageHandler) handler).handle(payload, context);
                    yield null;
                }
                case NON_CYCLIC -> {
                    ((NonCyclicMessageHandler) handler).handle(payload, context, publisher);
                    yield null;
                }
                case ASYNC -> ((AsyncMessageHandler) handler).handle(payload, context);
                case ASYNC_NON_CYCLIC -> ((AsyncNonCyclicMessageHandler) handler).handle(payload, context, publisher);
            };
            if (stage == null) {
                if (kind.isAsync()) {
                    return CompletableFuture.failedFuture(
                            new IllegalStateException("Async handler " + name + " returned null"));
                }
                return CompletableFuture.completedFuture(null);
            }
            return stage.toCompletableFuture();
        } catch (Throwable e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
