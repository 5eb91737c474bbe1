package com.intteq.queue.client.internal;

import com.intteq.queue.client.MessageContext;
import com.intteq.queue.client.MessageSerializer;
import com.intteq.queue.client.QueueClientProperties.ExchangeOptions;
import com.intteq.queue.client.QueuePublisher;
import com.intteq.queue.client.exception.ConnectionException;
import com.intteq.queue.client.exception.HandlerInvocationException;
import com.intteq.queue.client.exception.PublishConfirmationException;
import com.intteq.queue.client.exception.SerializationException;
import com.intteq.queue.client.handler.HandlerDescriptor;
import com.intteq.queue.client.handler.MessageHandlerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decides the fate of every delivery consumed from a queue.
 *
 * <p>Per delivery:
 * <ol>
 *     <li>Resolve the handlers of the routing key. None ⇒ acknowledge and drop.</li>
 *     <li>Deserialize the body once per payload type. A body that cannot be read fails the
 *     delivery without invoking any handler.</li>
 *     <li>Invoke the handlers in registration order. A failing cyclic-unsafe handler skips the
 *     remaining cyclic-unsafe handlers; non-cyclic handlers always run. Any failure fails the
 *     delivery.</li>
 *     <li>Success ⇒ ack.</li>
 *     <li>Failure ⇒ if the next retry count exceeds the exchange's requeue attempts, copy the
 *     message unchanged to the dead-letter exchange; otherwise, after the requeue delay,
 *     republish it to its exchange with the incremented retry count. Either way the original is
 *     then rejected without broker requeue.</li>
 * </ol>
 *
 * <p>A republish or dead-letter copy the broker does not confirm leaves the original
 * unacknowledged, so the broker redelivers it once the channel goes away.
 *
 * <p>The requeue delay runs on the {@link TaskScheduler}; no listener container thread is
 * held while waiting.
 */
@Slf4j
public class ConsumptionPipeline {

    private final MessageHandlerRegistry registry;
    private final MessageSerializer serializer;
    private final RetryPolicy retryPolicy;
    private final QueuePublisher publisher;
    private final TaskScheduler scheduler;

    @Nullable
    private final Duration handlerTimeout;

    /** Optional Micrometer registry (null-safe). */
    @Nullable
    private final MeterRegistry meterRegistry;

    public ConsumptionPipeline(MessageHandlerRegistry registry,
                               MessageSerializer serializer,
                               RetryPolicy retryPolicy,
                               QueuePublisher publisher,
                               TaskScheduler scheduler,
                               @Nullable Duration handlerTimeout,
                               @Nullable MeterRegistry meterRegistry) {
        this.registry = registry;
        this.serializer = serializer;
        this.retryPolicy = retryPolicy;
        this.publisher = publisher;
        this.scheduler = scheduler;
        this.handlerTimeout = handlerTimeout;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Processes one delivery.
     *
     * <p>The returned future completes with the outcome once the delivery has been settled
     * (or deliberately left unacknowledged). It completes exceptionally only when settling
     * itself failed, e.g. because the channel closed.
     */
    public CompletableFuture<DeliveryOutcome> process(InboundDelivery delivery,
                                                      ExchangeOptions exchange,
                                                      DeliveryAcknowledger acknowledger) {
        CompletableFuture<DeliveryOutcome> result = new CompletableFuture<>();
        int retryCount = retryPolicy.currentRetryCount(delivery.getHeaders());

        try (DeliveryMdc ignored = DeliveryMdc.open(delivery, retryCount)) {
            List<HandlerDescriptor> handlers = registry.resolve(delivery.getRoutingKey());

            if (handlers.isEmpty()) {
                log.debug("No handler for routingKey={} (queue={}) → acknowledging",
                        delivery.getRoutingKey(), delivery.getQueue());
                settle(delivery, acknowledger, DeliveryOutcome.ACKED, result);
                return track(delivery, result);
            }

            long start = System.nanoTime();
            Throwable failure = dispatch(delivery, handlers, retryCount);
            recordLatency(delivery.getQueue(), System.nanoTime() - start);

            if (failure == null) {
                log.debug("Delivery handled (tag={}, handlers={})", delivery.getDeliveryTag(), handlers.size());
                settle(delivery, acknowledger, DeliveryOutcome.ACKED, result);
            } else {
                onFailure(delivery, exchange, acknowledger, failure, result);
            }
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
        return track(delivery, result);
    }

    // =====================================================================
    // DISPATCH
    // =====================================================================

    /**
     * @return {@code null} on success, otherwise the failure of this delivery
     */
    private Throwable dispatch(InboundDelivery delivery, List<HandlerDescriptor> handlers, int retryCount) {
        Map<Class<?>, Object> payloads;
        try {
            payloads = deserialize(delivery, handlers);
        } catch (SerializationException e) {
            log.warn("Unreadable message body (routingKey={}, tag={})",
                    delivery.getRoutingKey(), delivery.getDeliveryTag(), e);
            return e;
        }

        MessageContext context = MessageContext.builder()
                .queue(delivery.getQueue())
                .exchange(delivery.getExchange())
                .routingKey(delivery.getRoutingKey())
                .deliveryTag(delivery.getDeliveryTag())
                .redelivered(delivery.isRedelivered())
                .messageId(delivery.getMessageId())
                .retryCount(retryCount)
                .headers(delivery.getHeaders())
                .build();

        List<Throwable> failures = new ArrayList<>();
        boolean cyclicChainHalted = false;

        for (HandlerDescriptor handler : handlers) {
            if (cyclicChainHalted && !handler.nonCyclic()) {
                log.debug("Skipping handler {} after an earlier cyclic-unsafe failure", handler.name());
                continue;
            }

            Throwable failure = await(handler, handler.invoke(payloads.get(handler.payloadType()), context, publisher));
            if (failure != null) {
                failures.add(failure);
                log.warn("Handler {} failed (routingKey={}, tag={})",
                        handler.name(), delivery.getRoutingKey(), delivery.getDeliveryTag(), failure);
                if (!handler.nonCyclic()) {
                    cyclicChainHalted = true;
                }
            }
        }

        return failures.isEmpty() ? null : HandlerInvocationException.aggregate(delivery.getRoutingKey(), failures);
    }

    private Map<Class<?>, Object> deserialize(InboundDelivery delivery, List<HandlerDescriptor> handlers) {
        Map<Class<?>, Object> payloads = new HashMap<>();
        for (HandlerDescriptor handler : handlers) {
            Class<?> type = handler.payloadType();
            if (!payloads.containsKey(type)) {
                payloads.put(type, serializer.deserialize(delivery.getBody(), type));
            }
        }
        return payloads;
    }

    private Throwable await(HandlerDescriptor handler, CompletableFuture<Void> invocation) {
        try {
            if (handlerTimeout != null) {
                invocation.get(handlerTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } else {
                invocation.get();
            }
            return null;
        } catch (ExecutionException e) {
            return e.getCause() != null ? e.getCause() : e;
        } catch (TimeoutException e) {
            invocation.cancel(true);
            return new HandlerInvocationException(
                    "Handler " + handler.name() + " did not complete within " + handlerTimeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return e;
        }
    }

    // =====================================================================
    // FAILURE: REQUEUE OR DEAD-LETTER
    // =====================================================================

    private void onFailure(InboundDelivery delivery,
                           ExchangeOptions exchange,
                           DeliveryAcknowledger acknowledger,
                           Throwable failure,
                           CompletableFuture<DeliveryOutcome> result) {

        int nextRetryCount = retryPolicy.nextRetryCount(delivery);

        if (retryPolicy.shouldDeadLetter(nextRetryCount, exchange.getRequeueAttempts())) {
            log.error("Delivery failed after {} attempt(s) → dead-lettering (routingKey={}, dlx={})",
                    nextRetryCount, delivery.getRoutingKey(), exchange.getDeadLetterExchange(), failure);
            deadLetter(delivery, exchange, acknowledger, result);
            return;
        }

        long delayMs = exchange.getRequeueTimeoutMilliseconds();
        log.warn("Delivery failed → requeue {}/{} in {}ms (routingKey={}): {}",
                nextRetryCount, exchange.getRequeueAttempts(), delayMs, delivery.getRoutingKey(), failure.toString());

        try {
            scheduler.schedule(
                    () -> requeue(delivery, nextRetryCount, acknowledger, result),
                    Instant.now().plusMillis(delayMs));
        } catch (TaskRejectedException e) {
            log.error("Requeue scheduler rejected delivery tag={} → leaving it unacknowledged",
                    delivery.getDeliveryTag(), e);
            result.complete(DeliveryOutcome.LEFT_UNACKED);
        }
    }

    private void requeue(InboundDelivery delivery,
                         int nextRetryCount,
                         DeliveryAcknowledger acknowledger,
                         CompletableFuture<DeliveryOutcome> result) {
        try (DeliveryMdc ignored = DeliveryMdc.open(delivery, nextRetryCount - 1)) {
            publisher.publishCopy(
                    delivery.getBody(),
                    delivery.getExchange(),
                    delivery.getRoutingKey(),
                    retryPolicy.withRetryCount(delivery.getHeaders(), nextRetryCount),
                    delivery.getContentType(),
                    delivery.getMessageId());
        } catch (PublishConfirmationException e) {
            log.error("Requeue publish not confirmed (tag={}) → leaving delivery unacknowledged",
                    delivery.getDeliveryTag(), e);
            result.complete(DeliveryOutcome.LEFT_UNACKED);
            return;
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }
        settle(delivery, acknowledger, DeliveryOutcome.REQUEUED, result);
    }

    private void deadLetter(InboundDelivery delivery,
                            ExchangeOptions exchange,
                            DeliveryAcknowledger acknowledger,
                            CompletableFuture<DeliveryOutcome> result) {
        if (exchange.hasDeadLetterExchange()) {
            try {
                publisher.publishCopy(
                        delivery.getBody(),
                        exchange.getDeadLetterExchange(),
                        delivery.getRoutingKey(),
                        delivery.getHeaders(),
                        delivery.getContentType(),
                        delivery.getMessageId());
            } catch (PublishConfirmationException e) {
                log.error("Dead-letter publish not confirmed (tag={}) → leaving delivery unacknowledged",
                        delivery.getDeliveryTag(), e);
                result.complete(DeliveryOutcome.LEFT_UNACKED);
                return;
            }
        } else {
            log.warn("No dead-letter exchange configured for exchange={} → discarding tag={}",
                    exchange.getName(), delivery.getDeliveryTag());
        }
        settle(delivery, acknowledger, DeliveryOutcome.DEAD_LETTERED, result);
    }

    // =====================================================================
    // SETTLEMENT
    // =====================================================================

    private void settle(InboundDelivery delivery,
                        DeliveryAcknowledger acknowledger,
                        DeliveryOutcome outcome,
                        CompletableFuture<DeliveryOutcome> result) {
        try {
            if (outcome == DeliveryOutcome.ACKED) {
                acknowledger.ack(delivery.getDeliveryTag());
            } else {
                acknowledger.reject(delivery.getDeliveryTag());
            }
            result.complete(outcome);
        } catch (IOException | RuntimeException e) {
            result.completeExceptionally(new ConnectionException(
                    "Failed to settle delivery tag=" + delivery.getDeliveryTag() + " as " + outcome, e));
        }
    }

    // =====================================================================
    // METRICS
    // =====================================================================

    private CompletableFuture<DeliveryOutcome> track(InboundDelivery delivery, CompletableFuture<DeliveryOutcome> result) {
        if (meterRegistry == null) return result;

        result.whenComplete((outcome, error) -> meterRegistry.counter(
                        "queue.client.delivery",
                        "queue", String.valueOf(delivery.getQueue()),
                        "outcome", error != null ? "error" : outcome.name().toLowerCase())
                .increment());
        return result;
    }

    private void recordLatency(String queue, long durationNs) {
        if (meterRegistry == null) return;

        meterRegistry.timer("queue.client.handle.latency", "queue", String.valueOf(queue))
                .record(durationNs, TimeUnit.NANOSECONDS);
    }
}
