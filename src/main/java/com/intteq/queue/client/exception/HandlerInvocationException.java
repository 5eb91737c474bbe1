package com.intteq.queue.client.exception;

import java.util.List;

/**
 * Aggregates the failures of the handlers invoked for a single delivery.
 *
 * <p>The first failure becomes the cause; the remaining ones are attached as suppressed
 * exceptions.
 */
public class HandlerInvocationException extends QueueClientException {

    public HandlerInvocationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static HandlerInvocationException aggregate(String routingKey, List<Throwable> failures) {
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("failures must not be empty");
        }
        HandlerInvocationException ex = new HandlerInvocationException(
                failures.size() + " handler(s) failed for routingKey=" + routingKey,
                failures.get(0));
        failures.stream().skip(1).forEach(ex::addSuppressed);
        return ex;
    }
}
