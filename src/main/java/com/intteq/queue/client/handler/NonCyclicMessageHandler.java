package com.intteq.queue.client.handler;

import com.intteq.queue.client.MessageContext;
import com.intteq.queue.client.QueuePublisher;

/**
 * Synchronous, non-cyclic message handler.
 *
 * <p>Non-cyclic handlers run for every delivery regardless of how the other handlers for the
 * same routing key behave. Their own failure still fails the delivery. They receive the
 * {@link QueuePublisher} to emit follow-up messages.
 *
 * @param <T> payload type the message body is deserialized into
 */
@FunctionalInterface
public interface NonCyclicMessageHandler<T> {

    void handle(T message, MessageContext context, QueuePublisher publisher) throws Exception;
}
