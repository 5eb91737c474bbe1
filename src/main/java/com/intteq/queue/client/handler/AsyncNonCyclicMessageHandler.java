package com.intteq.queue.client.handler;

import com.intteq.queue.client.MessageContext;
import com.intteq.queue.client.QueuePublisher;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous variant of {@link NonCyclicMessageHandler}.
 *
 * @param <T> payload type the message body is deserialized into
 */
@FunctionalInterface
public interface AsyncNonCyclicMessageHandler<T> {

    CompletionStage<Void> handle(T message, MessageContext context, QueuePublisher publisher);
}
