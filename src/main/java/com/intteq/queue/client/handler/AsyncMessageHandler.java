package com.intteq.queue.client.handler;

import com.intteq.queue.client.MessageContext;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous variant of {@link MessageHandler}. The delivery is settled once the returned
 * stage completes; exceptional completion counts as a failure.
 *
 * @param <T> payload type the message body is deserialized into
 */
@FunctionalInterface
public interface AsyncMessageHandler<T> {

    CompletionStage<Void> handle(T message, MessageContext context);
}
