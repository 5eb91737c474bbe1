package com.intteq.queue.client.handler;

import com.intteq.queue.client.MessageContext;

/**
 * Synchronous, cyclic-unsafe message handler.
 *
 * <p>A failure (any thrown exception) halts the remaining cyclic-unsafe handlers registered
 * for the same routing key and fails the delivery.
 *
 * @param <T> payload type the message body is deserialized into
 */
@FunctionalInterface
public interface MessageHandler<T> {

    void handle(T message, MessageContext context) throws Exception;
}
