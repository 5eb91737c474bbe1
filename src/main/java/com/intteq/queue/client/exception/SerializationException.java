package com.intteq.queue.client.exception;

/**
 * Thrown when a payload cannot be converted to or from its wire representation.
 */
public class SerializationException extends QueueClientException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
