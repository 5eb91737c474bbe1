package com.intteq.queue.client.exception;

/**
 * Exception thrown when the broker negatively confirms a publish, when no confirm arrives
 * in time, or when the message cannot be sent after the configured attempts.
 */
public class PublishConfirmationException extends QueueClientException {

    public PublishConfirmationException(String message) {
        super(message);
    }

    public PublishConfirmationException(String message, Throwable cause) {
        super(message, cause);
    }
}
