package com.intteq.queue.client.exception;

/**
 * Root of the unchecked exceptions raised by the queue client.
 */
public class QueueClientException extends RuntimeException {

    public QueueClientException(String message) {
        super(message);
    }

    public QueueClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
