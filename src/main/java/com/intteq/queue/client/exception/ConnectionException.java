package com.intteq.queue.client.exception;

/**
 * Thrown when a connection or channel to the broker cannot be opened or used.
 *
 * <p>Fatal to the affected consumer. Reconnection is left to the broker client's own
 * recovery or to the process owner.
 */
public class ConnectionException extends QueueClientException {

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
