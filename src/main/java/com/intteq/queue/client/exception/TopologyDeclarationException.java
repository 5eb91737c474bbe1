package com.intteq.queue.client.exception;

/**
 * Thrown when exchanges, queues or bindings cannot be declared, or when the declared
 * topology is invalid. Fatal at startup.
 */
public class TopologyDeclarationException extends QueueClientException {

    public TopologyDeclarationException(String message) {
        super(message);
    }

    public TopologyDeclarationException(String message, Throwable cause) {
        super(message, cause);
    }
}
