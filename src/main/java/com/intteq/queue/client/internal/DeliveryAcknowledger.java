package com.intteq.queue.client.internal;

import java.io.IOException;

/**
 * Settles deliveries on the channel they arrived on. Each delivery is settled at most once.
 */
public interface DeliveryAcknowledger {

    void ack(long deliveryTag) throws IOException;

    /**
     * Rejects without asking the broker to requeue.
     */
    void reject(long deliveryTag) throws IOException;
}
