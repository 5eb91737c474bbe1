package com.intteq.queue.client.internal;

import org.slf4j.MDC;

/**
 * Puts the identifying fields of a delivery into the SLF4J MDC for the duration of a
 * try-with-resources block, then removes exactly those keys again.
 */
final class DeliveryMdc implements AutoCloseable {

    static final String QUEUE = "queue";
    static final String ROUTING_KEY = "routingKey";
    static final String MESSAGE_ID = "messageId";
    static final String RETRY_COUNT = "retryCount";

    private DeliveryMdc(InboundDelivery delivery, int retryCount) {
        putIfPresent(QUEUE, delivery.getQueue());
        putIfPresent(ROUTING_KEY, delivery.getRoutingKey());
        putIfPresent(MESSAGE_ID, delivery.getMessageId());
        MDC.put(RETRY_COUNT, Integer.toString(retryCount));
    }

    static DeliveryMdc open(InboundDelivery delivery, int retryCount) {
        return new DeliveryMdc(delivery, retryCount);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    @Override
    public void close() {
        MDC.remove(QUEUE);
        MDC.remove(ROUTING_KEY);
        MDC.remove(MESSAGE_ID);
        MDC.remove(RETRY_COUNT);
    }
}
