package com.intteq.queue.client.internal;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Requeue bookkeeping for failed deliveries.
 *
 * <p>Holds no state: the attempt counter travels with the message in the
 * {@value #RETRY_COUNT_HEADER} header, so the policy gives the same answer across consumer
 * restarts and across consumer instances. A missing header means the first delivery.
 *
 * <p>With a limit of {@code n} a message is delivered at most {@code n + 1} times: the
 * failure of the delivery carrying retry count {@code n} dead-letters it.
 */
@Slf4j
public class RetryPolicy {

    public static final String RETRY_COUNT_HEADER = "retry-count";

    public int currentRetryCount(Map<String, Object> headers) {
        if (headers == null) {
            return 0;
        }
        Object value = headers.get(RETRY_COUNT_HEADER);
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            return Math.max(0, ((Number) value).intValue());
        }
        String text = value instanceof byte[]
                ? new String((byte[]) value, StandardCharsets.UTF_8)
                : value.toString();
        try {
            return Math.max(0, Integer.parseInt(text.trim()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparseable {} header value '{}'", RETRY_COUNT_HEADER, text);
            return 0;
        }
    }

    public int nextRetryCount(InboundDelivery delivery) {
        return currentRetryCount(delivery.getHeaders()) + 1;
    }

    public boolean shouldDeadLetter(int retryCount, int limit) {
        return retryCount > limit;
    }

    /**
     * Copy of {@code headers} with the retry count set to {@code retryCount}.
     */
    public Map<String, Object> withRetryCount(Map<String, Object> headers, int retryCount) {
        Map<String, Object> copy = headers == null ? new HashMap<>() : new HashMap<>(headers);
        copy.put(RETRY_COUNT_HEADER, retryCount);
        return copy;
    }
}
