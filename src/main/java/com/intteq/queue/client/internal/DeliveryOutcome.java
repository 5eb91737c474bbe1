package com.intteq.queue.client.internal;

/**
 * How the consumption pipeline settled a delivery.
 */
public enum DeliveryOutcome {

    /** Handled successfully, or no handler matched. Positively acknowledged. */
    ACKED,

    /** Failed; a copy with an incremented retry count was published, the original rejected. */
    REQUEUED,

    /** Failed after the last allowed attempt; copied to the dead-letter exchange and rejected. */
    DEAD_LETTERED,

    /**
     * The requeue or dead-letter publish was not confirmed. The original delivery is left
     * unacknowledged so the broker redelivers it once the channel closes.
     */
    LEFT_UNACKED
}
