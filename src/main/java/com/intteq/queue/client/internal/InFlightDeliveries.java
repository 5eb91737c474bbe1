package com.intteq.queue.client.internal;

import java.time.Duration;

/**
 * Counts deliveries that have been accepted for processing and not yet settled.
 *
 * <p>Once {@link #close() closed} no further delivery is accepted, and
 * {@link #awaitEmpty(Duration)} lets shutdown wait for the ones already in flight.
 */
class InFlightDeliveries {

    private int count;
    private boolean closed;

    synchronized boolean tryAcquire() {
        if (closed) {
            return false;
        }
        count++;
        return true;
    }

    synchronized void release() {
        if (count > 0) {
            count--;
        }
        if (count == 0) {
            notifyAll();
        }
    }

    synchronized void close() {
        closed = true;
    }

    synchronized int count() {
        return count;
    }

    /**
     * @return {@code true} if every in-flight delivery was released within {@code timeout}
     */
    synchronized boolean awaitEmpty(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (count > 0) {
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
            if (remainingMs <= 0) {
                return false;
            }
            wait(remainingMs);
        }
        return true;
    }
}
