package com.intteq.queue.client.internal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InFlightDeliveries - shutdown draining")
class InFlightDeliveriesTest {

    @Test
    @DisplayName("rejects new deliveries once closed")
    void testClosedRejects() {
        InFlightDeliveries inFlight = new InFlightDeliveries();

        assertTrue(inFlight.tryAcquire());
        inFlight.close();

        assertFalse(inFlight.tryAcquire());
        assertEquals(1, inFlight.count());
    }

    @Test
    @DisplayName("awaitEmpty returns immediately when nothing is in flight")
    void testAwaitEmptyIdle() throws InterruptedException {
        assertTrue(new InFlightDeliveries().awaitEmpty(Duration.ZERO));
    }

    @Test
    @DisplayName("awaitEmpty times out while a delivery is still in flight")
    void testAwaitEmptyTimeout() throws InterruptedException {
        InFlightDeliveries inFlight = new InFlightDeliveries();
        inFlight.tryAcquire();

        assertFalse(inFlight.awaitEmpty(Duration.ofMillis(50)));
    }

    @Test
    @DisplayName("awaitEmpty wakes up when the last delivery is released")
    void testAwaitEmptyReleased() throws Exception {
        InFlightDeliveries inFlight = new InFlightDeliveries();
        inFlight.tryAcquire();
        CountDownLatch started = new CountDownLatch(1);

        Thread releaser = new Thread(() -> {
            started.countDown();
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inFlight.release();
        });
        releaser.start();
        started.await();

        assertTrue(inFlight.awaitEmpty(Duration.ofSeconds(5)));
        releaser.join();
    }
}
