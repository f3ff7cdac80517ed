package com.devflow.syncclient.connection;

import com.devflow.syncclient.support.ManualTaskScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ReconnectionSchedulerTest {

    private ManualTaskScheduler scheduler;
    private AtomicInteger runs;

    @BeforeEach
    void setUp() {
        scheduler = new ManualTaskScheduler();
        runs = new AtomicInteger();
    }

    @Test
    @DisplayName("Runs the attempt after the base interval and counts attempts from 1")
    void firstAttempt() {
        ReconnectionScheduler reconnection = new ReconnectionScheduler(scheduler, 100, 1.0, 60_000, 3);

        assertEquals(1, reconnection.scheduleNext(runs::incrementAndGet));
        assertTrue(reconnection.isPending());

        scheduler.advance(99);
        assertEquals(0, runs.get());
        scheduler.advance(1);
        assertEquals(1, runs.get());
        assertFalse(reconnection.isPending());
    }

    @Test
    @DisplayName("Delay grows by the multiplier and is capped")
    void backoff() {
        ReconnectionScheduler reconnection = new ReconnectionScheduler(scheduler, 1000, 2.0, 5000, 10);

        assertEquals(1000, reconnection.delayFor(1));
        assertEquals(2000, reconnection.delayFor(2));
        assertEquals(4000, reconnection.delayFor(3));
        assertEquals(5000, reconnection.delayFor(4));
        assertEquals(5000, reconnection.delayFor(9));
    }

    @Test
    @DisplayName("Exhausted after maxAttempts schedules; scheduling more is refused")
    void exhaustion() {
        ReconnectionScheduler reconnection = new ReconnectionScheduler(scheduler, 100, 1.0, 60_000, 2);

        reconnection.scheduleNext(runs::incrementAndGet);
        assertFalse(reconnection.isExhausted());
        reconnection.scheduleNext(runs::incrementAndGet);
        assertTrue(reconnection.isExhausted());

        assertThrows(IllegalStateException.class, () -> reconnection.scheduleNext(runs::incrementAndGet));
    }

    @Test
    @DisplayName("At most one retry is pending: rescheduling cancels the previous timer")
    void singlePendingTimer() {
        ReconnectionScheduler reconnection = new ReconnectionScheduler(scheduler, 100, 1.0, 60_000, 5);

        reconnection.scheduleNext(runs::incrementAndGet);
        reconnection.scheduleNext(runs::incrementAndGet);
        assertEquals(1, scheduler.pendingTimers());

        scheduler.advance(1000);
        assertEquals(1, runs.get());
    }

    @Test
    @DisplayName("reset cancels the pending retry and zeroes the counter")
    void resetCancels() {
        ReconnectionScheduler reconnection = new ReconnectionScheduler(scheduler, 100, 1.0, 60_000, 5);
        reconnection.scheduleNext(runs::incrementAndGet);

        reconnection.reset();
        scheduler.advance(1000);

        assertEquals(0, runs.get());
        assertEquals(0, reconnection.getAttempts());
        assertFalse(reconnection.isPending());
    }

    @Test
    @DisplayName("Zero attempts allowed means exhausted from the start")
    void zeroAttempts() {
        ReconnectionScheduler reconnection = new ReconnectionScheduler(scheduler, 100, 1.0, 60_000, 0);
        assertTrue(reconnection.isExhausted());
    }
}
