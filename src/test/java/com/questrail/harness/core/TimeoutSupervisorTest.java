package com.questrail.harness.core;

import com.questrail.harness.time.DeterministicScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static com.questrail.harness.core.TimeoutSupervisor.Deadline.ASYNC_SETUP;
import static com.questrail.harness.core.TimeoutSupervisor.Deadline.TEST;
import static org.junit.jupiter.api.Assertions.*;

class TimeoutSupervisorTest {

    private DeterministicScheduler loop;
    private TimeoutSupervisor timeouts;

    @BeforeEach
    void setUp() {
        loop = new DeterministicScheduler();
        timeouts = new TimeoutSupervisor(loop);
    }

    @Test
    void armedDeadlineFiresOnceAndIsNoLongerArmed() {
        AtomicInteger fired = new AtomicInteger();
        timeouts.arm(TEST, Duration.ofSeconds(1), () -> {
            assertFalse(timeouts.isArmed(TEST));
            fired.incrementAndGet();
        });

        assertTrue(timeouts.isArmed(TEST));
        loop.advance(Duration.ofMillis(999));
        assertEquals(0, fired.get());

        loop.advance(Duration.ofMillis(1));
        assertEquals(1, fired.get());

        loop.advance(Duration.ofSeconds(5));
        assertEquals(1, fired.get());
    }

    @Test
    void cancelledDeadlineNeverFires() {
        AtomicInteger fired = new AtomicInteger();
        timeouts.arm(ASYNC_SETUP, Duration.ofSeconds(1), fired::incrementAndGet);

        timeouts.cancel(ASYNC_SETUP);
        loop.advance(Duration.ofSeconds(2));

        assertEquals(0, fired.get());
        assertFalse(timeouts.isArmed(ASYNC_SETUP));
    }

    @Test
    void rearmingReplacesThePreviousDeadline() {
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();
        timeouts.arm(TEST, Duration.ofSeconds(1), first::incrementAndGet);
        timeouts.arm(TEST, Duration.ofSeconds(3), second::incrementAndGet);

        loop.advance(Duration.ofSeconds(2));
        assertEquals(0, first.get());
        assertEquals(0, second.get());

        loop.advance(Duration.ofSeconds(1));
        assertEquals(0, first.get());
        assertEquals(1, second.get());
    }

    @Test
    void cancelAllCancelsEveryKind() {
        AtomicInteger fired = new AtomicInteger();
        timeouts.arm(TEST, Duration.ofSeconds(1), fired::incrementAndGet);
        timeouts.arm(ASYNC_SETUP, Duration.ofSeconds(1), fired::incrementAndGet);

        timeouts.cancelAll();
        loop.advance(Duration.ofSeconds(1));

        assertEquals(0, fired.get());
        assertEquals(0, loop.pendingTasks());
    }
}
