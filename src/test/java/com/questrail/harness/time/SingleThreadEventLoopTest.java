package com.questrail.harness.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class SingleThreadEventLoopTest {

    private SingleThreadEventLoop loop;

    @BeforeEach
    void setUp() {
        loop = new SingleThreadEventLoop("test-loop");
    }

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    void executedTasksRunInSubmissionOrderOnTheLoopThread() throws InterruptedException {
        List<Integer> order = new CopyOnWriteArrayList<>();
        AtomicBoolean onLoop = new AtomicBoolean(true);
        CountDownLatch latch = new CountDownLatch(1);

        for (int i = 0; i < 5; i++) {
            int n = i;
            loop.execute(() -> {
                order.add(n);
                if (!loop.inEventLoop()) {
                    onLoop.set(false);
                }
            });
        }
        loop.execute(latch::countDown);

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertEquals(List.of(0, 1, 2, 3, 4), order);
        assertTrue(onLoop.get());
        assertFalse(loop.inEventLoop());
    }

    @Test
    void failingTaskDoesNotKillTheLoop() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        loop.execute(() -> {
            throw new IllegalStateException("boom");
        });
        loop.execute(latch::countDown);

        assertTrue(latch.await(2, TimeUnit.SECONDS), "Loop should survive a failing task");
    }

    @Test
    void scheduledTaskRunsAfterDelay() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long before = loop.clock().nowNanos();
        long[] ranAt = new long[1];

        loop.schedule(Duration.ofMillis(30), () -> {
            ranAt[0] = loop.clock().nowNanos();
            latch.countDown();
        });

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertTrue(ranAt[0] - before >= TimeUnit.MILLISECONDS.toNanos(30));
    }

    @Test
    void pastDeadlineRunsAtOnce() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        loop.scheduleAtNanos(loop.clock().nowNanos() - TimeUnit.SECONDS.toNanos(1), latch::countDown);

        assertTrue(latch.await(1, TimeUnit.SECONDS));
    }

    @Test
    void cancelledTaskNeverRuns() throws InterruptedException {
        AtomicBoolean ran = new AtomicBoolean(false);
        CountDownLatch later = new CountDownLatch(1);

        Cancellable handle = loop.schedule(Duration.ofMillis(50), () -> ran.set(true));
        assertTrue(handle.cancel());
        loop.schedule(Duration.ofMillis(150), later::countDown);

        assertTrue(later.await(2, TimeUnit.SECONDS));
        assertFalse(ran.get());
    }
}
