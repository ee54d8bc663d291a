package com.questrail.harness.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * SingleThreadEventLoop
 * =============================================================================
 * Production {@link EventLoop}: one daemon thread behind a
 * {@link ScheduledExecutorService}. Monotonic deadlines are turned into
 * relative delays when the task is scheduled.
 *
 * <p>A task that throws is logged and the loop keeps running; a misbehaving
 * callback must not take down every other test sharing the loop.</p>
 *
 * <h2>Lifecycle</h2>
 * The loop starts on construction. {@link #close()} shuts the executor down,
 * waits up to five seconds for in-flight work and then forces termination.
 */
public final class SingleThreadEventLoop implements EventLoop, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(SingleThreadEventLoop.class);

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    private volatile Thread loopThread;

    public SingleThreadEventLoop(String threadName)
    {
        Objects.requireNonNull(threadName, "threadName");
        this.clock = MonotonicClock.SYSTEM;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
    }

    @Override
    public MonotonicClock clock()
    {
        return clock;
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task)
    {
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(guarded(task), delayNanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void execute(Runnable task)
    {
        executor.execute(guarded(task));
    }

    /**
     * @return {@code true} when called from the loop thread itself
     */
    public boolean inEventLoop()
    {
        return Thread.currentThread() == loopThread;
    }

    @Override
    public void close()
    {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static Runnable guarded(Runnable task)
    {
        Objects.requireNonNull(task, "task");
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Event loop task failed", e);
            }
        };
    }
}
