package com.questrail.harness.time;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * EventLoop
 * =============================================================================
 * The single serialized execution context of a harness process.
 *
 * <h2>Threading model</h2>
 * All test state (checklist, extra-info, lifecycle flags) is owned by the loop.
 * Deadline expiries, process polls, bus replies, bus signals and pipeline
 * messages are all delivered as tasks on the loop, so no test state is ever
 * touched by two threads. Code running on a foreign thread (Netty I/O,
 * pipeline streaming threads) hops onto the loop with {@link #execute(Runnable)}.
 *
 * <h2>Ordering</h2>
 * Tasks submitted with {@link #execute(Runnable)} run in submission order.
 * Deadlines are monotonic ticks of {@link #clock()}, never wall-clock
 * instants; a deadline already in the past runs as soon as possible.
 */
public interface EventLoop extends Executor
{
    /**
     * The monotonic clock this loop measures deadlines against.
     */
    MonotonicClock clock();

    /**
     * @param deadlineNanos tick of {@link #clock()} at or after which the task runs
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    default Cancellable schedule(Duration delay, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        return scheduleAtNanos(clock().nowNanos() + delay.toNanos(), task);
    }

    @Override
    default void execute(Runnable task)
    {
        scheduleAtNanos(clock().nowNanos(), task);
    }
}
