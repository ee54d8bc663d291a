package com.questrail.harness.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every lifecycle deadline and duration measurement.
 *
 * <h2>Binding invariant</h2>
 * Async-setup deadlines, test deadlines, process polling and the
 * {@code test-setup-duration} / {@code test-total-duration} extra-infos MUST use
 * a monotonic time source. Wall-clock time is permitted only for observability
 * and storage timestamps (see {@link WallClock}).
 */
@FunctionalInterface
public interface MonotonicClock
{
    /**
     * Backed by {@link System#nanoTime()}.
     */
    MonotonicClock SYSTEM = System::nanoTime;

    /**
     * Tick in nanoseconds; only differences between ticks are meaningful.
     */
    long nowNanos();
}
