package com.questrail.harness.time;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * RepeatingTask
 * =============================================================================
 * A periodic step that decides after each run whether it continues.
 *
 * <p>The step returns {@link Outcome#RESCHEDULE} to run again after the
 * interval, or {@link Outcome#FINISHED} to stop. The owner may also
 * {@link #cancel()} at any time; a cancelled task never runs its step again.</p>
 *
 * <p>A step that throws finishes the task: it is not rescheduled,
 * {@link #isActive()} turns false, and the exception propagates to the loop,
 * which reports it.</p>
 *
 * <p>Must be started, stepped and cancelled on the loop thread.</p>
 */
public final class RepeatingTask implements Cancellable
{
    public enum Outcome
    {
        RESCHEDULE,
        FINISHED
    }

    private final EventLoop loop;
    private final Duration interval;
    private final Supplier<Outcome> step;

    private Cancellable pending;
    private boolean active = true;

    private RepeatingTask(EventLoop loop, Duration interval, Supplier<Outcome> step)
    {
        this.loop = loop;
        this.interval = interval;
        this.step = step;
    }

    /**
     * Schedules the first step one interval from now.
     */
    public static RepeatingTask start(EventLoop loop, Duration interval, Supplier<Outcome> step)
    {
        Objects.requireNonNull(loop, "loop");
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(step, "step");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }

        RepeatingTask task = new RepeatingTask(loop, interval, step);
        task.scheduleNext();
        return task;
    }

    public boolean isActive()
    {
        return active;
    }

    @Override
    public boolean cancel()
    {
        if (!active) {
            return false;
        }
        active = false;
        Cancellable p = pending;
        pending = null;
        if (p != null) {
            p.cancel();
        }
        return true;
    }

    private void scheduleNext()
    {
        pending = loop.schedule(interval, this::runStep);
    }

    private void runStep()
    {
        pending = null;
        if (!active) {
            return;
        }
        Outcome outcome;
        try {
            outcome = step.get();
        } catch (RuntimeException e) {
            active = false;
            throw e;
        }
        if (outcome == Outcome.RESCHEDULE && active) {
            scheduleNext();
        }
        else {
            active = false;
        }
    }
}
