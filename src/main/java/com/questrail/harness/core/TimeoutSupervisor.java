package com.questrail.harness.core;

import com.questrail.harness.time.Cancellable;
import com.questrail.harness.time.EventLoop;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * TimeoutSupervisor
 * =============================================================================
 * Owns the single-shot deadlines of one test.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>At most one deadline per {@link Deadline} kind is armed at a time;
 *       arming again replaces (and cancels) the previous one.</li>
 *   <li>A cancelled deadline never fires, even if its task was already queued
 *       on the loop when {@link #cancel(Deadline)} ran.</li>
 *   <li>A fired deadline is no longer armed by the time its callback runs.</li>
 * </ul>
 *
 * <p>Must be used from the loop thread only.</p>
 */
public final class TimeoutSupervisor
{
    public enum Deadline
    {
        ASYNC_SETUP,
        TEST
    }

    private final EventLoop loop;
    private final Map<Deadline, Armed> armed = new EnumMap<>(Deadline.class);

    public TimeoutSupervisor(EventLoop loop)
    {
        this.loop = Objects.requireNonNull(loop, "loop");
    }

    public void arm(Deadline deadline, Duration delay, Runnable onExpiry)
    {
        Objects.requireNonNull(deadline, "deadline");
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(onExpiry, "onExpiry");

        cancel(deadline);
        Armed entry = new Armed();
        armed.put(deadline, entry);
        entry.handle = loop.schedule(delay, () -> {
            if (armed.get(deadline) != entry) {
                return;
            }
            armed.remove(deadline);
            onExpiry.run();
        });
    }

    public boolean isArmed(Deadline deadline)
    {
        return armed.containsKey(deadline);
    }

    public void cancel(Deadline deadline)
    {
        Armed entry = armed.remove(deadline);
        if (entry != null && entry.handle != null) {
            entry.handle.cancel();
        }
    }

    public void cancelAll()
    {
        for (Deadline d : Deadline.values()) {
            cancel(d);
        }
    }

    private static final class Armed
    {
        private Cancellable handle;
    }
}
