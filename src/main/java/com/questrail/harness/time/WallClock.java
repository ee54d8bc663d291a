package com.questrail.harness.time;

import java.time.Instant;

/**
 * Source of the timestamps written to storage and observability events. Never
 * used for deadlines; those run on {@link MonotonicClock}.
 */
@FunctionalInterface
public interface WallClock
{
    WallClock SYSTEM = Instant::now;

    Instant now();
}
