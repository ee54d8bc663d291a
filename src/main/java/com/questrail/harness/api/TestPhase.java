package com.questrail.harness.api;

/**
 * Lifecycle phase of a single test instance.
 *
 * <pre>
 *   CREATED → SETTING_UP → (AWAITING_ASYNC_READY) → RUNNING → STOPPING → DONE
 * </pre>
 *
 * A failed setup goes straight from {@link #SETTING_UP} to {@link #STOPPING}.
 * {@link #DONE} is terminal and is entered exactly once.
 */
public enum TestPhase
{
    CREATED,
    SETTING_UP,
    AWAITING_ASYNC_READY,
    RUNNING,
    STOPPING,
    DONE;

    public boolean isTerminal()
    {
        return this == DONE;
    }
}
