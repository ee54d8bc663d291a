package com.questrail.harness.api;

/**
 * Observer of a test's lifecycle events.
 *
 * <p>All callbacks are delivered on the event loop, in emission order.
 * {@link #onStart} precedes every {@link #onCheck} that follows
 * {@code test-started}; {@link #onDone} is delivered at most once and is always
 * the last callback.</p>
 */
public interface TestListener
{
    default void onStart(TestLifecycle test) {}

    default void onCheck(TestLifecycle test, String checkItem) {}

    default void onExtraInfo(TestLifecycle test, String key, Object value) {}

    default void onDone(TestLifecycle test) {}
}
