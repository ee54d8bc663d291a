package com.questrail.harness.time;

/**
 * Handle returned for every scheduled task: deadlines, process polls and
 * deferred bus callbacks.
 */
@FunctionalInterface
public interface Cancellable
{
    /**
     * @return {@code false} if the task already ran or was cancelled before
     */
    boolean cancel();
}
