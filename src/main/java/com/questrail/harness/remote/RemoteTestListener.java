package com.questrail.harness.remote;

/**
 * Observer of workers joining and leaving the bus, keyed by test uuid.
 */
public interface RemoteTestListener
{
    /**
     * A worker for {@code uuid} acquired its bus name.
     */
    default void newRemoteTest(String uuid) {}

    /**
     * The worker for {@code uuid} lost its bus name (exited or disconnected).
     */
    default void removedRemoteTest(String uuid) {}
}
