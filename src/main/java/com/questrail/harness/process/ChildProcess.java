package com.questrail.harness.process;

import java.time.Duration;

/**
 * Handle to a launched worker process.
 *
 * <p>{@link #status()} never blocks; it is what the liveness poll calls.</p>
 */
public interface ChildProcess
{
    long pid();

    ProcessStatus status();

    /**
     * Forcibly terminates the process. Returns immediately.
     */
    void kill();

    /**
     * Blocks up to {@code timeout} for the process to terminate.
     *
     * @return {@code true} if the process has terminated
     */
    boolean waitFor(Duration timeout) throws InterruptedException;
}
