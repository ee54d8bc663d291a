package com.questrail.harness.config;

import java.time.Duration;
import java.util.Objects;

/**
 * HarnessTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for worker-process supervision.
 *
 * <p>Per-test deadlines (test timeout, async-setup timeout) are declared by
 * each test type's capability layers; this policy only covers the process
 * side of a remote test.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>processPollInterval</b>: Interval between non-blocking liveness
 *       checks of a spawned worker.</li>
 *   <li><b>stopGracePeriod</b>: How long teardown waits for the worker to
 *       exit on its own after the graceful remote stop before killing it.</li>
 *   <li><b>killRetryInterval</b>: Wait after each forced kill before checking
 *       again.</li>
 *   <li><b>maxKillAttempts</b>: Upper bound on forced kills; teardown gives up
 *       (and logs) after this many so it can never hang.</li>
 * </ul>
 */
public record HarnessTimingPolicy(
        Duration processPollInterval,
        Duration stopGracePeriod,
        Duration killRetryInterval,
        int maxKillAttempts
) {
    public HarnessTimingPolicy {
        Objects.requireNonNull(processPollInterval, "processPollInterval");
        Objects.requireNonNull(stopGracePeriod, "stopGracePeriod");
        Objects.requireNonNull(killRetryInterval, "killRetryInterval");

        if (processPollInterval.isNegative() || processPollInterval.isZero()) {
            throw new IllegalArgumentException("processPollInterval must be positive");
        }
        if (stopGracePeriod.isNegative()) {
            throw new IllegalArgumentException("stopGracePeriod must be non-negative");
        }
        if (killRetryInterval.isNegative()) {
            throw new IllegalArgumentException("killRetryInterval must be non-negative");
        }
        if (maxKillAttempts < 1) {
            throw new IllegalArgumentException("maxKillAttempts must be >= 1");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>processPollInterval: 500ms</li>
     *   <li>stopGracePeriod: 250ms</li>
     *   <li>killRetryInterval: 100ms</li>
     *   <li>maxKillAttempts: 50</li>
     * </ul>
     */
    public static HarnessTimingPolicy defaults() {
        return new HarnessTimingPolicy(
                Duration.ofMillis(500),
                Duration.ofMillis(250),
                Duration.ofMillis(100),
                50
        );
    }
}
