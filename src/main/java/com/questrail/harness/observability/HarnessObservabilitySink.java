package com.questrail.harness.observability;

/**
 * Main interface for receiving harness observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface HarnessObservabilitySink {
    /**
     * Called when a test changes lifecycle phase.
     * @param event the transition event details
     */
    void onPhaseTransition(TestPhaseTransitionEvent event);

    /**
     * Called when a test fails in a recoverable way (timeout, lost worker, remote error...).
     * @param event the failure event
     */
    void onFailure(TestFailureEvent event);
}
