package com.questrail.harness.observability;

/**
 * Discards every event. The default when a {@link com.questrail.harness.core.TestContext}
 * is built without a sink.
 */
public enum NullObservabilitySink implements HarnessObservabilitySink
{
    INSTANCE;

    @Override
    public void onPhaseTransition(TestPhaseTransitionEvent event) {}

    @Override
    public void onFailure(TestFailureEvent event) {}
}
