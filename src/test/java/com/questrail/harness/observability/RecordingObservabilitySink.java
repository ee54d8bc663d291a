package com.questrail.harness.observability;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps phase transitions and failures, in arrival order, for assertions.
 * Safe to use from a real event loop thread.
 */
public final class RecordingObservabilitySink implements HarnessObservabilitySink {

    private final List<TestPhaseTransitionEvent> transitions = new ArrayList<>();
    private final List<TestFailureEvent> failures = new ArrayList<>();

    @Override
    public synchronized void onPhaseTransition(TestPhaseTransitionEvent event) {
        transitions.add(event);
    }

    @Override
    public synchronized void onFailure(TestFailureEvent event) {
        failures.add(event);
    }

    public synchronized List<TestPhaseTransitionEvent> getPhaseTransitions() {
        return List.copyOf(transitions);
    }

    public synchronized List<TestFailureEvent> getFailures() {
        return List.copyOf(failures);
    }

    public synchronized List<FailureKind> getFailureKinds() {
        List<FailureKind> kinds = new ArrayList<>(failures.size());
        for (TestFailureEvent failure : failures) {
            kinds.add(failure.kind());
        }
        return kinds;
    }
}
