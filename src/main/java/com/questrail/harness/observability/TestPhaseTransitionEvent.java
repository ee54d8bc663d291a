package com.questrail.harness.observability;

import com.questrail.harness.api.TestPhase;

import java.time.Instant;

/**
 * Record representing a lifecycle phase change of one test.
 */
public record TestPhaseTransitionEvent(
    Instant timestamp,
    String testUuid,
    String testType,
    TestPhase oldPhase,
    TestPhase newPhase
) {
    public boolean isTerminal() {
        return newPhase.isTerminal();
    }
}
