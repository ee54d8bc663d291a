package com.questrail.harness.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of HarnessObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jObservabilitySink implements HarnessObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jObservabilitySink.class);

    @Override
    public void onPhaseTransition(TestPhaseTransitionEvent event) {
        if (event.isTerminal()) {
            log.info("Test {} [{}]: {} -> {}",
                event.testUuid(),
                event.testType(),
                event.oldPhase(),
                event.newPhase());
        }
        else {
            log.debug("Test {} [{}]: {} -> {}",
                event.testUuid(),
                event.testType(),
                event.oldPhase(),
                event.newPhase());
        }
    }

    @Override
    public void onFailure(TestFailureEvent event) {
        if (event.cause() != null) {
            log.error("Test {} failed ({}): {}", event.testUuid(), event.kind(), event.detail(), event.cause());
        }
        else {
            log.warn("Test {} failed ({}): {}", event.testUuid(), event.kind(), event.detail());
        }
    }
}
