package com.questrail.harness.observability;

import java.time.Instant;

/**
 * Record representing a recoverable failure of one test.
 *
 * @param cause may be {@code null}
 */
public record TestFailureEvent(
    Instant timestamp,
    String testUuid,
    FailureKind kind,
    String detail,
    Throwable cause
) {
}
