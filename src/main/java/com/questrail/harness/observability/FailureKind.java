package com.questrail.harness.observability;

/**
 * Recoverable failure categories. Every one of them ends the affected test via
 * {@code stop()}; none propagates to the controller.
 */
public enum FailureKind
{
    SETUP_FAILURE,
    ASYNC_SETUP_TIMEOUT,
    TEST_TIMEOUT,
    REMOTE_CALL_FAILURE,
    WORKER_PROCESS_TERMINATED,
    WORKER_DISAPPEARED,
    PIPELINE_CREATION_FAILURE,
    PIPELINE_RUNTIME_ERROR
}
