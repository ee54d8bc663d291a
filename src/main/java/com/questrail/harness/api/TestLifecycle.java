package com.questrail.harness.api;

import com.questrail.harness.capability.CapabilityDescriptor;

import java.time.Duration;
import java.util.Map;

/**
 * TestLifecycle
 * =============================================================================
 * The public contract of a test, as seen by whoever runs it.
 *
 * <h2>Outcome</h2>
 * A test never throws its verdict at the caller. The outcome is read from the
 * checklist ({@link #getChecklist()}, {@link #getSuccessPercentage()}) and the
 * extra-info mapping once {@link TestListener#onDone} has been delivered.
 *
 * <h2>Threading</h2>
 * Every method is meant to be called on the owning event loop.
 */
public interface TestLifecycle
{
    String uuid();

    CapabilityDescriptor descriptor();

    TestPhase phase();

    /**
     * Entry point. Callable once.
     */
    void run();

    /**
     * Idempotent. The first call tears the test down and emits "done".
     */
    void stop();

    /**
     * Marks a declared checkitem as passed. Undeclared names are ignored.
     */
    void validateStep(String checkItem);

    /**
     * Records a diagnostic key/value pair; last write wins.
     */
    void extraInfo(String key, Object value);

    /**
     * Changes the test deadline. Refused once the test is running.
     *
     * @return {@code true} if the new timeout was accepted
     */
    boolean setTimeout(Duration timeout);

    Duration getTimeout();

    /**
     * @return ordered snapshot of checkitem name to pass state
     */
    Map<String, Boolean> getChecklist();

    /**
     * @return ordered snapshot of the extra-info mapping
     */
    Map<String, Object> getExtraInfo();

    /**
     * @return arguments filtered to the declared argument keys
     */
    Map<String, Object> getArguments();

    double getSuccessPercentage();

    Subscription addListener(TestListener listener);
}
