package com.questrail.harness.run.storage;

import com.questrail.harness.api.TestLifecycle;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * TestStorage
 * =============================================================================
 * Where test runs and test outcomes are recorded and looked up.
 *
 * <h2>Recording</h2>
 * {@link #startNewTestRun} opens a run; every test is announced with
 * {@link #newTestStarted} before it runs and recorded again with
 * {@link #newTestFinished} after its "done"; {@link #endTestRun} closes the run.
 *
 * <h2>Retrieval</h2>
 * Unknown run ids produce empty results rather than exceptions.
 */
public interface TestStorage
{
    /**
     * @return the id of the new run
     */
    long startNewTestRun(Instant startedAt);

    void endTestRun(long runId, Instant endedAt);

    void newTestStarted(long runId, TestLifecycle test, Instant startedAt);

    void newTestFinished(long runId, TestLifecycle test, Instant endedAt);

    List<Long> listTestRuns();

    Optional<TestRunRecord> getTestRun(long runId);

    List<TestRecord> getTestsForTestRun(long runId);

    /**
     * Uuids of tests of {@code typeName} whose arguments contain every entry
     * of {@code arguments}, across all runs.
     */
    List<String> findTestsByArgument(String typeName, Map<String, ?> arguments);

    /**
     * As {@link #findTestsByArgument(String, Map)}, restricted to one run.
     */
    List<String> findTestsByArgument(String typeName, Map<String, ?> arguments, long runId);
}
