package com.questrail.harness.run.storage;

import com.questrail.harness.api.TestLifecycle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongPredicate;

/**
 * {@link TestStorage} kept in memory for the lifetime of the process.
 *
 * <p>Thread-safe; every operation holds the instance lock.</p>
 */
public final class InMemoryTestStorage implements TestStorage
{
    private final Map<Long, TestRunRecord> runs = new LinkedHashMap<>();
    private final Map<Long, Map<String, TestRecord>> tests = new LinkedHashMap<>();
    private long nextRunId = 1;

    @Override
    public synchronized long startNewTestRun(Instant startedAt)
    {
        long id = nextRunId++;
        runs.put(id, new TestRunRecord(id, startedAt, null));
        tests.put(id, new LinkedHashMap<>());
        return id;
    }

    @Override
    public synchronized void endTestRun(long runId, Instant endedAt)
    {
        Objects.requireNonNull(endedAt, "endedAt");
        runs.computeIfPresent(runId, (id, run) -> run.ended(endedAt));
    }

    @Override
    public synchronized void newTestStarted(long runId, TestLifecycle test, Instant startedAt)
    {
        testsOf(runId).put(test.uuid(), TestRecord.of(runId, test, startedAt, null));
    }

    @Override
    public synchronized void newTestFinished(long runId, TestLifecycle test, Instant endedAt)
    {
        Objects.requireNonNull(endedAt, "endedAt");
        Map<String, TestRecord> forRun = testsOf(runId);
        TestRecord started = forRun.get(test.uuid());
        Instant startedAt = started != null ? started.startedAt() : endedAt;
        forRun.put(test.uuid(), TestRecord.of(runId, test, startedAt, endedAt));
    }

    @Override
    public synchronized List<Long> listTestRuns()
    {
        return List.copyOf(runs.keySet());
    }

    @Override
    public synchronized Optional<TestRunRecord> getTestRun(long runId)
    {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public synchronized List<TestRecord> getTestsForTestRun(long runId)
    {
        Map<String, TestRecord> forRun = tests.get(runId);
        return forRun == null ? List.of() : List.copyOf(forRun.values());
    }

    @Override
    public List<String> findTestsByArgument(String typeName, Map<String, ?> arguments)
    {
        return find(typeName, arguments, id -> true);
    }

    @Override
    public List<String> findTestsByArgument(String typeName, Map<String, ?> arguments, long runId)
    {
        return find(typeName, arguments, id -> id == runId);
    }

    private synchronized List<String> find(String typeName, Map<String, ?> arguments, LongPredicate runFilter)
    {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(arguments, "arguments");

        List<String> found = new ArrayList<>();
        for (Map.Entry<Long, Map<String, TestRecord>> run : tests.entrySet()) {
            if (!runFilter.test(run.getKey())) {
                continue;
            }
            for (TestRecord record : run.getValue().values()) {
                if (record.typeName().equals(typeName) && containsAll(record.arguments(), arguments)) {
                    found.add(record.uuid());
                }
            }
        }
        return found;
    }

    private static boolean containsAll(Map<String, Object> actual, Map<String, ?> wanted)
    {
        for (Map.Entry<String, ?> entry : wanted.entrySet()) {
            if (!actual.containsKey(entry.getKey()) || !Objects.equals(actual.get(entry.getKey()), entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    private Map<String, TestRecord> testsOf(long runId)
    {
        Map<String, TestRecord> forRun = tests.get(runId);
        if (forRun == null) {
            throw new IllegalArgumentException("Unknown test run " + runId);
        }
        return forRun;
    }
}
