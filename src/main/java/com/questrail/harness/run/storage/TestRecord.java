package com.questrail.harness.run.storage;

import com.questrail.harness.api.TestLifecycle;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of one test as stored. {@code endedAt} is {@code null} until the
 * test has finished.
 */
public record TestRecord(
        long runId,
        String uuid,
        String typeName,
        Map<String, Object> arguments,
        Map<String, Boolean> checklist,
        Map<String, Object> extraInfo,
        double successPercentage,
        Instant startedAt,
        Instant endedAt
) {
    public TestRecord {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(startedAt, "startedAt");
        arguments = copy(arguments);
        checklist = copy(checklist);
        extraInfo = copy(extraInfo);
    }

    static TestRecord of(long runId, TestLifecycle test, Instant startedAt, Instant endedAt)
    {
        return new TestRecord(runId,
                test.uuid(),
                test.descriptor().typeName(),
                test.getArguments(),
                test.getChecklist(),
                test.getExtraInfo(),
                test.getSuccessPercentage(),
                startedAt,
                endedAt);
    }

    public boolean isFinished()
    {
        return endedAt != null;
    }

    private static <V> Map<String, V> copy(Map<String, V> map)
    {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
