package com.questrail.harness.run.storage;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One stored test run. {@code endedAt} is {@code null} while the run is open.
 */
public record TestRunRecord(long id, Instant startedAt, Instant endedAt)
{
    public TestRunRecord {
        Objects.requireNonNull(startedAt, "startedAt");
    }

    public Optional<Instant> end()
    {
        return Optional.ofNullable(endedAt);
    }

    TestRunRecord ended(Instant at)
    {
        return new TestRunRecord(id, startedAt, at);
    }
}
