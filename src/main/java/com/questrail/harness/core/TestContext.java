package com.questrail.harness.core;

import com.questrail.harness.observability.HarnessObservabilitySink;
import com.questrail.harness.observability.NullObservabilitySink;
import com.questrail.harness.time.CpuClock;
import com.questrail.harness.time.EventLoop;
import com.questrail.harness.time.WallClock;

import java.util.Objects;

/**
 * Process-level services a test runs against.
 *
 * @param loop          the serialized execution context owning all test state
 * @param wallClock     timestamps for observability and storage only
 * @param observability sink for phase transitions and failures
 * @param cpuClock      process CPU time behind the {@code cpu-load} extra-info
 */
public record TestContext(
        EventLoop loop,
        WallClock wallClock,
        HarnessObservabilitySink observability,
        CpuClock cpuClock
) {
    public TestContext {
        Objects.requireNonNull(loop, "loop");
        wallClock = Objects.requireNonNullElse(wallClock, WallClock.SYSTEM);
        observability = Objects.requireNonNullElse(observability, NullObservabilitySink.INSTANCE);
        cpuClock = Objects.requireNonNullElse(cpuClock, CpuClock.SYSTEM);
    }

    public TestContext(EventLoop loop, WallClock wallClock, HarnessObservabilitySink observability) {
        this(loop, wallClock, observability, CpuClock.SYSTEM);
    }

    public static TestContext of(EventLoop loop) {
        return new TestContext(loop, WallClock.SYSTEM, NullObservabilitySink.INSTANCE, CpuClock.SYSTEM);
    }
}
