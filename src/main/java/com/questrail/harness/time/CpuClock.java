package com.questrail.harness.time;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * CpuClock
 * =============================================================================
 * CPU time consumed by the whole JVM process, user and system combined.
 *
 * <p>Feeds the {@code cpu-load} extra-info: CPU time spent between the start
 * and the end of a test, relative to the monotonic time that elapsed.
 */
@FunctionalInterface
public interface CpuClock
{
    /**
     * Backed by the platform {@link OperatingSystemMXBean}, when it exposes
     * process CPU time.
     */
    CpuClock SYSTEM = CpuClock::processCpuNanos;

    /**
     * Reports no CPU time at all; {@code cpu-load} is never recorded.
     */
    CpuClock UNSUPPORTED = () -> -1L;

    /**
     * @return consumed CPU time in nanoseconds, or a negative value when the
     *         platform cannot tell
     */
    long cpuNanos();

    private static long processCpuNanos()
    {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean platform) {
            return platform.getProcessCpuTime();
        }
        return -1L;
    }
}
