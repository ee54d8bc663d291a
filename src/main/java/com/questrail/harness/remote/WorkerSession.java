package com.questrail.harness.remote;

import com.questrail.harness.bus.BusConnection;
import com.questrail.harness.bus.BusNames;
import com.questrail.harness.core.TestContext;

import java.util.Objects;

/**
 * Worker-side collaborators: the worker's own loop, its bus connection, and
 * the uuid of the test it serves.
 */
public record WorkerSession(TestContext context, BusConnection bus, String uuid)
{
    public WorkerSession {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(bus, "bus");
        BusNames.requireBusSafe(uuid);
    }
}
