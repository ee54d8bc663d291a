package com.questrail.harness.remote;

import com.questrail.harness.bus.BusConnection;
import com.questrail.harness.config.HarnessTimingPolicy;
import com.questrail.harness.process.ProcessLauncher;

import java.util.Objects;

/**
 * Controller-side collaborators a {@link ProxyTest} needs.
 *
 * @param bus        the controller's bus connection
 * @param membership where "new/removed remote test" notifications come from
 * @param launcher   starts worker processes
 * @param busAddress address handed to workers; must not be blank
 * @param timing     process supervision timing
 */
public record RemoteEnvironment(
        BusConnection bus,
        RemoteTestMembership membership,
        ProcessLauncher launcher,
        String busAddress,
        HarnessTimingPolicy timing
) {
    public RemoteEnvironment {
        Objects.requireNonNull(bus, "bus");
        Objects.requireNonNull(membership, "membership");
        Objects.requireNonNull(launcher, "launcher");
        Objects.requireNonNull(busAddress, "busAddress");
        if (busAddress.isBlank()) {
            throw new IllegalArgumentException("busAddress must not be blank");
        }
        timing = Objects.requireNonNullElse(timing, HarnessTimingPolicy.defaults());
    }
}
