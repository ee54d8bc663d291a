package com.questrail.harness.runtime;

import com.questrail.harness.bus.BusAddress;
import com.questrail.harness.bus.netty.BusDaemon;
import com.questrail.harness.bus.netty.NettyBusConnection;
import com.questrail.harness.config.HarnessTimingPolicy;
import com.questrail.harness.core.TestContext;
import com.questrail.harness.observability.HarnessObservabilitySink;
import com.questrail.harness.observability.NullObservabilitySink;
import com.questrail.harness.process.OsProcessLauncher;
import com.questrail.harness.process.ProcessLauncher;
import com.questrail.harness.remote.RemoteEnvironment;
import com.questrail.harness.run.TestRun;
import com.questrail.harness.run.storage.InMemoryTestStorage;
import com.questrail.harness.run.storage.TestStorage;
import com.questrail.harness.time.SingleThreadEventLoop;
import com.questrail.harness.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * HarnessRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a controller process: private bus
 * daemon, event loop, the controller's bus connection and the test run.
 *
 * <h2>Usage</h2>
 * <pre>
 *   try (HarnessRuntime runtime = HarnessRuntime.builder().build()) {
 *       runtime.start();
 *       runtime.testRun().addTest(new MyProxyTest(runtime.context(), runtime.environment(), ...));
 *       runtime.testRun().start().get();
 *   }
 * </pre>
 */
public final class HarnessRuntime implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(HarnessRuntime.class);

    private final HarnessTimingPolicy timingPolicy;
    private final HarnessObservabilitySink observabilitySink;
    private final TestStorage storage;
    private final InetSocketAddress bindAddress;
    private final ProcessLauncher launcher;

    private final SingleThreadEventLoop loop;
    private final TestContext context;

    private BusDaemon daemon;
    private NettyBusConnection bus;
    private TestRun testRun;
    private RemoteEnvironment environment;

    private HarnessRuntime(Builder b)
    {
        this.timingPolicy = b.timingPolicy;
        this.observabilitySink = b.observabilitySink;
        this.storage = b.storage;
        this.bindAddress = b.bindAddress;
        this.launcher = b.launcher;

        this.loop = new SingleThreadEventLoop("harness-controller");
        this.context = new TestContext(loop, WallClock.SYSTEM, observabilitySink);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Starts the bus daemon and connects the controller to it.
     */
    public synchronized void start() throws IOException
    {
        if (daemon != null) {
            throw new IllegalStateException("Runtime already started");
        }

        daemon = new BusDaemon(bindAddress);
        BusAddress address = daemon.start();
        bus = NettyBusConnection.connect(address, loop);

        testRun = new TestRun(context, bus, storage);
        environment = new RemoteEnvironment(bus, testRun, launcher, address.toString(), timingPolicy);
        log.info("Harness runtime started, bus at {}", address);
    }

    public TestContext context()
    {
        return context;
    }

    public synchronized RemoteEnvironment environment()
    {
        requireStarted();
        return environment;
    }

    public synchronized TestRun testRun()
    {
        requireStarted();
        return testRun;
    }

    public TestStorage storage()
    {
        return storage;
    }

    @Override
    public synchronized void close()
    {
        if (testRun != null) {
            testRun.close();
        }
        if (bus != null) {
            bus.close();
        }
        if (daemon != null) {
            daemon.close();
        }
        loop.close();
        log.info("Harness runtime stopped");
    }

    private void requireStarted()
    {
        if (testRun == null) {
            throw new IllegalStateException("Runtime not started");
        }
    }

    public static final class Builder
    {
        private HarnessTimingPolicy timingPolicy = HarnessTimingPolicy.defaults();
        private HarnessObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private TestStorage storage = new InMemoryTestStorage();
        private InetSocketAddress bindAddress = new InetSocketAddress(InetAddress.getLoopbackAddress(), 0);
        private ProcessLauncher launcher = new OsProcessLauncher();

        public Builder withTimingPolicy(HarnessTimingPolicy policy)
        {
            this.timingPolicy = policy;
            return this;
        }

        public Builder withObservabilitySink(HarnessObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withStorage(TestStorage storage)
        {
            this.storage = storage;
            return this;
        }

        public Builder withBindAddress(InetSocketAddress address)
        {
            this.bindAddress = address;
            return this;
        }

        public Builder withProcessLauncher(ProcessLauncher launcher)
        {
            this.launcher = launcher;
            return this;
        }

        public HarnessRuntime build()
        {
            Objects.requireNonNull(timingPolicy, "timingPolicy");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(storage, "storage");
            Objects.requireNonNull(bindAddress, "bindAddress");
            Objects.requireNonNull(launcher, "launcher");
            return new HarnessRuntime(this);
        }
    }
}
