package com.questrail.harness.remote;

import com.questrail.harness.bus.BusAddress;
import com.questrail.harness.bus.BusNames;
import com.questrail.harness.bus.netty.NettyBusConnection;
import com.questrail.harness.core.TestContext;
import com.questrail.harness.observability.Slf4jObservabilitySink;
import com.questrail.harness.time.SingleThreadEventLoop;
import com.questrail.harness.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point of a worker process: {@code WorkerMain <uuid>}, with the bus
 * address in {@link BusNames#BUS_ADDRESS_ENV}.
 *
 * <p>Connects to the bus, exports a {@link RemoteRunner}, claims the test's
 * bus name and waits until the hosted test is done or the bus goes away.</p>
 *
 * <p>Exit codes: 0 normal end, 1 bus failure, 2 usage or configuration error.</p>
 */
public final class WorkerMain
{
    private static final Logger log = LoggerFactory.getLogger(WorkerMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_BUS_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private WorkerMain() {}

    public static void main(String[] args)
    {
        System.exit(run(args, System.getenv()));
    }

    static int run(String[] args, Map<String, String> env)
    {
        if (args.length != 1 || !BusNames.isBusSafe(args[0])) {
            log.error("usage: WorkerMain <uuid>");
            return EXIT_USAGE;
        }
        String uuid = args[0];

        String rawAddress = env.get(BusNames.BUS_ADDRESS_ENV);
        if (rawAddress == null || rawAddress.isBlank()) {
            log.error("{} is not set", BusNames.BUS_ADDRESS_ENV);
            return EXIT_USAGE;
        }
        BusAddress address;
        try {
            address = BusAddress.parse(rawAddress);
        } catch (IllegalArgumentException e) {
            log.error("Invalid bus address '{}'", rawAddress, e);
            return EXIT_USAGE;
        }

        try (SingleThreadEventLoop loop = new SingleThreadEventLoop("harness-worker-" + uuid)) {
            NettyBusConnection bus;
            try {
                bus = NettyBusConnection.connect(address, loop);
            } catch (IOException e) {
                log.error("Worker {} could not reach the bus", uuid, e);
                return EXIT_BUS_FAILURE;
            }

            CountDownLatch finished = new CountDownLatch(1);
            bus.whenClosed(finished::countDown);

            TestContext context = new TestContext(loop, WallClock.SYSTEM, new Slf4jObservabilitySink());
            RemoteRunner runner = new RemoteRunner(new WorkerSession(context, bus, uuid), finished::countDown);
            runner.export();

            try {
                bus.requestName(BusNames.testBusName(uuid)).get(5, TimeUnit.SECONDS);
                finished.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Worker {} interrupted", uuid);
            } catch (ExecutionException | TimeoutException e) {
                log.error("Worker {} could not claim its bus name", uuid, e);
                bus.close();
                return EXIT_BUS_FAILURE;
            }

            bus.close();
            return EXIT_OK;
        }
    }
}
