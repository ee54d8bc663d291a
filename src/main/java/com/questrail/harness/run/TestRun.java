package com.questrail.harness.run;

import com.questrail.harness.api.Subscription;
import com.questrail.harness.api.TestLifecycle;
import com.questrail.harness.api.TestListener;
import com.questrail.harness.bus.BusConnection;
import com.questrail.harness.bus.BusNames;
import com.questrail.harness.bus.MembershipListener;
import com.questrail.harness.core.TestContext;
import com.questrail.harness.remote.RemoteTestListener;
import com.questrail.harness.remote.RemoteTestMembership;
import com.questrail.harness.run.generator.Generator;
import com.questrail.harness.run.storage.TestStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * TestRun
 * =============================================================================
 * Runs a queue of tests one after the other and records them.
 *
 * <h2>Sequencing</h2>
 * Each test's "done" starts the next test; when the queue is empty the run is
 * closed in storage and {@link #completion()} completes with the run id.
 *
 * <h2>Membership</h2>
 * Watches the bus for test names ({@code com.questrail.Harness.Test.Test<uuid>})
 * appearing and disappearing, and relays them to proxies as
 * {@code newRemoteTest} / {@code removedRemoteTest}.
 *
 * <h2>Threading model</h2>
 * Runs on the context's event loop; {@link #start()} may be called from any
 * thread.
 */
public final class TestRun implements RemoteTestMembership, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(TestRun.class);

    private final TestContext context;
    private final TestStorage storage;
    private final Deque<TestLifecycle> queue = new ArrayDeque<>();
    private final List<RemoteTestListener> remoteListeners = new CopyOnWriteArrayList<>();
    private final CompletableFuture<Long> completion = new CompletableFuture<>();
    private final Subscription membership;

    private volatile boolean started;
    private long runId;
    private TestLifecycle current;

    public TestRun(TestContext context, BusConnection bus, TestStorage storage)
    {
        this.context = Objects.requireNonNull(context, "context");
        this.storage = Objects.requireNonNull(storage, "storage");
        Objects.requireNonNull(bus, "bus");
        this.membership = bus.addMembershipListener(new MembershipRelay());
    }

    // ---------------------------------------------------------------------
    // Queue
    // ---------------------------------------------------------------------

    public synchronized void addTest(TestLifecycle test)
    {
        Objects.requireNonNull(test, "test");
        if (started) {
            throw new IllegalStateException("Test run already started");
        }
        queue.add(test);
    }

    /**
     * Queues one test per value of {@code generator}, created by
     * {@code factory} with {@code {argument: value}} as arguments.
     *
     * @return how many tests were queued
     */
    public <T> int addGeneratedTests(String argument,
                                     Generator<T> generator,
                                     Function<Map<String, Object>, ? extends TestLifecycle> factory)
    {
        Objects.requireNonNull(argument, "argument");
        Objects.requireNonNull(generator, "generator");
        Objects.requireNonNull(factory, "factory");

        List<T> values = generator.generate();
        for (T value : values) {
            addTest(factory.apply(Map.of(argument, value)));
        }
        log.debug("Queued {} tests over argument '{}'", values.size(), argument);
        return values.size();
    }

    public synchronized int pendingTests()
    {
        return queue.size();
    }

    // ---------------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------------

    /**
     * Starts running the queue on the event loop.
     *
     * @return {@link #completion()}
     */
    public CompletableFuture<Long> start()
    {
        synchronized (this) {
            if (started) {
                throw new IllegalStateException("Test run already started");
            }
            started = true;
        }
        context.loop().execute(this::begin);
        return completion;
    }

    /**
     * Completes with the run id once every queued test is done.
     */
    public CompletableFuture<Long> completion()
    {
        return completion;
    }

    public TestLifecycle currentTest()
    {
        return current;
    }

    @Override
    public void close()
    {
        membership.close();
    }

    private void begin()
    {
        runId = storage.startNewTestRun(context.wallClock().now());
        log.info("Test run {} started", runId);
        runNext();
    }

    private void runNext()
    {
        TestLifecycle next;
        synchronized (this) {
            next = queue.poll();
        }
        current = next;
        if (next == null) {
            storage.endTestRun(runId, context.wallClock().now());
            log.info("Test run {} finished", runId);
            completion.complete(runId);
            return;
        }

        next.addListener(new TestListener() {
            @Override
            public void onDone(TestLifecycle test) {
                context.loop().execute(() -> testFinished(test));
            }
        });
        storage.newTestStarted(runId, next, context.wallClock().now());
        log.debug("Running test {} [{}]", next.uuid(), next.descriptor().typeName());

        try {
            next.run();
        } catch (RuntimeException e) {
            log.error("Test {} failed to run", next.uuid(), e);
            if (!next.phase().isTerminal()) {
                next.stop();
            }
        }
    }

    private void testFinished(TestLifecycle test)
    {
        storage.newTestFinished(runId, test, context.wallClock().now());
        log.info("Test {} [{}] done: {}%", test.uuid(), test.descriptor().typeName(),
                String.format("%.1f", test.getSuccessPercentage()));
        runNext();
    }

    // ---------------------------------------------------------------------
    // Membership
    // ---------------------------------------------------------------------

    @Override
    public Subscription addRemoteTestListener(RemoteTestListener listener)
    {
        Objects.requireNonNull(listener, "listener");
        remoteListeners.add(listener);
        return () -> remoteListeners.remove(listener);
    }

    private final class MembershipRelay implements MembershipListener
    {
        @Override
        public void nameAppeared(String name)
        {
            BusNames.uuidFromTestBusName(name).ifPresent(uuid -> {
                log.debug("Remote test {} appeared", uuid);
                for (RemoteTestListener l : remoteListeners) {
                    l.newRemoteTest(uuid);
                }
            });
        }

        @Override
        public void nameRemoved(String name)
        {
            BusNames.uuidFromTestBusName(name).ifPresent(uuid -> {
                log.debug("Remote test {} disappeared", uuid);
                for (RemoteTestListener l : remoteListeners) {
                    l.removedRemoteTest(uuid);
                }
            });
        }
    }
}
