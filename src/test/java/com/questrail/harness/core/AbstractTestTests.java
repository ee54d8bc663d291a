package com.questrail.harness.core;

import com.questrail.harness.api.TestLifecycle;
import com.questrail.harness.api.TestListener;
import com.questrail.harness.api.TestPhase;
import com.questrail.harness.capability.CapabilityDescriptor;
import com.questrail.harness.capability.CapabilityLayer;
import com.questrail.harness.observability.FailureKind;
import com.questrail.harness.observability.RecordingObservabilitySink;
import com.questrail.harness.observability.TestPhaseTransitionEvent;
import com.questrail.harness.time.CpuClock;
import com.questrail.harness.time.DeterministicScheduler;
import com.questrail.harness.time.WallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AbstractTestTests
 * -----------------------------------------------------------------------------
 * Lifecycle contract of the base test: one "done" per instance, deadlines,
 * setup failure, synchronous vs asynchronous tests.
 */
class AbstractTestTests {

    private static final CapabilityLayer SYNC_LAYER = CapabilityLayer.builder("sync-sample")
            .includes(AbstractTest.BASE_LAYER)
            .checkItem("body-ran", "The test body ran")
            .argument("label", "A free-form label", "default-label")
            .asyncTest(false)
            .build();

    private static final CapabilityLayer ASYNC_LAYER = CapabilityLayer.builder("async-sample")
            .includes(AbstractTest.BASE_LAYER)
            .checkItem("body-ran", "The test body ran")
            .asyncSetup(true)
            .asyncSetupTimeout(Duration.ofMillis(1))
            .testTimeout(Duration.ofSeconds(2))
            .build();

    private DeterministicScheduler loop;
    private RecordingObservabilitySink sink;
    private TestContext context;

    @BeforeEach
    void setUp() {
        loop = new DeterministicScheduler();
        sink = new RecordingObservabilitySink();
        context = new TestContext(loop, WallClock.SYSTEM, sink);
    }

    @Test
    void freshTestHasAllCheckItemsFalse() {
        SampleTest test = new SampleTest(context, CapabilityDescriptor.resolve(SYNC_LAYER), Map.of());

        assertEquals(TestPhase.CREATED, test.phase());
        assertEquals(Map.of(AbstractTest.TEST_STARTED, false, "body-ran", false), test.getChecklist());
        assertEquals(0.0, test.getSuccessPercentage());
        assertEquals(32, test.uuid().length());
    }

    @Test
    void argumentsAreFilteredAndDefaulted() {
        SampleTest test = new SampleTest(context, CapabilityDescriptor.resolve(SYNC_LAYER),
                Map.of("unknown", 1));

        assertEquals(Map.of("label", "default-label"), test.getArguments());
    }

    @Test
    void synchronousTestIsStoppedByRun() {
        SampleTest test = new SampleTest(context, CapabilityDescriptor.resolve(SYNC_LAYER), Map.of());
        DoneCounter done = new DoneCounter();
        test.addListener(done);

        test.run();

        assertEquals(TestPhase.DONE, test.phase());
        assertEquals(1, done.count);
        assertEquals(1, test.tearDowns);
        assertEquals(100.0, test.getSuccessPercentage());
        assertTrue(test.getExtraInfo().containsKey(AbstractTest.SETUP_DURATION));
        assertTrue(test.getExtraInfo().containsKey(AbstractTest.TOTAL_DURATION));
        assertEquals(0, loop.pendingTasks(), "Every deadline is cancelled by teardown");
    }

    @Test
    void stopIsIdempotent() {
        SampleTest test = new SampleTest(context, CapabilityDescriptor.resolve(ASYNC_LAYER), Map.of());
        DoneCounter done = new DoneCounter();
        test.addListener(done);

        test.run();
        test.stop();
        test.stop();
        test.stop();

        assertEquals(1, done.count);
        assertEquals(1, test.tearDowns);
    }

    @Test
    void asyncSetupDeadlineStopsTheTest() {
        SampleTest test = new SampleTest(context, CapabilityDescriptor.resolve(ASYNC_LAYER), Map.of());
        DoneCounter done = new DoneCounter();
        test.addListener(done);

        test.run();
        assertEquals(TestPhase.AWAITING_ASYNC_READY, test.phase());

        loop.advance(Duration.ofMillis(1));

        assertEquals(TestPhase.DONE, test.phase());
        assertFalse(test.getChecklist().get(AbstractTest.TEST_STARTED));
        assertTrue(test.getSuccessPercentage() < 100.0);
        assertEquals(1, done.count);
        assertEquals(List.of(FailureKind.ASYNC_SETUP_TIMEOUT), sink.getFailureKinds());
    }

    @Test
    void startCancelsTheAsyncSetupDeadline() {
        SampleTest test = new SampleTest(context, CapabilityDescriptor.resolve(ASYNC_LAYER), Map.of());
        test.run();

        test.becomeReady();
        loop.advance(Duration.ofMillis(5));

        assertEquals(TestPhase.RUNNING, test.phase());
        assertTrue(test.getChecklist().get(AbstractTest.TEST_STARTED));
        assertTrue(sink.getFailureKinds().isEmpty());
    }

    @Test
    void testDeadlineStopsARunningTest() {
        SampleTest test = new SampleTest(context, CapabilityDescriptor.resolve(ASYNC_LAYER), Map.of());
        test.run();
        test.becomeReady();

        loop.advance(Duration.ofSeconds(2));

        assertEquals(TestPhase.DONE, test.phase());
        assertEquals(List.of(FailureKind.TEST_TIMEOUT), sink.getFailureKinds());
    }

    @Test
    void setTimeoutIsRefusedOnceRunning() {
        SampleTest test = new SampleTest(context, CapabilityDescriptor.resolve(ASYNC_LAYER), Map.of());

        assertTrue(test.setTimeout(Duration.ofSeconds(5)));
        assertEquals(Duration.ofSeconds(5), test.getTimeout());
        assertThrows(IllegalArgumentException.class, () -> test.setTimeout(Duration.ZERO));

        test.run();
        test.becomeReady();

        assertFalse(test.setTimeout(Duration.ofSeconds(30)));
        assertEquals(Duration.ofSeconds(5), test.getTimeout());

        loop.advance(Duration.ofSeconds(5));
        assertEquals(TestPhase.DONE, test.phase());
    }

    @Test
    void failedSetUpStopsWithoutStarting() {
        SampleTest test = new SampleTest(context, CapabilityDescriptor.resolve(SYNC_LAYER), Map.of());
        test.setUpResult = false;
        DoneCounter done = new DoneCounter();
        test.addListener(done);

        test.run();

        assertEquals(TestPhase.DONE, test.phase());
        assertEquals(0, test.bodyRuns);
        assertEquals(1, done.count);
        assertEquals(0, done.starts);
        assertEquals(List.of(FailureKind.SETUP_FAILURE), sink.getFailureKinds());
    }

    @Test
    void runTwiceIsAProgrammingError() {
        SampleTest test = new SampleTest(context, CapabilityDescriptor.resolve(SYNC_LAYER), Map.of());
        test.run();
        assertThrows(IllegalStateException.class, test::run);
    }

    @Test
    void undeclaredCheckItemsAreIgnored() {
        SampleTest test = new SampleTest(context, CapabilityDescriptor.resolve(ASYNC_LAYER), Map.of());
        List<String> checks = new ArrayList<>();
        test.addListener(new TestListener() {
            @Override
            public void onCheck(TestLifecycle t, String checkItem) {
                checks.add(checkItem);
            }
        });

        test.validateStep("not-declared");

        assertEquals(List.of(), checks);
        assertFalse(test.getChecklist().containsKey("not-declared"));
    }

    @Test
    void startIsDeliveredBeforeTheFirstCheckItem() {
        SampleTest test = new SampleTest(context, CapabilityDescriptor.resolve(SYNC_LAYER), Map.of());
        List<String> events = new ArrayList<>();
        test.addListener(new TestListener() {
            @Override
            public void onStart(TestLifecycle t) {
                events.add("start");
            }

            @Override
            public void onCheck(TestLifecycle t, String checkItem) {
                events.add(checkItem);
            }

            @Override
            public void onDone(TestLifecycle t) {
                events.add("done");
            }
        });

        test.run();

        assertEquals(List.of("start", AbstractTest.TEST_STARTED, "body-ran", "done"), events);
    }

    @Test
    void failingListenerDoesNotBreakTheLifecycle() {
        SampleTest test = new SampleTest(context, CapabilityDescriptor.resolve(SYNC_LAYER), Map.of());
        test.addListener(new TestListener() {
            @Override
            public void onCheck(TestLifecycle t, String checkItem) {
                throw new IllegalStateException("listener bug");
            }
        });
        DoneCounter done = new DoneCounter();
        test.addListener(done);

        test.run();

        assertEquals(1, done.count);
        assertEquals(100.0, test.getSuccessPercentage());
    }

    @Test
    void phaseTransitionsAreReported() {
        SampleTest test = new SampleTest(context, CapabilityDescriptor.resolve(SYNC_LAYER), Map.of());
        test.run();

        List<TestPhase> phases = sink.getPhaseTransitions().stream()
                .map(TestPhaseTransitionEvent::newPhase)
                .collect(Collectors.toList());
        assertEquals(List.of(TestPhase.SETTING_UP, TestPhase.RUNNING, TestPhase.STOPPING, TestPhase.DONE), phases);
    }

    @Test
    void listenerStoppingTheTestFromOnStartPreventsTheBody() {
        SampleTest test = new SampleTest(context, CapabilityDescriptor.resolve(ASYNC_LAYER), Map.of());
        test.addListener(new TestListener() {
            @Override
            public void onStart(TestLifecycle t) {
                t.stop();
            }
        });
        DoneCounter done = new DoneCounter();
        test.addListener(done);

        test.run();
        test.becomeReady();

        assertEquals(TestPhase.DONE, test.phase());
        assertEquals(0, test.bodyRuns);
        assertEquals(1, done.count);
        assertFalse(test.getChecklist().get(AbstractTest.TEST_STARTED));
        assertEquals(0, loop.pendingTasks(), "No test deadline is armed after the stop");
    }

    @Test
    void listenerStoppingTheTestOnTestStartedPreventsTheBody() {
        SampleTest test = new SampleTest(context, CapabilityDescriptor.resolve(SYNC_LAYER), Map.of());
        test.addListener(new TestListener() {
            @Override
            public void onCheck(TestLifecycle t, String checkItem) {
                if (AbstractTest.TEST_STARTED.equals(checkItem)) {
                    t.stop();
                }
            }
        });

        test.run();

        assertEquals(TestPhase.DONE, test.phase());
        assertEquals(0, test.bodyRuns);
        assertEquals(1, test.tearDowns);
        assertEquals(0, loop.pendingTasks());
    }

    @Test
    void pingRestartsTheTestDeadline() {
        SampleTest test = new SampleTest(context, CapabilityDescriptor.resolve(ASYNC_LAYER), Map.of());
        test.run();
        test.becomeReady();

        loop.advance(Duration.ofMillis(1500));
        test.keepAlive();
        loop.advance(Duration.ofMillis(1500));

        assertEquals(TestPhase.RUNNING, test.phase());
        assertTrue(sink.getFailureKinds().isEmpty());

        loop.advance(Duration.ofMillis(500));

        assertEquals(TestPhase.DONE, test.phase());
        assertEquals(List.of(FailureKind.TEST_TIMEOUT), sink.getFailureKinds());
    }

    @Test
    void pingAfterStopIsIgnored() {
        SampleTest test = new SampleTest(context, CapabilityDescriptor.resolve(ASYNC_LAYER), Map.of());
        test.run();
        test.becomeReady();
        test.stop();

        test.keepAlive();

        assertEquals(TestPhase.DONE, test.phase());
        assertEquals(0, loop.pendingTasks());
    }

    @Test
    void cpuLoadIsCpuTimeOverElapsedTime() {
        long[] cpuNanos = {2_000_000_000L};
        TestContext cpuContext = new TestContext(loop, WallClock.SYSTEM, sink, () -> cpuNanos[0]);
        SampleTest test = new SampleTest(cpuContext, CapabilityDescriptor.resolve(ASYNC_LAYER), Map.of());
        test.run();
        test.becomeReady();

        loop.advance(Duration.ofSeconds(1));
        cpuNanos[0] += 500_000_000L;
        test.stop();

        assertEquals(50, test.getExtraInfo().get(AbstractTest.CPU_LOAD));
    }

    @Test
    void cpuLoadAlreadyReportedIsKept() {
        long[] cpuNanos = {0L};
        TestContext cpuContext = new TestContext(loop, WallClock.SYSTEM, sink, () -> cpuNanos[0]);
        SampleTest test = new SampleTest(cpuContext, CapabilityDescriptor.resolve(ASYNC_LAYER), Map.of());
        test.run();
        test.becomeReady();

        test.extraInfo(AbstractTest.CPU_LOAD, 7);
        loop.advance(Duration.ofSeconds(1));
        cpuNanos[0] = 1_000_000_000L;
        test.stop();

        assertEquals(7, test.getExtraInfo().get(AbstractTest.CPU_LOAD));
    }

    @Test
    void cpuLoadIsSkippedWithoutCpuTime() {
        SampleTest test = new SampleTest(new TestContext(loop, WallClock.SYSTEM, sink, CpuClock.UNSUPPORTED),
                CapabilityDescriptor.resolve(ASYNC_LAYER), Map.of());
        test.run();
        test.becomeReady();
        loop.advance(Duration.ofSeconds(1));
        test.stop();

        assertFalse(test.getExtraInfo().containsKey(AbstractTest.CPU_LOAD));
    }

    private static final class SampleTest extends AbstractTest {
        boolean setUpResult = true;
        int bodyRuns;
        int tearDowns;

        SampleTest(TestContext context, CapabilityDescriptor descriptor, Map<String, ?> arguments) {
            super(context, descriptor, null, arguments);
        }

        void becomeReady() {
            start();
        }

        void keepAlive() {
            ping();
        }

        @Override
        protected boolean setUp() {
            return super.setUp() && setUpResult;
        }

        @Override
        protected void test() {
            bodyRuns++;
            validateStep("body-ran");
        }

        @Override
        protected void tearDown() {
            tearDowns++;
            super.tearDown();
        }
    }

    private static final class DoneCounter implements TestListener {
        int starts;
        int count;

        @Override
        public void onStart(TestLifecycle test) {
            starts++;
        }

        @Override
        public void onDone(TestLifecycle test) {
            count++;
        }
    }
}
