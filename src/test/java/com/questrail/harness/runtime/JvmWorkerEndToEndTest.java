package com.questrail.harness.runtime;

import com.questrail.harness.core.AbstractTest;
import com.questrail.harness.core.TestContext;
import com.questrail.harness.observability.RecordingObservabilitySink;
import com.questrail.harness.remote.EchoProxyTest;
import com.questrail.harness.remote.EchoRemoteTest;
import com.questrail.harness.remote.RemoteEnvironment;
import com.questrail.harness.remote.WorkerMain;
import com.questrail.harness.run.storage.TestRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JvmWorkerEndToEndTest
 * -----------------------------------------------------------------------------
 * Full stack: bus daemon over TCP, a worker JVM started through
 * {@link WorkerMain}, and the echo test driven across the process boundary.
 */
class JvmWorkerEndToEndTest {

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private HarnessRuntime runtime;

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.close();
        }
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void echoTestPassesAcrossProcesses() throws Exception {
        runtime = HarnessRuntime.builder()
                .withObservabilitySink(sink)
                .build();
        runtime.start();

        String uuid = AbstractTest.generateUuid();
        JvmEchoProxyTest proxy = new JvmEchoProxyTest(runtime.context(), runtime.environment(), uuid);
        runtime.testRun().addTest(proxy);

        long runId = runtime.testRun().start().get(45, TimeUnit.SECONDS);

        List<TestRecord> records = runtime.storage().getTestsForTestRun(runId);
        assertEquals(1, records.size());
        TestRecord record = records.get(0);
        assertTrue(record.isFinished());
        assertEquals(uuid, record.uuid());
        assertTrue(record.checklist().values().stream().allMatch(Boolean::booleanValue),
                () -> "Checklist: " + record.checklist());
        assertEquals(100.0, record.successPercentage());
        assertEquals(Map.of("uuid", uuid), record.extraInfo().get("echo-info"));
        assertTrue(sink.getFailureKinds().isEmpty(), () -> "Failures: " + sink.getFailureKinds());
    }

    /**
     * Echo test launched as a real worker JVM on the test classpath.
     */
    static final class JvmEchoProxyTest extends EchoProxyTest {

        JvmEchoProxyTest(TestContext context, RemoteEnvironment environment, String uuid) {
            super(context, environment, uuid, Map.of(), EchoRemoteTest.class);
        }

        @Override
        protected List<String> remoteLauncherArgs() {
            String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
            return List.of(java, "-cp", System.getProperty("java.class.path"), WorkerMain.class.getName(), uuid());
        }
    }
}
