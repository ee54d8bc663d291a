package com.questrail.harness.remote;

import com.questrail.harness.api.Subscription;
import com.questrail.harness.bus.BusNames;
import com.questrail.harness.capability.CapabilityDescriptor;
import com.questrail.harness.capability.CapabilityLayer;
import com.questrail.harness.core.AbstractTest;
import com.questrail.harness.core.TestContext;
import com.questrail.harness.observability.FailureKind;
import com.questrail.harness.process.ProcessStatus;
import com.questrail.harness.process.ProcessSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.security.CodeSource;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ProxyTest
 * =============================================================================
 * Controller-side half of a test that runs in a separate worker process.
 *
 * <h2>What it does</h2>
 * <ul>
 *   <li>Setup spawns the worker ({@code process-spawned}) and waits,
 *       asynchronously, for it to join the bus ({@code process-connected})</li>
 *   <li>Asks the worker to instantiate {@link #remoteTestClass()}
 *       ({@code remote-instance-created}) and to set it up</li>
 *   <li>Enters its own {@code start()} when the worker reports ready, and
 *       drives the worker's test body from {@link #test()}</li>
 *   <li>Mirrors the worker's checkitems and extra-infos into its own, which
 *       are the source of truth for the outcome</li>
 *   <li>Restarts its test deadline whenever the worker pings</li>
 *   <li>Stops when the worker stops, exits, leaves the bus or a call fails</li>
 * </ul>
 *
 * <p>Nothing is registered with the test run until {@link #run()}; an
 * instance that is never run holds no subscriptions.</p>
 *
 * <h2>Teardown</h2>
 * Asks the worker to stop, drops every bus subscription, then makes sure the
 * worker process is gone before "done" is emitted. The process status ends up
 * in the {@code process-exit-status} extra-info.
 */
public abstract class ProxyTest extends AbstractTest
{
    private static final Logger log = LoggerFactory.getLogger(ProxyTest.class);

    public static final String PROCESS_SPAWNED = "process-spawned";
    public static final String PROCESS_CONNECTED = "process-connected";
    public static final String REMOTE_INSTANCE_CREATED = "remote-instance-created";

    public static final String BUS_ADDRESS_ARGUMENT = "bus-address";
    public static final String PROCESS_EXIT_STATUS = "process-exit-status";

    public static final CapabilityLayer PROXY_LAYER = CapabilityLayer.builder("proxy-test")
            .description("Test whose body runs in a worker process supervised over the bus")
            .includes(AbstractTest.BASE_LAYER)
            .checkItem(PROCESS_SPAWNED, "The worker process was started", "The worker executable could not be launched")
            .checkItem(PROCESS_CONNECTED, "The worker process joined the bus", "The worker crashed or could not reach the bus")
            .checkItem(REMOTE_INSTANCE_CREATED, "The worker instantiated the remote test", "The remote test class could not be loaded")
            .argument(BUS_ADDRESS_ARGUMENT, "Address of the private bus the worker connects to")
            .extraInfo(PROCESS_EXIT_STATUS, "How the worker process ended")
            .asyncSetup(true)
            .build();

    private final RemoteEnvironment environment;
    private final ProcessSupervisor supervisor;
    private final RemoteBridge bridge;
    private Subscription membership;

    protected ProxyTest(TestContext context,
                        CapabilityDescriptor descriptor,
                        RemoteEnvironment environment,
                        String uuid,
                        Map<String, ?> arguments)
    {
        super(context, descriptor, uuid, withBusAddress(arguments, environment));
        this.environment = environment;
        BusNames.requireBusSafe(uuid());

        this.supervisor = new ProcessSupervisor(loop(), environment.launcher(), environment.timing(), this::workerExited);
        this.bridge = new RemoteBridge(environment.bus(), loop(), uuid(), new BridgeCallbacks());
    }

    private static Map<String, Object> withBusAddress(Map<String, ?> arguments, RemoteEnvironment environment)
    {
        Objects.requireNonNull(environment, "environment");
        Map<String, Object> merged = new LinkedHashMap<>();
        if (arguments != null) {
            merged.putAll(arguments);
        }
        merged.put(BUS_ADDRESS_ARGUMENT, environment.busAddress());
        return merged;
    }

    /**
     * The worker-side test class the runner instantiates.
     */
    protected abstract Class<? extends RemoteTest> remoteTestClass();

    /**
     * Command line of the worker process. The default runs {@link WorkerMain}
     * on the current JVM with the current classpath.
     */
    protected List<String> remoteLauncherArgs()
    {
        String java = ProcessHandle.current().info().command()
                .orElse(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        return List.of(java, "-cp", System.getProperty("java.class.path"), WorkerMain.class.getName(), uuid());
    }

    @Override
    protected boolean setUp()
    {
        if (!super.setUp()) {
            return false;
        }

        membership = environment.membership().addRemoteTestListener(new MembershipCallbacks());
        Map<String, String> env = Map.of(BusNames.BUS_ADDRESS_ENV, environment.busAddress());
        if (!supervisor.spawn(remoteLauncherArgs(), env)) {
            return false;
        }
        validateStep(PROCESS_SPAWNED);
        return true;
    }

    @Override
    protected void test()
    {
        bridge.callRemoteTest();
    }

    @Override
    protected void tearDown()
    {
        try {
            bridge.callRemoteStop();
        } finally {
            bridge.detach();
            if (membership != null) {
                membership.close();
                membership = null;
            }
            supervisor.terminate();
            supervisor.lastStatus().ifPresent(status -> extraInfo(PROCESS_EXIT_STATUS, status.describe()));
        }
        super.tearDown();
    }

    public final RemoteBridge bridge()
    {
        return bridge;
    }

    private void workerExited(ProcessStatus status)
    {
        reportFailure(FailureKind.WORKER_PROCESS_TERMINATED, "worker " + status.describe(), null);
        stop();
    }

    private void remoteTestConnected()
    {
        validateStep(PROCESS_CONNECTED);

        Class<? extends RemoteTest> cls = remoteTestClass();
        String packageName = cls.getPackageName();
        String className = packageName.isEmpty() ? cls.getName() : cls.getName().substring(packageName.length() + 1);
        CodeSource source = cls.getProtectionDomain().getCodeSource();
        String location = source == null || source.getLocation() == null ? "" : source.getLocation().toString();

        bridge.createRemoteInstance(location, packageName, className, getArguments());
    }

    /**
     * Bridge events, translated into lifecycle calls on this test.
     */
    private final class BridgeCallbacks implements RemoteBridgeListener
    {
        @Override
        public void onRemoteInstanceCreated(boolean created)
        {
            if (isStopping()) {
                return;
            }
            if (!created) {
                log.warn("Test {}: worker could not create {}", uuid(), remoteTestClass().getName());
                reportFailure(FailureKind.REMOTE_CALL_FAILURE, "createTestInstance returned false", null);
                stop();
                return;
            }
            validateStep(REMOTE_INSTANCE_CREATED);
            bridge.attach();
            bridge.callRemoteSetUp();
        }

        @Override
        public void onRemoteReady()
        {
            start();
        }

        @Override
        public void onRemoteStopped()
        {
            if (!isStopping()) {
                stop();
            }
        }

        @Override
        public void onRemotePing()
        {
            ping();
        }

        @Override
        public void onRemoteStepValidated(String checkItem)
        {
            validateStep(checkItem);
        }

        @Override
        public void onRemoteExtraInfo(String key, Object value)
        {
            extraInfo(key, value);
        }

        @Override
        public void onRemoteFailure(String member, Throwable cause)
        {
            if (isStopping()) {
                return;
            }
            log.warn("Test {}: remote call {} failed: {}", uuid(), member, cause.getMessage());
            reportFailure(FailureKind.REMOTE_CALL_FAILURE, member + " failed", cause);
            stop();
        }
    }

    /**
     * Worker membership, filtered to this test's uuid.
     */
    private final class MembershipCallbacks implements RemoteTestListener
    {
        @Override
        public void newRemoteTest(String remoteUuid)
        {
            if (!uuid().equals(remoteUuid) || isStopping()) {
                return;
            }
            remoteTestConnected();
        }

        @Override
        public void removedRemoteTest(String remoteUuid)
        {
            if (!uuid().equals(remoteUuid)) {
                return;
            }
            bridge.remoteDisappeared();
            if (!isStopping()) {
                reportFailure(FailureKind.WORKER_DISAPPEARED, "worker left the bus", null);
                stop();
            }
        }
    }
}
