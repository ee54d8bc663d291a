package com.questrail.harness.bus;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Well-known names, object paths, interfaces and error names of the harness
 * bus protocol. Every per-test name embeds the test uuid.
 */
public final class BusNames
{
    private BusNames() {}

    /** Environment variable carrying the private bus address to a worker. */
    public static final String BUS_ADDRESS_ENV = "PRIVATE_BUS_ADDRESS";

    public static final String TEST_INTERFACE = "com.questrail.Harness.Test";
    public static final String RUNNER_INTERFACE = "com.questrail.Harness.RemoteRunner";

    public static final String TEST_BUS_NAME_PREFIX = "com.questrail.Harness.Test.Test";
    public static final String TEST_PATH_PREFIX = "/com/questrail/Harness/Test/Test";
    public static final String RUNNER_PATH_PREFIX = "/com/questrail/Harness/Test/RemoteRunner";

    // Test interface methods
    public static final String REMOTE_TEST = "remoteTest";
    public static final String REMOTE_SET_UP = "remoteSetUp";
    public static final String REMOTE_STOP = "remoteStop";
    public static final String REMOTE_TEAR_DOWN = "remoteTearDown";

    // Test interface signals
    public static final String READY_SIGNAL = "remoteReadySignal";
    public static final String STOP_SIGNAL = "remoteStopSignal";
    public static final String VALIDATE_STEP_SIGNAL = "remoteValidateStepSignal";
    public static final String EXTRA_INFO_SIGNAL = "remoteExtraInfoSignal";
    public static final String PING_SIGNAL = "remotePingSignal";

    // Runner interface methods
    public static final String CREATE_TEST_INSTANCE = "createTestInstance";

    // Errors
    public static final String ERROR_SERVICE_UNKNOWN = "com.questrail.Harness.Error.ServiceUnknown";
    public static final String ERROR_UNKNOWN_OBJECT = "com.questrail.Harness.Error.UnknownObject";
    public static final String ERROR_UNKNOWN_METHOD = "com.questrail.Harness.Error.UnknownMethod";
    public static final String ERROR_FAILED = "com.questrail.Harness.Error.Failed";
    public static final String ERROR_DISCONNECTED = "com.questrail.Harness.Error.Disconnected";

    private static final Pattern BUS_SAFE = Pattern.compile("[A-Za-z0-9_]+");

    public static boolean isBusSafe(String uuid)
    {
        return uuid != null && BUS_SAFE.matcher(uuid).matches();
    }

    /**
     * @throws IllegalArgumentException if {@code uuid} cannot be embedded in an object path
     */
    public static String requireBusSafe(String uuid)
    {
        if (!isBusSafe(uuid)) {
            throw new IllegalArgumentException("uuid '" + uuid + "' may only contain [A-Za-z0-9_]");
        }
        return uuid;
    }

    public static String testBusName(String uuid)
    {
        return TEST_BUS_NAME_PREFIX + requireBusSafe(uuid);
    }

    public static String testObjectPath(String uuid)
    {
        return TEST_PATH_PREFIX + requireBusSafe(uuid);
    }

    public static String runnerObjectPath(String uuid)
    {
        return RUNNER_PATH_PREFIX + requireBusSafe(uuid);
    }

    /**
     * Extracts the uuid from a remote test's bus name.
     */
    public static Optional<String> uuidFromTestBusName(String busName)
    {
        Objects.requireNonNull(busName, "busName");
        if (!busName.startsWith(TEST_BUS_NAME_PREFIX)) {
            return Optional.empty();
        }
        String uuid = busName.substring(TEST_BUS_NAME_PREFIX.length());
        return isBusSafe(uuid) ? Optional.of(uuid) : Optional.empty();
    }
}
