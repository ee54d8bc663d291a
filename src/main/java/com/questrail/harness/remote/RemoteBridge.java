package com.questrail.harness.remote;

import com.questrail.harness.api.Subscription;
import com.questrail.harness.bus.BusConnection;
import com.questrail.harness.bus.BusNames;
import com.questrail.harness.bus.BusValues;
import com.questrail.harness.bus.SignalMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;

/**
 * RemoteBridge
 * =============================================================================
 * Proxy-side end of the remote test protocol for one test uuid.
 *
 * <h2>Protocol</h2>
 * <ol>
 *   <li>{@link #createRemoteInstance}: ask the worker's runner object to
 *       instantiate the remote test class</li>
 *   <li>{@link #attach()}: bind to the remote test object and subscribe to its
 *       five signals</li>
 *   <li>{@link #callRemoteSetUp()}, {@link #callRemoteTest()},
 *       {@link #callRemoteStop()}, {@link #callRemoteTearDown()}: fire-and-report
 *       calls whose only observable outcome is a failure callback</li>
 *   <li>{@link #detach()}: drop the subscriptions; anything arriving later is
 *       ignored</li>
 * </ol>
 *
 * <h2>Signal table</h2>
 * Signals are routed through a fixed member → handler table; unknown members
 * are logged and dropped.
 *
 * <h2>Threading</h2>
 * Replies are hopped onto the proxy's loop before they touch any state.
 */
public final class RemoteBridge
{
    private static final Logger log = LoggerFactory.getLogger(RemoteBridge.class);

    private static final Map<String, BiConsumer<RemoteBridgeListener, List<Object>>> SIGNAL_TABLE = Map.of(
            BusNames.READY_SIGNAL, (l, args) -> l.onRemoteReady(),
            BusNames.STOP_SIGNAL, (l, args) -> l.onRemoteStopped(),
            BusNames.PING_SIGNAL, (l, args) -> l.onRemotePing(),
            BusNames.VALIDATE_STEP_SIGNAL, (l, args) -> {
                if (!args.isEmpty() && args.get(0) instanceof String step) {
                    l.onRemoteStepValidated(step);
                }
            },
            BusNames.EXTRA_INFO_SIGNAL, (l, args) -> {
                if (args.size() >= 2 && args.get(0) instanceof String key) {
                    l.onRemoteExtraInfo(key, args.get(1));
                }
            });

    private final BusConnection bus;
    private final Executor loop;
    private final String uuid;
    private final RemoteBridgeListener listener;

    private RemoteLink link;
    private Subscription signals;
    private boolean detached;

    public RemoteBridge(BusConnection bus, Executor loop, String uuid, RemoteBridgeListener listener)
    {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.uuid = BusNames.requireBusSafe(uuid);
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Asks the worker's runner to instantiate {@code moduleName.className}.
     * The outcome arrives as {@link RemoteBridgeListener#onRemoteInstanceCreated}
     * or {@link RemoteBridgeListener#onRemoteFailure}.
     */
    public void createRemoteInstance(String location, String moduleName, String className, Map<String, Object> arguments)
    {
        if (detached) {
            return;
        }
        bus.call(BusNames.testBusName(uuid),
                        BusNames.runnerObjectPath(uuid),
                        BusNames.RUNNER_INTERFACE,
                        BusNames.CREATE_TEST_INSTANCE,
                        BusValues.toWireList(location, moduleName, className, arguments))
                .whenCompleteAsync((reply, error) -> {
                    if (detached) {
                        log.debug("Test {}: dropping {} outcome after detach", uuid, BusNames.CREATE_TEST_INSTANCE);
                        return;
                    }
                    if (error != null) {
                        listener.onRemoteFailure(BusNames.CREATE_TEST_INSTANCE, unwrap(error));
                    }
                    else {
                        listener.onRemoteInstanceCreated(Boolean.TRUE.equals(reply));
                    }
                }, loop);
    }

    /**
     * Binds to the remote test object. Idempotent.
     */
    public void attach()
    {
        if (detached || link != null) {
            return;
        }
        link = new RemoteLink(BusNames.testBusName(uuid), BusNames.testObjectPath(uuid));
        signals = bus.subscribeSignal(
                SignalMatch.of(link.objectPath(), BusNames.TEST_INTERFACE, null),
                this::onSignal);
    }

    public Optional<RemoteLink> link()
    {
        return Optional.ofNullable(link);
    }

    public void callRemoteSetUp()
    {
        callRemote(BusNames.REMOTE_SET_UP);
    }

    public void callRemoteTest()
    {
        callRemote(BusNames.REMOTE_TEST);
    }

    public void callRemoteStop()
    {
        callRemote(BusNames.REMOTE_STOP);
    }

    public void callRemoteTearDown()
    {
        callRemote(BusNames.REMOTE_TEAR_DOWN);
    }

    /**
     * The worker left the bus; no further calls go out.
     */
    public void remoteDisappeared()
    {
        if (link != null) {
            link.markDisconnected();
        }
    }

    /**
     * Drops the signal subscription and silences every pending reply. Idempotent.
     */
    public void detach()
    {
        if (detached) {
            return;
        }
        detached = true;
        if (signals != null) {
            signals.close();
            signals = null;
        }
        if (link != null) {
            link.markDisconnected();
        }
    }

    private void callRemote(String member)
    {
        RemoteLink l = link;
        if (detached || l == null || !l.isLive()) {
            log.debug("Test {}: not calling {}, no live remote instance", uuid, member);
            return;
        }
        bus.call(l.busName(), l.objectPath(), BusNames.TEST_INTERFACE, member, List.of())
                .whenCompleteAsync((reply, error) -> {
                    if (error != null && !detached) {
                        listener.onRemoteFailure(member, unwrap(error));
                    }
                }, loop);
    }

    private void onSignal(String member, List<Object> args)
    {
        if (detached) {
            return;
        }
        BiConsumer<RemoteBridgeListener, List<Object>> handler = SIGNAL_TABLE.get(member);
        if (handler == null) {
            log.debug("Test {}: ignoring unknown signal {}", uuid, member);
            return;
        }
        handler.accept(listener, args);
    }

    private static Throwable unwrap(Throwable error)
    {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
