package com.questrail.harness.bus;

import com.questrail.harness.api.Subscription;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * BusConnection
 * =============================================================================
 * One participant's view of the harness bus.
 *
 * <h2>Threading</h2>
 * Exported method handlers, signal handlers and membership listeners run on
 * the connection's dispatch executor (normally the owner's event loop). Reply
 * futures may complete on a transport thread; callers hop back with
 * {@code whenCompleteAsync(..., loop)}.
 *
 * <h2>Failure</h2>
 * A call to a destination without owner, an unknown method, a failing handler
 * or a lost connection completes the future exceptionally with a
 * {@link RemoteCallException}.
 */
public interface BusConnection extends AutoCloseable
{
    /**
     * Name assigned by the daemon, e.g. {@code :1.4}.
     */
    String uniqueName();

    CompletableFuture<Void> requestName(String name);

    /**
     * @return future of the first reply value ({@code null} for an empty reply)
     */
    CompletableFuture<Object> call(String destination, String path, String iface, String member, List<Object> args);

    void emitSignal(String path, String iface, String member, List<Object> args);

    void exportObject(String path, ExportedObject object);

    void unexportObject(String path);

    Subscription subscribeSignal(SignalMatch match, SignalHandler handler);

    Subscription addMembershipListener(MembershipListener listener);

    @Override
    void close();
}
