package com.questrail.harness.bus;

import com.questrail.harness.api.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;

/**
 * Transport-independent half of a {@link BusConnection}: the object table,
 * signal subscriptions and membership listeners, and their dispatch onto the
 * owner's executor.
 */
public abstract class AbstractBusConnection implements BusConnection
{
    private static final Logger log = LoggerFactory.getLogger(AbstractBusConnection.class);

    private final Executor dispatcher;
    private final Map<String, ExportedObject> objects = new ConcurrentHashMap<>();
    private final List<SignalSubscription> signalSubscriptions = new CopyOnWriteArrayList<>();
    private final List<MembershipListener> membershipListeners = new CopyOnWriteArrayList<>();

    protected AbstractBusConnection(Executor dispatcher)
    {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    @Override
    public void exportObject(String path, ExportedObject object)
    {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(object, "object");
        if (objects.putIfAbsent(path, object) != null) {
            throw new IllegalStateException("An object is already exported at " + path);
        }
    }

    @Override
    public void unexportObject(String path)
    {
        objects.remove(path);
    }

    @Override
    public Subscription subscribeSignal(SignalMatch match, SignalHandler handler)
    {
        SignalSubscription s = new SignalSubscription(
                Objects.requireNonNull(match, "match"),
                Objects.requireNonNull(handler, "handler"));
        signalSubscriptions.add(s);
        return () -> signalSubscriptions.remove(s);
    }

    @Override
    public Subscription addMembershipListener(MembershipListener listener)
    {
        Objects.requireNonNull(listener, "listener");
        membershipListeners.add(listener);
        return () -> membershipListeners.remove(listener);
    }

    /**
     * Runs the exported handler for an inbound call on the dispatcher and
     * hands its outcome to {@code reply}: {@code (value, null)} on success,
     * {@code (null, error)} on failure.
     */
    protected final void dispatchMethodCall(String path, String iface, String member, List<Object> args,
                                            BiConsumer<Object, RemoteCallException> reply)
    {
        dispatcher.execute(() -> {
            ExportedObject object = objects.get(path);
            if (object == null) {
                reply.accept(null, new RemoteCallException(BusNames.ERROR_UNKNOWN_OBJECT, "No object at " + path));
                return;
            }
            Object result;
            try {
                result = object.invoke(iface, member, args);
            } catch (RemoteCallException e) {
                reply.accept(null, e);
                return;
            } catch (Exception e) {
                log.warn("Handler for {}.{} at {} failed", iface, member, path, e);
                reply.accept(null, new RemoteCallException(BusNames.ERROR_FAILED, String.valueOf(e.getMessage()), e));
                return;
            }
            reply.accept(result, null);
        });
    }

    protected final void dispatchSignal(String path, String iface, String member, List<Object> args)
    {
        dispatcher.execute(() -> {
            for (SignalSubscription s : signalSubscriptions) {
                if (s.match.matches(path, iface, member)) {
                    s.handler.onSignal(member, args);
                }
            }
        });
    }

    protected final void dispatchNameOwnerChanged(String name, String oldOwner, String newOwner)
    {
        boolean hadOwner = oldOwner != null && !oldOwner.isEmpty();
        boolean hasOwner = newOwner != null && !newOwner.isEmpty();
        dispatcher.execute(() -> {
            for (MembershipListener l : membershipListeners) {
                if (hadOwner) {
                    l.nameRemoved(name);
                }
                if (hasOwner) {
                    l.nameAppeared(name);
                }
            }
        });
    }

    private static final class SignalSubscription
    {
        private final SignalMatch match;
        private final SignalHandler handler;

        private SignalSubscription(SignalMatch match, SignalHandler handler)
        {
            this.match = match;
            this.handler = handler;
        }
    }
}
