package com.questrail.harness.bus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One frame of the bus protocol.
 *
 * <h2>Addressing</h2>
 * {@code sender} is always stamped by the daemon with the unique name of the
 * originating connection. {@code destination} is a unique or well-known name
 * for calls, a unique name for replies, and unused for signals (signals are
 * broadcast and filtered by the receiver).
 *
 * <h2>Replies</h2>
 * A {@link Type#METHOD_RETURN} or {@link Type#ERROR} answers the call whose
 * {@code serial} equals its {@code replySerial}.
 */
public record BusMessage(
        Type type,
        long serial,
        long replySerial,
        String sender,
        String destination,
        String path,
        String iface,
        String member,
        String errorName,
        List<Object> args
) {
    public enum Type
    {
        HELLO,
        REQUEST_NAME,
        METHOD_CALL,
        METHOD_RETURN,
        ERROR,
        SIGNAL,
        NAME_OWNER_CHANGED
    }

    public BusMessage {
        Objects.requireNonNull(type, "type");
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    public static BusMessage hello(long serial) {
        return new BusMessage(Type.HELLO, serial, 0, null, null, null, null, null, null, List.of());
    }

    public static BusMessage requestName(long serial, String name) {
        return new BusMessage(Type.REQUEST_NAME, serial, 0, null, null, null, null, null, null, List.of(name));
    }

    public static BusMessage methodCall(long serial, String destination, String path, String iface,
                                        String member, List<Object> args) {
        return new BusMessage(Type.METHOD_CALL, serial, 0, null, destination, path, iface, member, null, args);
    }

    public static BusMessage methodReturn(long serial, long replySerial, String destination, List<Object> args) {
        return new BusMessage(Type.METHOD_RETURN, serial, replySerial, null, destination, null, null, null, null, args);
    }

    public static BusMessage error(long serial, long replySerial, String destination, String errorName, String text) {
        return new BusMessage(Type.ERROR, serial, replySerial, null, destination, null, null, null, errorName,
                Collections.singletonList(text));
    }

    public static BusMessage signal(long serial, String path, String iface, String member, List<Object> args) {
        return new BusMessage(Type.SIGNAL, serial, 0, null, null, path, iface, member, null, args);
    }

    public static BusMessage nameOwnerChanged(String name, String oldOwner, String newOwner) {
        return new BusMessage(Type.NAME_OWNER_CHANGED, 0, 0, null, null, null, null, null, null,
                List.of(name, oldOwner, newOwner));
    }

    public BusMessage withSender(String sender) {
        return new BusMessage(type, serial, replySerial, sender, destination, path, iface, member, errorName, args);
    }

    /**
     * First argument, or {@code null} for an empty body.
     */
    public Object firstArg() {
        return args.isEmpty() ? null : args.get(0);
    }
}
