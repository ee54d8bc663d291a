package com.questrail.harness.bus;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversion of arbitrary values into bus-representable ones, and typed
 * access to call arguments.
 *
 * <p>Representable values are {@code null}, strings, numbers, booleans, lists
 * and string-keyed maps of representable values. Anything else travels as its
 * {@link String#valueOf(Object) display form}.</p>
 */
public final class BusValues
{
    private BusValues() {}

    public static Object toWire(Object value)
    {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                out.put(String.valueOf(entry.getKey()), toWire(entry.getValue()));
            }
            return out;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> out = new ArrayList<>(collection.size());
            for (Object o : collection) {
                out.add(toWire(o));
            }
            return out;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> out = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                out.add(toWire(Array.get(value, i)));
            }
            return out;
        }
        return String.valueOf(value);
    }

    public static List<Object> toWireList(Object... values)
    {
        List<Object> out = new ArrayList<>(values.length);
        for (Object v : values) {
            out.add(toWire(v));
        }
        return out;
    }

    public static String stringArg(List<Object> args, int index) throws RemoteCallException
    {
        Object value = arg(args, index);
        if (value != null && !(value instanceof String)) {
            throw new RemoteCallException(BusNames.ERROR_FAILED, "argument " + index + " is not a string");
        }
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> mapArg(List<Object> args, int index) throws RemoteCallException
    {
        Object value = arg(args, index);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new RemoteCallException(BusNames.ERROR_FAILED, "argument " + index + " is not a map");
        }
        return (Map<String, Object>) value;
    }

    public static Object arg(List<Object> args, int index) throws RemoteCallException
    {
        if (index >= args.size()) {
            throw new RemoteCallException(BusNames.ERROR_FAILED, "missing argument " + index);
        }
        return args.get(index);
    }
}
