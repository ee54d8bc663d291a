package com.questrail.harness.bus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * ExportedObject
 * =============================================================================
 * A statically declared method table served at one object path.
 *
 * <p>The table is fixed when the object is built; incoming calls are routed by
 * member name, never by reflection.</p>
 *
 * <pre>
 *   ExportedObject.builder(BusNames.TEST_INTERFACE)
 *       .method(BusNames.REMOTE_TEST, args -&gt; { remoteTest(); return null; })
 *       .build();
 * </pre>
 */
public final class ExportedObject
{
    @FunctionalInterface
    public interface MethodHandler
    {
        /**
         * @return the single reply value, or {@code null} for an empty reply
         */
        Object invoke(List<Object> args) throws Exception;
    }

    private final String interfaceName;
    private final Map<String, MethodHandler> methods;

    private ExportedObject(String interfaceName, Map<String, MethodHandler> methods)
    {
        this.interfaceName = interfaceName;
        this.methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods));
    }

    public static Builder builder(String interfaceName)
    {
        return new Builder(interfaceName);
    }

    public String interfaceName()
    {
        return interfaceName;
    }

    public Set<String> members()
    {
        return methods.keySet();
    }

    /**
     * @throws RemoteCallException for an unknown interface or member
     * @throws Exception           whatever the handler throws
     */
    public Object invoke(String iface, String member, List<Object> args) throws Exception
    {
        MethodHandler handler = methods.get(member);
        if ((iface != null && !interfaceName.equals(iface)) || handler == null) {
            throw new RemoteCallException(BusNames.ERROR_UNKNOWN_METHOD,
                    "No method " + iface + "." + member + " on " + interfaceName);
        }
        return handler.invoke(args);
    }

    public static final class Builder
    {
        private final String interfaceName;
        private final Map<String, MethodHandler> methods = new LinkedHashMap<>();

        private Builder(String interfaceName)
        {
            this.interfaceName = Objects.requireNonNull(interfaceName, "interfaceName");
        }

        public Builder method(String member, MethodHandler handler)
        {
            Objects.requireNonNull(member, "member");
            Objects.requireNonNull(handler, "handler");
            if (methods.putIfAbsent(member, handler) != null) {
                throw new IllegalArgumentException("Duplicate method " + member);
            }
            return this;
        }

        public ExportedObject build()
        {
            return new ExportedObject(interfaceName, methods);
        }
    }
}
