package com.questrail.harness.capability;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ChecklistRegistry
 * =============================================================================
 * Process-wide index of test types by name.
 *
 * <p>Test types register their top layer once, typically from a static
 * initializer:</p>
 * <pre>
 *   static final CapabilityDescriptor DESCRIPTOR =
 *       ChecklistRegistry.INSTANCE.register(LAYER);
 * </pre>
 *
 * <p>Registration resolves the layer graph exactly once. Registering the same
 * declaration again returns the cached descriptor; registering a different
 * declaration under an already-used name is a programming error.</p>
 */
public enum ChecklistRegistry
{
    INSTANCE;

    private final Map<String, Entry> types = new ConcurrentHashMap<>();

    public CapabilityDescriptor register(CapabilityLayer layer)
    {
        Objects.requireNonNull(layer, "layer");
        Entry entry = types.computeIfAbsent(layer.name(),
                name -> new Entry(layer, CapabilityDescriptor.resolve(layer)));
        if (!entry.layer.equals(layer)) {
            throw new IllegalStateException("Test type '" + layer.name() + "' is already registered with a different declaration");
        }
        return entry.descriptor;
    }

    public Optional<CapabilityDescriptor> find(String typeName)
    {
        Entry entry = types.get(typeName);
        return entry == null ? Optional.empty() : Optional.of(entry.descriptor);
    }

    public List<String> typeNames()
    {
        return List.copyOf(types.keySet());
    }

    private static final class Entry
    {
        private final CapabilityLayer layer;
        private final CapabilityDescriptor descriptor;

        private Entry(CapabilityLayer layer, CapabilityDescriptor descriptor)
        {
            this.layer = layer;
            this.descriptor = descriptor;
        }
    }
}
