package com.questrail.harness.capability;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * CapabilityDescriptor
 * =============================================================================
 * The fully merged declaration of one test type.
 *
 * <h2>Resolution rule</h2>
 * The layer graph is linearized depth-first, included layers before the layer
 * that includes them, each layer visited once. Declarations are then applied
 * in that order, so a more-derived layer overrides a duplicate key or flag of
 * a layer it builds on, while key order stays base-first.
 *
 * <p>A resolved descriptor must carry at least one checkitem and a value for
 * every lifecycle flag and deadline; in practice that means the layer graph
 * reaches the base test layer.</p>
 */
public final class CapabilityDescriptor
{
    private final String typeName;
    private final String description;
    private final Map<String, CheckItemSpec> checkItems;
    private final Map<String, ArgumentSpec> arguments;
    private final Map<String, String> extraInfos;
    private final boolean asyncSetup;
    private final boolean asyncTest;
    private final Duration testTimeout;
    private final Duration asyncSetupTimeout;

    private CapabilityDescriptor(String typeName,
                                 String description,
                                 Map<String, CheckItemSpec> checkItems,
                                 Map<String, ArgumentSpec> arguments,
                                 Map<String, String> extraInfos,
                                 boolean asyncSetup,
                                 boolean asyncTest,
                                 Duration testTimeout,
                                 Duration asyncSetupTimeout)
    {
        this.typeName = typeName;
        this.description = description;
        this.checkItems = Collections.unmodifiableMap(checkItems);
        this.arguments = Collections.unmodifiableMap(arguments);
        this.extraInfos = Collections.unmodifiableMap(extraInfos);
        this.asyncSetup = asyncSetup;
        this.asyncTest = asyncTest;
        this.testTimeout = testTimeout;
        this.asyncSetupTimeout = asyncSetupTimeout;
    }

    /**
     * Merges {@code layer} with every layer it (transitively) includes.
     *
     * @throws IllegalStateException if the merged declaration is incomplete
     */
    public static CapabilityDescriptor resolve(CapabilityLayer layer)
    {
        Objects.requireNonNull(layer, "layer");

        List<CapabilityLayer> order = new ArrayList<>();
        linearize(layer, new LinkedHashSet<>(), order);

        Map<String, CheckItemSpec> checkItems = new LinkedHashMap<>();
        Map<String, ArgumentSpec> arguments = new LinkedHashMap<>();
        Map<String, String> extraInfos = new LinkedHashMap<>();
        Boolean asyncSetup = null;
        Boolean asyncTest = null;
        Duration testTimeout = null;
        Duration asyncSetupTimeout = null;

        for (CapabilityLayer l : order) {
            checkItems.putAll(l.checkItems());
            arguments.putAll(l.arguments());
            extraInfos.putAll(l.extraInfos());
            if (l.asyncSetup() != null) {
                asyncSetup = l.asyncSetup();
            }
            if (l.asyncTest() != null) {
                asyncTest = l.asyncTest();
            }
            if (l.testTimeout() != null) {
                testTimeout = l.testTimeout();
            }
            if (l.asyncSetupTimeout() != null) {
                asyncSetupTimeout = l.asyncSetupTimeout();
            }
        }

        if (checkItems.isEmpty()) {
            throw new IllegalStateException("Test type '" + layer.name() + "' declares no checkitems");
        }
        if (asyncSetup == null || asyncTest == null || testTimeout == null || asyncSetupTimeout == null) {
            throw new IllegalStateException("Test type '" + layer.name()
                    + "' does not resolve lifecycle flags and deadlines; does it include the base test layer?");
        }

        return new CapabilityDescriptor(layer.name(), layer.description(), checkItems, arguments, extraInfos,
                asyncSetup, asyncTest, testTimeout, asyncSetupTimeout);
    }

    private static void linearize(CapabilityLayer layer, Set<String> inProgress, List<CapabilityLayer> out)
    {
        if (out.contains(layer)) {
            return;
        }
        if (!inProgress.add(layer.name())) {
            throw new IllegalStateException("Capability layer cycle through '" + layer.name() + "'");
        }
        for (CapabilityLayer include : layer.includes()) {
            linearize(include, inProgress, out);
        }
        inProgress.remove(layer.name());
        out.add(layer);
    }

    public String typeName() { return typeName; }

    public String description() { return description; }

    public Map<String, CheckItemSpec> checkItems() { return checkItems; }

    public Map<String, ArgumentSpec> arguments() { return arguments; }

    public Map<String, String> extraInfos() { return extraInfos; }

    public boolean asyncSetup() { return asyncSetup; }

    public boolean asyncTest() { return asyncTest; }

    public Duration testTimeout() { return testTimeout; }

    public Duration asyncSetupTimeout() { return asyncSetupTimeout; }

    public boolean declaresCheckItem(String name) { return checkItems.containsKey(name); }

    /**
     * Keeps the declared arguments of {@code supplied} and fills declared
     * defaults for the ones that are missing. Undeclared keys are dropped.
     */
    public Map<String, Object> filterArguments(Map<String, ?> supplied)
    {
        Map<String, Object> filtered = new LinkedHashMap<>();
        for (Map.Entry<String, ArgumentSpec> e : arguments.entrySet()) {
            Object value = supplied.get(e.getKey());
            if (value == null) {
                value = e.getValue().defaultValue();
            }
            if (value != null) {
                filtered.put(e.getKey(), value);
            }
        }
        return filtered;
    }

    @Override
    public String toString()
    {
        return "CapabilityDescriptor[" + typeName + ", checkItems=" + checkItems.keySet() + "]";
    }
}
