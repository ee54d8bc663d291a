package com.questrail.harness.core;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered checkitem → passed map.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Every declared checkitem is present from construction, as {@code false}</li>
 *   <li>Items only move {@code false → true}</li>
 *   <li>Names that were not declared are never added</li>
 * </ul>
 */
public final class Checklist
{
    private final Map<String, Boolean> items = new LinkedHashMap<>();

    public Checklist(Collection<String> declared)
    {
        Objects.requireNonNull(declared, "declared");
        for (String name : declared) {
            items.put(name, Boolean.FALSE);
        }
    }

    /**
     * @return {@code true} if {@code name} is declared (whether or not it was already passed)
     */
    public boolean validate(String name)
    {
        if (!items.containsKey(name)) {
            return false;
        }
        items.put(name, Boolean.TRUE);
        return true;
    }

    public boolean isPassed(String name)
    {
        return Boolean.TRUE.equals(items.get(name));
    }

    /**
     * Share of passed items, in percent. Defined for every declared checklist.
     */
    public double successPercentage()
    {
        if (items.isEmpty()) {
            return 0.0;
        }
        long passed = items.values().stream().filter(Boolean::booleanValue).count();
        return passed * 100.0 / items.size();
    }

    public Map<String, Boolean> snapshot()
    {
        return Collections.unmodifiableMap(new LinkedHashMap<>(items));
    }
}
