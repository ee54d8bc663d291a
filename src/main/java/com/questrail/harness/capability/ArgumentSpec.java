package com.questrail.harness.capability;

import java.util.Objects;

/**
 * Declaration of one test argument.
 *
 * @param defaultValue value used when the caller supplies none; {@code null} means no default
 */
public record ArgumentSpec(String description, Object defaultValue)
{
    public ArgumentSpec {
        Objects.requireNonNull(description, "description");
    }
}
