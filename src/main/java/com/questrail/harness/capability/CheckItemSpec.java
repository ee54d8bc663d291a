package com.questrail.harness.capability;

import java.util.Objects;

/**
 * Declaration of one checkitem.
 *
 * @param likelyError hint shown when the item fails; may be {@code null}
 */
public record CheckItemSpec(String description, String likelyError)
{
    public CheckItemSpec {
        Objects.requireNonNull(description, "description");
    }
}
