package com.questrail.harness.bus;

/**
 * Observer of bus name ownership changes.
 */
public interface MembershipListener
{
    default void nameAppeared(String name) {}

    default void nameRemoved(String name) {}
}
