package com.questrail.harness.api;

/**
 * Handle for an explicit observer registration. Closing is idempotent.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable
{
    @Override
    void close();
}
