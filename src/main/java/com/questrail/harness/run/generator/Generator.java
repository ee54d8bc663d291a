package com.questrail.harness.run.generator;

import java.util.List;

/**
 * Produces the values a test argument is swept over. {@link com.questrail.harness.run.TestRun}
 * queues one test per generated value.
 */
@FunctionalInterface
public interface Generator<T>
{
    List<T> generate();
}
