package com.questrail.harness.pipeline;

/**
 * Builds a {@link Pipeline} from a declarative description.
 */
@FunctionalInterface
public interface PipelineParser
{
    Pipeline parse(String description) throws PipelineParseException;
}
