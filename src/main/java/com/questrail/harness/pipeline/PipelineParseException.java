package com.questrail.harness.pipeline;

/**
 * A pipeline description could not be turned into a {@link Pipeline}.
 */
public final class PipelineParseException extends Exception
{
    public PipelineParseException(String message)
    {
        super(message);
    }

    public PipelineParseException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
