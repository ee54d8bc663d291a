package com.questrail.harness.pipeline;

import java.util.Arrays;
import java.util.List;

/**
 * One error posted by a pipeline while it was monitored.
 */
public record PipelineErrorRecord(int code, String domain, String message, String debug)
{
    public static PipelineErrorRecord of(PipelineMessage.Error error)
    {
        return new PipelineErrorRecord(error.code(), error.domain(), error.text(), error.debug());
    }

    /**
     * {@code [code, domain, message, debug]}, the form reported in extra-infos.
     */
    public List<Object> toList()
    {
        return Arrays.asList(code, domain, message, debug);
    }
}
