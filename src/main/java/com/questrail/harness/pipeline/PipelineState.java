package com.questrail.harness.pipeline;

/**
 * States a {@link Pipeline} moves through. {@link #VOID_PENDING} is only ever
 * reported as the pending state of a transition that has settled.
 */
public enum PipelineState
{
    VOID_PENDING,
    NULL,
    READY,
    PAUSED,
    PLAYING
}
