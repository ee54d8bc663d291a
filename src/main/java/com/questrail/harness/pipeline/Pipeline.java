package com.questrail.harness.pipeline;

import com.questrail.harness.api.Subscription;

import java.util.function.Consumer;

/**
 * A running processing graph observed through its message stream.
 *
 * <p>Listeners may be called from any thread; {@link PipelineMonitor} hops
 * every message onto its event loop before handling it.</p>
 */
public interface Pipeline
{
    String name();

    void setState(PipelineState state);

    Subscription addMessageListener(Consumer<PipelineMessage> listener);
}
