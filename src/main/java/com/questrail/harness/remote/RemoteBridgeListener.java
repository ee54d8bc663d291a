package com.questrail.harness.remote;

/**
 * What a {@link RemoteBridge} reports back to its proxy. Every callback runs on
 * the proxy's event loop.
 */
public interface RemoteBridgeListener
{
    void onRemoteInstanceCreated(boolean created);

    void onRemoteReady();

    void onRemoteStopped();

    /**
     * The worker reports progress; the test deadline starts over.
     */
    void onRemotePing();

    void onRemoteStepValidated(String checkItem);

    void onRemoteExtraInfo(String key, Object value);

    /**
     * A call to the worker failed (error reply, unknown destination, lost connection).
     */
    void onRemoteFailure(String member, Throwable cause);
}
