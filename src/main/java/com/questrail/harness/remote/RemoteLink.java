package com.questrail.harness.remote;

import java.util.Objects;

/**
 * Reference to the remote test object a proxy talks to.
 *
 * <p>A link never owns the worker. It goes dead when the worker leaves the
 * bus or the bridge is detached, after which no call is sent through it.</p>
 */
public final class RemoteLink
{
    private final String busName;
    private final String objectPath;
    private boolean live = true;

    RemoteLink(String busName, String objectPath)
    {
        this.busName = Objects.requireNonNull(busName, "busName");
        this.objectPath = Objects.requireNonNull(objectPath, "objectPath");
    }

    public String busName()
    {
        return busName;
    }

    public String objectPath()
    {
        return objectPath;
    }

    public boolean isLive()
    {
        return live;
    }

    void markDisconnected()
    {
        live = false;
    }

    @Override
    public String toString()
    {
        return "RemoteLink[" + busName + " " + objectPath + (live ? "" : " (dead)") + "]";
    }
}
