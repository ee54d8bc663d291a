package com.questrail.harness.remote;

import com.questrail.harness.api.Subscription;

/**
 * Source of {@link RemoteTestListener} notifications; implemented by the test run.
 */
public interface RemoteTestMembership
{
    Subscription addRemoteTestListener(RemoteTestListener listener);
}
