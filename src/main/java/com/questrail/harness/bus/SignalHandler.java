package com.questrail.harness.bus;

import java.util.List;

@FunctionalInterface
public interface SignalHandler
{
    void onSignal(String member, List<Object> args);
}
