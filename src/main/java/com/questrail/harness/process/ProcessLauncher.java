package com.questrail.harness.process;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Starts worker processes.
 */
public interface ProcessLauncher
{
    /**
     * @param argv         command line; the first element is the executable
     * @param envOverrides variables added to (or replacing) the caller's environment
     * @throws IOException if the process cannot be started
     */
    ChildProcess launch(List<String> argv, Map<String, String> envOverrides) throws IOException;
}
