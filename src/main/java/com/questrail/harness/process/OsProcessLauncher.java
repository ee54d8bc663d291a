package com.questrail.harness.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link ProcessLauncher} backed by {@link ProcessBuilder}.
 *
 * <p>The child inherits the controller's environment plus the overrides, and
 * its standard output and error streams, so worker logs land next to the
 * controller's.</p>
 */
public final class OsProcessLauncher implements ProcessLauncher
{
    private static final Logger log = LoggerFactory.getLogger(OsProcessLauncher.class);

    @Override
    public ChildProcess launch(List<String> argv, Map<String, String> envOverrides) throws IOException
    {
        Objects.requireNonNull(argv, "argv");
        Objects.requireNonNull(envOverrides, "envOverrides");
        if (argv.isEmpty()) {
            throw new IllegalArgumentException("argv must not be empty");
        }

        ProcessBuilder builder = new ProcessBuilder(argv).inheritIO();
        builder.environment().putAll(envOverrides);

        Process process = builder.start();
        log.debug("Launched worker pid={} argv={}", process.pid(), argv);
        return new OsChildProcess(process);
    }

    private static final class OsChildProcess implements ChildProcess
    {
        private final Process process;
        private volatile boolean destroyed;

        private OsChildProcess(Process process)
        {
            this.process = process;
        }

        @Override
        public long pid()
        {
            return process.pid();
        }

        @Override
        public ProcessStatus status()
        {
            if (process.isAlive()) {
                return ProcessStatus.RUNNING;
            }
            return ProcessStatus.fromExitValue(process.exitValue(), destroyed);
        }

        @Override
        public void kill()
        {
            destroyed = true;
            process.destroyForcibly();
        }

        @Override
        public boolean waitFor(Duration timeout) throws InterruptedException
        {
            return process.waitFor(timeout.toNanos(), TimeUnit.NANOSECONDS);
        }
    }
}
