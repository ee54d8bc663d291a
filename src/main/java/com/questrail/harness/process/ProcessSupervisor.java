package com.questrail.harness.process;

import com.questrail.harness.config.HarnessTimingPolicy;
import com.questrail.harness.time.EventLoop;
import com.questrail.harness.time.RepeatingTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * ProcessSupervisor
 * =============================================================================
 * Owns at most one worker process for a remote test.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Launch the worker with the given argv and environment overrides</li>
 *   <li>Poll liveness on the event loop without ever blocking it</li>
 *   <li>Report an unexpected exit to the owner exactly once</li>
 *   <li>Guarantee on {@link #terminate()} that the worker is gone</li>
 * </ul>
 *
 * <h2>Termination</h2>
 * {@link #terminate()} is the only blocking operation. It gives the worker
 * {@link HarnessTimingPolicy#stopGracePeriod()} to exit on its own (the owner
 * has asked it to stop over the bus), then force-kills it, waiting
 * {@link HarnessTimingPolicy#killRetryInterval()} after each attempt, at most
 * {@link HarnessTimingPolicy#maxKillAttempts()} times.
 *
 * <p>Must be used from the loop thread only.</p>
 */
public final class ProcessSupervisor
{
    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);

    private final EventLoop loop;
    private final ProcessLauncher launcher;
    private final HarnessTimingPolicy timing;
    private final Consumer<ProcessStatus> onUnexpectedExit;

    private ChildProcess process;
    private RepeatingTask poll;
    private ProcessStatus lastStatus;

    /**
     * @param onUnexpectedExit called on the loop when polling observes that the
     *                         worker terminated before {@link #terminate()}
     */
    public ProcessSupervisor(EventLoop loop,
                             ProcessLauncher launcher,
                             HarnessTimingPolicy timing,
                             Consumer<ProcessStatus> onUnexpectedExit)
    {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.onUnexpectedExit = Objects.requireNonNull(onUnexpectedExit, "onUnexpectedExit");
    }

    /**
     * @return {@code false} if the process could not be launched
     */
    public boolean spawn(List<String> argv, Map<String, String> envOverrides)
    {
        if (process != null) {
            throw new IllegalStateException("a worker process is already supervised");
        }

        try {
            process = launcher.launch(argv, envOverrides);
        } catch (IOException | RuntimeException e) {
            log.error("Could not launch worker {}", argv, e);
            return false;
        }

        poll = RepeatingTask.start(loop, timing.processPollInterval(), this::pollOnce);
        return true;
    }

    public boolean hasProcess()
    {
        return process != null;
    }

    public Optional<Long> pid()
    {
        return process == null ? Optional.empty() : Optional.of(process.pid());
    }

    /**
     * Terminal status of the last supervised process, once known.
     */
    public Optional<ProcessStatus> lastStatus()
    {
        return Optional.ofNullable(lastStatus);
    }

    /**
     * Makes sure the worker is gone. Idempotent; never hangs.
     */
    public void terminate()
    {
        stopPolling();

        ChildProcess p = process;
        if (p == null) {
            return;
        }
        process = null;

        try {
            if (!p.waitFor(timing.stopGracePeriod())) {
                int attempts = 0;
                boolean gone = false;
                while (!gone && attempts < timing.maxKillAttempts()) {
                    attempts++;
                    p.kill();
                    gone = p.waitFor(timing.killRetryInterval());
                }
                if (!gone) {
                    log.error("Worker pid={} survived {} kill attempts", p.pid(), attempts);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while terminating worker pid={}", p.pid());
        }

        ProcessStatus status = p.status();
        if (!status.isRunning()) {
            lastStatus = status;
        }
        log.debug("Worker pid={} terminated: {}", p.pid(), status.describe());
    }

    private RepeatingTask.Outcome pollOnce()
    {
        ChildProcess p = process;
        if (p == null) {
            return RepeatingTask.Outcome.FINISHED;
        }

        ProcessStatus status = p.status();
        if (status.isRunning()) {
            return RepeatingTask.Outcome.RESCHEDULE;
        }

        process = null;
        poll = null;
        lastStatus = status;
        log.info("Worker pid={} terminated unexpectedly: {}", p.pid(), status.describe());
        onUnexpectedExit.accept(status);
        return RepeatingTask.Outcome.FINISHED;
    }

    private void stopPolling()
    {
        RepeatingTask t = poll;
        poll = null;
        if (t != null) {
            t.cancel();
        }
    }
}
