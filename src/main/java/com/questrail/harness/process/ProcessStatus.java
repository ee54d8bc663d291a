package com.questrail.harness.process;

/**
 * Observed state of a worker process.
 */
public sealed interface ProcessStatus permits ProcessStatus.Running, ProcessStatus.Exited, ProcessStatus.Killed
{
    Running RUNNING = new Running();

    default boolean isRunning()
    {
        return this instanceof Running;
    }

    /**
     * Short diagnostic form, e.g. {@code exited(3)} or {@code killed(9)}.
     */
    String describe();

    /**
     * Maps an exit value to a terminal status.
     *
     * <p>The JDK reports a process terminated by signal N as exit value
     * {@code 128 + N}, which a worker may also return on its own. The value is
     * read as a signal only when the supervisor destroyed the process; anything
     * else, including a crash by signal nobody sent, is reported as
     * {@link Exited}.</p>
     *
     * @param destroyed whether the process was destroyed by its supervisor
     */
    static ProcessStatus fromExitValue(int exitValue, boolean destroyed)
    {
        if (destroyed && exitValue > 128 && exitValue < 128 + 65) {
            return new Killed(exitValue - 128);
        }
        return new Exited(exitValue);
    }

    final class Running implements ProcessStatus
    {
        private Running() {}

        @Override
        public String describe()
        {
            return "running";
        }

        @Override
        public String toString()
        {
            return describe();
        }
    }

    record Exited(int code) implements ProcessStatus
    {
        @Override
        public String describe()
        {
            return "exited(" + code + ")";
        }
    }

    record Killed(int signal) implements ProcessStatus
    {
        @Override
        public String describe()
        {
            return "killed(" + signal + ")";
        }
    }
}
