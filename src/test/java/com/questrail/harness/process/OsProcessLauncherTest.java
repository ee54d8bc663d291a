package com.questrail.harness.process;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OsProcessLauncherTest
 * -----------------------------------------------------------------------------
 * Launches a real child JVM; uses real time.
 */
class OsProcessLauncherTest {

    private static String javaExecutable() {
        return Path.of(System.getProperty("java.home"), "bin", "java").toString();
    }

    @Test
    void launchedProcessExitsWithItsStatus() throws Exception {
        ChildProcess process = new OsProcessLauncher().launch(List.of(javaExecutable(), "-version"), Map.of());

        assertTrue(process.pid() > 0);
        assertTrue(process.waitFor(Duration.ofSeconds(30)), "java -version should finish");
        assertEquals(new ProcessStatus.Exited(0), process.status());
    }

    @Test
    void killedProcessIsNoLongerRunning() throws Exception {
        ChildProcess process = new OsProcessLauncher().launch(
                List.of(javaExecutable(), "-cp", System.getProperty("java.class.path"), SleepMain.class.getName()),
                Map.of());

        process.kill();

        assertTrue(process.waitFor(Duration.ofSeconds(30)));
        assertFalse(process.status().isRunning());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void destroyedProcessReportsTheSignal() throws Exception {
        ChildProcess process = new OsProcessLauncher().launch(
                List.of(javaExecutable(), "-cp", System.getProperty("java.class.path"), SleepMain.class.getName()),
                Map.of());

        process.kill();

        assertTrue(process.waitFor(Duration.ofSeconds(30)));
        assertEquals(new ProcessStatus.Killed(9), process.status());
    }

    @Test
    void workerExitingWithAHighCodeIsNotReportedAsKilled() throws Exception {
        ChildProcess process = new OsProcessLauncher().launch(
                List.of(javaExecutable(), "-cp", System.getProperty("java.class.path"), ExitMain.class.getName(), "137"),
                Map.of());

        assertTrue(process.waitFor(Duration.ofSeconds(30)));
        assertEquals(new ProcessStatus.Exited(137), process.status());
    }

    @Test
    void emptyArgvIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new OsProcessLauncher().launch(List.of(), Map.of()));
    }

    /**
     * Child that sleeps until killed.
     */
    public static final class SleepMain {
        public static void main(String[] args) throws InterruptedException {
            Thread.sleep(60_000);
        }
    }

    /**
     * Child that exits at once with the code given as its argument.
     */
    public static final class ExitMain {
        public static void main(String[] args) {
            System.exit(Integer.parseInt(args[0]));
        }
    }
}
