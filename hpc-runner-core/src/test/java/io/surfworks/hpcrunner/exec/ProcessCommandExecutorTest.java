package io.surfworks.hpcrunner.exec;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ForkJoinPool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs real processes through ProcessCommandExecutor.
 */
class ProcessCommandExecutorTest {

    private final ProcessCommandExecutor executor = new ProcessCommandExecutor();

    @Test
    void capturesStdout() throws CommandException {
        CommandResult result = executor.run(List.of("echo", "hello"));

        assertTrue(result.isSuccess());
        assertEquals("hello\n", result.stdout());
        assertEquals("", result.stderr());
        assertEquals("echo hello", result.commandLine());
    }

    @Test
    void feedsStdin() throws CommandException {
        CommandResult result = executor.run(List.of("cat"), "#!/bin/bash\necho job\n", Duration.ofSeconds(10));

        assertEquals("#!/bin/bash\necho job\n", result.stdout());
    }

    @Test
    void nonZeroExitIsReportedNotThrown() throws CommandException {
        CommandResult result = executor.run(List.of("/bin/sh", "-c", "echo oops >&2; exit 4"));

        assertFalse(result.isSuccess());
        assertEquals(4, result.exitCode());
        assertEquals("oops\n", result.stderr());
        assertEquals("oops\n", result.combinedOutput());
    }

    @Test
    void largeOutputDoesNotBlock() throws CommandException {
        CommandResult result = executor.run(
                List.of("/bin/sh", "-c", "head -c 200000 /dev/zero | tr '\\000' x"), null, Duration.ofSeconds(10));

        assertEquals(200000, result.stdout().length());
    }

    @Test
    void largeStderrDrainsWhileCommonPoolIsBusy() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        int workers = Math.max(1, ForkJoinPool.getCommonPoolParallelism());
        for (int i = 0; i < workers; i++) {
            ForkJoinPool.commonPool().execute(() -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        try {
            CommandResult result = executor.run(
                    List.of("/bin/sh", "-c", "head -c 200000 /dev/zero >&2; echo done"), null, Duration.ofSeconds(10));

            assertEquals("done\n", result.stdout());
            assertEquals(200000, result.stderr().length());
        } finally {
            release.countDown();
        }
    }

    @Test
    void hungCommandTimesOut() {
        Instant start = Instant.now();

        CommandTimeoutException e = assertThrows(CommandTimeoutException.class,
                () -> executor.run(List.of("sleep", "30"), null, Duration.ofMillis(300)));

        assertTrue(Duration.between(start, Instant.now()).compareTo(Duration.ofSeconds(10)) < 0);
        assertTrue(e.getMessage().contains("sleep"));
    }

    @Test
    void missingProgramFailsToStart() {
        assertThrows(CommandException.class,
                () -> executor.run(List.of("/nonexistent/hpc-runner-test-binary")));
    }
}
