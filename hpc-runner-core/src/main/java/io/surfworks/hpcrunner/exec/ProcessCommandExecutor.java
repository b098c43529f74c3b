package io.surfworks.hpcrunner.exec;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link CommandExecutor} backed by {@link ProcessBuilder}.
 *
 * <p>Standard output and error are drained on daemon threads owned by this
 * class, never on a shared pool, so a chatty command cannot block on a full
 * pipe. On timeout the process is destroyed forcibly.
 */
public final class ProcessCommandExecutor implements CommandExecutor {

    private static final Logger LOG = Logger.getLogger(ProcessCommandExecutor.class.getName());

    private static final ExecutorService DRAINERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "hpc-runner-process-drain");
        t.setDaemon(true);
        return t;
    });

    @Override
    public CommandResult run(List<String> command, String stdin, Duration timeout) throws CommandException {
        LOG.fine(() -> "Running: " + String.join(" ", command));

        Process p;
        try {
            p = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new CommandException("Failed to start " + command.get(0) + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> stdout = drain(p.getInputStream());
        CompletableFuture<String> stderr = drain(p.getErrorStream());

        try {
            try (OutputStream in = p.getOutputStream()) {
                if (stdin != null) {
                    in.write(stdin.getBytes(StandardCharsets.UTF_8));
                }
            }

            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                throw new CommandTimeoutException(command, timeout);
            }

            return new CommandResult(command, p.exitValue(), stdout.get(), stderr.get());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroyForcibly();
            throw new CommandException("Interrupted while running " + command.get(0), e);
        } catch (IOException | ExecutionException e) {
            p.destroyForcibly();
            throw new CommandException("I/O error while running " + command.get(0) + ": " + e.getMessage(), e);
        }
    }

    @Override
    public int runInteractive(List<String> command, Path workDir) throws CommandException {
        LOG.fine(() -> "Running interactively: " + String.join(" ", command));

        ProcessBuilder pb = new ProcessBuilder(command).inheritIO();
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }
        try {
            return pb.start().waitFor();
        } catch (IOException e) {
            throw new CommandException("Failed to start " + command.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CommandException("Interrupted while running " + command.get(0), e);
        }
    }

    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                LOG.log(Level.FINE, "Error reading process output", e);
                return "";
            }
        }, DRAINERS);
    }
}
