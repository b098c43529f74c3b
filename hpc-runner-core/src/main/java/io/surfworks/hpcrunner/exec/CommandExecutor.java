package io.surfworks.hpcrunner.exec;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs external commands on behalf of the scheduler backends.
 *
 * <p>Backends never start processes themselves; they hand argument lists to an
 * executor. This keeps every scheduler CLI call behind a bounded timeout and
 * lets tests substitute canned output.
 *
 * <p>Implementations must be thread-safe.
 */
public interface CommandExecutor {

    /** Timeout used when a caller does not specify one */
    Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Runs a command, feeding {@code stdin} (if not null) to it and capturing its output.
     *
     * <p>A non-zero exit status is not an error at this level; callers inspect
     * {@link CommandResult#exitCode()}.
     *
     * @param command Program and arguments
     * @param stdin   Text written to the process's standard input, or null
     * @param timeout Maximum time to wait before the process is killed
     * @return Captured result
     * @throws CommandTimeoutException if the command did not finish in time
     * @throws CommandException if the command could not be started or was interrupted
     */
    CommandResult run(List<String> command, String stdin, Duration timeout) throws CommandException;

    /**
     * Runs a command with no input and the default timeout.
     */
    default CommandResult run(List<String> command) throws CommandException {
        return run(command, null, DEFAULT_TIMEOUT);
    }

    /**
     * Runs a command attached to the caller's terminal and waits for it without a timeout.
     *
     * @param command Program and arguments
     * @param workDir Working directory, or null for the current one
     * @return Process exit code
     * @throws CommandException if the command could not be started or was interrupted
     */
    int runInteractive(List<String> command, Path workDir) throws CommandException;
}
