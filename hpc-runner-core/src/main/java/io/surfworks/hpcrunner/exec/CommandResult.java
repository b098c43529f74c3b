package io.surfworks.hpcrunner.exec;

import java.util.List;
import java.util.Objects;

/**
 * Captured outcome of an external command.
 *
 * @param command  The command line that was run
 * @param exitCode Process exit code
 * @param stdout   Captured standard output
 * @param stderr   Captured standard error
 */
public record CommandResult(
        List<String> command,
        int exitCode,
        String stdout,
        String stderr
) {

    public CommandResult {
        Objects.requireNonNull(command, "command cannot be null");
        command = List.copyOf(command);
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    /**
     * Creates a successful result with the given standard output.
     */
    public static CommandResult ok(List<String> command, String stdout) {
        return new CommandResult(command, 0, stdout, "");
    }

    /**
     * Returns true if the command exited with status zero.
     */
    public boolean isSuccess() {
        return exitCode == 0;
    }

    /**
     * Returns stdout followed by stderr, for error messages and loose parsing.
     */
    public String combinedOutput() {
        if (stderr.isEmpty()) {
            return stdout;
        }
        if (stdout.isEmpty()) {
            return stderr;
        }
        return stdout + "\n" + stderr;
    }

    /**
     * Returns the command line joined by spaces, for log messages.
     */
    public String commandLine() {
        return String.join(" ", command);
    }
}
