package io.surfworks.hpcrunner.exec;

import java.time.Duration;
import java.util.List;

/**
 * Thrown when an external command exceeds its time budget and is killed.
 */
public class CommandTimeoutException extends CommandException {

    private final Duration timeout;

    public CommandTimeoutException(List<String> command, Duration timeout) {
        super("Command timed out after " + timeout.toMillis() + "ms: " + String.join(" ", command));
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
