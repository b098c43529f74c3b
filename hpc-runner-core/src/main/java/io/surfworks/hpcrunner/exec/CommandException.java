package io.surfworks.hpcrunner.exec;

/**
 * Exception thrown when an external command cannot be run to completion.
 */
public class CommandException extends Exception {

    public CommandException(String message) {
        super(message);
    }

    public CommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
