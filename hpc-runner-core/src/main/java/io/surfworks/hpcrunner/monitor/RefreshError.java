package io.surfworks.hpcrunner.monitor;

import java.time.Instant;
import java.util.Objects;

/**
 * A failed refresh.
 *
 * @param message    Human-readable description
 * @param cause      Exception raised by the scheduler
 * @param occurredAt When the refresh failed
 */
public record RefreshError(
        String message,
        Throwable cause,
        Instant occurredAt
) {

    public RefreshError {
        Objects.requireNonNull(message, "message cannot be null");
        Objects.requireNonNull(occurredAt, "occurredAt cannot be null");
    }

    static RefreshError of(Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new RefreshError(message, cause, Instant.now());
    }
}
