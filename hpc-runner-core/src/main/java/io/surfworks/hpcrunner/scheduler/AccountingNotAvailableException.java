package io.surfworks.hpcrunner.scheduler;

/**
 * Thrown when completed-job history is requested from a backend without accounting.
 *
 * @see Scheduler#hasAccounting()
 */
public class AccountingNotAvailableException extends SchedulerException {

    public AccountingNotAvailableException(String schedulerName) {
        super("Job accounting is not available for scheduler '" + schedulerName + "'");
    }
}
