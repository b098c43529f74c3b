package io.surfworks.hpcrunner.scheduler;

/**
 * Thrown when the scheduler rejects a submission or its output carries no job id.
 * Submissions are never retried automatically.
 */
public class SubmissionException extends SchedulerException {

    public SubmissionException(String message) {
        super(message);
    }

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
