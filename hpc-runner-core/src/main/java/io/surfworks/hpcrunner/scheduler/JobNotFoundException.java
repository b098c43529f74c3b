package io.surfworks.hpcrunner.scheduler;

/**
 * Thrown when neither the live listing nor accounting knows a job id.
 */
public class JobNotFoundException extends SchedulerException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
