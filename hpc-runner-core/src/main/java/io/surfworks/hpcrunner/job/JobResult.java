package io.surfworks.hpcrunner.job;

import java.util.Objects;

/**
 * Outcome of a submission.
 *
 * <p>For batch submissions the scheduler has only accepted the job, so the
 * status is {@link JobStatus#PENDING} and there is no exit code. Interactive
 * submissions block until the job ends and carry its exit code.
 *
 * @param jobId     Scheduler-assigned job ID
 * @param scheduler Name of the scheduler that accepted the job
 * @param status    Status at the time the submit call returned
 * @param exitCode  Exit code of an interactive run (null for batch submissions)
 */
public record JobResult(
        String jobId,
        String scheduler,
        JobStatus status,
        Integer exitCode
) {

    /** Job id reported for interactive runs, which have no queue entry */
    public static final String INTERACTIVE_ID = "interactive";

    public JobResult {
        Objects.requireNonNull(jobId, "jobId cannot be null");
        Objects.requireNonNull(scheduler, "scheduler cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
    }

    /**
     * Creates the result of a batch submission that was accepted by the scheduler.
     */
    public static JobResult submitted(String jobId, String scheduler) {
        return new JobResult(jobId, scheduler, JobStatus.PENDING, null);
    }

    /**
     * Creates the result of an interactive run that has finished.
     */
    public static JobResult finished(String jobId, String scheduler, int exitCode) {
        return new JobResult(jobId, scheduler,
                exitCode == 0 ? JobStatus.COMPLETED : JobStatus.FAILED, exitCode);
    }

    /**
     * Returns true if the job ran to completion with exit code zero.
     */
    public boolean isSuccess() {
        return status.isSuccess();
    }
}
