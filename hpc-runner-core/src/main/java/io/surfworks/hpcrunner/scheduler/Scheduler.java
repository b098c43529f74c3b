package io.surfworks.hpcrunner.scheduler;

import io.surfworks.hpcrunner.job.ArrayJobResult;
import io.surfworks.hpcrunner.job.JobArraySpec;
import io.surfworks.hpcrunner.job.JobInfo;
import io.surfworks.hpcrunner.job.JobResult;
import io.surfworks.hpcrunner.job.JobSpec;
import io.surfworks.hpcrunner.job.JobStatus;
import io.surfworks.hpcrunner.job.OutputStreamKind;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Service Provider Interface for batch schedulers.
 * Implementations translate this contract into a scheduler's own command-line tools.
 *
 * <p>Schedulers are responsible for:
 * <ul>
 *   <li>Submitting jobs and job arrays</li>
 *   <li>Reporting live and historical job state as normalized {@link JobInfo} records</li>
 *   <li>Managing job lifecycle (cancellation)</li>
 * </ul>
 *
 * <p>Status queries are used on a polling hot path: {@link #status}, {@link #cancel}
 * and {@link #hasAccounting} never throw, and transient failures resolve to
 * {@link JobStatus#UNKNOWN} or {@code false}.
 *
 * <p>Implementations must be thread-safe.
 */
public interface Scheduler extends AutoCloseable {

    /**
     * Returns the name of this scheduler ("sge", "slurm", "pbs" or "local").
     */
    String name();

    /**
     * Returns the capabilities of this scheduler.
     */
    SchedulerCapabilities capabilities();

    /**
     * Submits a job.
     *
     * <p>A batch submission returns as soon as the scheduler accepts the job.
     * An interactive submission blocks until the job's process exits and the
     * result carries its exit code.
     *
     * @param spec        The job to run
     * @param interactive Whether to run attached to the terminal
     * @return Submission result
     * @throws SubmissionException if the scheduler rejected the job or no job id could be parsed
     */
    JobResult submit(JobSpec spec, boolean interactive) throws SubmissionException;

    /**
     * Submits a batch job.
     */
    default JobResult submit(JobSpec spec) throws SubmissionException {
        return submit(spec, false);
    }

    /**
     * Submits a job array. Task ids are derived as {@code baseId.taskIndex}.
     *
     * @throws SubmissionException if the scheduler rejected the array or no job id could be parsed
     */
    ArrayJobResult submitArray(JobArraySpec array) throws SubmissionException;

    /**
     * Cancels a running or pending job.
     *
     * @return true if the scheduler accepted the cancellation; false for unknown
     *         or already finished jobs and when the cancel command failed
     */
    boolean cancel(String jobId);

    /**
     * Gets the current status of a job.
     *
     * @return Current status, or {@link JobStatus#UNKNOWN} if the job is unknown
     *         or the scheduler could not be queried
     */
    JobStatus status(String jobId);

    /**
     * Gets the exit code of a finished job.
     *
     * @return The exit code, or empty while the job is not complete or the code is unknown
     */
    OptionalInt exitCode(String jobId);

    /**
     * Gets the path of a job's standard output or error file.
     */
    Optional<Path> outputPath(String jobId, OutputStreamKind stream);

    /**
     * Renders the job script fed to the submission command. Pure, no I/O.
     */
    String generateScript(JobSpec spec);

    /**
     * Builds the native submission command line. Pure, no I/O.
     */
    List<String> buildSubmitCommand(JobSpec spec);

    /**
     * Lists jobs currently known to the scheduler's live listing.
     *
     * @param query Client-side filters
     * @return Matching jobs in scheduler order
     * @throws SchedulerException if the listing command failed
     */
    List<JobInfo> listActiveJobs(ActiveJobQuery query) throws SchedulerException;

    /**
     * Lists finished jobs from scheduler accounting, most recent first.
     *
     * @param query Filters and result limit
     * @return Matching jobs, at most {@code query.limit()} of them
     * @throws AccountingNotAvailableException if {@link #hasAccounting()} is false;
     *         thrown before any command is run
     * @throws SchedulerException if the accounting command failed
     */
    List<JobInfo> listCompletedJobs(CompletedJobQuery query) throws SchedulerException;

    /**
     * Returns true if this scheduler can report completed jobs.
     */
    boolean hasAccounting();

    /**
     * Gets the full record of a job, consulting the live listing first and accounting second.
     *
     * @throws JobNotFoundException if neither source knows the job
     * @throws SchedulerException if the scheduler could not be queried
     */
    JobInfo jobDetails(String jobId) throws SchedulerException;

    /**
     * Waits for a job to complete (blocking with timeout).
     *
     * @param jobId   The scheduler-assigned job ID
     * @param timeout Maximum time to wait
     * @return The terminal status of the job
     * @throws SchedulerException if waiting was interrupted or timed out
     */
    default JobStatus awaitCompletion(String jobId, Duration timeout) throws SchedulerException {
        long deadlineMillis = System.currentTimeMillis() + timeout.toMillis();
        long pollIntervalMillis = 1000;

        while (System.currentTimeMillis() < deadlineMillis) {
            JobStatus s = status(jobId);
            if (s.isComplete()) {
                return s;
            }
            try {
                Thread.sleep(Math.max(1, Math.min(pollIntervalMillis, deadlineMillis - System.currentTimeMillis())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SchedulerException("Interrupted while waiting for job " + jobId, e);
            }
        }
        throw new SchedulerException("Timeout waiting for job " + jobId + " after " + timeout);
    }

    /**
     * Closes this scheduler and releases any resources.
     */
    @Override
    void close();
}
