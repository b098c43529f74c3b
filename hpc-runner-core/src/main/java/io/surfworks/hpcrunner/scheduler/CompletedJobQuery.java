package io.surfworks.hpcrunner.scheduler;

import io.surfworks.hpcrunner.job.JobInfo;

import java.time.Instant;
import java.util.Comparator;

/**
 * Filters applied to accounting (completed job) queries.
 *
 * @param user     Only jobs owned by this user (null = all users)
 * @param since    Only jobs that finished at or after this time (null = no lower bound)
 * @param until    Only jobs that finished at or before this time (null = no upper bound)
 * @param exitCode Only jobs with this exit code (null = any)
 * @param queue    Only jobs that ran in this queue (null = all queues)
 * @param limit    Maximum number of results, most recent first
 */
public record CompletedJobQuery(
        String user,
        Instant since,
        Instant until,
        Integer exitCode,
        String queue,
        int limit
) {

    /** Default result cap */
    public static final int DEFAULT_LIMIT = 100;

    /** Most recently finished first; jobs without an end time sort last. */
    public static final Comparator<JobInfo> MOST_RECENT_FIRST = Comparator.comparing(
            JobInfo::endTime, Comparator.nullsLast(Comparator.reverseOrder()));

    public CompletedJobQuery {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (since != null && until != null && since.isAfter(until)) {
            throw new IllegalArgumentException("since must not be after until");
        }
    }

    /**
     * Creates a query for the most recent completed jobs of every user.
     */
    public static CompletedJobQuery recent() {
        return new CompletedJobQuery(null, null, null, null, null, DEFAULT_LIMIT);
    }

    /**
     * Creates a query for one user's most recent completed jobs.
     */
    public static CompletedJobQuery forUser(String user) {
        return new CompletedJobQuery(user, null, null, null, null, DEFAULT_LIMIT);
    }

    public CompletedJobQuery withUser(String user) {
        return new CompletedJobQuery(user, since, until, exitCode, queue, limit);
    }

    public CompletedJobQuery inTimeRange(Instant since, Instant until) {
        return new CompletedJobQuery(user, since, until, exitCode, queue, limit);
    }

    public CompletedJobQuery withExitCode(Integer exitCode) {
        return new CompletedJobQuery(user, since, until, exitCode, queue, limit);
    }

    public CompletedJobQuery withQueue(String queue) {
        return new CompletedJobQuery(user, since, until, exitCode, queue, limit);
    }

    public CompletedJobQuery withLimit(int limit) {
        return new CompletedJobQuery(user, since, until, exitCode, queue, limit);
    }

    /**
     * Returns true if the job passes every filter of this query.
     *
     * <p>Time bounds are inclusive and apply to the end time; a job without an
     * end time fails any time bound.
     */
    public boolean matches(JobInfo job) {
        if (user != null && !user.equals(job.user())) {
            return false;
        }
        if (queue != null && !queue.equals(job.queue())) {
            return false;
        }
        if (exitCode != null && !exitCode.equals(job.exitCode())) {
            return false;
        }
        if (since != null || until != null) {
            Instant end = job.endTime();
            if (end == null) {
                return false;
            }
            if (since != null && end.isBefore(since)) {
                return false;
            }
            if (until != null && end.isAfter(until)) {
                return false;
            }
        }
        return true;
    }
}
