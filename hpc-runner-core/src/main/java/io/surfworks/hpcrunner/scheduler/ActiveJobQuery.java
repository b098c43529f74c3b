package io.surfworks.hpcrunner.scheduler;

import io.surfworks.hpcrunner.job.JobInfo;
import io.surfworks.hpcrunner.job.JobStatus;

import java.util.Set;

/**
 * Filters applied to the live job listing.
 *
 * <p>Filtering happens client-side after the full listing has been parsed.
 *
 * @param user     Only jobs owned by this user (null = all users)
 * @param statuses Only jobs in these statuses (null = the active partition)
 * @param queue    Only jobs in this queue (null = all queues)
 */
public record ActiveJobQuery(
        String user,
        Set<JobStatus> statuses,
        String queue
) {

    public ActiveJobQuery {
        statuses = statuses == null ? null : Set.copyOf(statuses);
    }

    /**
     * Creates a query that matches every active job.
     */
    public static ActiveJobQuery all() {
        return new ActiveJobQuery(null, null, null);
    }

    /**
     * Creates a query for one user's active jobs.
     */
    public static ActiveJobQuery forUser(String user) {
        return new ActiveJobQuery(user, null, null);
    }

    public ActiveJobQuery withUser(String user) {
        return new ActiveJobQuery(user, statuses, queue);
    }

    public ActiveJobQuery withStatuses(Set<JobStatus> statuses) {
        return new ActiveJobQuery(user, statuses, queue);
    }

    public ActiveJobQuery withQueue(String queue) {
        return new ActiveJobQuery(user, statuses, queue);
    }

    /**
     * Returns the status set in effect, substituting the active partition for null.
     */
    public Set<JobStatus> effectiveStatuses() {
        return statuses == null ? JobStatus.ACTIVE : statuses;
    }

    /**
     * Returns true if the job passes every filter of this query.
     */
    public boolean matches(JobInfo job) {
        if (user != null && !user.equals(job.user())) {
            return false;
        }
        if (!effectiveStatuses().contains(job.status())) {
            return false;
        }
        return queue == null || queue.equals(job.queue());
    }
}
