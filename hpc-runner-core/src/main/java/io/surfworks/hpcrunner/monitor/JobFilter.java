package io.surfworks.hpcrunner.monitor;

import io.surfworks.hpcrunner.job.JobStatus;
import io.surfworks.hpcrunner.scheduler.ActiveJobQuery;

import java.util.Objects;
import java.util.Set;

/**
 * User-visible filter of the job monitor.
 *
 * @param scope    Whose jobs to show
 * @param statuses Statuses to show (null = the active partition)
 * @param queue    Queue to show (null = all queues)
 */
public record JobFilter(
        UserScope scope,
        Set<JobStatus> statuses,
        String queue
) {

    public JobFilter {
        Objects.requireNonNull(scope, "scope cannot be null");
        statuses = statuses == null ? null : Set.copyOf(statuses);
    }

    /**
     * The current user's active jobs.
     */
    public static JobFilter mine() {
        return new JobFilter(UserScope.MINE, null, null);
    }

    /**
     * Every user's active jobs.
     */
    public static JobFilter all() {
        return new JobFilter(UserScope.ALL, null, null);
    }

    public JobFilter withScope(UserScope scope) {
        return new JobFilter(scope, statuses, queue);
    }

    public JobFilter withStatuses(Set<JobStatus> statuses) {
        return new JobFilter(scope, statuses, queue);
    }

    public JobFilter withQueue(String queue) {
        return new JobFilter(scope, statuses, queue);
    }

    /**
     * Translates this filter into a listing query.
     *
     * @param currentUser User name substituted for {@link UserScope#MINE}
     */
    public ActiveJobQuery toQuery(String currentUser) {
        return new ActiveJobQuery(scope == UserScope.MINE ? currentUser : null, statuses, queue);
    }
}
