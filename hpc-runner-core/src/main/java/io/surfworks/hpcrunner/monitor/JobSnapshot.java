package io.surfworks.hpcrunner.monitor;

import io.surfworks.hpcrunner.job.JobInfo;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable result of one successful refresh.
 *
 * @param jobs        Jobs in scheduler order
 * @param filter      Filter the listing was made with
 * @param refreshedAt When the listing completed (null for the initial empty snapshot)
 */
public record JobSnapshot(
        List<JobInfo> jobs,
        JobFilter filter,
        Instant refreshedAt
) {

    public JobSnapshot {
        Objects.requireNonNull(jobs, "jobs cannot be null");
        Objects.requireNonNull(filter, "filter cannot be null");
        jobs = List.copyOf(jobs);
    }

    /**
     * Snapshot published before the first refresh.
     */
    public static JobSnapshot empty(JobFilter filter) {
        return new JobSnapshot(List.of(), filter, null);
    }

    public int count() {
        return jobs.size();
    }

    public boolean isEmpty() {
        return jobs.isEmpty();
    }
}
