package io.surfworks.hpcrunner.job;

import java.util.EnumSet;
import java.util.Set;

/**
 * Normalized job status shared by every scheduler backend.
 *
 * <p>Each backend maps its own state vocabulary onto these values. Codes a
 * backend does not recognize map to {@link #UNKNOWN}.
 *
 * <p>The values split into two disjoint partitions: <em>active</em>
 * ({@code PENDING}, {@code RUNNING}, {@code UNKNOWN}) and <em>complete</em>
 * ({@code COMPLETED}, {@code FAILED}, {@code CANCELLED}, {@code TIMEOUT}).
 */
public enum JobStatus {
    /** Job is waiting in queue to be scheduled (also held and suspended jobs) */
    PENDING,

    /** Job is currently executing */
    RUNNING,

    /** Job finished successfully */
    COMPLETED,

    /** Job finished with an error */
    FAILED,

    /** Job was cancelled or deleted */
    CANCELLED,

    /** Job exceeded its time limit */
    TIMEOUT,

    /** Scheduler reported a state we could not classify */
    UNKNOWN;

    /** Statuses of jobs the scheduler still tracks as live. */
    public static final Set<JobStatus> ACTIVE =
            Set.copyOf(EnumSet.of(PENDING, RUNNING, UNKNOWN));

    /** Statuses of jobs that have left the live queue. */
    public static final Set<JobStatus> COMPLETE =
            Set.copyOf(EnumSet.of(COMPLETED, FAILED, CANCELLED, TIMEOUT));

    /**
     * Returns true if the job is still active (not yet finished).
     */
    public boolean isActive() {
        return this == PENDING || this == RUNNING || this == UNKNOWN;
    }

    /**
     * Returns true if the job has finished, successfully or not.
     */
    public boolean isComplete() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == TIMEOUT;
    }

    /**
     * Returns true if this status indicates successful completion.
     */
    public boolean isSuccess() {
        return this == COMPLETED;
    }
}
