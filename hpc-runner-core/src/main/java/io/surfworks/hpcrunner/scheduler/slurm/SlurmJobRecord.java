package io.surfworks.hpcrunner.scheduler.slurm;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One row of an {@code squeue} or {@code sacct} listing.
 *
 * @param jobId        Base job id (array suffix removed)
 * @param arrayTaskId  Array task index or range, null for plain jobs
 * @param name         Job name
 * @param user         Owner
 * @param state        Raw state, e.g. "RUNNING" or "CANCELLED by 1000"
 * @param partition    Partition
 * @param submitTime   Submission time
 * @param startTime    Start time
 * @param endTime      End time (accounting only)
 * @param elapsed      Elapsed wall-clock time
 * @param cpus         Allocated or requested CPUs
 * @param memory       Memory request, e.g. "16G"
 * @param gpus         GPUs requested through GRES/TRES
 * @param nodes        Node list
 * @param dependencies Ids of jobs this one waits on
 * @param exitCode     Exit code (accounting only)
 */
record SlurmJobRecord(
        String jobId,
        String arrayTaskId,
        String name,
        String user,
        String state,
        String partition,
        Instant submitTime,
        Instant startTime,
        Instant endTime,
        Duration elapsed,
        Integer cpus,
        String memory,
        Integer gpus,
        String nodes,
        List<String> dependencies,
        Integer exitCode
) {

    SlurmJobRecord {
        Objects.requireNonNull(jobId, "jobId cannot be null");
    }
}
