package io.surfworks.hpcrunner.job;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scheduler-agnostic view of a single job, rebuilt from scheduler output on every poll.
 *
 * <p>Only {@code jobId}, {@code name}, {@code user} and {@code status} are always present.
 * Every other component is null when the backend could not supply it.
 *
 * @param jobId       Scheduler-native job identifier (opaque)
 * @param name        Job name
 * @param user        Owner of the job
 * @param status      Normalized status
 * @param queue       Queue or partition name
 * @param submitTime  When the job was submitted
 * @param startTime   When the job started running
 * @param endTime     When the job finished
 * @param runtime     Wall-clock time used so far (or in total, for finished jobs)
 * @param cpu         Number of cores or slots
 * @param memory      Memory request or usage as reported, e.g. "16G"
 * @param gpu         Number of GPUs
 * @param exitCode    Exit code of a finished job
 * @param stdoutPath  Standard output file
 * @param stderrPath  Standard error file
 * @param node        Execution host
 * @param dependencies Ids of jobs this job waits on, in scheduler order
 * @param arrayTaskId Array task index or task range, verbatim
 */
public record JobInfo(
        String jobId,
        String name,
        String user,
        JobStatus status,
        String queue,
        Instant submitTime,
        Instant startTime,
        Instant endTime,
        Duration runtime,
        Integer cpu,
        String memory,
        Integer gpu,
        Integer exitCode,
        Path stdoutPath,
        Path stderrPath,
        String node,
        List<String> dependencies,
        String arrayTaskId
) {

    /** Placeholder shown when a display value is not known */
    public static final String NOT_AVAILABLE = "-";

    public JobInfo {
        Objects.requireNonNull(jobId, "jobId cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(user, "user cannot be null");
        Objects.requireNonNull(status, "status cannot be null");

        if (jobId.isBlank()) {
            throw new IllegalArgumentException("jobId cannot be blank");
        }
        dependencies = dependencies == null ? null : List.copyOf(dependencies);
    }

    /**
     * Creates a builder for constructing JobInfo instances.
     */
    public static Builder builder(String jobId) {
        return new Builder(jobId);
    }

    /**
     * Returns true if the job is still active (not yet completed).
     */
    public boolean isActive() {
        return status.isActive();
    }

    /**
     * Returns true if the job has finished, successfully or not.
     */
    public boolean isComplete() {
        return status.isComplete();
    }

    /**
     * Formats the runtime for display, e.g. "45s", "12m", "2h 15m" or "3d 4h".
     */
    public String runtimeDisplay() {
        if (runtime == null) {
            return NOT_AVAILABLE;
        }

        long totalSeconds = runtime.getSeconds();
        if (totalSeconds < 60) {
            return totalSeconds + "s";
        }

        long minutes = totalSeconds / 60;
        if (minutes < 60) {
            return minutes + "m";
        }

        long hours = minutes / 60;
        if (hours < 24) {
            return hours + "h " + (minutes % 60) + "m";
        }

        return (hours / 24) + "d " + (hours % 24) + "h";
    }

    /**
     * Formats the resource request for display, e.g. "4/16G/1GPU".
     */
    public String resourcesDisplay() {
        List<String> parts = new ArrayList<>();
        if (cpu != null) {
            parts.add(String.valueOf(cpu));
        }
        if (memory != null) {
            parts.add(memory);
        }
        if (gpu != null) {
            parts.add(gpu + "GPU");
        }
        return parts.isEmpty() ? NOT_AVAILABLE : String.join("/", parts);
    }

    /**
     * Returns a builder pre-populated with this job's values.
     */
    public Builder toBuilder() {
        return new Builder(jobId)
                .name(name)
                .user(user)
                .status(status)
                .queue(queue)
                .submitTime(submitTime)
                .startTime(startTime)
                .endTime(endTime)
                .runtime(runtime)
                .cpu(cpu)
                .memory(memory)
                .gpu(gpu)
                .exitCode(exitCode)
                .stdoutPath(stdoutPath)
                .stderrPath(stderrPath)
                .node(node)
                .dependencies(dependencies)
                .arrayTaskId(arrayTaskId);
    }

    /**
     * Builder for JobInfo. Name and user default to empty strings and status to
     * {@link JobStatus#UNKNOWN} when the scheduler output does not include them.
     */
    public static class Builder {
        private final String jobId;
        private String name = "";
        private String user = "";
        private JobStatus status = JobStatus.UNKNOWN;
        private String queue;
        private Instant submitTime;
        private Instant startTime;
        private Instant endTime;
        private Duration runtime;
        private Integer cpu;
        private String memory;
        private Integer gpu;
        private Integer exitCode;
        private Path stdoutPath;
        private Path stderrPath;
        private String node;
        private List<String> dependencies;
        private String arrayTaskId;

        private Builder(String jobId) {
            this.jobId = jobId;
        }

        public Builder name(String name) {
            this.name = name == null ? "" : name;
            return this;
        }

        public Builder user(String user) {
            this.user = user == null ? "" : user;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status == null ? JobStatus.UNKNOWN : status;
            return this;
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder submitTime(Instant submitTime) {
            this.submitTime = submitTime;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder runtime(Duration runtime) {
            this.runtime = runtime;
            return this;
        }

        public Builder cpu(Integer cpu) {
            this.cpu = cpu;
            return this;
        }

        public Builder memory(String memory) {
            this.memory = memory;
            return this;
        }

        public Builder gpu(Integer gpu) {
            this.gpu = gpu;
            return this;
        }

        public Builder exitCode(Integer exitCode) {
            this.exitCode = exitCode;
            return this;
        }

        public Builder stdoutPath(Path stdoutPath) {
            this.stdoutPath = stdoutPath;
            return this;
        }

        public Builder stderrPath(Path stderrPath) {
            this.stderrPath = stderrPath;
            return this;
        }

        public Builder node(String node) {
            this.node = node;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Builder arrayTaskId(String arrayTaskId) {
            this.arrayTaskId = arrayTaskId;
            return this;
        }

        public JobInfo build() {
            return new JobInfo(
                    jobId, name, user, status, queue,
                    submitTime, startTime, endTime, runtime,
                    cpu, memory, gpu, exitCode,
                    stdoutPath, stderrPath, node, dependencies, arrayTaskId
            );
        }
    }
}
