package io.surfworks.hpcrunner.scheduler.local;

import io.surfworks.hpcrunner.job.JobInfo;
import io.surfworks.hpcrunner.job.JobSpec;
import io.surfworks.hpcrunner.job.JobStatus;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Internal representation of a job in the local scheduler.
 * Tracks job state, the running process and the exit code.
 */
final class LocalJob {

    private final String jobId;
    private final JobSpec spec;
    private final String user;
    private final String arrayTaskId;
    private final Path stdoutPath;
    private final Path stderrPath;
    private final Instant submittedAt;
    private final AtomicReference<JobStatus> state;
    private final CompletableFuture<JobStatus> done;
    private volatile Instant startedAt;
    private volatile Instant completedAt;
    private volatile Integer exitCode;
    private volatile Process process;

    LocalJob(String jobId, JobSpec spec, String user, String arrayTaskId, Path stdoutPath, Path stderrPath) {
        this.jobId = jobId;
        this.spec = spec;
        this.user = user;
        this.arrayTaskId = arrayTaskId;
        this.stdoutPath = stdoutPath;
        this.stderrPath = stderrPath;
        this.submittedAt = Instant.now();
        this.state = new AtomicReference<>(JobStatus.PENDING);
        this.done = new CompletableFuture<>();
    }

    String jobId() {
        return jobId;
    }

    JobSpec spec() {
        return spec;
    }

    String arrayTaskId() {
        return arrayTaskId;
    }

    Path stdoutPath() {
        return stdoutPath;
    }

    Path stderrPath() {
        return stderrPath;
    }

    JobStatus state() {
        return state.get();
    }

    Integer exitCode() {
        return exitCode;
    }

    /**
     * Completes with the terminal status once the job finishes.
     */
    CompletableFuture<JobStatus> done() {
        return done;
    }

    /**
     * Moves the job to RUNNING. Returns false if it was cancelled while queued,
     * in which case the caller must kill the process.
     */
    boolean markRunning(Process p) {
        process = p;
        if (state.compareAndSet(JobStatus.PENDING, JobStatus.RUNNING)) {
            startedAt = Instant.now();
            return true;
        }
        return false;
    }

    void finish(int code) {
        JobStatus terminal = code == 0 ? JobStatus.COMPLETED : JobStatus.FAILED;
        if (state.compareAndSet(JobStatus.RUNNING, terminal)) {
            exitCode = code;
            completed(terminal);
        }
    }

    void fail() {
        if (state.compareAndSet(JobStatus.RUNNING, JobStatus.FAILED)
                || state.compareAndSet(JobStatus.PENDING, JobStatus.FAILED)) {
            completed(JobStatus.FAILED);
        }
    }

    void timeout() {
        if (state.compareAndSet(JobStatus.RUNNING, JobStatus.TIMEOUT)) {
            destroyProcess();
            completed(JobStatus.TIMEOUT);
        }
    }

    /**
     * Cancels a pending or running job, killing its process.
     *
     * @return true if this call moved the job to CANCELLED
     */
    boolean cancel() {
        JobStatus current = state.get();
        if (current == JobStatus.PENDING || current == JobStatus.RUNNING) {
            if (state.compareAndSet(current, JobStatus.CANCELLED)) {
                destroyProcess();
                completed(JobStatus.CANCELLED);
                return true;
            }
        }
        return false;
    }

    JobInfo toJobInfo() {
        return JobInfo.builder(jobId)
                .name(spec.name())
                .user(user)
                .status(state.get())
                .queue(LocalScheduler.NAME)
                .submitTime(submittedAt)
                .startTime(startedAt)
                .endTime(completedAt)
                .runtime(startedAt == null ? null : elapsed())
                .cpu(spec.cpu())
                .memory(spec.memory())
                .gpu(spec.gpu())
                .exitCode(exitCode)
                .stdoutPath(stdoutPath)
                .stderrPath(stderrPath)
                .node("localhost")
                .dependencies(spec.dependencies().isEmpty() ? null : spec.dependencies())
                .arrayTaskId(arrayTaskId)
                .build();
    }

    Duration elapsed() {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        Instant end = completedAt != null ? completedAt : Instant.now();
        return Duration.between(startedAt, end);
    }

    private void completed(JobStatus terminal) {
        completedAt = Instant.now();
        done.complete(terminal);
    }

    private void destroyProcess() {
        Process p = process;
        if (p != null) {
            p.descendants().forEach(ProcessHandle::destroyForcibly);
            p.destroyForcibly();
        }
    }
}
