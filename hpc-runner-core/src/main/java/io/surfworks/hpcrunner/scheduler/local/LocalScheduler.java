package io.surfworks.hpcrunner.scheduler.local;

import io.surfworks.hpcrunner.config.LocalConfig;
import io.surfworks.hpcrunner.exec.CommandException;
import io.surfworks.hpcrunner.exec.CommandExecutor;
import io.surfworks.hpcrunner.job.ArrayJobResult;
import io.surfworks.hpcrunner.job.JobArraySpec;
import io.surfworks.hpcrunner.job.JobInfo;
import io.surfworks.hpcrunner.job.JobResult;
import io.surfworks.hpcrunner.job.JobSpec;
import io.surfworks.hpcrunner.job.JobStatus;
import io.surfworks.hpcrunner.job.OutputStreamKind;
import io.surfworks.hpcrunner.scheduler.AccountingNotAvailableException;
import io.surfworks.hpcrunner.scheduler.ActiveJobQuery;
import io.surfworks.hpcrunner.scheduler.CompletedJobQuery;
import io.surfworks.hpcrunner.scheduler.JobNotFoundException;
import io.surfworks.hpcrunner.scheduler.Scheduler;
import io.surfworks.hpcrunner.scheduler.SchedulerCapabilities;
import io.surfworks.hpcrunner.scheduler.SchedulerException;
import io.surfworks.hpcrunner.scheduler.SubmissionException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fallback scheduler that runs jobs as local {@code /bin/bash -c} processes.
 * Useful on workstations and for single-node testing.
 *
 * <p>Jobs run on a bounded thread pool; state lives in memory only, so there
 * is no accounting and finished jobs are forgotten when the scheduler closes.
 * Only the most recent {@value #DEFAULT_RETAINED_FINISHED_JOBS} finished jobs
 * are kept; older ones are evicted in the order they finished and then report
 * {@link JobStatus#UNKNOWN}.
 * A job with dependencies starts once all of them have finished, and is
 * cancelled if any of them did not complete successfully.
 */
public final class LocalScheduler implements Scheduler {

    private static final Logger LOG = Logger.getLogger(LocalScheduler.class.getName());

    public static final String NAME = "local";

    /** Environment variable carrying the task index of an array job */
    public static final String TASK_ID_VARIABLE = "HPC_RUNNER_TASK_ID";

    /** Finished jobs kept in memory before the oldest are evicted */
    public static final int DEFAULT_RETAINED_FINISHED_JOBS = 1000;

    private final ExecutorService pool;
    private final CommandExecutor executor;
    private final Path outputDir;
    private final Map<String, LocalJob> jobs;
    private final Deque<String> finishedJobs;
    private final int retainedFinishedJobs;
    private final int maxConcurrentJobs;
    private final AtomicInteger jobCounter;
    private final AtomicInteger threadCounter;
    private final String user;
    private volatile boolean closed;

    /**
     * Creates a local scheduler writing default job output under the system temp directory.
     */
    public LocalScheduler(LocalConfig config, CommandExecutor executor) {
        this(config, executor, Path.of(System.getProperty("java.io.tmpdir"), "hpc-runner"));
    }

    /**
     * Creates a local scheduler.
     *
     * @param config    Pool size
     * @param executor  Used for interactive runs
     * @param outputDir Directory for output files of jobs that name none
     */
    public LocalScheduler(LocalConfig config, CommandExecutor executor, Path outputDir) {
        this(config, executor, outputDir, DEFAULT_RETAINED_FINISHED_JOBS);
    }

    LocalScheduler(LocalConfig config, CommandExecutor executor, Path outputDir, int retainedFinishedJobs) {
        if (retainedFinishedJobs < 0) {
            throw new IllegalArgumentException("retainedFinishedJobs must be >= 0: " + retainedFinishedJobs);
        }
        this.retainedFinishedJobs = retainedFinishedJobs;
        this.finishedJobs = new ArrayDeque<>();
        this.maxConcurrentJobs = config.maxConcurrentJobs();
        this.executor = executor;
        this.outputDir = outputDir;
        this.jobs = new ConcurrentHashMap<>();
        this.jobCounter = new AtomicInteger(0);
        this.threadCounter = new AtomicInteger(0);
        this.user = System.getProperty("user.name", "");
        this.closed = false;
        this.pool = Executors.newFixedThreadPool(maxConcurrentJobs, r -> {
            Thread t = new Thread(r, "hpc-runner-local-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SchedulerCapabilities capabilities() {
        return SchedulerCapabilities.local(maxConcurrentJobs);
    }

    // ===== Submission =====

    @Override
    public JobResult submit(JobSpec spec, boolean interactive) throws SubmissionException {
        ensureOpen();

        if (interactive) {
            try {
                int exitCode = executor.runInteractive(buildSubmitCommand(spec), spec.workDir());
                return JobResult.finished(JobResult.INTERACTIVE_ID, NAME, exitCode);
            } catch (CommandException e) {
                throw new SubmissionException("Interactive local job failed to start: " + e.getMessage(), e);
            }
        }

        String jobId = NAME + "-" + jobCounter.incrementAndGet();
        enqueue(new LocalJob(jobId, spec, user, null,
                outputFile(spec, jobId, OutputStreamKind.STDOUT),
                outputFile(spec, jobId, OutputStreamKind.STDERR)));
        return JobResult.submitted(jobId, NAME);
    }

    @Override
    public ArrayJobResult submitArray(JobArraySpec array) throws SubmissionException {
        ensureOpen();

        String baseId = NAME + "-" + jobCounter.incrementAndGet();
        ArrayJobResult result = new ArrayJobResult(baseId, NAME, array);
        for (int index : array.taskIndices()) {
            String taskJobId = result.taskJobId(index);
            JobSpec task = withTaskId(array.job(), index);
            enqueue(new LocalJob(taskJobId, task, user, String.valueOf(index),
                    outputFile(task, taskJobId, OutputStreamKind.STDOUT),
                    outputFile(task, taskJobId, OutputStreamKind.STDERR)));
        }
        return result;
    }

    private static JobSpec withTaskId(JobSpec spec, int index) {
        Map<String, String> env = new HashMap<>(spec.environment());
        env.put(TASK_ID_VARIABLE, String.valueOf(index));
        return new JobSpec(spec.name(), spec.command(), spec.queue(), spec.cpu(), spec.memory(), spec.gpu(),
                spec.timeLimit(), spec.workDir(), spec.stdoutPath(), spec.stderrPath(), spec.mergeOutput(),
                env, spec.dependencies(), spec.rawArgs());
    }

    private void enqueue(LocalJob job) throws SubmissionException {
        List<CompletableFuture<JobStatus>> prerequisites = new ArrayList<>();
        for (String dependency : job.spec().dependencies()) {
            LocalJob prerequisite = jobs.get(dependency);
            if (prerequisite == null) {
                throw new SubmissionException("Unknown dependency " + dependency + " for job " + job.jobId());
            }
            prerequisites.add(prerequisite.done());
        }
        jobs.put(job.jobId(), job);
        job.done().thenRun(() -> retire(job.jobId()));

        CompletableFuture.allOf(prerequisites.toArray(new CompletableFuture<?>[0]))
                .thenRun(() -> {
                    boolean satisfied = prerequisites.stream().allMatch(f -> f.join() == JobStatus.COMPLETED);
                    if (!satisfied) {
                        LOG.info(() -> "Dependency of " + job.jobId() + " did not complete, cancelling");
                        job.cancel();
                        return;
                    }
                    try {
                        pool.submit(() -> executeJob(job));
                    } catch (RejectedExecutionException e) {
                        job.cancel();
                    }
                });
    }

    // ===== Queries =====

    @Override
    public boolean cancel(String jobId) {
        LocalJob job = jobs.get(jobId);
        if (job == null) {
            return false;
        }
        return job.cancel();
    }

    @Override
    public JobStatus status(String jobId) {
        LocalJob job = jobs.get(jobId);
        return job == null ? JobStatus.UNKNOWN : job.state();
    }

    @Override
    public OptionalInt exitCode(String jobId) {
        LocalJob job = jobs.get(jobId);
        if (job == null || !job.state().isComplete() || job.exitCode() == null) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(job.exitCode());
    }

    @Override
    public Optional<Path> outputPath(String jobId, OutputStreamKind stream) {
        LocalJob job = jobs.get(jobId);
        if (job == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(stream == OutputStreamKind.STDOUT ? job.stdoutPath() : job.stderrPath());
    }

    @Override
    public String generateScript(JobSpec spec) {
        StringBuilder sb = new StringBuilder();
        spec.environment().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> sb.append("export ").append(e.getKey()).append("='")
                        .append(e.getValue().replace("'", "'\\''")).append("'\n"));
        sb.append(spec.command()).append("\n");
        return sb.toString();
    }

    @Override
    public List<String> buildSubmitCommand(JobSpec spec) {
        return List.of("/bin/bash", "-c", generateScript(spec));
    }

    @Override
    public List<JobInfo> listActiveJobs(ActiveJobQuery query) throws SchedulerException {
        return jobs.values().stream()
                .map(LocalJob::toJobInfo)
                .filter(query::matches)
                .sorted(Comparator.comparing(JobInfo::submitTime).thenComparing(JobInfo::jobId))
                .toList();
    }

    @Override
    public List<JobInfo> listCompletedJobs(CompletedJobQuery query) throws SchedulerException {
        throw new AccountingNotAvailableException(NAME);
    }

    @Override
    public boolean hasAccounting() {
        return false;
    }

    @Override
    public JobInfo jobDetails(String jobId) throws SchedulerException {
        LocalJob job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job.toJobInfo();
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;

        jobs.values().forEach(LocalJob::cancel);
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ===== Execution =====

    private void executeJob(LocalJob job) {
        if (job.state() != JobStatus.PENDING) {
            return;
        }
        JobSpec spec = job.spec();
        ProcessBuilder pb = new ProcessBuilder(buildSubmitCommand(spec));
        pb.environment().putAll(spec.environment());
        if (spec.workDir() != null) {
            pb.directory(spec.workDir().toFile());
        }

        try {
            Files.createDirectories(job.stdoutPath().toAbsolutePath().getParent());
            pb.redirectOutput(ProcessBuilder.Redirect.appendTo(job.stdoutPath().toFile()));
            if (spec.mergeOutput()) {
                pb.redirectErrorStream(true);
            } else {
                Files.createDirectories(job.stderrPath().toAbsolutePath().getParent());
                pb.redirectError(ProcessBuilder.Redirect.appendTo(job.stderrPath().toFile()));
            }

            Process p = pb.start();
            if (!job.markRunning(p)) {
                p.destroyForcibly();
                return;
            }

            if (spec.timeLimit() != null) {
                if (!p.waitFor(spec.timeLimit().toMillis(), TimeUnit.MILLISECONDS)) {
                    job.timeout();
                    return;
                }
            } else {
                p.waitFor();
            }
            job.finish(p.exitValue());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            job.cancel();
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Local job " + job.jobId() + " failed to start", e);
            job.fail();
        }
    }

    private synchronized void retire(String jobId) {
        finishedJobs.addLast(jobId);
        while (finishedJobs.size() > retainedFinishedJobs) {
            String evicted = finishedJobs.removeFirst();
            jobs.remove(evicted);
            LOG.fine(() -> "Evicted finished local job " + evicted);
        }
    }

    private Path outputFile(JobSpec spec, String jobId, OutputStreamKind stream) {
        Path explicit = stream == OutputStreamKind.STDOUT ? spec.stdoutPath() : spec.stderrPath();
        if (explicit != null) {
            return explicit;
        }
        if (stream == OutputStreamKind.STDERR && spec.mergeOutput()) {
            return outputFile(spec, jobId, OutputStreamKind.STDOUT);
        }
        String suffix = stream == OutputStreamKind.STDOUT ? ".o" : ".e";
        Path dir = spec.workDir() != null ? spec.workDir() : outputDir;
        return dir.resolve(spec.name() + suffix + jobId.substring(NAME.length() + 1));
    }

    private void ensureOpen() throws SubmissionException {
        if (closed) {
            throw new SubmissionException("Scheduler is closed");
        }
    }
}
