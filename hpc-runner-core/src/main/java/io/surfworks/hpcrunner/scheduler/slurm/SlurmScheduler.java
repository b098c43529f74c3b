package io.surfworks.hpcrunner.scheduler.slurm;

import io.surfworks.hpcrunner.config.SlurmConfig;
import io.surfworks.hpcrunner.exec.BinaryResolver;
import io.surfworks.hpcrunner.exec.CommandExecutor;
import io.surfworks.hpcrunner.exec.CommandResult;
import io.surfworks.hpcrunner.job.JobArraySpec;
import io.surfworks.hpcrunner.job.JobInfo;
import io.surfworks.hpcrunner.job.JobSpec;
import io.surfworks.hpcrunner.scheduler.CommandLineScheduler;
import io.surfworks.hpcrunner.scheduler.CompletedJobQuery;
import io.surfworks.hpcrunner.scheduler.SchedulerException;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Slurm scheduler using sbatch/srun/squeue/scancel/sacct.
 *
 * <p>Array task ids are accepted as either {@code 123.4} or Slurm's own {@code 123_4}.
 */
public final class SlurmScheduler extends CommandLineScheduler {

    public static final String NAME = "slurm";

    /** Accounting window used when a query has no lower bound */
    static final Duration DEFAULT_HISTORY = Duration.ofDays(7);

    private static final DateTimeFormatter SACCT_TIME = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private final SlurmConfig config;

    /**
     * Creates a Slurm scheduler with the given configuration.
     */
    public SlurmScheduler(SlurmConfig config, CommandExecutor executor, BinaryResolver resolver,
                          Duration commandTimeout) {
        super(executor, resolver, commandTimeout);
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    // ===== Script and command generation =====

    @Override
    public String generateScript(JobSpec spec) {
        StringBuilder sb = new StringBuilder();
        sb.append("#!/bin/bash\n");
        sb.append("# hpc-runner job: ").append(spec.name()).append("\n");
        appendEnvironment(sb, spec.environment());
        sb.append("\n");
        sb.append(spec.command()).append("\n");
        return sb.toString();
    }

    @Override
    public List<String> buildSubmitCommand(JobSpec spec) {
        List<String> cmd = new ArrayList<>();
        cmd.add("sbatch");
        cmd.add("--parsable");
        cmd.add("--job-name=" + spec.name());
        addResourceFlags(cmd, spec);

        if (spec.workDir() != null) {
            cmd.add("--chdir=" + spec.workDir());
        }
        if (spec.stdoutPath() != null) {
            cmd.add("--output=" + spec.stdoutPath());
        }
        if (!spec.mergeOutput() && spec.stderrPath() != null) {
            cmd.add("--error=" + spec.stderrPath());
        }
        if (!spec.dependencies().isEmpty()) {
            cmd.add("--dependency=afterok:" + String.join(":", spec.dependencies()));
        }
        cmd.addAll(spec.rawArgs(NAME));
        return cmd;
    }

    @Override
    protected List<String> buildArraySubmitCommand(JobArraySpec array) {
        List<String> cmd = buildSubmitCommand(array.job());
        String range = array.rangeString();
        if (array.maxConcurrent() != null) {
            range += "%" + array.maxConcurrent();
        }
        cmd.add(2, "--array=" + range);
        return cmd;
    }

    @Override
    protected List<String> buildInteractiveCommand(JobSpec spec) {
        List<String> cmd = new ArrayList<>();
        cmd.add("srun");
        cmd.add("--job-name=" + spec.name());
        addResourceFlags(cmd, spec);
        cmd.addAll(spec.rawArgs(NAME));
        cmd.add("--pty");

        StringBuilder script = new StringBuilder();
        appendEnvironment(script, spec.environment());
        script.append(spec.command());
        cmd.add("/bin/bash");
        cmd.add("-c");
        cmd.add(script.toString());
        return cmd;
    }

    private void addResourceFlags(List<String> cmd, JobSpec spec) {
        String partition = spec.queue() != null ? spec.queue() : config.partition();
        if (partition != null && !partition.isBlank()) {
            cmd.add("--partition=" + partition);
        }
        if (spec.cpu() != null) {
            cmd.add("--cpus-per-task=" + spec.cpu());
        }
        if (spec.memory() != null) {
            cmd.add("--mem=" + spec.memory());
        }
        if (spec.timeLimit() != null) {
            cmd.add("--time=" + formatWallClock(spec.timeLimit()));
        }
        if (spec.requiresGpu()) {
            cmd.add("--gres=gpu:" + spec.gpu());
        }
    }

    @Override
    protected Optional<String> parseSubmittedId(String output) {
        return SlurmParser.parseSbatchOutput(output);
    }

    @Override
    protected List<String> buildCancelCommand(String jobId) {
        return List.of("scancel", toSlurmId(jobId));
    }

    // ===== Live listing =====

    @Override
    protected List<JobInfo> fetchActiveJobs() throws SchedulerException {
        String output = runChecked(List.of("squeue", "-h", "-a", "-o", SlurmParser.SQUEUE_FORMAT));
        return SlurmParser.parseSqueue(output).stream()
                .map(SlurmParser::toJobInfo)
                .toList();
    }

    @Override
    protected Optional<JobInfo> fetchActiveJob(String jobId) throws SchedulerException {
        String slurmId = toSlurmId(jobId);
        CommandResult result = run(List.of("squeue", "-h", "-j", slurmId, "-o", SlurmParser.SQUEUE_FORMAT));
        if (!result.isSuccess()) {
            // squeue rejects ids that have left the queue
            return Optional.empty();
        }
        Optional<JobInfo> job = SlurmParser.parseSqueue(result.stdout()).stream()
                .map(SlurmParser::toJobInfo)
                .filter(j -> matchesId(j, jobId))
                .findFirst();
        if (job.isEmpty()) {
            return job;
        }
        return Optional.of(withOutputPaths(job.get(), slurmId));
    }

    private JobInfo withOutputPaths(JobInfo job, String slurmId) throws SchedulerException {
        CommandResult result = run(List.of("scontrol", "show", "job", slurmId));
        if (!result.isSuccess()) {
            return job;
        }
        Map<String, String> detail = SlurmParser.parseScontrol(result.stdout());
        return job.toBuilder()
                .stdoutPath(pathOrNull(detail.get("StdOut")))
                .stderrPath(pathOrNull(detail.get("StdErr")))
                .build();
    }

    // ===== Accounting =====

    @Override
    protected boolean probeAccounting() {
        return resolver.isAvailable("sacct");
    }

    @Override
    protected List<JobInfo> fetchCompletedJobs(CompletedJobQuery query) throws SchedulerException {
        Instant since = query.since() != null
                ? query.since()
                : Instant.now().minus(DEFAULT_HISTORY).truncatedTo(ChronoUnit.SECONDS);

        List<String> cmd = new ArrayList<>(List.of("sacct", "-P", "-n", "-X", "-o", SlurmParser.SACCT_FIELDS));
        cmd.add("-S");
        cmd.add(formatSacctTime(since));
        if (query.until() != null) {
            cmd.add("-E");
            cmd.add(formatSacctTime(query.until()));
        }
        if (query.user() != null) {
            cmd.add("-u");
            cmd.add(query.user());
        } else {
            cmd.add("-a");
        }

        return SlurmParser.parseSacct(runChecked(cmd)).stream()
                .map(SlurmParser::toJobInfo)
                .filter(JobInfo::isComplete)
                .toList();
    }

    @Override
    protected Optional<JobInfo> fetchCompletedJob(String jobId) throws SchedulerException {
        String output = runChecked(List.of("sacct", "-P", "-n", "-X", "-o", SlurmParser.SACCT_FIELDS,
                "-j", toSlurmId(jobId)));
        return SlurmParser.parseSacct(output).stream()
                .map(SlurmParser::toJobInfo)
                .filter(j -> matchesId(j, jobId))
                .findFirst();
    }

    // ===== Ids =====

    /**
     * Converts a {@code base.task} id to Slurm's {@code base_task} form.
     */
    static String toSlurmId(String jobId) {
        return jobId.replace('.', '_');
    }

    private static boolean matchesId(JobInfo job, String jobId) {
        String slurmId = toSlurmId(jobId);
        if (job.arrayTaskId() == null) {
            return job.jobId().equals(slurmId);
        }
        return slurmId.equals(job.jobId()) || slurmId.equals(job.jobId() + "_" + job.arrayTaskId());
    }

    private static String formatSacctTime(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneId.systemDefault()).truncatedTo(ChronoUnit.SECONDS)
                .format(SACCT_TIME);
    }

    private static Path pathOrNull(String value) {
        return value == null || value.isBlank() ? null : Path.of(value);
    }
}
