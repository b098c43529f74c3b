package io.surfworks.hpcrunner.scheduler.pbs;

import io.surfworks.hpcrunner.config.PbsConfig;
import io.surfworks.hpcrunner.exec.BinaryResolver;
import io.surfworks.hpcrunner.exec.CommandExecutor;
import io.surfworks.hpcrunner.exec.CommandResult;
import io.surfworks.hpcrunner.job.JobArraySpec;
import io.surfworks.hpcrunner.job.JobInfo;
import io.surfworks.hpcrunner.job.JobSpec;
import io.surfworks.hpcrunner.scheduler.CommandLineScheduler;
import io.surfworks.hpcrunner.scheduler.CompletedJobQuery;
import io.surfworks.hpcrunner.scheduler.SchedulerException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PBS Pro / OpenPBS scheduler using qsub/qstat/qdel.
 *
 * <p>PBS has no separate accounting tool; finished jobs are visible through
 * {@code qstat -x} only when the server keeps job history, which the
 * configuration must declare.
 */
public final class PbsScheduler extends CommandLineScheduler {

    public static final String NAME = "pbs";

    private static final Pattern ARRAY_TASK_PATTERN = Pattern.compile("^(\\d+)\\[\\](.*)\\.(\\d+)$");
    private static final Pattern MEMORY_PATTERN = Pattern.compile("^(\\d+)([KMGT])$", Pattern.CASE_INSENSITIVE);

    private final PbsConfig config;

    public PbsScheduler(PbsConfig config, CommandExecutor executor, BinaryResolver resolver, Duration commandTimeout) {
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
        if (spec.workDir() != null) {
            sb.append("cd ").append(shellQuote(spec.workDir().toString())).append("\n");
        } else {
            sb.append("cd \"${PBS_O_WORKDIR:-.}\"\n");
        }
        sb.append("\n");
        sb.append(spec.command()).append("\n");
        return sb.toString();
    }

    @Override
    public List<String> buildSubmitCommand(JobSpec spec) {
        List<String> cmd = new ArrayList<>();
        cmd.add("qsub");
        cmd.add("-N");
        cmd.add(spec.name());
        addResourceFlags(cmd, spec);

        if (spec.stdoutPath() != null) {
            cmd.add("-o");
            cmd.add(spec.stdoutPath().toString());
        }
        if (spec.mergeOutput()) {
            cmd.add("-j");
            cmd.add("oe");
        } else if (spec.stderrPath() != null) {
            cmd.add("-e");
            cmd.add(spec.stderrPath().toString());
        }
        if (!spec.dependencies().isEmpty()) {
            cmd.add("-W");
            cmd.add("depend=afterok:" + String.join(":", spec.dependencies()));
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
        cmd.add("-J");
        cmd.add(range);
        return cmd;
    }

    @Override
    protected List<String> buildInteractiveCommand(JobSpec spec) {
        List<String> cmd = new ArrayList<>();
        cmd.add("qsub");
        cmd.add("-I");
        cmd.add("-N");
        cmd.add(spec.name());
        addResourceFlags(cmd, spec);
        cmd.addAll(spec.rawArgs(NAME));

        StringBuilder script = new StringBuilder();
        appendEnvironment(script, spec.environment());
        script.append(spec.command());
        cmd.add("--");
        cmd.add("/bin/bash");
        cmd.add("-c");
        cmd.add(script.toString());
        return cmd;
    }

    private void addResourceFlags(List<String> cmd, JobSpec spec) {
        if (spec.queue() != null) {
            cmd.add("-q");
            cmd.add(spec.queue());
        }

        StringBuilder select = new StringBuilder("select=1");
        if (spec.cpu() != null) {
            select.append(":ncpus=").append(spec.cpu());
        }
        if (spec.memory() != null) {
            select.append(":mem=").append(toPbsMemory(spec.memory()));
        }
        if (spec.requiresGpu()) {
            select.append(":ngpus=").append(spec.gpu());
        }
        if (select.length() > "select=1".length()) {
            cmd.add("-l");
            cmd.add(select.toString());
        }
        if (spec.timeLimit() != null) {
            cmd.add("-l");
            cmd.add("walltime=" + formatWallClock(spec.timeLimit()));
        }
    }

    /**
     * Converts "16G" style sizes to PBS units ("16gb"); anything else passes through.
     */
    static String toPbsMemory(String memory) {
        Matcher m = MEMORY_PATTERN.matcher(memory.strip());
        if (m.matches()) {
            return m.group(1) + m.group(2).toLowerCase(Locale.ROOT) + "b";
        }
        return memory;
    }

    @Override
    protected Optional<String> parseSubmittedId(String output) {
        return PbsParser.parseQsubOutput(output);
    }

    @Override
    protected List<String> buildCancelCommand(String jobId) {
        return List.of("qdel", toPbsId(jobId));
    }

    // ===== Live listing =====

    @Override
    protected List<JobInfo> fetchActiveJobs() throws SchedulerException {
        return PbsParser.parseQstatFull(runChecked(List.of("qstat", "-f", "-t"))).stream()
                .map(PbsParser::toJobInfo)
                .toList();
    }

    @Override
    protected Optional<JobInfo> fetchActiveJob(String jobId) throws SchedulerException {
        return lookup(List.of("qstat", "-f", toPbsId(jobId)));
    }

    // ===== Accounting =====

    @Override
    protected boolean probeAccounting() {
        return config.jobHistory();
    }

    @Override
    protected List<JobInfo> fetchCompletedJobs(CompletedJobQuery query) throws SchedulerException {
        return PbsParser.parseQstatFull(runChecked(List.of("qstat", "-x", "-f", "-t"))).stream()
                .map(PbsParser::toJobInfo)
                .filter(JobInfo::isComplete)
                .toList();
    }

    @Override
    protected Optional<JobInfo> fetchCompletedJob(String jobId) throws SchedulerException {
        return lookup(List.of("qstat", "-x", "-f", toPbsId(jobId)));
    }

    private Optional<JobInfo> lookup(List<String> cmd) throws SchedulerException {
        CommandResult result = run(cmd);
        if (!result.isSuccess()) {
            // qstat exits non-zero for unknown ids
            return Optional.empty();
        }
        return PbsParser.parseQstatFull(result.stdout()).stream()
                .map(PbsParser::toJobInfo)
                .findFirst();
    }

    /**
     * Converts a {@code base.task} id produced for array tasks
     * ("1234[].server.3") to PBS's subjob form ("1234[3].server").
     */
    static String toPbsId(String jobId) {
        Matcher m = ARRAY_TASK_PATTERN.matcher(jobId);
        if (m.matches()) {
            return m.group(1) + "[" + m.group(3) + "]" + m.group(2);
        }
        return jobId;
    }
}
