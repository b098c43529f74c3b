package io.surfworks.hpcrunner.scheduler.sge;

import io.surfworks.hpcrunner.config.SgeConfig;
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
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Grid Engine (SGE, Son of Grid Engine, Univa/Altair GE) scheduler using
 * qsub/qstat/qdel/qacct.
 *
 * <p>Batch scripts are fed to {@code qsub} on standard input; resource
 * requests are passed as command-line flags so a dry run shows them.
 */
public final class SgeScheduler extends CommandLineScheduler {

    private static final Logger LOG = Logger.getLogger(SgeScheduler.class.getName());

    public static final String NAME = "sge";

    private final SgeConfig config;

    public SgeScheduler(SgeConfig config, CommandExecutor executor, BinaryResolver resolver, Duration commandTimeout) {
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
        sb.append("#$ -S /bin/bash\n");
        sb.append("# hpc-runner job: ").append(spec.name()).append("\n");
        appendEnvironment(sb, spec.environment());
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

        if (spec.workDir() != null) {
            cmd.add("-wd");
            cmd.add(spec.workDir().toString());
        } else {
            cmd.add("-cwd");
        }
        if (spec.stdoutPath() != null) {
            cmd.add("-o");
            cmd.add(spec.stdoutPath().toString());
        }
        if (spec.mergeOutput()) {
            cmd.add("-j");
            cmd.add("y");
        } else if (spec.stderrPath() != null) {
            cmd.add("-e");
            cmd.add(spec.stderrPath().toString());
        }
        if (!spec.dependencies().isEmpty()) {
            cmd.add("-hold_jid");
            cmd.add(String.join(",", spec.dependencies()));
        }
        cmd.addAll(spec.rawArgs(NAME));
        return cmd;
    }

    @Override
    protected List<String> buildArraySubmitCommand(JobArraySpec array) {
        List<String> cmd = buildSubmitCommand(array.job());
        cmd.add("-t");
        cmd.add(array.rangeString());
        if (array.maxConcurrent() != null) {
            cmd.add("-tc");
            cmd.add(String.valueOf(array.maxConcurrent()));
        }
        return cmd;
    }

    @Override
    protected List<String> buildInteractiveCommand(JobSpec spec) {
        List<String> cmd = new ArrayList<>();
        cmd.add("qrsh");
        cmd.add("-now");
        cmd.add("no");
        cmd.add("-N");
        cmd.add(spec.name());
        addResourceFlags(cmd, spec);
        cmd.addAll(spec.rawArgs(NAME));

        StringBuilder script = new StringBuilder();
        appendEnvironment(script, spec.environment());
        script.append(spec.command());
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
        if (spec.cpu() != null) {
            cmd.add("-pe");
            cmd.add(config.parallelEnvironment());
            cmd.add(String.valueOf(spec.cpu()));
        }
        if (spec.memory() != null) {
            cmd.add("-l");
            cmd.add(config.memoryResource() + "=" + spec.memory());
        }
        if (spec.timeLimit() != null) {
            cmd.add("-l");
            cmd.add(config.timeResource() + "=" + formatWallClock(spec.timeLimit()));
        }
        if (spec.requiresGpu()) {
            cmd.add("-l");
            cmd.add("gpu=" + spec.gpu());
        }
    }

    @Override
    protected Optional<String> parseSubmittedId(String output) {
        return SgeParser.parseQsubOutput(output);
    }

    @Override
    protected List<String> buildCancelCommand(String jobId) {
        return List.of("qdel", jobId);
    }

    // ===== Live listing =====

    @Override
    protected List<JobInfo> fetchActiveJobs() throws SchedulerException {
        Instant now = Instant.now();
        return listRecords().values().stream()
                .map(job -> SgeParser.toJobInfo(job, now))
                .toList();
    }

    @Override
    protected Optional<JobInfo> fetchActiveJob(String jobId) throws SchedulerException {
        Map<String, SgeJobRecord> records = listRecords();
        SgeJobRecord record = records.get(jobId);
        if (record == null) {
            record = records.values().stream()
                    .filter(r -> r.jobId().equals(jobId))
                    .findFirst()
                    .orElse(null);
        }
        if (record == null) {
            return Optional.empty();
        }

        JobInfo job = SgeParser.toJobInfo(record, Instant.now());
        return Optional.of(withDetail(job, record.jobId()));
    }

    private Map<String, SgeJobRecord> listRecords() throws SchedulerException {
        CommandResult xml = run(List.of("qstat", "-xml", "-u", "*"));
        if (xml.isSuccess() && xml.stdout().strip().startsWith("<")) {
            return SgeParser.readQstatXml(xml.stdout())
                    .orElseThrow(() -> new SchedulerException("qstat -xml returned a malformed document"));
        }
        LOG.fine("qstat -xml unavailable, falling back to plain listing");
        return SgeParser.parseQstatPlain(runChecked(List.of("qstat", "-u", "*")));
    }

    /**
     * Adds output paths, dependencies and memory from {@code qstat -j}, when it answers.
     */
    private JobInfo withDetail(JobInfo job, String baseId) throws SchedulerException {
        CommandResult result = run(List.of("qstat", "-j", baseId));
        if (!result.isSuccess()) {
            return job;
        }
        Map<String, String> detail = SgeParser.parseQstatJobDetail(result.stdout());
        JobInfo.Builder builder = job.toBuilder()
                .stdoutPath(SgeParser.parsePathList(detail.get("stdout_path_list")))
                .stderrPath(SgeParser.parsePathList(detail.get("stderr_path_list")))
                .dependencies(SgeParser.parseDependencies(detail.get("jid_predecessor_list")));
        String memory = SgeParser.parseResource(detail.get("hard resource_list"), config.memoryResource());
        if (memory != null) {
            builder.memory(memory);
        }
        return builder.build();
    }

    // ===== Accounting =====

    @Override
    protected boolean probeAccounting() {
        return resolver.isAvailable("qacct");
    }

    @Override
    protected List<JobInfo> fetchCompletedJobs(CompletedJobQuery query) throws SchedulerException {
        List<String> cmd = new ArrayList<>();
        cmd.add("qacct");
        if (query.user() != null) {
            cmd.add("-o");
            cmd.add(query.user());
        }
        if (query.since() != null) {
            long days = Duration.between(query.since(), Instant.now()).toDays() + 1;
            cmd.add("-d");
            cmd.add(String.valueOf(Math.max(1, days)));
        }
        cmd.add("-j");
        return readAccounting(cmd);
    }

    @Override
    protected Optional<JobInfo> fetchCompletedJob(String jobId) throws SchedulerException {
        int dot = jobId.indexOf('.');
        String baseId = dot >= 0 ? jobId.substring(0, dot) : jobId;
        String taskId = dot >= 0 ? jobId.substring(dot + 1) : null;

        List<JobInfo> records = readAccounting(List.of("qacct", "-j", baseId));
        return records.stream()
                .filter(job -> taskId == null || taskId.equals(job.arrayTaskId()))
                .reduce((first, second) -> second);
    }

    private List<JobInfo> readAccounting(List<String> cmd) throws SchedulerException {
        CommandResult result = run(cmd);
        if (!result.isSuccess()) {
            if (result.combinedOutput().contains("not found")) {
                return List.of();
            }
            throw new SchedulerException("qacct failed (exit " + result.exitCode() + "): "
                    + result.combinedOutput().trim());
        }

        List<JobInfo> jobs = new ArrayList<>();
        for (Map<String, String> record : SgeParser.parseQacctRecords(result.stdout())) {
            JobInfo job = SgeParser.qacctToJobInfo(record);
            if (job != null) {
                jobs.add(job);
            }
        }
        return jobs;
    }
}
