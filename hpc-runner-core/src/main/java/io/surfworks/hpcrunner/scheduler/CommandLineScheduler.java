package io.surfworks.hpcrunner.scheduler;

import io.surfworks.hpcrunner.exec.BinaryResolver;
import io.surfworks.hpcrunner.exec.CommandException;
import io.surfworks.hpcrunner.exec.CommandExecutor;
import io.surfworks.hpcrunner.exec.CommandResult;
import io.surfworks.hpcrunner.job.ArrayJobResult;
import io.surfworks.hpcrunner.job.JobArraySpec;
import io.surfworks.hpcrunner.job.JobInfo;
import io.surfworks.hpcrunner.job.JobResult;
import io.surfworks.hpcrunner.job.JobSpec;
import io.surfworks.hpcrunner.job.JobStatus;
import io.surfworks.hpcrunner.job.OutputStreamKind;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class for schedulers driven through their command-line tools.
 *
 * <p>Implements the parts of the {@link Scheduler} contract that are the same
 * for every batch system: submission flow, client-side filtering, the
 * live-then-accounting lookup behind {@link #jobDetails}, and the
 * never-throwing status queries. Subclasses supply command lines and parsers.
 *
 * <p>Every command runs through the supplied {@link CommandExecutor} with the
 * configured timeout.
 */
public abstract class CommandLineScheduler implements Scheduler {

    private static final Logger LOG = Logger.getLogger(CommandLineScheduler.class.getName());

    protected final CommandExecutor executor;
    protected final BinaryResolver resolver;
    protected final Duration commandTimeout;

    private volatile Boolean accounting;
    private volatile boolean closed;

    protected CommandLineScheduler(CommandExecutor executor, BinaryResolver resolver, Duration commandTimeout) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver cannot be null");
        this.commandTimeout = Objects.requireNonNull(commandTimeout, "commandTimeout cannot be null");
    }

    // ===== Hooks =====

    /**
     * Command that runs the job attached to the terminal.
     */
    protected abstract List<String> buildInteractiveCommand(JobSpec spec);

    /**
     * Command that submits a job array; the script is fed on standard input.
     */
    protected abstract List<String> buildArraySubmitCommand(JobArraySpec array);

    /**
     * Extracts the new job id from submission output.
     */
    protected abstract Optional<String> parseSubmittedId(String output);

    protected abstract List<String> buildCancelCommand(String jobId);

    /**
     * Runs the live listing once and parses all of it.
     */
    protected abstract List<JobInfo> fetchActiveJobs() throws SchedulerException;

    /**
     * Looks up a single job in the live listing.
     */
    protected abstract Optional<JobInfo> fetchActiveJob(String jobId) throws SchedulerException;

    /**
     * Reads accounting. Implementations may push coarse filters down to the
     * command; exact filtering, ordering and the limit are applied afterwards.
     */
    protected abstract List<JobInfo> fetchCompletedJobs(CompletedJobQuery query) throws SchedulerException;

    /**
     * Looks up a single job in accounting.
     */
    protected abstract Optional<JobInfo> fetchCompletedJob(String jobId) throws SchedulerException;

    /**
     * Decides whether accounting is available. Called at most once.
     */
    protected abstract boolean probeAccounting();

    // ===== Scheduler =====

    @Override
    public SchedulerCapabilities capabilities() {
        return SchedulerCapabilities.cluster(hasAccounting());
    }

    @Override
    public JobResult submit(JobSpec spec, boolean interactive) throws SubmissionException {
        ensureOpenForSubmit();

        if (interactive) {
            List<String> command = buildInteractiveCommand(spec);
            try {
                int exitCode = executor.runInteractive(command, spec.workDir());
                return JobResult.finished(JobResult.INTERACTIVE_ID, name(), exitCode);
            } catch (CommandException e) {
                throw new SubmissionException("Interactive " + name() + " job failed to start: " + e.getMessage(), e);
            }
        }

        String jobId = submitScript(buildSubmitCommand(spec), generateScript(spec));
        LOG.info(() -> "Submitted " + name() + " job " + jobId + " (" + spec.name() + ")");
        return JobResult.submitted(jobId, name());
    }

    @Override
    public ArrayJobResult submitArray(JobArraySpec array) throws SubmissionException {
        ensureOpenForSubmit();

        String jobId = submitScript(buildArraySubmitCommand(array), generateScript(array.job()));
        LOG.info(() -> "Submitted " + name() + " array job " + jobId + " tasks " + array.rangeString());
        return new ArrayJobResult(jobId, name(), array);
    }

    @Override
    public boolean cancel(String jobId) {
        if (closed) {
            return false;
        }
        try {
            if (jobDetails(jobId).isComplete()) {
                LOG.fine(() -> "Not cancelling finished job " + jobId);
                return false;
            }
        } catch (JobNotFoundException e) {
            LOG.fine(() -> "Not cancelling unknown job " + jobId);
            return false;
        } catch (SchedulerException e) {
            // lookup failed; let the native cancel decide
            LOG.log(Level.FINE, "Lookup of " + jobId + " before cancel failed", e);
        }
        try {
            CommandResult result = executor.run(buildCancelCommand(jobId), null, commandTimeout);
            if (!result.isSuccess()) {
                LOG.fine(() -> "Cancel of " + jobId + " refused: " + result.combinedOutput().trim());
            }
            return result.isSuccess();
        } catch (CommandException e) {
            LOG.log(Level.FINE, "Cancel of " + jobId + " failed", e);
            return false;
        }
    }

    @Override
    public JobStatus status(String jobId) {
        try {
            return jobDetails(jobId).status();
        } catch (JobNotFoundException e) {
            return JobStatus.UNKNOWN;
        } catch (SchedulerException e) {
            LOG.log(Level.FINE, "Status query for " + jobId + " failed", e);
            return JobStatus.UNKNOWN;
        }
    }

    @Override
    public OptionalInt exitCode(String jobId) {
        try {
            JobInfo job = jobDetails(jobId);
            if (job.isComplete() && job.exitCode() != null) {
                return OptionalInt.of(job.exitCode());
            }
        } catch (SchedulerException e) {
            LOG.log(Level.FINE, "Exit code query for " + jobId + " failed", e);
        }
        return OptionalInt.empty();
    }

    @Override
    public Optional<Path> outputPath(String jobId, OutputStreamKind stream) {
        try {
            JobInfo job = jobDetails(jobId);
            return Optional.ofNullable(stream == OutputStreamKind.STDOUT ? job.stdoutPath() : job.stderrPath());
        } catch (SchedulerException e) {
            LOG.log(Level.FINE, "Output path query for " + jobId + " failed", e);
            return Optional.empty();
        }
    }

    @Override
    public List<JobInfo> listActiveJobs(ActiveJobQuery query) throws SchedulerException {
        ensureOpen();
        return fetchActiveJobs().stream()
                .filter(query::matches)
                .toList();
    }

    @Override
    public List<JobInfo> listCompletedJobs(CompletedJobQuery query) throws SchedulerException {
        if (!hasAccounting()) {
            throw new AccountingNotAvailableException(name());
        }
        ensureOpen();
        return fetchCompletedJobs(query).stream()
                .filter(query::matches)
                .sorted(CompletedJobQuery.MOST_RECENT_FIRST)
                .limit(query.limit())
                .toList();
    }

    @Override
    public boolean hasAccounting() {
        Boolean available = accounting;
        if (available == null) {
            available = probeAccounting();
            accounting = available;
        }
        return available;
    }

    @Override
    public JobInfo jobDetails(String jobId) throws SchedulerException {
        ensureOpen();
        Optional<JobInfo> live = fetchActiveJob(jobId);
        if (live.isPresent()) {
            return live.get();
        }
        if (hasAccounting()) {
            Optional<JobInfo> finished = fetchCompletedJob(jobId);
            if (finished.isPresent()) {
                return finished.get();
            }
        }
        throw new JobNotFoundException(jobId);
    }

    @Override
    public void close() {
        closed = true;
    }

    // ===== Helpers for subclasses =====

    /**
     * Runs a command with the configured timeout.
     *
     * @throws SchedulerException if the command could not be run or timed out
     */
    protected CommandResult run(List<String> command) throws SchedulerException {
        return run(command, null);
    }

    protected CommandResult run(List<String> command, String stdin) throws SchedulerException {
        try {
            return executor.run(command, stdin, commandTimeout);
        } catch (CommandException e) {
            throw new SchedulerException(e.getMessage(), e);
        }
    }

    /**
     * Runs a command and returns its standard output, failing on a non-zero exit.
     */
    protected String runChecked(List<String> command) throws SchedulerException {
        CommandResult result = run(command);
        if (!result.isSuccess()) {
            throw new SchedulerException(command.get(0) + " failed (exit " + result.exitCode() + "): "
                    + result.combinedOutput().trim());
        }
        return result.stdout();
    }

    /**
     * Renders the environment exports shared by every batch script.
     */
    protected static void appendEnvironment(StringBuilder sb, Map<String, String> environment) {
        environment.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> sb.append("export ").append(e.getKey()).append('=')
                        .append(shellQuote(e.getValue())).append('\n'));
    }

    protected static String shellQuote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }

    /**
     * Formats a duration as {@code H:MM:SS}, the wall-clock syntax all three batch systems accept.
     */
    protected static String formatWallClock(Duration duration) {
        long seconds = duration.getSeconds();
        return String.format("%d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }

    private String submitScript(List<String> command, String script) throws SubmissionException {
        CommandResult result;
        try {
            result = executor.run(command, script, commandTimeout);
        } catch (CommandException e) {
            throw new SubmissionException(name() + " submission failed: " + e.getMessage(), e);
        }

        String output = result.combinedOutput().trim();
        if (!result.isSuccess()) {
            throw new SubmissionException(name() + " submission failed (exit " + result.exitCode() + "): " + output);
        }
        return parseSubmittedId(result.stdout())
                .orElseThrow(() -> new SubmissionException("Failed to parse " + name() + " job ID from: " + output));
    }

    private void ensureOpen() throws SchedulerException {
        if (closed) {
            throw new SchedulerException("Scheduler is closed");
        }
    }

    private void ensureOpenForSubmit() throws SubmissionException {
        if (closed) {
            throw new SubmissionException("Scheduler is closed");
        }
    }
}
