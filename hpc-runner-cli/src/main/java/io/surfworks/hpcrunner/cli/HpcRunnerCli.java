package io.surfworks.hpcrunner.cli;

import io.surfworks.hpcrunner.config.HpcConfig;
import io.surfworks.hpcrunner.config.HpcConfigLoader;
import io.surfworks.hpcrunner.config.LocalConfig;
import io.surfworks.hpcrunner.config.PbsConfig;
import io.surfworks.hpcrunner.config.SgeConfig;
import io.surfworks.hpcrunner.config.SlurmConfig;
import io.surfworks.hpcrunner.config.SshConfig;
import io.surfworks.hpcrunner.job.ArrayJobResult;
import io.surfworks.hpcrunner.job.JobArraySpec;
import io.surfworks.hpcrunner.job.JobInfo;
import io.surfworks.hpcrunner.job.JobResult;
import io.surfworks.hpcrunner.job.JobSpec;
import io.surfworks.hpcrunner.job.JobStatus;
import io.surfworks.hpcrunner.monitor.JobFilter;
import io.surfworks.hpcrunner.monitor.JobProvider;
import io.surfworks.hpcrunner.scheduler.ActiveJobQuery;
import io.surfworks.hpcrunner.scheduler.CompletedJobQuery;
import io.surfworks.hpcrunner.scheduler.Scheduler;
import io.surfworks.hpcrunner.scheduler.SchedulerException;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * hpc-runner CLI - uniform job submission and monitoring for batch schedulers.
 *
 * <p>Commands:
 * <ul>
 *   <li>submit - Submit a job or job array</li>
 *   <li>script - Print the job script a submission would use</li>
 *   <li>status - Get job status</li>
 *   <li>cancel - Cancel a job</li>
 *   <li>list - List active jobs</li>
 *   <li>history - List completed jobs from accounting</li>
 *   <li>details - Show everything known about a job</li>
 *   <li>monitor - Live view of active jobs</li>
 *   <li>detect - Show which scheduler would be used</li>
 *   <li>config - Show/set configuration</li>
 * </ul>
 */
public class HpcRunnerCli {

    private static final Logger LOG = Logger.getLogger(HpcRunnerCli.class.getName());

    private static final String VERSION = "0.1.0";
    private static final Duration WAIT_TIMEOUT = Duration.ofDays(7);

    private final PrintStream out;
    private final PrintStream err;
    private final HpcConfig config;
    private final Path configFile;
    private final SchedulerFactory schedulers;
    private final String currentUser;

    HpcRunnerCli(PrintStream out, PrintStream err, HpcConfig config, Path configFile,
                 SchedulerFactory schedulers, String currentUser) {
        this.out = out;
        this.err = err;
        this.config = config;
        this.configFile = configFile;
        this.schedulers = schedulers;
        this.currentUser = currentUser;
    }

    public static void main(String[] args) {
        configureLogging();
        HpcConfig config = HpcConfigLoader.load();
        HpcRunnerCli cli = new HpcRunnerCli(
                System.out, System.err, config, HpcConfig.configFile(),
                SchedulerFactory.forConfig(config), System.getProperty("user.name"));
        int exitCode = cli.run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = HpcRunnerCli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging configuration: " + e.getMessage());
        }
    }

    /**
     * Runs one command.
     *
     * @return Process exit code
     */
    int run(String[] args) {
        if (args.length == 0) {
            printHelp();
            return 0;
        }

        String command = args[0];

        // Handle global flags (only when they're the command itself)
        if (command.equals("--help") || command.equals("-h")) {
            printHelp();
            return 0;
        }
        if (command.equals("--version") || command.equals("-v")) {
            out.println("hpc-runner " + VERSION);
            return 0;
        }
        String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);

        try {
            return switch (command) {
                case "submit" -> handleSubmit(commandArgs);
                case "script" -> handleScript(commandArgs);
                case "status" -> handleStatus(commandArgs);
                case "cancel" -> handleCancel(commandArgs);
                case "list" -> handleList(commandArgs);
                case "history" -> handleHistory(commandArgs);
                case "details" -> handleDetails(commandArgs);
                case "monitor" -> handleMonitor(commandArgs);
                case "detect" -> handleDetect(commandArgs);
                case "config" -> handleConfig(commandArgs);
                default -> {
                    err.println("Unknown command: " + command);
                    err.println("Run 'hpc --help' for usage.");
                    yield 1;
                }
            };
        } catch (SchedulerException e) {
            err.println("Scheduler error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted.");
            return 130;
        }
    }

    // ===== Submission =====

    private int handleSubmit(String[] args) throws SchedulerException, IOException {
        String[] options = options(args);
        if (hasFlag(options, "--help")) {
            printSubmitHelp();
            return 0;
        }
        String command = trailingCommand(args);
        if (command == null) {
            err.println("Error: a command is required after '--'");
            printSubmitHelp();
            return 1;
        }

        boolean dryRun = hasFlag(options, "--dry-run");
        boolean interactive = hasFlag(options, "--interactive");
        boolean wait = hasFlag(options, "--wait");
        boolean json = hasFlag(options, "--json");
        String array = getFlagValue(options, "--array");
        String maxConcurrent = getFlagValue(options, "--max-concurrent");

        if (interactive && array != null) {
            throw new IllegalArgumentException("--interactive cannot be combined with --array");
        }

        String schedulerName = schedulers.resolveName(getFlagValue(options, "--scheduler"));
        JobSpec spec = buildSpec(options, command, schedulerName);

        try (Scheduler scheduler = schedulers.open(schedulerName)) {
            if (dryRun) {
                out.println("# " + String.join(" ", scheduler.buildSubmitCommand(spec)));
                out.print(scheduler.generateScript(spec));
                return 0;
            }

            if (array != null) {
                JobArraySpec arraySpec = JobArraySpec.parse(spec, array);
                if (maxConcurrent != null) {
                    arraySpec = arraySpec.withMaxConcurrent(Integer.parseInt(maxConcurrent));
                }
                ArrayJobResult result = scheduler.submitArray(arraySpec);
                if (json) {
                    out.println(JsonOutput.toJson(new ArraySubmitResponse(
                            result.baseJobId(), result.scheduler(), result.taskJobIds())));
                } else {
                    out.println("Submitted array job " + result.baseJobId() + " (" +
                            arraySpec.taskCount() + " tasks) to " + result.scheduler());
                }
                return 0;
            }

            JobResult result = scheduler.submit(spec, interactive);
            if (interactive) {
                int exitCode = result.exitCode() == null ? 0 : result.exitCode();
                if (json) {
                    out.println(JsonOutput.toJson(result));
                }
                return exitCode;
            }

            if (json) {
                out.println(JsonOutput.toJson(result));
            } else {
                out.println("Submitted job " + result.jobId() + " to " + result.scheduler());
            }

            if (wait) {
                out.println("Waiting for job to complete...");
                JobStatus finalStatus = scheduler.awaitCompletion(result.jobId(), WAIT_TIMEOUT);
                out.println("Job " + result.jobId() + " finished: " + finalStatus);
                return finalStatus.isSuccess() ? 0 : 1;
            }
            return 0;
        }
    }

    private int handleScript(String[] args) {
        String[] options = options(args);
        String command = trailingCommand(args);
        if (hasFlag(options, "--help")) {
            out.println("Usage: hpc script [submit options] -- <command>");
            return 0;
        }
        if (command == null) {
            err.println("Error: a command is required after '--'");
            return 1;
        }
        String schedulerName = schedulers.resolveName(getFlagValue(options, "--scheduler"));
        try (Scheduler scheduler = schedulers.open(schedulerName)) {
            out.print(scheduler.generateScript(buildSpec(options, command, schedulerName)));
        }
        return 0;
    }

    /**
     * Builds a job from submit options.
     *
     * @param options       Arguments before the {@code --} separator
     * @param command       The job's command line
     * @param schedulerName Scheduler that {@code --raw} arguments are passed to
     */
    static JobSpec buildSpec(String[] options, String command, String schedulerName) {
        String name = getFlagValue(options, "--name");
        if (name == null) {
            name = defaultJobName(command);
        }

        JobSpec.Builder builder = JobSpec.builder(name, command)
                .queue(getFlagValue(options, "--queue"))
                .memory(getFlagValue(options, "--mem"))
                .mergeOutput(hasFlag(options, "--merge"));

        String cpu = getFlagValue(options, "--cpu");
        if (cpu != null) {
            builder.cpu(Integer.parseInt(cpu));
        }
        String gpu = getFlagValue(options, "--gpu");
        if (gpu != null) {
            builder.gpu(Integer.parseInt(gpu));
        }
        String time = getFlagValue(options, "--time");
        if (time != null) {
            builder.timeLimit(parseTimeLimit(time));
        }
        String workDir = getFlagValue(options, "--workdir");
        if (workDir != null) {
            builder.workDir(Path.of(workDir));
        }
        String stdout = getFlagValue(options, "--stdout");
        if (stdout != null) {
            builder.stdoutPath(Path.of(stdout));
        }
        String stderr = getFlagValue(options, "--stderr");
        if (stderr != null) {
            builder.stderrPath(Path.of(stderr));
        }

        List<String> env = getFlagValues(options, "--env");
        if (!env.isEmpty()) {
            Map<String, String> environment = new LinkedHashMap<>();
            for (String entry : env) {
                String[] parts = entry.split("=", 2);
                if (parts.length != 2 || parts[0].isBlank()) {
                    throw new IllegalArgumentException("Invalid --env value (expected KEY=VALUE): " + entry);
                }
                environment.put(parts[0], parts[1]);
            }
            builder.environment(environment);
        }

        String after = getFlagValue(options, "--after");
        if (after != null) {
            builder.dependencies(splitList(after));
        }

        String raw = getFlagValue(options, "--raw");
        if (raw != null && !raw.isBlank()) {
            builder.rawArgs(schedulerName, List.of(raw.trim().split("\\s+")));
        }
        return builder.build();
    }

    /**
     * Derives a job name from the first word of a command, e.g. "train" for
     * "./bin/train --epochs 3".
     */
    static String defaultJobName(String command) {
        String first = command.trim().split("\\s+", 2)[0];
        int slash = first.lastIndexOf('/');
        String base = slash >= 0 ? first.substring(slash + 1) : first;
        return base.isEmpty() ? "job" : base;
    }

    /**
     * Parses a time limit given as {@code H:MM:SS}, {@code H:MM} or whole minutes.
     */
    static Duration parseTimeLimit(String value) {
        String[] parts = value.trim().split(":");
        try {
            return switch (parts.length) {
                case 1 -> Duration.ofMinutes(Long.parseLong(parts[0]));
                case 2 -> Duration.ofHours(Long.parseLong(parts[0]))
                        .plusMinutes(Long.parseLong(parts[1]));
                case 3 -> Duration.ofHours(Long.parseLong(parts[0]))
                        .plusMinutes(Long.parseLong(parts[1]))
                        .plusSeconds(Long.parseLong(parts[2]));
                default -> throw new IllegalArgumentException("Invalid time limit: " + value);
            };
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid time limit: " + value, e);
        }
    }

    // ===== Job queries =====

    private int handleStatus(String[] args) throws IOException {
        if (args.length == 0 || args[0].startsWith("--") || hasFlag(args, "--help")) {
            out.println("Usage: hpc status <job-id> [--scheduler <name>] [--json]");
            return args.length == 0 ? 1 : 0;
        }

        String jobId = args[0];
        boolean json = hasFlag(args, "--json");
        try (Scheduler scheduler = openScheduler(args)) {
            JobStatus status = scheduler.status(jobId);
            if (json) {
                out.println(JsonOutput.toJson(new StatusResponse(jobId, status)));
            } else {
                out.println(jobId + ": " + status);
            }
        }
        return 0;
    }

    private int handleCancel(String[] args) {
        if (args.length == 0 || args[0].startsWith("--") || hasFlag(args, "--help")) {
            out.println("Usage: hpc cancel <job-id> [--scheduler <name>]");
            return args.length == 0 ? 1 : 0;
        }

        String jobId = args[0];
        try (Scheduler scheduler = openScheduler(args)) {
            if (scheduler.cancel(jobId)) {
                out.println("Job " + jobId + " cancelled.");
                return 0;
            }
        }
        out.println("Job " + jobId + " could not be cancelled (may have already completed).");
        return 1;
    }

    private int handleList(String[] args) throws SchedulerException, IOException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: hpc list [--all | --user <name>] [--status <s,...>] [--queue <name>] " +
                    "[--scheduler <name>] [--json]");
            out.println("Statuses: PENDING, RUNNING, UNKNOWN (default: all three)");
            return 0;
        }

        boolean json = hasFlag(args, "--json");
        ActiveJobQuery query = filterFromFlags(args).toQuery(currentUser);
        String user = getFlagValue(args, "--user");
        if (user != null) {
            query = query.withUser(user);
        }

        try (Scheduler scheduler = openScheduler(args)) {
            List<JobInfo> jobs = scheduler.listActiveJobs(query);
            if (json) {
                out.println(JsonOutput.toJson(jobs));
            } else if (jobs.isEmpty()) {
                out.println("No jobs found.");
            } else {
                out.print(JobTable.format(jobs));
            }
        }
        return 0;
    }

    private int handleHistory(String[] args) throws SchedulerException, IOException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: hpc history [--all | --user <name>] [--since <date|instant>] [--until <date|instant>]");
            out.println("                   [--days <n>] [--exit-code <n>] [--queue <name>] [--limit <n>] [--json]");
            return 0;
        }

        boolean json = hasFlag(args, "--json");
        CompletedJobQuery query = CompletedJobQuery.recent();
        String user = getFlagValue(args, "--user");
        if (user != null) {
            query = query.withUser(user);
        } else if (!hasFlag(args, "--all")) {
            query = query.withUser(currentUser);
        }

        Instant since = parseInstant(getFlagValue(args, "--since"));
        Instant until = parseInstant(getFlagValue(args, "--until"));
        String days = getFlagValue(args, "--days");
        if (days != null && since == null) {
            since = Instant.now().minus(Duration.ofDays(Long.parseLong(days)));
        }
        if (since != null || until != null) {
            query = query.inTimeRange(since, until);
        }
        String exitCode = getFlagValue(args, "--exit-code");
        if (exitCode != null) {
            query = query.withExitCode(Integer.parseInt(exitCode));
        }
        String queue = getFlagValue(args, "--queue");
        if (queue != null) {
            query = query.withQueue(queue);
        }
        String limit = getFlagValue(args, "--limit");
        if (limit != null) {
            query = query.withLimit(Integer.parseInt(limit));
        }

        try (Scheduler scheduler = openScheduler(args)) {
            List<JobInfo> jobs = scheduler.listCompletedJobs(query);
            if (json) {
                out.println(JsonOutput.toJson(jobs));
            } else if (jobs.isEmpty()) {
                out.println("No completed jobs found.");
            } else {
                out.print(JobTable.format(jobs));
            }
        }
        return 0;
    }

    private int handleDetails(String[] args) throws SchedulerException, IOException {
        if (args.length == 0 || args[0].startsWith("--") || hasFlag(args, "--help")) {
            out.println("Usage: hpc details <job-id> [--scheduler <name>] [--json]");
            return args.length == 0 ? 1 : 0;
        }

        String jobId = args[0];
        try (Scheduler scheduler = openScheduler(args)) {
            JobInfo job = scheduler.jobDetails(jobId);
            if (hasFlag(args, "--json")) {
                out.println(JsonOutput.toJson(job));
            } else {
                out.print(JobTable.details(job));
            }
        }
        return 0;
    }

    // ===== Monitoring =====

    private int handleMonitor(String[] args) throws InterruptedException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: hpc monitor [--all] [--status <s,...>] [--queue <name>] [--interval <seconds>]");
            out.println("                   [--count <n>] [--scheduler <name>]");
            out.println();
            out.println("Refreshes until interrupted, or until <n> listings have been shown.");
            return 0;
        }

        JobFilter filter = filterFromFlags(args);
        String intervalFlag = getFlagValue(args, "--interval");
        Duration interval = intervalFlag != null
                ? Duration.ofSeconds(Long.parseLong(intervalFlag))
                : config.refreshInterval();
        String countFlag = getFlagValue(args, "--count");
        int count = countFlag != null ? Integer.parseInt(countFlag) : Integer.MAX_VALUE;
        if (count <= 0) {
            throw new IllegalArgumentException("--count must be positive");
        }

        String schedulerName = schedulers.resolveName(getFlagValue(args, "--scheduler"));
        try (Scheduler scheduler = schedulers.open(schedulerName);
             JobProvider provider = new JobProvider(scheduler, currentUser, interval, filter)) {
            ConsoleMonitor console = new ConsoleMonitor(out, countFlag == null, schedulerName, count);
            provider.addListener(console);
            LOG.fine(() -> "Monitoring " + schedulerName + " every " + interval.toSeconds() + "s");
            provider.start();
            console.awaitDone();
        }
        return 0;
    }

    private static JobFilter filterFromFlags(String[] args) {
        JobFilter filter = hasFlag(args, "--all") ? JobFilter.all() : JobFilter.mine();
        String statuses = getFlagValue(args, "--status");
        if (statuses != null) {
            filter = filter.withStatuses(parseStatuses(statuses));
        }
        String queue = getFlagValue(args, "--queue");
        if (queue != null) {
            filter = filter.withQueue(queue);
        }
        return filter;
    }

    static Set<JobStatus> parseStatuses(String value) {
        Set<JobStatus> statuses = EnumSet.noneOf(JobStatus.class);
        for (String name : splitList(value)) {
            try {
                statuses.add(JobStatus.valueOf(name.toUpperCase()));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown status: " + name, e);
            }
        }
        return statuses;
    }

    // ===== Environment =====

    private int handleDetect(String[] args) {
        if (hasFlag(args, "--help")) {
            out.println("Usage: hpc detect");
            out.println("Prints the scheduler chosen from HPC_SCHEDULER, the config file and installed tools.");
            return 0;
        }
        out.println(schedulers.resolveName(null));
        return 0;
    }

    private int handleConfig(String[] args) throws IOException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: hpc config [--set <key>=<value>] [--json]");
            out.println();
            out.println("Config keys:");
            out.println("  scheduler                - sge, slurm, pbs, local or auto");
            out.println("  refreshIntervalSeconds   - Monitor refresh period");
            out.println("  commandTimeoutSeconds    - Timeout for each scheduler command");
            out.println("  sge.parallelEnvironment  - Parallel environment for CPU requests");
            out.println("  sge.memoryResource       - Resource name for memory requests");
            out.println("  sge.timeResource         - Resource name for time limits");
            out.println("  slurm.partition          - Default partition");
            out.println("  pbs.jobHistory           - Whether qstat -x is available");
            out.println("  local.maxConcurrentJobs  - Local worker pool size");
            out.println("  ssh                      - user@host of a remote head node, or 'none'");
            out.println("  ssh.keyPath              - SSH identity file");
            return 0;
        }

        boolean json = hasFlag(args, "--json");
        String setValue = getFlagValue(args, "--set");

        HpcConfig current = config;
        if (setValue != null) {
            String[] parts = setValue.split("=", 2);
            if (parts.length != 2) {
                err.println("Invalid format. Use --set key=value");
                return 1;
            }
            current = applySetting(current, parts[0], parts[1]);
            HpcConfigLoader.save(current, configFile);
            out.println("Configuration updated.");
        }

        if (json) {
            out.println(JsonOutput.toJson(HpcConfigLoader.toJson(current)));
        } else {
            out.println("Configuration (" + configFile + "):");
            out.println("-".repeat(40));
            out.println("Scheduler: " + current.scheduler());
            out.println("Refresh Interval: " + current.refreshIntervalSeconds() + "s");
            out.println("Command Timeout: " + current.commandTimeoutSeconds() + "s");
            out.println("SGE: pe=" + current.sge().parallelEnvironment() +
                    " memory=" + current.sge().memoryResource() +
                    " time=" + current.sge().timeResource());
            out.println("Slurm Partition: " +
                    (current.slurm().partition() != null ? current.slurm().partition() : "(default)"));
            out.println("PBS Job History: " + current.pbs().jobHistory());
            out.println("Local Max Concurrent: " + current.local().maxConcurrentJobs());
            out.println("SSH: " + (current.ssh() != null ? current.ssh().target() : "(not set)"));
        }
        return 0;
    }

    /**
     * Returns a copy of {@code config} with one key changed.
     *
     * @throws IllegalArgumentException for unknown keys or invalid values
     */
    static HpcConfig applySetting(HpcConfig config, String key, String value) {
        return switch (key) {
            case "scheduler" -> config.withScheduler(value);
            case "refreshIntervalSeconds" -> config.withRefreshInterval(Integer.parseInt(value));
            case "commandTimeoutSeconds" -> config.withCommandTimeout(Integer.parseInt(value));
            case "sge.parallelEnvironment" -> config.withSge(new SgeConfig(
                    value, config.sge().memoryResource(), config.sge().timeResource()));
            case "sge.memoryResource" -> config.withSge(new SgeConfig(
                    config.sge().parallelEnvironment(), value, config.sge().timeResource()));
            case "sge.timeResource" -> config.withSge(new SgeConfig(
                    config.sge().parallelEnvironment(), config.sge().memoryResource(), value));
            case "slurm.partition" -> config.withSlurm(new SlurmConfig(value.isBlank() ? null : value));
            case "pbs.jobHistory" -> config.withPbs(new PbsConfig(Boolean.parseBoolean(value)));
            case "local.maxConcurrentJobs" -> config.withLocal(new LocalConfig(Integer.parseInt(value)));
            case "ssh" -> {
                if (value.isBlank() || value.equalsIgnoreCase("none")) {
                    yield config.withSsh(null);
                }
                int at = value.indexOf('@');
                if (at <= 0 || at == value.length() - 1) {
                    throw new IllegalArgumentException("ssh must be user@host: " + value);
                }
                SshConfig ssh = SshConfig.of(value.substring(at + 1), value.substring(0, at));
                if (config.ssh() != null && config.ssh().keyPath() != null) {
                    ssh = ssh.withKey(config.ssh().keyPath());
                }
                yield config.withSsh(ssh);
            }
            case "ssh.keyPath" -> {
                if (config.ssh() == null) {
                    throw new IllegalArgumentException("Set ssh=user@host before ssh.keyPath");
                }
                yield config.withSsh(config.ssh().withKey(Path.of(value)));
            }
            default -> throw new IllegalArgumentException("Unknown config key: " + key);
        };
    }

    // ===== Helper methods =====

    private Scheduler openScheduler(String[] args) {
        return schedulers.open(schedulers.resolveName(getFlagValue(args, "--scheduler")));
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(value).atStartOfDay(ZoneId.systemDefault()).toInstant();
            } catch (DateTimeParseException dateError) {
                throw new IllegalArgumentException(
                        "Invalid time (expected yyyy-MM-dd or an ISO instant): " + value, dateError);
            }
        }
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    /**
     * Returns the arguments before a {@code --} separator (all of them if there is none).
     */
    static String[] options(String[] args) {
        int separator = Arrays.asList(args).indexOf("--");
        return separator < 0 ? args : Arrays.copyOfRange(args, 0, separator);
    }

    /**
     * Returns the arguments after a {@code --} separator joined by spaces, or null.
     */
    static String trailingCommand(String[] args) {
        int separator = Arrays.asList(args).indexOf("--");
        if (separator < 0 || separator == args.length - 1) {
            return null;
        }
        return String.join(" ", Arrays.copyOfRange(args, separator + 1, args.length));
    }

    static boolean hasFlag(String[] args, String flag) {
        return Arrays.asList(args).contains(flag);
    }

    static String getFlagValue(String[] args, String flag) {
        List<String> argList = Arrays.asList(args);
        int index = argList.indexOf(flag);
        if (index >= 0 && index < args.length - 1) {
            return args[index + 1];
        }
        return null;
    }

    /**
     * Returns the values of every occurrence of a repeatable flag.
     */
    static List<String> getFlagValues(String[] args, String flag) {
        List<String> values = new ArrayList<>();
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].equals(flag)) {
                values.add(args[i + 1]);
            }
        }
        return values;
    }

    // ===== Help output =====

    private void printHelp() {
        out.println("hpc-runner - uniform job submission and monitoring for batch schedulers");
        out.println();
        out.println("Usage: hpc <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  submit    Submit a job or job array");
        out.println("  script    Print the job script a submission would use");
        out.println("  status    Get job status");
        out.println("  cancel    Cancel a job");
        out.println("  list      List active jobs");
        out.println("  history   List completed jobs (needs scheduler accounting)");
        out.println("  details   Show everything known about a job");
        out.println("  monitor   Live view of active jobs");
        out.println("  detect    Show which scheduler would be used");
        out.println("  config    Show/set configuration");
        out.println();
        out.println("Options:");
        out.println("  -h, --help    Show help for a command");
        out.println("  -v, --version Show version");
        out.println();
        out.println("Examples:");
        out.println("  hpc submit --cpu 4 --mem 16G --time 2:00:00 -- python train.py");
        out.println("  hpc submit --array 1-100 --max-concurrent 10 -- ./process.sh");
        out.println("  hpc list --all --status RUNNING");
        out.println("  hpc monitor --interval 5");
    }

    private void printSubmitHelp() {
        out.println("Usage: hpc submit [options] -- <command>");
        out.println();
        out.println("Options:");
        out.println("  --name <name>           Job name (default: first word of the command)");
        out.println("  --queue <name>          Queue or partition");
        out.println("  --cpu <n>               Cores / slots");
        out.println("  --mem <size>            Memory, e.g. 16G");
        out.println("  --gpu <n>               GPUs");
        out.println("  --time <H:MM:SS|min>    Wall-clock limit");
        out.println("  --workdir <dir>         Working directory");
        out.println("  --stdout <file>         Standard output file");
        out.println("  --stderr <file>         Standard error file");
        out.println("  --merge                 Merge stderr into stdout");
        out.println("  --env <KEY=VALUE>       Export a variable (repeatable)");
        out.println("  --after <id,...>        Run after these jobs succeed");
        out.println("  --raw \"<args>\"          Extra native scheduler arguments");
        out.println("  --array <start-end[:step]>  Submit a job array");
        out.println("  --max-concurrent <n>    Array tasks running at once");
        out.println("  --interactive           Run attached to the terminal");
        out.println("  --wait                  Wait for a batch job to finish");
        out.println("  --dry-run               Print the submit command and script only");
        out.println("  --scheduler <name>      sge, slurm, pbs or local (default: detect)");
        out.println("  --json                  Output as JSON");
    }

    // ===== Response records for JSON output =====

    record StatusResponse(String jobId, JobStatus status) {}

    record ArraySubmitResponse(String baseJobId, String scheduler, List<String> taskJobIds) {}
}
