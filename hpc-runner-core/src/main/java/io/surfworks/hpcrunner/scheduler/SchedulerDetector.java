package io.surfworks.hpcrunner.scheduler;

import io.surfworks.hpcrunner.exec.BinaryResolver;
import io.surfworks.hpcrunner.exec.CommandException;
import io.surfworks.hpcrunner.exec.CommandExecutor;
import io.surfworks.hpcrunner.exec.CommandResult;
import io.surfworks.hpcrunner.exec.PathBinaryResolver;
import io.surfworks.hpcrunner.exec.ProcessCommandExecutor;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Picks the scheduler backend from the environment and the installed binaries.
 *
 * <p>Order of precedence, first match wins:
 * <ol>
 *   <li>The {@code HPC_SCHEDULER} environment variable</li>
 *   <li>A configured scheduler name other than {@code "auto"}</li>
 *   <li>SGE: {@code qsub} exists and either {@code SGE_ROOT} is set or
 *       {@code qstat -help} identifies Grid Engine</li>
 *   <li>Slurm: {@code sbatch} and {@code squeue} exist</li>
 *   <li>PBS: {@code qsub} exists and {@code PBS_CONF_FILE} is set</li>
 *   <li>{@code "local"}</li>
 * </ol>
 *
 * <p>Detection never fails. A probe that cannot run counts as a negative answer.
 */
public final class SchedulerDetector {

    private static final Logger LOG = Logger.getLogger(SchedulerDetector.class.getName());

    /** Environment variable that forces a scheduler */
    public static final String OVERRIDE_VARIABLE = "HPC_SCHEDULER";

    static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

    private final Map<String, String> env;
    private final BinaryResolver resolver;
    private final CommandExecutor executor;

    public SchedulerDetector(Map<String, String> env, BinaryResolver resolver, CommandExecutor executor) {
        this.env = Map.copyOf(Objects.requireNonNull(env, "env cannot be null"));
        this.resolver = Objects.requireNonNull(resolver, "resolver cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    /**
     * Creates a detector over this process's environment and {@code PATH}.
     */
    public static SchedulerDetector system() {
        return new SchedulerDetector(System.getenv(), new PathBinaryResolver(), new ProcessCommandExecutor());
    }

    /**
     * Detects the scheduler with no configured preference.
     */
    public String detect() {
        return detect(null);
    }

    /**
     * Detects the scheduler.
     *
     * @param configured Configured scheduler name, {@code "auto"} or null
     * @return Lower-case scheduler name
     */
    public String detect(String configured) {
        String override = env.get(OVERRIDE_VARIABLE);
        if (override != null && !override.isBlank()) {
            return override.strip().toLowerCase(Locale.ROOT);
        }
        if (configured != null && !configured.isBlank() && !"auto".equalsIgnoreCase(configured.strip())) {
            return configured.strip().toLowerCase(Locale.ROOT);
        }

        boolean hasQsub = resolver.isAvailable("qsub");
        if (hasQsub && (isSet("SGE_ROOT") || qstatIdentifiesGridEngine())) {
            return "sge";
        }
        if (resolver.isAvailable("sbatch") && resolver.isAvailable("squeue")) {
            return "slurm";
        }
        if (hasQsub && isSet("PBS_CONF_FILE")) {
            return "pbs";
        }
        return "local";
    }

    private boolean isSet(String name) {
        String value = env.get(name);
        return value != null && !value.isEmpty();
    }

    private boolean qstatIdentifiesGridEngine() {
        try {
            CommandResult result = executor.run(List.of("qstat", "-help"), null, PROBE_TIMEOUT);
            String output = result.stdout() + result.stderr();
            return output.contains("SGE") || output.contains("Grid Engine");
        } catch (CommandException e) {
            LOG.log(Level.FINE, "qstat -help probe failed", e);
            return false;
        }
    }
}
