package io.surfworks.hpcrunner.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for hpc-runner.
 *
 * <p>Configuration is resolved in order of precedence:
 * <ol>
 *   <li>CLI arguments (highest priority)</li>
 *   <li>Config file ({@code ~/.config/hpc-runner/config.json})</li>
 *   <li>Auto-detection and defaults (lowest priority)</li>
 * </ol>
 *
 * @param scheduler              Scheduler name, or {@code "auto"} to detect one
 * @param refreshIntervalSeconds Polling period of the job monitor
 * @param commandTimeoutSeconds  Upper bound on any single scheduler command
 * @param sge                    Grid Engine resource names
 * @param slurm                  Slurm settings
 * @param pbs                    PBS settings
 * @param local                  Local backend settings
 * @param ssh                    Remote head node (null = run scheduler commands locally)
 */
public record HpcConfig(
        String scheduler,
        int refreshIntervalSeconds,
        int commandTimeoutSeconds,
        SgeConfig sge,
        SlurmConfig slurm,
        PbsConfig pbs,
        LocalConfig local,
        SshConfig ssh
) {

    /** Scheduler value that requests auto-detection */
    public static final String AUTO = "auto";

    public static final int DEFAULT_REFRESH_INTERVAL = 10;
    public static final int DEFAULT_COMMAND_TIMEOUT = 30;

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "hpc-runner"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "config.json";

    public HpcConfig {
        Objects.requireNonNull(scheduler, "scheduler cannot be null");
        Objects.requireNonNull(sge, "sge cannot be null");
        Objects.requireNonNull(slurm, "slurm cannot be null");
        Objects.requireNonNull(pbs, "pbs cannot be null");
        Objects.requireNonNull(local, "local cannot be null");

        if (scheduler.isBlank()) {
            throw new IllegalArgumentException("scheduler cannot be blank");
        }
        if (refreshIntervalSeconds <= 0) {
            throw new IllegalArgumentException("refreshIntervalSeconds must be positive");
        }
        if (commandTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("commandTimeoutSeconds must be positive");
        }
        scheduler = scheduler.toLowerCase();
    }

    /**
     * Returns the default configuration: auto-detected scheduler, 10 s refresh, 30 s command timeout.
     */
    public static HpcConfig defaults() {
        return new HpcConfig(
                AUTO,
                DEFAULT_REFRESH_INTERVAL,
                DEFAULT_COMMAND_TIMEOUT,
                SgeConfig.defaults(),
                SlurmConfig.defaults(),
                PbsConfig.defaults(),
                LocalConfig.defaults(),
                null
        );
    }

    /**
     * Returns the config file path.
     */
    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    /**
     * Returns true if the scheduler should be auto-detected.
     */
    public boolean autoDetect() {
        return AUTO.equals(scheduler);
    }

    public Duration refreshInterval() {
        return Duration.ofSeconds(refreshIntervalSeconds);
    }

    public Duration commandTimeout() {
        return Duration.ofSeconds(commandTimeoutSeconds);
    }

    public HpcConfig withScheduler(String scheduler) {
        return new HpcConfig(scheduler, refreshIntervalSeconds, commandTimeoutSeconds, sge, slurm, pbs, local, ssh);
    }

    public HpcConfig withRefreshInterval(int seconds) {
        return new HpcConfig(scheduler, seconds, commandTimeoutSeconds, sge, slurm, pbs, local, ssh);
    }

    public HpcConfig withCommandTimeout(int seconds) {
        return new HpcConfig(scheduler, refreshIntervalSeconds, seconds, sge, slurm, pbs, local, ssh);
    }

    public HpcConfig withSge(SgeConfig sge) {
        return new HpcConfig(scheduler, refreshIntervalSeconds, commandTimeoutSeconds, sge, slurm, pbs, local, ssh);
    }

    public HpcConfig withSlurm(SlurmConfig slurm) {
        return new HpcConfig(scheduler, refreshIntervalSeconds, commandTimeoutSeconds, sge, slurm, pbs, local, ssh);
    }

    public HpcConfig withPbs(PbsConfig pbs) {
        return new HpcConfig(scheduler, refreshIntervalSeconds, commandTimeoutSeconds, sge, slurm, pbs, local, ssh);
    }

    public HpcConfig withLocal(LocalConfig local) {
        return new HpcConfig(scheduler, refreshIntervalSeconds, commandTimeoutSeconds, sge, slurm, pbs, local, ssh);
    }

    public HpcConfig withSsh(SshConfig ssh) {
        return new HpcConfig(scheduler, refreshIntervalSeconds, commandTimeoutSeconds, sge, slurm, pbs, local, ssh);
    }
}
