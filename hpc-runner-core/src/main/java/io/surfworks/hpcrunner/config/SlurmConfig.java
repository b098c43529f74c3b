package io.surfworks.hpcrunner.config;

/**
 * Configuration for the Slurm backend.
 *
 * @param partition Default partition when a job names no queue (null = cluster default)
 */
public record SlurmConfig(String partition) {

    public static SlurmConfig defaults() {
        return new SlurmConfig(null);
    }
}
