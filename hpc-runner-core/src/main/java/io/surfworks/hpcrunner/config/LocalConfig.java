package io.surfworks.hpcrunner.config;

/**
 * Configuration for the local fallback backend.
 *
 * @param maxConcurrentJobs Size of the worker pool that runs jobs
 */
public record LocalConfig(int maxConcurrentJobs) {

    public static final int DEFAULT_MAX_CONCURRENT = 4;

    public LocalConfig {
        if (maxConcurrentJobs <= 0) {
            throw new IllegalArgumentException("maxConcurrentJobs must be positive");
        }
    }

    public static LocalConfig defaults() {
        return new LocalConfig(DEFAULT_MAX_CONCURRENT);
    }
}
