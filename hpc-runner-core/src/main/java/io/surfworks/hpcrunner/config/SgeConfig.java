package io.surfworks.hpcrunner.config;

import java.util.Objects;

/**
 * Site-specific resource names for Grid Engine.
 *
 * <p>Grid Engine installations differ in how slots, memory and run time are
 * requested; these names are substituted into {@code -pe} and {@code -l} flags.
 *
 * @param parallelEnvironment Parallel environment used for multi-slot jobs
 * @param memoryResource      Complex used for memory requests
 * @param timeResource        Complex used for wall-clock limits
 */
public record SgeConfig(
        String parallelEnvironment,
        String memoryResource,
        String timeResource
) {

    public static final String DEFAULT_PARALLEL_ENVIRONMENT = "smp";
    public static final String DEFAULT_MEMORY_RESOURCE = "mem_free";
    public static final String DEFAULT_TIME_RESOURCE = "h_rt";

    public SgeConfig {
        Objects.requireNonNull(parallelEnvironment, "parallelEnvironment cannot be null");
        Objects.requireNonNull(memoryResource, "memoryResource cannot be null");
        Objects.requireNonNull(timeResource, "timeResource cannot be null");
    }

    public static SgeConfig defaults() {
        return new SgeConfig(DEFAULT_PARALLEL_ENVIRONMENT, DEFAULT_MEMORY_RESOURCE, DEFAULT_TIME_RESOURCE);
    }
}
