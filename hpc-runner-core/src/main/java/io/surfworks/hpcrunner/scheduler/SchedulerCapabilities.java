package io.surfworks.hpcrunner.scheduler;

/**
 * Capabilities of a scheduler implementation.
 *
 * @param supportsJobArrays   Whether the scheduler can submit job arrays
 * @param supportsGpu         Whether the scheduler can handle GPU resource requests
 * @param supportsAccounting  Whether completed jobs can be queried
 * @param supportsInteractive Whether jobs can be run attached to the terminal
 * @param maxConcurrentJobs   Maximum number of concurrent jobs (0 = unlimited)
 */
public record SchedulerCapabilities(
        boolean supportsJobArrays,
        boolean supportsGpu,
        boolean supportsAccounting,
        boolean supportsInteractive,
        int maxConcurrentJobs
) {

    public SchedulerCapabilities {
        if (maxConcurrentJobs < 0) {
            throw new IllegalArgumentException("maxConcurrentJobs cannot be negative");
        }
    }

    /**
     * Creates capabilities for a local scheduler with limited concurrency.
     */
    public static SchedulerCapabilities local(int maxConcurrent) {
        return new SchedulerCapabilities(true, false, false, true, maxConcurrent);
    }

    /**
     * Creates capabilities for a full-featured cluster scheduler.
     *
     * @param accounting Whether the cluster exposes job accounting
     */
    public static SchedulerCapabilities cluster(boolean accounting) {
        return new SchedulerCapabilities(true, true, accounting, true, 0);
    }
}
