package io.surfworks.hpcrunner.config;

/**
 * Configuration for the PBS backend.
 *
 * @param jobHistory Whether the server keeps finished jobs ({@code job_history_enable}),
 *                   which makes {@code qstat -x} usable as accounting
 */
public record PbsConfig(boolean jobHistory) {

    public static PbsConfig defaults() {
        return new PbsConfig(false);
    }
}
