package io.surfworks.hpcrunner.job;

/**
 * Output streams a job writes to.
 */
public enum OutputStreamKind {
    STDOUT,
    STDERR
}
