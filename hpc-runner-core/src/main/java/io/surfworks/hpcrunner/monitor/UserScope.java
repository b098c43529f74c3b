package io.surfworks.hpcrunner.monitor;

/**
 * Whose jobs the monitor shows.
 */
public enum UserScope {
    /** Jobs of the current user */
    MINE,

    /** Jobs of every user */
    ALL
}
