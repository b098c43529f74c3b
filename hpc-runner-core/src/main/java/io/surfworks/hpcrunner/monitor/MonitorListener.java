package io.surfworks.hpcrunner.monitor;

/**
 * Receives job monitor updates. Called on the monitor's worker thread;
 * implementations should hand off to their own thread for anything slow.
 */
public interface MonitorListener {

    /**
     * A refresh succeeded and published a new snapshot.
     */
    void onSnapshot(JobSnapshot snapshot);

    /**
     * A refresh failed. The previous snapshot stays published.
     *
     * @param error   What went wrong
     * @param current The snapshot still in effect
     */
    default void onRefreshFailed(RefreshError error, JobSnapshot current) {
    }
}
