package io.surfworks.hpcrunner.cli;

import io.surfworks.hpcrunner.monitor.JobSnapshot;
import io.surfworks.hpcrunner.monitor.MonitorListener;
import io.surfworks.hpcrunner.monitor.RefreshError;

import java.io.PrintStream;
import java.util.concurrent.CountDownLatch;

/**
 * Prints each published snapshot as a table, and refresh failures as a one-line
 * warning under the last good listing.
 */
final class ConsoleMonitor implements MonitorListener {

    private static final String CLEAR_SCREEN = "\033[H\033[2J";

    private final PrintStream out;
    private final boolean clearScreen;
    private final String schedulerName;
    private final CountDownLatch remaining;

    /**
     * @param out           Destination
     * @param clearScreen   Whether to clear the terminal before each snapshot
     * @param schedulerName Shown in the header line
     * @param snapshots     Number of snapshots after which {@link #awaitDone} returns
     */
    ConsoleMonitor(PrintStream out, boolean clearScreen, String schedulerName, int snapshots) {
        this.out = out;
        this.clearScreen = clearScreen;
        this.schedulerName = schedulerName;
        this.remaining = new CountDownLatch(snapshots);
    }

    @Override
    public synchronized void onSnapshot(JobSnapshot snapshot) {
        if (clearScreen) {
            out.print(CLEAR_SCREEN);
        }
        out.printf("%s | %s | %d job(s) | %s%n",
                schedulerName,
                snapshot.filter().scope(),
                snapshot.count(),
                JobTable.formatTime(snapshot.refreshedAt()));
        if (snapshot.isEmpty()) {
            out.println("No active jobs.");
        } else {
            out.print(JobTable.format(snapshot.jobs()));
        }
        out.flush();
        remaining.countDown();
    }

    @Override
    public synchronized void onRefreshFailed(RefreshError error, JobSnapshot current) {
        out.printf("Refresh failed at %s: %s (showing %d job(s) from %s)%n",
                JobTable.formatTime(error.occurredAt()),
                error.message(),
                current.count(),
                JobTable.formatTime(current.refreshedAt()));
        out.flush();
    }

    /**
     * Blocks until the requested number of snapshots has been printed.
     */
    void awaitDone() throws InterruptedException {
        remaining.await();
    }
}
