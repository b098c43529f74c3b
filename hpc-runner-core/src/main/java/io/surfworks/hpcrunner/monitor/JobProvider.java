package io.surfworks.hpcrunner.monitor;

import io.surfworks.hpcrunner.job.JobInfo;
import io.surfworks.hpcrunner.scheduler.CompletedJobQuery;
import io.surfworks.hpcrunner.scheduler.Scheduler;
import io.surfworks.hpcrunner.scheduler.SchedulerException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polls a scheduler and publishes the latest job listing.
 *
 * <p>Refreshes are single-flight: timer ticks and {@link #refreshNow()} both
 * pass through one gate, and a request that finds a refresh in progress is
 * dropped, not queued. Scheduler calls run on a dedicated worker thread, never
 * on the caller's.
 *
 * <p>A successful refresh replaces the published {@link JobSnapshot} in one
 * reference swap. A failed refresh leaves the previous snapshot in place and
 * records a {@link RefreshError}. Changing the filter triggers a refresh; if one
 * is already running, it is repeated with the new filter once it finishes and
 * its stale result is discarded.
 */
public final class JobProvider implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(JobProvider.class.getName());

    private final Scheduler scheduler;
    private final String currentUser;
    private final Duration interval;
    private final ScheduledExecutorService timer;
    private final ExecutorService worker;

    private final AtomicBoolean refreshing = new AtomicBoolean();
    private final AtomicBoolean filterChanged = new AtomicBoolean();
    private final AtomicReference<JobFilter> filter;
    private final AtomicReference<JobSnapshot> snapshot;
    private final AtomicReference<RefreshError> lastError = new AtomicReference<>();
    private final List<MonitorListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean();
    private volatile boolean closed;

    /**
     * Creates a provider showing the current user's active jobs.
     *
     * @param scheduler   Backend to poll
     * @param currentUser User name for {@link UserScope#MINE}
     * @param interval    Timer period
     */
    public JobProvider(Scheduler scheduler, String currentUser, Duration interval) {
        this(scheduler, currentUser, interval, JobFilter.mine());
    }

    public JobProvider(Scheduler scheduler, String currentUser, Duration interval, JobFilter initialFilter) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.currentUser = Objects.requireNonNull(currentUser, "currentUser cannot be null");
        this.interval = Objects.requireNonNull(interval, "interval cannot be null");
        Objects.requireNonNull(initialFilter, "initialFilter cannot be null");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }

        this.filter = new AtomicReference<>(initialFilter);
        this.snapshot = new AtomicReference<>(JobSnapshot.empty(initialFilter));
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> daemon(r, "hpc-runner-monitor-timer"));
        this.worker = Executors.newSingleThreadExecutor(r -> daemon(r, "hpc-runner-monitor-worker"));
    }

    private static Thread daemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }

    /**
     * Starts the timer. The first tick fires immediately.
     */
    public void start() {
        if (closed || !started.compareAndSet(false, true)) {
            return;
        }
        timer.scheduleAtFixedRate(this::requestRefresh, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.fine(() -> "Polling " + scheduler.name() + " every " + interval.toSeconds() + "s");
    }

    /**
     * Requests an immediate refresh. Does not reset the timer.
     *
     * @return true if a refresh was started, false if one was already in flight
     */
    public boolean refreshNow() {
        return requestRefresh();
    }

    /**
     * Changes the filter and refreshes with it.
     */
    public void setFilter(JobFilter newFilter) {
        Objects.requireNonNull(newFilter, "filter cannot be null");
        JobFilter previous = filter.getAndSet(newFilter);
        if (!newFilter.equals(previous)) {
            filterChanged.set(true);
            requestRefresh();
        }
    }

    public JobFilter filter() {
        return filter.get();
    }

    /**
     * Returns the most recently published snapshot.
     */
    public JobSnapshot snapshot() {
        return snapshot.get();
    }

    /**
     * Returns the error of the last refresh, empty if it succeeded.
     */
    public Optional<RefreshError> lastError() {
        return Optional.ofNullable(lastError.get());
    }

    public boolean isRefreshing() {
        return refreshing.get();
    }

    public Duration interval() {
        return interval;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    public void addListener(MonitorListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public void removeListener(MonitorListener listener) {
        listeners.remove(listener);
    }

    /**
     * Queries accounting on the worker thread.
     *
     * @return Future completed with the jobs, or exceptionally with the
     *         scheduler's exception (e.g. accounting not available)
     */
    public CompletableFuture<List<JobInfo>> completedJobs(CompletedJobQuery query) {
        CompletableFuture<List<JobInfo>> result = new CompletableFuture<>();
        try {
            worker.execute(() -> {
                try {
                    result.complete(scheduler.listCompletedJobs(query));
                } catch (SchedulerException | RuntimeException e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new IllegalStateException("Job provider is closed", e));
        }
        return result;
    }

    @Override
    public void close() {
        closed = true;
        timer.shutdownNow();
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ===== Refresh cycle =====

    private boolean requestRefresh() {
        if (closed) {
            return false;
        }
        if (!refreshing.compareAndSet(false, true)) {
            LOG.finest("Refresh already in flight, request dropped");
            return false;
        }
        try {
            worker.execute(this::runRefresh);
            return true;
        } catch (RejectedExecutionException e) {
            refreshing.set(false);
            return false;
        }
    }

    private void runRefresh() {
        try {
            do {
                filterChanged.set(false);
                refreshOnce(filter.get());
            } while (filterChanged.get() && !closed);
        } finally {
            refreshing.set(false);
        }
        // A filter change that raced with the gate release above
        if (filterChanged.get()) {
            requestRefresh();
        }
    }

    private void refreshOnce(JobFilter requested) {
        List<JobInfo> jobs;
        try {
            jobs = scheduler.listActiveJobs(requested.toQuery(currentUser));
        } catch (SchedulerException | RuntimeException e) {
            if (!requested.equals(filter.get())) {
                return;
            }
            RefreshError error = RefreshError.of(e);
            lastError.set(error);
            LOG.log(Level.WARNING, "Refresh from " + scheduler.name() + " failed: " + error.message(), e);
            JobSnapshot current = snapshot.get();
            for (MonitorListener listener : listeners) {
                try {
                    listener.onRefreshFailed(error, current);
                } catch (RuntimeException listenerError) {
                    LOG.log(Level.WARNING, "Monitor listener failed", listenerError);
                }
            }
            return;
        }

        if (!requested.equals(filter.get())) {
            LOG.fine("Discarding listing made with a superseded filter");
            return;
        }

        JobSnapshot published = new JobSnapshot(jobs, requested, Instant.now());
        snapshot.set(published);
        lastError.set(null);
        for (MonitorListener listener : listeners) {
            try {
                listener.onSnapshot(published);
            } catch (RuntimeException listenerError) {
                LOG.log(Level.WARNING, "Monitor listener failed", listenerError);
            }
        }
    }
}
