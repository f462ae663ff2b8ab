package org.spts.batch.processing;

import org.spts.batch.metrics.JobResult;
import org.spts.batch.metrics.JobStatus;
import org.spts.batch.model.Job;
import org.spts.batch.plugin.CaptureProcessor;
import org.spts.batch.plugin.InputProbe;
import org.spts.batch.util.ConcurrencyUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes a work set on a fixed pool of platform threads.
 * <p>
 * Jobs share no mutable state. Each completion, in whatever order it arrives, updates the progress
 * and ETA. A failing job is recorded and its siblings keep running. A job exceeding the configured
 * timeout is recorded as failed and its worker interrupted. A failure matching a configured fatal
 * exception class stops the start of further jobs while running ones drain.
 */
public class Dispatcher {

    private static final Logger LOGGER = Logger.getLogger(Dispatcher.class.getName());

    private final CaptureProcessor processor;
    private final InputProbe probe;
    private final ConfigSnapshotWriter snapshotWriter;
    private final DispatchSettings settings;
    private final Clock clock;

    public Dispatcher(CaptureProcessor processor, InputProbe probe, ConfigSnapshotWriter snapshotWriter,
                      DispatchSettings settings, Clock clock) {
        this.processor = Objects.requireNonNull(processor, "processor");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.snapshotWriter = snapshotWriter;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs all jobs and returns their results ordered by job index.
     *
     * @param name used for thread names and log lines
     */
    public List<JobResult> dispatch(final String name, final List<Job> jobs) {
        if (jobs.isEmpty()) {
            LOGGER.info("No files to process.");
            return List.of();
        }
        final int poolSize = Math.max(1, Math.min(settings.workers(), jobs.size()));
        LOGGER.info(String.format("Submitting %d jobs to %d workers%s.", jobs.size(), poolSize,
                settings.jobTimeout() != null ? " (timeout " + settings.jobTimeout().toSeconds() + "s per job)" : ""));

        final ThreadFactory workerFactory = ConcurrencyUtils.createPlatformThreadFactory(name + "-Worker-");
        final ExecutorService workerPool = Executors.newFixedThreadPool(poolSize, workerFactory);
        final ScheduledExecutorService watchdog = settings.jobTimeout() != null
                ? ConcurrencyUtils.createWatchdog(name + "-Watchdog") : null;

        final AtomicBoolean cancelled = new AtomicBoolean(false);
        final JobStateTracker states = new JobStateTracker();
        final JobRunner runner = new JobRunner(processor, probe, snapshotWriter, fatalErrorMatcher(settings.fatalExceptions()),
                cancelled, states, jobs.size(), settings.verbose());
        final ProgressTracker progress = new ProgressTracker(jobs.size(), clock);
        final List<CompletableFuture<JobResult>> jobFutures = new ArrayList<>();

        final List<JobResult> results;
        try {
            for (final Job job : jobs) {
                states.submitted(job);
                jobFutures.add(submit(job, runner, workerPool, watchdog)
                        .whenComplete((result, error) -> onCompletion(progress, states, job, result, error)));
            }
            results = new ArrayList<>(ConcurrencyUtils.waitForCompletableFuturesAndCollect(jobFutures,
                    (position, error) -> JobResult.failed(jobs.get(position), Duration.ZERO, error), name));
        } finally {
            ConcurrencyUtils.shutdownExecutorService(workerPool, name + "-WorkerPool");
            if (watchdog != null) {
                watchdog.shutdownNow();
            }
        }
        if (cancelled.get()) {
            LOGGER.warning(String.format("Batch %s was cancelled after a fatal error, %d jobs not started.",
                    name, states.count(JobStatus.CANCELLED)));
        }
        results.sort(Comparator.comparingInt(r -> r.job().index()));
        return List.copyOf(results);
    }

    /**
     * The returned future completes with the job's result, or with a timed-out result when the job runs
     * longer than the configured timeout. The deadline is armed once a worker picks the job up.
     */
    private CompletableFuture<JobResult> submit(final Job job, final JobRunner runner, final ExecutorService workerPool,
                                                final ScheduledExecutorService watchdog) {
        final CompletableFuture<JobResult> jobFuture = new CompletableFuture<>();
        final AtomicReference<Thread> worker = new AtomicReference<>();

        CompletableFuture.supplyAsync(() -> {
            final Thread current = Thread.currentThread();
            worker.set(current);
            final ScheduledFuture<?> deadline = watchdog != null
                    ? watchdog.schedule(() -> expire(job, jobFuture, worker, current.getName()),
                            settings.jobTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    : null;
            try {
                return runner.run(job);
            } finally {
                if (deadline != null) {
                    deadline.cancel(false);
                }
                synchronized (worker) {
                    worker.set(null);
                }
            }
        }, workerPool).whenComplete((result, error) -> {
            if (error != null) {
                final Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                jobFuture.complete(JobResult.failed(job, Duration.ZERO, cause));
            } else {
                jobFuture.complete(result);
            }
        });
        return jobFuture;
    }

    private void expire(final Job job, final CompletableFuture<JobResult> jobFuture, final AtomicReference<Thread> worker,
                        final String workerName) {
        final Duration timeout = settings.jobTimeout();
        if (jobFuture.complete(JobResult.timedOut(job, timeout, workerName))) {
            LOGGER.severe(String.format("Job %s exceeded the timeout of %ds on %s, interrupting it.",
                    job.fileName(), timeout.toSeconds(), workerName));
            synchronized (worker) {
                final Thread thread = worker.get();
                if (thread != null) {
                    thread.interrupt();
                }
            }
        }
    }

    private void onCompletion(final ProgressTracker progress, final JobStateTracker states, final Job job,
                              final JobResult result, final Throwable error) {
        final ProgressTracker.Progress current = progress.recordCompletion();
        if (error != null) {
            states.finished(job, JobStatus.FAILED);
            LOGGER.log(Level.SEVERE, String.format("Job %s produced no result: %s", job.fileName(), error), error);
        } else {
            states.finished(job, result.status());
            if (result.status() == JobStatus.FAILED) {
                LOGGER.warning(String.format("Job %s failed: %s", job.fileName(), result.message()));
            }
        }
        LOGGER.info(current.describe());
        LOGGER.fine(() -> String.format("%d running, %d waiting.", states.count(JobStatus.RUNNING), states.count(JobStatus.PENDING)));
    }

    /**
     * Matches a throwable whose class, any superclass, or any cause's class is named in {@code classNames}.
     */
    static Predicate<Throwable> fatalErrorMatcher(final Collection<String> classNames) {
        final Set<String> names = Set.copyOf(classNames);
        return throwable -> {
            if (names.isEmpty()) {
                return false;
            }
            final Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
            for (Throwable t = throwable; t != null && seen.add(t); t = t.getCause()) {
                for (Class<?> type = t.getClass(); type != null; type = type.getSuperclass()) {
                    if (names.contains(type.getName())) {
                        return true;
                    }
                }
            }
            return false;
        };
    }
}
