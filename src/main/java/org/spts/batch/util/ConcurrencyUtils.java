package org.spts.batch.util;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility methods for handling concurrency, executors, and futures.
 */
public final class ConcurrencyUtils {

    private static final Logger LOGGER = Logger.getLogger(ConcurrencyUtils.class.getName());
    private static final Duration SHUTDOWN_WAIT_TIMEOUT = Duration.ofSeconds(60);

    private ConcurrencyUtils() {
    } // Prevent instantiation

    /**
     * Creates a ThreadFactory for creating named platform threads ({@code prefix + counter}).
     */
    public static ThreadFactory createPlatformThreadFactory(final String prefix) {
        final AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            final Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };
    }

    /**
     * Creates a single-threaded scheduler with daemon threads, used to watch job deadlines.
     */
    public static ScheduledExecutorService createWatchdog(final String name) {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            final Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Stops accepting work and waits for running tasks. Tasks still running after the grace period are
     * interrupted, queued ones are dropped.
     */
    public static void shutdownExecutorService(final ExecutorService executor, final String name) {
        if (executor == null) return;
        executor.shutdown();
        try {
            if (executor.awaitTermination(SHUTDOWN_WAIT_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                LOGGER.fine(() -> name + " stopped.");
                return;
            }
            final int dropped = executor.shutdownNow().size();
            LOGGER.warning(String.format("%s still busy after %ds, interrupting workers (%d queued tasks dropped).",
                    name, SHUTDOWN_WAIT_TIMEOUT.toSeconds(), dropped));
            if (!executor.awaitTermination(SHUTDOWN_WAIT_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                LOGGER.severe(name + " did not stop after interrupting its workers.");
            }
        } catch (final InterruptedException ie) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Waits for every future and returns one result per future, in submission order. A future that
     * completed exceptionally or was cancelled is turned into a result by {@code onFailure}, which
     * receives the future's position and the unwrapped cause.
     */
    public static <T> List<T> waitForCompletableFuturesAndCollect(
            final List<CompletableFuture<T>> futures,
            final BiFunction<Integer, Throwable, T> onFailure,
            final String name) {

        if (futures.isEmpty()) {
            return Collections.emptyList();
        }
        LOGGER.fine(() -> String.format("Waiting for %d %s jobs...", futures.size(), name));

        final List<T> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).join());
            } catch (final CompletionException | CancellationException e) {
                final Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                LOGGER.log(Level.SEVERE, String.format("%s job #%d produced no result: %s", name, i + 1, cause), cause);
                results.add(onFailure.apply(i, cause));
            }
        }
        return results;
    }
}
