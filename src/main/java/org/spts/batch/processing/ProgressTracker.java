package org.spts.batch.processing;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Counts completed jobs and estimates the remaining time from the average job duration so far.
 * Completions arrive from worker threads in any order.
 */
public class ProgressTracker {

    private final int total;
    private final Clock clock;
    private final Instant start;
    private int completed;

    public ProgressTracker(int total, Clock clock) {
        this.total = total;
        this.clock = clock;
        this.start = clock.instant();
    }

    /**
     * Records one completion and returns the progress including it.
     */
    public synchronized Progress recordCompletion() {
        completed++;
        final Duration elapsed = Duration.between(start, clock.instant());
        final double averageSeconds = elapsed.toNanos() / 1e9 / completed;
        final double etaSeconds = averageSeconds * Math.max(0, total - completed);
        return new Progress(completed, total, elapsed, etaSeconds);
    }

    public synchronized int completed() {
        return completed;
    }

    public record Progress(int completed, int total, Duration elapsed, double etaSeconds) {

        public String describe() {
            return String.format(Locale.ROOT, "Processed %d/%d files. ETA: %.2f seconds", completed, total, etaSeconds);
        }
    }
}
