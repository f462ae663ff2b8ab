package org.spts.batch.metrics;

import org.spts.batch.model.Job;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;

/**
 * Terminal outcome of one job.
 *
 * @param job              the job
 * @param status           terminal status
 * @param duration         wall time on the worker
 * @param threadName       worker thread that ran the job
 * @param message          short human-readable outcome
 * @param errorDescription exception summary for FAILED, else null
 * @param traceText        full stack trace for FAILED jobs that raised, else null
 * @param timedOut         whether the failure was a timeout
 */
public record JobResult(Job job, JobStatus status, Duration duration, String threadName, String message,
                        String errorDescription, String traceText, boolean timedOut) implements HasStatus {

    public static JobResult succeeded(Job job, Duration duration) {
        return new JobResult(job, JobStatus.SUCCEEDED, duration, Thread.currentThread().getName(),
                "Saved file: " + job.outputPath(), null, null, false);
    }

    public static JobResult skipped(Job job, String reason) {
        return new JobResult(job, JobStatus.SKIPPED, Duration.ZERO, Thread.currentThread().getName(), reason,
                null, null, false);
    }

    public static JobResult cancelled(Job job) {
        return new JobResult(job, JobStatus.CANCELLED, Duration.ZERO, Thread.currentThread().getName(),
                "Not started, batch cancelled", null, null, false);
    }

    public static JobResult failed(Job job, Duration duration, Throwable cause) {
        return failed(job, duration, cause, Thread.currentThread().getName());
    }

    public static JobResult failed(Job job, Duration duration, Throwable cause, String threadName) {
        return new JobResult(job, JobStatus.FAILED, duration, threadName,
                "Generated an exception: " + cause, String.valueOf(cause), stackTrace(cause), false);
    }

    /**
     * @param threadName the worker that was running the job when the deadline passed
     */
    public static JobResult timedOut(Job job, Duration timeout, String threadName) {
        final String description = "Timeout after " + timeout.toSeconds() + "s";
        return new JobResult(job, JobStatus.FAILED, timeout, threadName, description, description, null, true);
    }

    static String stackTrace(final Throwable cause) {
        final StringWriter writer = new StringWriter();
        cause.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
