package org.spts.batch.metrics;

import org.spts.batch.model.BatchMode;

import java.time.Duration;
import java.util.List;

/**
 * Aggregated outcome of one batch run.
 */
public record BatchReport(BatchMode mode, int planned, int succeeded, int failed, int skipped, int cancelled,
                          int timedOut, int unresolved, int dropped, JobStatus overallStatus, Duration duration,
                          List<JobResult> results) {

    public static final int EXIT_OK = 0;
    public static final int EXIT_JOB_FAILURES = 1;

    public BatchReport {
        results = List.copyOf(results);
    }

    public static BatchReport from(final BatchMode mode, final int planned, final int unresolved, final int dropped,
                                   final List<JobResult> results, final Duration duration) {
        final JobStatus overall = ReportHelper.determineOverallStatus(results, planned, "Batch", mode.label());
        return new BatchReport(mode, planned,
                count(results, JobStatus.SUCCEEDED),
                count(results, JobStatus.FAILED),
                count(results, JobStatus.SKIPPED),
                count(results, JobStatus.CANCELLED),
                (int) results.stream().filter(JobResult::timedOut).count(),
                unresolved, dropped, overall, duration, results);
    }

    private static int count(final List<JobResult> results, final JobStatus status) {
        return (int) results.stream().filter(r -> r.status() == status).count();
    }

    public int exitCode() {
        return overallStatus == JobStatus.SUCCEEDED ? EXIT_OK : EXIT_JOB_FAILURES;
    }
}
