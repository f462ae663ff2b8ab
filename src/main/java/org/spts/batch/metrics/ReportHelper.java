package org.spts.batch.metrics;

import java.io.PrintStream;
import java.util.List;
import java.util.logging.Logger;

/**
 * Helper methods for determining overall status and printing the batch summary.
 */
public final class ReportHelper {

    private static final Logger LOGGER = Logger.getLogger(ReportHelper.class.getName());

    private ReportHelper() {
    } // Prevent instantiation

    /**
     * Determines the overall status based on a collection of results: FAILED if any result failed or if
     * fewer results than submitted tasks were collected, SUCCEEDED otherwise. Skipped and cancelled jobs
     * do not fail a batch by themselves.
     */
    public static <T extends HasStatus> JobStatus determineOverallStatus(
            final List<T> results,
            final int expectedTaskCount,
            final String levelName,
            final Object identifier) {

        final String idStr = identifier != null ? identifier.toString() : "N/A";

        final long failedCount = results.stream().filter(r -> r.status() == JobStatus.FAILED).count();
        if (failedCount > 0) {
            LOGGER.warning(String.format("%s %s: Marked as FAILED because %d job(s) failed.", levelName, idStr, failedCount));
            return JobStatus.FAILED;
        }

        // A future that did not yield a result is a lost job
        if (results.size() < expectedTaskCount) {
            LOGGER.warning(String.format("%s %s: Marked as FAILED because some jobs produced no result (%d/%d).",
                    levelName, idStr, results.size(), expectedTaskCount));
            return JobStatus.FAILED;
        }

        LOGGER.fine(() -> String.format("%s %s: Marked as SUCCEEDED (%d/%d jobs).", levelName, idStr, results.size(), expectedTaskCount));
        return JobStatus.SUCCEEDED;
    }

    public static void printSummary(final BatchReport report, final PrintStream out) {
        out.println("---------------------- BATCH SUMMARY ----------------------");
        out.printf("Mode: %-8s | Status: %-9s | Duration: %8dms%n",
                report.mode().label(), report.overallStatus(), report.duration().toMillis());
        out.printf("Jobs: %d planned | %d succeeded | %d failed (%d timed out) | %d skipped | %d cancelled%n",
                report.planned(), report.succeeded(), report.failed(), report.timedOut(), report.skipped(), report.cancelled());
        out.printf("Candidates: %d dropped by log book | %d skipped due to resolution errors%n",
                report.dropped(), report.unresolved());
        for (final JobResult result : report.results()) {
            if (result.status() == JobStatus.SUCCEEDED) {
                continue;
            }
            out.printf("  %-24s | %-9s | Thread: %-20s | %s%n",
                    result.job().fileName(), result.status(), result.threadName(), result.message());
        }
        out.println("-----------------------------------------------------------");
    }
}
