package org.spts.batch.processing;

import org.spts.batch.metrics.JobResult;
import org.spts.batch.model.Job;
import org.spts.batch.plugin.CaptureProcessor;
import org.spts.batch.plugin.InputProbe;
import org.spts.batch.plugin.JobContext;
import org.spts.batch.util.FileUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one job on the calling worker thread: cancellation check, idempotency check, input probe,
 * configuration snapshot, then the processor. Every outcome is returned as a {@link JobResult}.
 */
class JobRunner {

    private static final Logger LOGGER = Logger.getLogger(JobRunner.class.getName());

    private final CaptureProcessor processor;
    private final InputProbe probe;
    private final ConfigSnapshotWriter snapshotWriter;
    private final Predicate<Throwable> fatalError;
    private final AtomicBoolean cancelled;
    private final JobStateTracker states;
    private final int totalJobs;
    private final boolean verbose;

    JobRunner(CaptureProcessor processor, InputProbe probe, ConfigSnapshotWriter snapshotWriter,
              Predicate<Throwable> fatalError, AtomicBoolean cancelled, JobStateTracker states, int totalJobs,
              boolean verbose) {
        this.processor = processor;
        this.probe = probe;
        this.snapshotWriter = snapshotWriter;
        this.fatalError = fatalError;
        this.cancelled = cancelled;
        this.states = states;
        this.totalJobs = totalJobs;
        this.verbose = verbose;
    }

    JobResult run(final Job job) {
        if (cancelled.get()) {
            LOGGER.fine(() -> "Batch cancelled, not starting " + job.fileName());
            return JobResult.cancelled(job);
        }
        states.started(job);
        final Instant jobStart = Instant.now();
        LOGGER.info(String.format("Processing file: %s (file %d of %d) on %s", job.fileName(), job.index(), totalJobs,
                Thread.currentThread().getName()));
        try {
            final Path output = job.outputPath();
            if (Files.exists(output)) {
                if (!job.parameters().overwrite()) {
                    LOGGER.info(String.format("File %s already exists. Skipping processing.", output));
                    return JobResult.skipped(job, "Output already exists: " + output);
                }
                LOGGER.info(String.format("Overwriting file %s.", output));
                Files.delete(output);
            }
            if (!probe.isValid(job.inputPath())) {
                LOGGER.warning(String.format("Input %s failed the integrity probe. Skipping processing.", job.inputPath()));
                return JobResult.skipped(job, "Input failed integrity probe: " + job.inputPath());
            }

            FileUtils.ensureParentExists(output);
            if (job.configSnapshotPath() != null) {
                snapshotWriter.write(job);
            }
            processor.process(job, new JobContext(job.index(), totalJobs, verbose));

            final Duration duration = Duration.between(jobStart, Instant.now());
            LOGGER.info(String.format("Saved file: %s (%d ms)", output, duration.toMillis()));
            return JobResult.succeeded(job, duration);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warning(String.format("Job %s interrupted.", job.fileName()));
            return JobResult.failed(job, Duration.between(jobStart, Instant.now()), e);
        } catch (final Exception e) {
            return failure(job, jobStart, e);
        } catch (final Error e) {
            // StackOverflowError, NoClassDefFoundError, OutOfMemoryError: the job fails, the worker carries on
            return failure(job, jobStart, e);
        }
    }

    private JobResult failure(final Job job, final Instant jobStart, final Throwable e) {
        LOGGER.log(Level.SEVERE, String.format("Job %s generated an exception: %s", job.fileName(), e), e);
        if (fatalError.test(e) && cancelled.compareAndSet(false, true)) {
            LOGGER.severe(String.format("Fatal error in %s (%s). No further jobs will be started; running jobs will drain.",
                    job.fileName(), e.getClass().getName()));
        }
        return JobResult.failed(job, Duration.between(jobStart, Instant.now()), e);
    }
}
