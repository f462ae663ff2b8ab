package org.spts.batch.selection;

import org.spts.batch.logbook.MetadataLog;
import org.spts.batch.model.BatchMode;
import org.spts.batch.model.Job;
import org.spts.batch.model.JobParameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * Builds the work set of a batch: scan, range filter, dependency resolution, ordering and job creation.
 * <pre>
 *   WorkSet workSet = new WorkSetBuilder(BatchMode.CONVERT, dataDir, log)
 *           .range(12, 15)
 *           .flatfield(flatfieldPath)
 *           .build();
 * </pre>
 */
public class WorkSetBuilder {

    private static final Logger LOGGER = Logger.getLogger(WorkSetBuilder.class.getName());

    private final BatchMode mode;
    private final Path dataDir;
    private final MetadataLog log;

    private CandidateScanner scanner = new CandidateScanner();
    private OutputPathPlanner planner;
    private JobParameters parameters = JobParameters.defaults();
    private Integer startNumber;
    private Integer endNumber;
    private String backgroundOverride;
    private int overrideFrameBudget;
    private Path flatfieldPath;
    private boolean strict;

    public WorkSetBuilder(BatchMode mode, Path dataDir, MetadataLog log) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir");
        this.log = Objects.requireNonNull(log, "log");
    }

    public WorkSetBuilder scanner(final CandidateScanner scanner) {
        this.scanner = Objects.requireNonNull(scanner);
        return this;
    }

    public WorkSetBuilder planner(final OutputPathPlanner planner) {
        this.planner = planner;
        return this;
    }

    public WorkSetBuilder parameters(final JobParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
        return this;
    }

    /**
     * Inclusive file number bounds, either may be null.
     */
    public WorkSetBuilder range(final Integer startNumber, final Integer endNumber) {
        this.startNumber = startNumber;
        this.endNumber = endNumber;
        return this;
    }

    public WorkSetBuilder backgroundOverride(final String backgroundFile, final int frameBudget) {
        this.backgroundOverride = backgroundFile;
        this.overrideFrameBudget = frameBudget;
        return this;
    }

    public WorkSetBuilder flatfield(final Path flatfieldPath) {
        this.flatfieldPath = flatfieldPath;
        return this;
    }

    /**
     * In strict mode the first resolution error aborts the build instead of skipping the candidate.
     */
    public WorkSetBuilder strict(final boolean strict) {
        this.strict = strict;
        return this;
    }

    public WorkSet build() throws IOException, WorkSetBuildException {
        final OutputPathPlanner paths = planner != null ? planner : defaultPlanner();
        final SortedSet<String> candidates = scanner.scan(dataDir, mode.inputExtension(), mode.doneExtension(),
                parameters.overwrite());

        final int scanned = candidates.size();
        if (startNumber != null || endNumber != null) {
            candidates.removeIf(name -> !withinRange(name));
        }
        final int outOfRange = scanned - candidates.size();

        final DependencyResolver resolver = new DependencyResolver(log, mode, dataDir, backgroundOverride, overrideFrameBudget);
        final List<CandidateResolution> dropped = new ArrayList<>();
        final List<CandidateResolution> unresolved = new ArrayList<>();
        final List<Job> jobs = new ArrayList<>();
        final Set<Path> plannedOutputs = new HashSet<>();

        for (final String candidate : candidates) {
            final CandidateResolution resolution = resolver.resolve(candidate);
            switch (resolution.status()) {
                case DROPPED -> dropped.add(resolution);
                case UNRESOLVED -> {
                    if (strict) {
                        throw new WorkSetBuildException(resolution.error());
                    }
                    unresolved.add(resolution);
                }
                case RESOLVED -> {
                    final Path outputPath = paths.outputPath(candidate);
                    if (!plannedOutputs.add(outputPath)) {
                        LOGGER.warning(String.format("Skipping %s: output %s already planned for another job", candidate, outputPath));
                        continue;
                    }
                    jobs.add(toJob(jobs.size() + 1, resolution, outputPath, paths));
                }
            }
        }

        LOGGER.info(String.format("Number of files to process: %d (%d dropped by log book, %d out of range)",
                jobs.size(), dropped.size(), outOfRange));
        if (!unresolved.isEmpty()) {
            LOGGER.warning(String.format("%d candidates skipped due to resolution errors", unresolved.size()));
        }
        LOGGER.fine(() -> "Found these files to process: " + jobs.stream().map(Job::fileName).toList());
        return new WorkSet(jobs, dropped, unresolved, outOfRange);
    }

    private boolean withinRange(final String fileName) {
        final OptionalInt number = FileNumbers.parse(fileName);
        if (number.isEmpty()) {
            LOGGER.fine(() -> "No file number in " + fileName + ", excluded by range filter");
            return false;
        }
        return FileNumbers.inRange(number.getAsInt(), startNumber, endNumber);
    }

    private Job toJob(final int index, final CandidateResolution resolution, final Path outputPath,
                      final OutputPathPlanner paths) {
        final String fileName = resolution.fileName();
        final Path backgroundPath = resolution.backgroundFile() != null ? dataDir.resolve(resolution.backgroundFile()) : null;
        return new Job(index, mode, dataDir.resolve(fileName), backgroundPath, resolution.backgroundFrameBudget(),
                mode.requiresBackground() ? flatfieldPath : null, resolution.frameCount(), outputPath,
                paths.configSnapshotPath(fileName), parameters);
    }

    private OutputPathPlanner defaultPlanner() {
        if (mode == BatchMode.CONVERT) {
            return OutputPathPlanner.forConversion(dataDir);
        }
        final Integer windowSize = parameters.windowSize();
        if (windowSize == null) {
            throw new IllegalStateException("Analysis batches need a window size to plan output paths");
        }
        return OutputPathPlanner.forAnalysis(dataDir, null, null, windowSize, null, startNumber, endNumber);
    }
}
