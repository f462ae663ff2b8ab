package org.spts.batch;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.ParseException;
import org.spts.batch.config.AppConfig;
import org.spts.batch.config.BatchConfigurationException;
import org.spts.batch.config.BatchRequest;
import org.spts.batch.config.CommandLineOptions;
import org.spts.batch.config.ConfigManager;
import org.spts.batch.logbook.MetadataLoadException;
import org.spts.batch.logbook.MetadataLog;
import org.spts.batch.metrics.BatchReport;
import org.spts.batch.metrics.JobResult;
import org.spts.batch.metrics.ReportHelper;
import org.spts.batch.model.BatchMode;
import org.spts.batch.model.JobParameters;
import org.spts.batch.plugin.CaptureProcessor;
import org.spts.batch.plugin.InputProbe;
import org.spts.batch.processing.ConfigSnapshotWriter;
import org.spts.batch.processing.DispatchSettings;
import org.spts.batch.processing.Dispatcher;
import org.spts.batch.processing.ExternalCommandProcessor;
import org.spts.batch.processing.Hdf5SignatureProbe;
import org.spts.batch.processing.NonEmptyFileProbe;
import org.spts.batch.selection.FlatfieldLocator;
import org.spts.batch.selection.OutputPathPlanner;
import org.spts.batch.selection.WorkSet;
import org.spts.batch.selection.WorkSetBuildException;
import org.spts.batch.selection.WorkSetBuilder;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.RandomAccessFile;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Batch driver for SPTS captures: selects the files of a data directory that still need conversion or
 * analysis, resolves their inputs from the experiment log book and runs one external job per file on a
 * pool of worker threads.
 * <pre>
 *   spts-batch convert -d data/2024/run3 -l logbook.csv -sn 12 -en 15 -c 8
 *   spts-batch analyze -d data/2024/run3 -l logbook.csv -wd 5 -out d25
 * </pre>
 */
public class SptsBatch {

    private static final Logger LOGGER = Logger.getLogger(SptsBatch.class.getName());

    public static final int EXIT_CONFIG_ERROR = 2;
    public static final String LOCK_FILE_NAME = ".spts-batch.lock";
    public static final String DEFAULT_TEMPLATE_NAME = "spts.yaml";

    private final BatchRequest request;
    private final CaptureProcessor processor;
    private final InputProbe probe;
    private final Clock clock;

    public SptsBatch(final BatchRequest request) {
        this(request, null, null, Clock.systemUTC());
    }

    /**
     * @param processor runs each job, null for the external command of the request
     * @param probe     input check before each job, null for the mode's default probe
     */
    public SptsBatch(final BatchRequest request, final CaptureProcessor processor, final InputProbe probe, final Clock clock) {
        this.request = Objects.requireNonNull(request, "Batch request cannot be null");
        this.processor = processor;
        this.probe = probe;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // --- Main Method ---
    public static void main(final String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the command line and returns the process exit code.
     */
    public static int run(final String[] args) {
        final CommandLine cmd;
        try {
            cmd = CommandLineOptions.parse(args);
        } catch (final ParseException e) {
            System.err.println("Error: " + e.getMessage());
            printHelp();
            return EXIT_CONFIG_ERROR;
        }
        if (cmd.hasOption("help")) {
            printHelp();
            return BatchReport.EXIT_OK;
        }

        final BatchRequest request;
        try {
            final Path configPath = CommandLineOptions.configPath(cmd);
            final AppConfig appConfig = ConfigManager.load(configPath, configPath != null);
            request = CommandLineOptions.toRequest(cmd, appConfig);
        } catch (final BatchConfigurationException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        ConfigManager.setVerbose(request.verbose());
        return runExclusively(request, Path.of(".").resolve(LOCK_FILE_NAME));
    }

    static int runExclusively(final BatchRequest request, final Path lockFilePath) {
        try (RandomAccessFile raf = new RandomAccessFile(lockFilePath.toFile(), "rw");
             FileChannel channel = raf.getChannel();
             FileLock lock = tryLock(channel)) {
            if (lock == null) {
                System.err.printf("!!!! WARN: Could not acquire lock (%s), another instance already running ??? %n", lockFilePath);
                return EXIT_CONFIG_ERROR;
            }

            System.out.println("========================================================");
            System.out.printf(" Starting %s batch on %s%n", request.mode().label(), request.dataDir());
            System.out.println("========================================================");

            final BatchReport report = new SptsBatch(request).execute();

            System.out.println("\n========================================================");
            System.out.println(" Batch Finished ");
            System.out.println("========================================================");
            ReportHelper.printSummary(report, System.out);
            return report.exitCode();
        } catch (final BatchConfigurationException | WorkSetBuildException e) {
            LOGGER.severe(e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (final IOException e) {
            LOGGER.severe("I/O error before dispatch: " + e);
            return EXIT_CONFIG_ERROR;
        }
    }

    private static FileLock tryLock(final FileChannel channel) throws IOException {
        try {
            return channel.tryLock();
        } catch (final OverlappingFileLockException e) {
            return null; // held by this JVM
        }
    }

    private static void printHelp() {
        CommandLineOptions.printHelp(new PrintWriter(System.out, true, StandardCharsets.UTF_8));
    }

    // --- Entry Point ---
    public BatchReport execute() throws BatchConfigurationException, WorkSetBuildException, IOException {
        final Instant batchStart = clock.instant();
        final BatchMode mode = request.mode();
        final Path dataDir = request.dataDir();
        if (!Files.isDirectory(dataDir)) {
            throw new BatchConfigurationException("Data directory not found: " + dataDir);
        }

        final MetadataLog log;
        try {
            log = MetadataLog.load(request.logFile());
        } catch (final MetadataLoadException e) {
            throw new BatchConfigurationException(e.getMessage(), e);
        }

        final CaptureProcessor jobProcessor = processor != null ? processor : externalProcessor();
        final WorkSetBuilder builder = new WorkSetBuilder(mode, dataDir, log)
                .range(request.startNumber(), request.endNumber())
                .strict(request.strictResolution());
        final ConfigSnapshotWriter snapshotWriter;
        final InputProbe jobProbe;

        if (mode == BatchMode.CONVERT) {
            snapshotWriter = null;
            jobProbe = probe != null ? probe : new NonEmptyFileProbe();
            builder.parameters(request.parameters())
                    .planner(OutputPathPlanner.forConversion(dataDir))
                    .backgroundOverride(request.backgroundFile(), request.bgFramesMax())
                    .flatfield(locateFlatfield(dataDir));
        } else {
            snapshotWriter = loadTemplate(dataDir);
            jobProbe = probe != null ? probe : new Hdf5SignatureProbe();
            final int windowSize = windowSize(snapshotWriter);
            final OutputPathPlanner planner = OutputPathPlanner.forAnalysis(dataDir, request.saveDirectory(),
                    request.saveRoot(), windowSize, request.suffix(), request.startNumber(), request.endNumber());
            LOGGER.info("Analysis results go to " + planner.saveDirectory());
            builder.parameters(request.parameters().withWindowSize(windowSize))
                    .planner(planner);
        }

        final WorkSet workSet = builder.build();

        final DispatchSettings settings = new DispatchSettings(request.workers(), request.jobTimeout(),
                request.fatalExceptions(), request.verbose());
        final Dispatcher dispatcher = new Dispatcher(jobProcessor, jobProbe, snapshotWriter, settings, clock);
        final List<JobResult> results = dispatcher.dispatch(mode.label(), workSet.jobs());

        return BatchReport.from(mode, workSet.size(), workSet.unresolved().size(), workSet.dropped().size(), results,
                Duration.between(batchStart, clock.instant()));
    }

    private CaptureProcessor externalProcessor() throws BatchConfigurationException {
        if (request.command().isEmpty()) {
            throw new BatchConfigurationException(String.format(
                    "No external command configured for %s (section '%s.command' of the config file).",
                    request.mode().label(), request.mode() == BatchMode.CONVERT ? "conversion" : "analysis"));
        }
        return new ExternalCommandProcessor(request.command());
    }

    private Path locateFlatfield(final Path dataDir) throws BatchConfigurationException {
        try {
            return FlatfieldLocator.locate(dataDir, request.flatfield());
        } catch (final NoSuchFileException e) {
            throw new BatchConfigurationException("Flat-field not available: " + e.getMessage(), e);
        }
    }

    private ConfigSnapshotWriter loadTemplate(final Path dataDir) throws BatchConfigurationException {
        Path template = request.analysisTemplate();
        if (template == null && Files.isRegularFile(dataDir.resolve(DEFAULT_TEMPLATE_NAME))) {
            template = dataDir.resolve(DEFAULT_TEMPLATE_NAME);
        }
        try {
            return ConfigSnapshotWriter.fromTemplate(template);
        } catch (final IOException e) {
            throw new BatchConfigurationException("Cannot read analysis template: " + e.getMessage(), e);
        }
    }

    private int windowSize(final ConfigSnapshotWriter snapshotWriter) throws BatchConfigurationException {
        final JobParameters parameters = request.parameters();
        if (parameters.windowSize() != null) {
            return checkedWindowSize(parameters.windowSize());
        }
        final Integer fromTemplate;
        try {
            fromTemplate = snapshotWriter.templateWindowSize();
        } catch (final IllegalArgumentException e) {
            throw new BatchConfigurationException(e.getMessage(), e);
        }
        if (fromTemplate == null) {
            throw new BatchConfigurationException("No window size given (--window-size or analyse.window_size in the analysis template).");
        }
        return checkedWindowSize(fromTemplate);
    }

    private static int checkedWindowSize(final int windowSize) throws BatchConfigurationException {
        if (windowSize < 1) {
            throw new BatchConfigurationException("Window size must be positive, got " + windowSize);
        }
        return windowSize;
    }
}
