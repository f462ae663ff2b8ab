package org.spts.batch.config;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.spts.batch.model.BatchMode;
import org.spts.batch.model.JobParameters;
import org.spts.batch.processing.DispatchSettings;
import org.spts.batch.selection.OutputPathPlanner;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Command line surface: {@code spts-batch <convert|analyze> [options]}.
 * Values given here win over {@code conf/spts-batch.yaml}, which wins over built-in defaults.
 */
public final class CommandLineOptions {

    public static final String APP_NAME = "spts-batch";

    private CommandLineOptions() {
    }

    public static Options buildOptions() {
        Options options = new Options();
        // input selection
        options.addOption(Option.builder("d").longOpt("data-path").hasArg().argName("dir").desc("directory holding the capture files").build());
        options.addOption(Option.builder("l").longOpt("log-file").hasArg().argName("csv").desc("log book of the experiment (CSV)").build());
        options.addOption(Option.builder("sn").longOpt("start-number").hasArg().argName("n").desc("number of the first file to be processed").build());
        options.addOption(Option.builder("en").longOpt("end-number").hasArg().argName("n").desc("number of the last file to be processed").build());
        options.addOption(Option.builder("ow").longOpt("overwrite").desc("reprocess files whose output already exists").build());
        // conversion
        options.addOption(Option.builder("b").longOpt("background-file").hasArg().argName("file").desc("single background file used for every capture").build());
        options.addOption(Option.builder("bn").longOpt("bg-frames-max").hasArg().argName("n").desc("frames of --background-file used for background estimation (default 100)").build());
        options.addOption(Option.builder("f").longOpt("flatfield").hasArg().argName("file").desc("flat-field capture (name in data path, or path)").build());
        options.addOption(Option.builder("fn").longOpt("ff-frames-max").hasArg().argName("n").desc("frames used for flat-field estimation (default 100)").build());
        options.addOption(Option.builder("rl").longOpt("roi-low-limit").hasArg().argName("n").desc("minimum intensity threshold for ROI calculation (default 10)").build());
        options.addOption(Option.builder("rf").longOpt("roi-fraction").hasArg().argName("x").desc("fraction of intensity above threshold in ROI (default 0.999)").build());
        options.addOption(Option.builder("m").longOpt("percentile-filter").desc("apply a percentile filter to output images").build());
        options.addOption(Option.builder("p").longOpt("percentile-number").hasArg().argName("n").desc("percentile for the percentile filter (default 50)").build());
        options.addOption(Option.builder("pf").longOpt("percentile-frames").hasArg().argName("n").desc("frames in the percentile filter kernel (default 4)").build());
        options.addOption(Option.builder("crop").longOpt("crop-raw").desc("crop raw data to the given bounds").build());
        options.addOption(Option.builder().longOpt("min-x").hasArg().argName("n").desc("minimum x of cropped raw data (default 0)").build());
        options.addOption(Option.builder().longOpt("max-x").hasArg().argName("n").desc("maximum x of cropped raw data (default 2048)").build());
        options.addOption(Option.builder().longOpt("min-y").hasArg().argName("n").desc("minimum y of cropped raw data (default 0)").build());
        options.addOption(Option.builder().longOpt("max-y").hasArg().argName("n").desc("maximum y of cropped raw data (default 2048)").build());
        options.addOption(Option.builder("sk").longOpt("skip-raw").desc("link raw data to processed data instead of saving it").build());
        // analysis
        options.addOption(Option.builder("wd").longOpt("window-size").hasArg().argName("n").desc("analysis window width in pixels").build());
        options.addOption(Option.builder("cf").longOpt("analysis-config").hasArg().argName("yaml").desc("analysis configuration template").build());
        options.addOption(Option.builder("sd").longOpt("save-directory").hasArg().argName("dir").desc("analysis output directory").build());
        options.addOption(Option.builder().longOpt("save-root").hasArg().argName("dir").desc("root of derived analysis output directories").build());
        options.addOption(Option.builder("out").longOpt("suffix").hasArg().argName("text").desc("appended to output names, e.g. d25 -> data00000_ana_w05_d25.cxi").build());
        // dispatch
        options.addOption(Option.builder("c").longOpt("cores").hasArg().argName("n").desc("number of worker threads (default: available processors)").build());
        options.addOption(Option.builder().longOpt("job-timeout").hasArg().argName("seconds").desc("fail a job running longer than this").build());
        options.addOption(Option.builder().longOpt("strict").desc("abort the batch on the first unresolvable file").build());
        options.addOption(Option.builder("v").longOpt("verbose").desc("verbose mode").build());
        options.addOption(Option.builder().longOpt("config").hasArg().argName("yaml").desc("framework configuration (default conf/spts-batch.yaml)").build());
        options.addOption(Option.builder("h").longOpt("help").desc("show help").build());
        return options;
    }

    public static CommandLine parse(final String[] args) throws ParseException {
        return new DefaultParser().parse(buildOptions(), args);
    }

    public static void printHelp(final PrintWriter out) {
        new HelpFormatter().printHelp(out, HelpFormatter.DEFAULT_WIDTH, APP_NAME + " <convert|analyze> [options]",
                null, buildOptions(), HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        out.flush();
    }

    /**
     * The explicitly requested framework configuration, or null.
     */
    public static Path configPath(final CommandLine cmd) {
        return cmd.hasOption("config") ? Path.of(cmd.getOptionValue("config")) : null;
    }

    public static BatchRequest toRequest(final CommandLine cmd, final AppConfig config) throws BatchConfigurationException {
        final List<String> positional = cmd.getArgList();
        if (positional.isEmpty()) {
            throw new BatchConfigurationException("No batch mode given, expected 'convert' or 'analyze'.");
        }
        final BatchMode mode;
        try {
            mode = BatchMode.fromLabel(positional.get(0));
        } catch (IllegalArgumentException e) {
            throw new BatchConfigurationException(e.getMessage(), e);
        }
        if (!cmd.hasOption("data-path")) {
            throw new BatchConfigurationException("No data directory was given (--data-path).");
        }
        if (!cmd.hasOption("log-file")) {
            throw new BatchConfigurationException("No log book file was given (--log-file).");
        }

        final DispatchConfig dispatch = config.dispatch();
        final ConversionConfig conversion = config.conversion();
        final AnalysisConfig analysis = config.analysis();
        final JobParameters defaults = JobParameters.defaults();

        final JobParameters parameters = new JobParameters(
                intOption(cmd, "window-size", analysis.windowSize()),
                cmd.hasOption("crop-raw"),
                intOption(cmd, "min-x", defaults.minX()),
                intOption(cmd, "max-x", defaults.maxX()),
                intOption(cmd, "min-y", defaults.minY()),
                intOption(cmd, "max-y", defaults.maxY()),
                cmd.hasOption("percentile-filter"),
                intOption(cmd, "percentile-number", orDefault(conversion.percentileNumber(), defaults.percentileNumber())),
                intOption(cmd, "percentile-frames", orDefault(conversion.percentileFrames(), defaults.percentileFrames())),
                intOption(cmd, "roi-low-limit", orDefault(conversion.roiLowLimit(), defaults.roiLowLimit())),
                doubleOption(cmd, "roi-fraction", orDefault(conversion.roiFraction(), defaults.roiFraction())),
                intOption(cmd, "ff-frames-max", orDefault(conversion.ffFramesMax(), defaults.ffFramesMax())),
                cmd.hasOption("skip-raw"),
                cmd.hasOption("overwrite"));

        final Integer startNumber = intOption(cmd, "start-number", null);
        final Integer endNumber = intOption(cmd, "end-number", null);
        if (startNumber != null && endNumber != null && startNumber > endNumber) {
            throw new BatchConfigurationException(String.format("Start number %d is after end number %d.", startNumber, endNumber));
        }

        final int workers = intOption(cmd, "cores", orDefault(dispatch.workers(), DispatchSettings.defaultWorkers()));
        if (workers < 1) {
            throw new BatchConfigurationException("Number of cores must be at least 1, got " + workers);
        }
        final Integer timeoutSeconds = intOption(cmd, "job-timeout", null);
        final Duration jobTimeout = timeoutSeconds != null
                ? Duration.ofSeconds(timeoutSeconds)
                : (dispatch.jobTimeoutSeconds() != null ? Duration.ofSeconds(dispatch.jobTimeoutSeconds()) : null);
        if (jobTimeout != null && (jobTimeout.isZero() || jobTimeout.isNegative())) {
            throw new BatchConfigurationException("Job timeout must be positive, got " + jobTimeout.toSeconds() + "s");
        }

        final String template = cmd.getOptionValue("analysis-config", analysis.template());
        final String saveRoot = cmd.getOptionValue("save-root", analysis.saveRoot());

        return new BatchRequest(mode,
                Path.of(cmd.getOptionValue("data-path")),
                Path.of(cmd.getOptionValue("log-file")),
                startNumber, endNumber,
                cmd.getOptionValue("background-file"),
                intOption(cmd, "bg-frames-max", orDefault(conversion.bgFramesMax(), BatchRequest.DEFAULT_BG_FRAMES_MAX)),
                cmd.getOptionValue("flatfield", conversion.flatfield()),
                cmd.hasOption("save-directory") ? Path.of(cmd.getOptionValue("save-directory")) : null,
                saveRoot != null ? Path.of(saveRoot) : OutputPathPlanner.DEFAULT_SAVE_ROOT,
                cmd.getOptionValue("suffix"),
                template != null ? Path.of(template) : null,
                parameters,
                workers,
                jobTimeout,
                cmd.hasOption("strict") || Boolean.TRUE.equals(dispatch.strictResolution()),
                dispatch.fatalExceptions(),
                cmd.hasOption("verbose") || Boolean.TRUE.equals(dispatch.verboseJobs()),
                mode == BatchMode.CONVERT ? conversion.command() : analysis.command());
    }

    private static <T> T orDefault(final T value, final T fallback) {
        return value != null ? value : fallback;
    }

    private static Integer intOption(final CommandLine cmd, final String name, final Integer fallback)
            throws BatchConfigurationException {
        if (!cmd.hasOption(name)) {
            return fallback;
        }
        final String value = cmd.getOptionValue(name);
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new BatchConfigurationException(String.format("Option --%s expects an integer, got '%s'", name, value), e);
        }
    }

    private static double doubleOption(final CommandLine cmd, final String name, final double fallback)
            throws BatchConfigurationException {
        if (!cmd.hasOption(name)) {
            return fallback;
        }
        final String value = cmd.getOptionValue(name);
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new BatchConfigurationException(String.format("Option --%s expects a number, got '%s'", name, value), e);
        }
    }
}
