package org.spts.batch.processing;

import org.spts.batch.model.Job;
import org.spts.batch.model.JobParameters;
import org.spts.batch.plugin.CaptureProcessor;
import org.spts.batch.plugin.JobContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Runs the external conversion or analysis program for a job.
 * <p>
 * The command is a template, one list element per argument. Placeholders such as {@code {input}} are
 * replaced by job values; an argument that is exactly a placeholder without a value is left out, and
 * {@code {flags}} expands to the enabled boolean switches. Example:
 * <pre>
 *   [python, cxd_to_h5.py, {input}, -b, {background}, -bn, {bgFrames}, -f, {flatfield}, -o, {output}, {flags}]
 * </pre>
 * The program's combined stdout/stderr is captured in a temporary file and logged at the job's output
 * level once the program ends, so waiting stays interruptible and a timed-out program can be destroyed.
 */
public class ExternalCommandProcessor implements CaptureProcessor {

    private static final Logger LOGGER = Logger.getLogger(ExternalCommandProcessor.class.getName());

    public static final String FLAGS_PLACEHOLDER = "{flags}";
    static final int OUTPUT_TAIL_LINES = 20;

    private final List<String> commandTemplate;

    public ExternalCommandProcessor(List<String> commandTemplate) {
        if (commandTemplate == null || commandTemplate.isEmpty()) {
            throw new IllegalArgumentException("External command template must not be empty");
        }
        this.commandTemplate = List.copyOf(commandTemplate);
    }

    @Override
    public void process(final Job job, final JobContext context) throws IOException, InterruptedException {
        final List<String> command = buildCommand(job);
        LOGGER.log(context.outputLevel(), "Executing command: " + String.join(" ", command));

        final Path outputLog = Files.createTempFile("spts-batch-" + job.index() + "-", ".log");
        try {
            final Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.to(outputLog.toFile()))
                    .start();
            final int exitCode;
            try {
                exitCode = process.waitFor();
            } catch (final InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }

            final List<String> tail = relayOutput(outputLog, job, context.outputLevel());
            if (exitCode != 0) {
                throw new ExternalProcessException(job.fileName(), exitCode, command, tail);
            }
        } finally {
            Files.deleteIfExists(outputLog);
        }
    }

    private List<String> relayOutput(final Path outputLog, final Job job, final Level level) throws IOException {
        final Deque<String> tail = new ArrayDeque<>();
        try (Stream<String> lines = Files.lines(outputLog, StandardCharsets.UTF_8)) {
            lines.forEach(line -> {
                LOGGER.log(level, "[" + job.fileName() + "] " + line);
                tail.addLast(line);
                if (tail.size() > OUTPUT_TAIL_LINES) {
                    tail.removeFirst();
                }
            });
        } catch (final UncheckedIOException e) {
            // Undecodable program output, keep what was read
            LOGGER.fine(() -> "Could not read complete output of " + job.fileName() + ": " + e.getMessage());
        }
        return List.copyOf(tail);
    }

    List<String> buildCommand(final Job job) {
        final Map<String, String> values = placeholderValues(job);
        final List<String> command = new ArrayList<>();
        for (final String token : commandTemplate) {
            if (FLAGS_PLACEHOLDER.equals(token)) {
                command.addAll(flags(job.parameters()));
                continue;
            }
            if (values.containsKey(token) && values.get(token) == null) {
                continue;
            }
            String argument = token;
            for (final Map.Entry<String, String> entry : values.entrySet()) {
                if (argument.contains(entry.getKey())) {
                    argument = argument.replace(entry.getKey(), Objects.toString(entry.getValue(), ""));
                }
            }
            command.add(argument);
        }
        return command;
    }

    static Map<String, String> placeholderValues(final Job job) {
        final JobParameters p = job.parameters();
        final Map<String, String> values = new LinkedHashMap<>();
        values.put("{input}", job.inputPath().toString());
        values.put("{output}", job.outputPath().toString());
        values.put("{background}", job.backgroundPath() != null ? job.backgroundPath().toString() : null);
        values.put("{bgFrames}", job.backgroundPath() != null ? String.valueOf(job.backgroundFrameBudget()) : null);
        values.put("{flatfield}", job.flatfieldPath() != null ? job.flatfieldPath().toString() : null);
        values.put("{ffFrames}", String.valueOf(p.ffFramesMax()));
        values.put("{frames}", job.frameCount() != null ? String.valueOf(job.frameCount()) : null);
        values.put("{config}", job.configSnapshotPath() != null ? job.configSnapshotPath().toString() : null);
        values.put("{window}", p.windowSize() != null ? String.valueOf(p.windowSize()) : null);
        values.put("{minX}", String.valueOf(p.minX()));
        values.put("{maxX}", String.valueOf(p.maxX()));
        values.put("{minY}", String.valueOf(p.minY()));
        values.put("{maxY}", String.valueOf(p.maxY()));
        values.put("{roiLowLimit}", String.valueOf(p.roiLowLimit()));
        values.put("{roiFraction}", String.valueOf(p.roiFraction()));
        values.put("{percentile}", String.valueOf(p.percentileNumber()));
        values.put("{percentileFrames}", String.valueOf(p.percentileFrames()));
        return values;
    }

    static List<String> flags(final JobParameters parameters) {
        final List<String> flags = new ArrayList<>();
        if (parameters.percentileFilter()) {
            flags.add("--percentile-filter");
        }
        if (parameters.cropRaw()) {
            flags.add("--crop-raw");
        }
        if (parameters.skipRaw()) {
            flags.add("--skip-raw");
        }
        return flags;
    }
}
