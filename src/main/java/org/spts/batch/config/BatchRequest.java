package org.spts.batch.config;

import org.spts.batch.model.BatchMode;
import org.spts.batch.model.JobParameters;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Everything one batch run needs, merged from command line, YAML configuration and built-in defaults.
 *
 * @param backgroundFile   background used for every capture instead of the log book reference, or null
 * @param flatfield        flat-field as given by the user (name or path), null to search the default locations
 * @param saveDirectory    explicit analysis save directory, or null to derive one under {@code saveRoot}
 * @param analysisTemplate analysis configuration template, or null
 * @param command          external program template for the mode
 */
public record BatchRequest(BatchMode mode, Path dataDir, Path logFile,
                           Integer startNumber, Integer endNumber,
                           String backgroundFile, int bgFramesMax, String flatfield,
                           Path saveDirectory, Path saveRoot, String suffix, Path analysisTemplate,
                           JobParameters parameters,
                           int workers, Duration jobTimeout, boolean strictResolution, List<String> fatalExceptions,
                           boolean verbose, List<String> command) {

    public static final int DEFAULT_BG_FRAMES_MAX = 100;

    public BatchRequest {
        fatalExceptions = fatalExceptions == null ? List.of() : List.copyOf(fatalExceptions);
        command = command == null ? List.of() : List.copyOf(command);
    }
}
