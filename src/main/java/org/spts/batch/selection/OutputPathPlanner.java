package org.spts.batch.selection;

import org.spts.batch.model.BatchMode;
import org.spts.batch.util.FileUtils;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Derives deterministic output locations from the job parameters.
 * <p>
 * Conversion writes {@code <dataDir>/<stem>.cxi}. Analysis writes
 * {@code <saveDir>/<stem>_ana_w<ww>[_<suffix>].cxi} and a configuration snapshot with the same name under
 * {@code <saveDir>/conf/}, where {@code saveDir} defaults to {@code <saveRoot>/<label>_ana_w<ww>[_<suffix>]}.
 */
public final class OutputPathPlanner {

    public static final String ANALYSIS_INFIX = "_ana_";
    public static final String OUTPUT_EXTENSION = ".cxi";
    public static final String CONFIG_DIR = "conf";
    public static final String CONFIG_EXTENSION = ".yaml";
    public static final Path DEFAULT_SAVE_ROOT = Path.of("data", "analysis");

    private final BatchMode mode;
    private final Path dataDir;
    private final Path saveDirectory;
    private final String fileTag;

    private OutputPathPlanner(BatchMode mode, Path dataDir, Path saveDirectory, String fileTag) {
        this.mode = mode;
        this.dataDir = dataDir;
        this.saveDirectory = saveDirectory;
        this.fileTag = fileTag;
    }

    public static OutputPathPlanner forConversion(final Path dataDir) {
        return new OutputPathPlanner(BatchMode.CONVERT, Objects.requireNonNull(dataDir), dataDir, "");
    }

    /**
     * @param saveDirectory explicit save directory, or null to derive one under {@code saveRoot}
     * @param saveRoot      root for derived save directories, null for {@link #DEFAULT_SAVE_ROOT}
     * @param suffix        free text appended to names, an underscore is prepended when missing
     */
    public static OutputPathPlanner forAnalysis(final Path dataDir, final Path saveDirectory, final Path saveRoot,
                                                final int windowSize, final String suffix,
                                                final Integer startNumber, final Integer endNumber) {
        final String fileTag = ANALYSIS_INFIX + windowTag(windowSize) + normalizeSuffix(suffix);
        final Path target = saveDirectory != null
                ? saveDirectory
                : (saveRoot != null ? saveRoot : DEFAULT_SAVE_ROOT).resolve(runLabel(dataDir, startNumber, endNumber) + fileTag);
        return new OutputPathPlanner(BatchMode.ANALYZE, Objects.requireNonNull(dataDir), target, fileTag);
    }

    /**
     * {@code w} followed by the window size, zero-padded below 10.
     */
    public static String windowTag(final int windowSize) {
        return windowSize < 10 ? "w0" + windowSize : "w" + windowSize;
    }

    public static String normalizeSuffix(final String suffix) {
        if (suffix == null || suffix.isBlank()) {
            return "";
        }
        final String trimmed = suffix.trim();
        return trimmed.startsWith("_") ? trimmed : "_" + trimmed;
    }

    /**
     * Trailing two segments of the data directory plus the numeric range, e.g. {@code 2024_run3_00012-00015}.
     */
    public static String runLabel(final Path dataDir, final Integer startNumber, final Integer endNumber) {
        final Path normalized = dataDir.toAbsolutePath().normalize();
        final int count = normalized.getNameCount();
        final StringBuilder label = new StringBuilder();
        if (count >= 2) {
            label.append(normalized.getName(count - 2)).append('_').append(normalized.getName(count - 1));
        } else if (count == 1) {
            label.append(normalized.getName(0));
        } else {
            label.append("data");
        }
        if (startNumber != null && endNumber != null) {
            label.append('_').append(FileNumbers.pad(startNumber)).append('-').append(FileNumbers.pad(endNumber));
        } else if (startNumber != null) {
            label.append("_from").append(FileNumbers.pad(startNumber));
        } else if (endNumber != null) {
            label.append("_to").append(FileNumbers.pad(endNumber));
        }
        return label.toString();
    }

    public Path outputPath(final String inputFileName) {
        final String stem = FileUtils.stem(inputFileName);
        if (mode == BatchMode.CONVERT) {
            return dataDir.resolve(stem + OUTPUT_EXTENSION);
        }
        return saveDirectory.resolve(stem + fileTag + OUTPUT_EXTENSION);
    }

    /**
     * Per-job configuration snapshot, null for conversion.
     */
    public Path configSnapshotPath(final String inputFileName) {
        if (mode == BatchMode.CONVERT) {
            return null;
        }
        return saveDirectory.resolve(CONFIG_DIR).resolve(FileUtils.stem(inputFileName) + fileTag + CONFIG_EXTENSION);
    }

    public Path saveDirectory() {
        return saveDirectory;
    }
}
