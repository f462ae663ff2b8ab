package org.spts.batch.selection;

import org.spts.batch.model.BatchMode;
import org.spts.batch.util.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Lists eligible input files in a data directory.
 */
public class CandidateScanner {

    private static final Logger LOGGER = Logger.getLogger(CandidateScanner.class.getName());

    /** Canonical flat-field captures, never processed whatever the log book says, in raw or converted form. */
    public static final Set<String> CALIBRATION_SENTINELS = Set.of("_flatfield01624.cxd", "data01624.cxd");

    /**
     * @param directory the data directory (non-recursive)
     * @param rawExt    extension of the inputs, e.g. {@code .cxd}
     * @param doneExt   extension of finished artifacts in the same directory, or null when there are none
     * @param overwrite when true, inputs are returned even if their artifact exists
     * @return the sorted candidate file names
     * @throws IOException if the directory does not exist or cannot be listed
     */
    public SortedSet<String> scan(final Path directory, final String rawExt, final String doneExt, final boolean overwrite)
            throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Data path does not exist: " + directory);
        }
        final SortedSet<String> candidates = new TreeSet<>(FileUtils.listFileNames(directory, rawExt));
        final int found = candidates.size();

        if (doneExt != null && !overwrite) {
            final List<String> done = FileUtils.listFileNames(directory, doneExt);
            done.stream().map(name -> FileUtils.replaceExtension(name, rawExt)).forEach(candidates::remove);
        }
        final int pending = candidates.size();
        candidates.removeIf(CandidateScanner::isCalibrationSentinel);

        LOGGER.info(String.format("Scanned %s: %d %s files, %d already done, %d calibration sentinels removed, %d candidates.",
                directory, found, rawExt, found - pending, pending - candidates.size(), candidates.size()));
        return candidates;
    }

    static boolean isCalibrationSentinel(final String fileName) {
        return CALIBRATION_SENTINELS.contains(FileUtils.replaceExtension(fileName, BatchMode.RAW_EXTENSION));
    }
}
