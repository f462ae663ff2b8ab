package org.spts.batch.selection;

import org.spts.batch.logbook.FileClass;
import org.spts.batch.logbook.LogRecord;
import org.spts.batch.logbook.MetadataLog;
import org.spts.batch.logbook.ResolutionException;
import org.spts.batch.model.BatchMode;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Cross-references candidates with the log book: drops calibration and excluded files and, for
 * conversion, resolves each capture's background file and the number of background frames to use.
 * <p>
 * Classification runs first so that background captures, which carry no dark correction of their
 * own, are dropped instead of failing resolution.
 */
public class DependencyResolver {

    private static final Logger LOGGER = Logger.getLogger(DependencyResolver.class.getName());

    private final MetadataLog log;
    private final BatchMode mode;
    private final Path dataDir;
    private final String backgroundOverride;
    private final int overrideFrameBudget;

    /**
     * @param backgroundOverride  background used for every capture instead of the log book reference, or null
     * @param overrideFrameBudget frames to use from {@code backgroundOverride}
     */
    public DependencyResolver(MetadataLog log, BatchMode mode, Path dataDir, String backgroundOverride, int overrideFrameBudget) {
        this.log = Objects.requireNonNull(log, "log");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir");
        this.backgroundOverride = backgroundOverride == null || backgroundOverride.isBlank() ? null : backgroundOverride.trim();
        this.overrideFrameBudget = overrideFrameBudget;
    }

    public CandidateResolution resolve(final String candidate) {
        final String logKey = mode.logKey(candidate);
        final LogRecord record;
        try {
            record = log.lookup(logKey);
        } catch (ResolutionException e) {
            return unresolved(candidate, null, e);
        }

        final FileClass fileClass = record.classify();
        if (fileClass != FileClass.NORMAL) {
            LOGGER.fine(() -> String.format("Dropping %s: %s", candidate, fileClass));
            return CandidateResolution.dropped(candidate, fileClass);
        }

        try {
            if (!mode.requiresBackground()) {
                if (record.frameCount() == null) {
                    throw new IncompleteRecordException(candidate, logKey, MetadataLog.COLUMN_FRAMES);
                }
                return CandidateResolution.resolved(candidate, null, 0, record.frameCount());
            }
            return resolveBackground(candidate, record);
        } catch (ResolutionException e) {
            return unresolved(candidate, fileClass, e);
        }
    }

    private CandidateResolution resolveBackground(final String candidate, final LogRecord record) throws ResolutionException {
        final String backgroundFile;
        final int frameBudget;
        if (backgroundOverride != null) {
            backgroundFile = backgroundOverride;
            frameBudget = overrideFrameBudget;
        } else {
            backgroundFile = BackgroundReference.toFileName(record.darkCorrectionRef(), candidate);
            final LogRecord backgroundRecord = log.lookup(backgroundFile);
            if (backgroundRecord.frameCount() == null) {
                throw new IncompleteRecordException(candidate, backgroundFile, MetadataLog.COLUMN_FRAMES);
            }
            frameBudget = backgroundRecord.frameCount();
        }

        final Path backgroundPath = dataDir.resolve(backgroundFile);
        if (!Files.isRegularFile(backgroundPath)) {
            throw new MissingBackgroundFileException(candidate, backgroundPath);
        }
        return CandidateResolution.resolved(candidate, backgroundFile, frameBudget, null);
    }

    private CandidateResolution unresolved(final String candidate, final FileClass fileClass, final ResolutionException e) {
        LOGGER.warning(String.format("Cannot resolve %s: %s", candidate, e.getMessage()));
        return CandidateResolution.unresolved(candidate, fileClass, e);
    }
}
