package org.spts.batch.model;

import java.nio.file.Path;

/**
 * One unit of work. Immutable and self-contained, so workers never share state.
 *
 * @param index                 1-based position in the work set, used for progress numbering
 * @param inputPath             the capture to process
 * @param backgroundPath        dark-frame reference ({@link BatchMode#CONVERT} only, else null)
 * @param backgroundFrameBudget frames of the background to use, 0 when no background applies
 * @param flatfieldPath         flat-field reference ({@link BatchMode#CONVERT} only, else null)
 * @param frameCount            frames of the raw capture ({@link BatchMode#ANALYZE} only, else null)
 * @param outputPath            file written by the job; its presence marks the job done
 * @param configSnapshotPath    per-job configuration snapshot ({@link BatchMode#ANALYZE} only, else null)
 * @param parameters            batch wide processing parameters
 */
public record Job(int index, BatchMode mode, Path inputPath, Path backgroundPath, int backgroundFrameBudget,
                  Path flatfieldPath, Integer frameCount, Path outputPath, Path configSnapshotPath,
                  JobParameters parameters) {

    public String fileName() {
        return inputPath.getFileName().toString();
    }
}
