package org.spts.batch.model;

/**
 * Processing parameters shared by every job of a batch. Values are handed to the external
 * conversion or analysis program unchanged.
 */
public record JobParameters(Integer windowSize,
                            boolean cropRaw, int minX, int maxX, int minY, int maxY,
                            boolean percentileFilter, int percentileNumber, int percentileFrames,
                            int roiLowLimit, double roiFraction,
                            int ffFramesMax, boolean skipRaw, boolean overwrite) {

    public static final int DEFAULT_MAX_COORDINATE = 2048;

    public static JobParameters defaults() {
        return new JobParameters(null, false, 0, DEFAULT_MAX_COORDINATE, 0, DEFAULT_MAX_COORDINATE,
                false, 50, 4, 10, 0.999, 100, false, false);
    }

    public JobParameters withWindowSize(final Integer newWindowSize) {
        return new JobParameters(newWindowSize, cropRaw, minX, maxX, minY, maxY, percentileFilter, percentileNumber,
                percentileFrames, roiLowLimit, roiFraction, ffFramesMax, skipRaw, overwrite);
    }
}
