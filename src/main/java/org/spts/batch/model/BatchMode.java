package org.spts.batch.model;

import org.spts.batch.util.FileUtils;

import java.util.Locale;

/**
 * The two batch drivers sharing the log book: raw capture conversion and analysis of converted files.
 */
public enum BatchMode {

    /** {@code .cxd} raw captures to {@code .cxi}, written next to the input. */
    CONVERT(".cxd", ".cxi", true),
    /** {@code .cxi} files to analysis results in a separate save directory. */
    ANALYZE(".cxi", null, false);

    public static final String RAW_EXTENSION = ".cxd";

    private final String inputExtension;
    private final String doneExtension;
    private final boolean requiresBackground;

    BatchMode(String inputExtension, String doneExtension, boolean requiresBackground) {
        this.inputExtension = inputExtension;
        this.doneExtension = doneExtension;
        this.requiresBackground = requiresBackground;
    }

    public String inputExtension() {
        return inputExtension;
    }

    /**
     * Extension of artifacts in the input directory marking an input as done, null when outputs live elsewhere.
     */
    public String doneExtension() {
        return doneExtension;
    }

    public boolean requiresBackground() {
        return requiresBackground;
    }

    /**
     * The log book is keyed by raw capture name; converted files map back to it by extension substitution.
     */
    public String logKey(final String candidate) {
        return FileUtils.replaceExtension(candidate, RAW_EXTENSION);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BatchMode fromLabel(final String label) {
        if (label == null) {
            throw new IllegalArgumentException("Batch mode missing, expected 'convert' or 'analyze'");
        }
        for (BatchMode mode : values()) {
            if (mode.label().equals(label.trim().toLowerCase(Locale.ROOT))) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown batch mode '" + label + "', expected 'convert' or 'analyze'");
    }
}
