package org.spts.batch.logbook;

import java.util.Locale;

/**
 * One log book row describing a physical capture file.
 *
 * @param fileId            canonical file name, e.g. {@code data00012.cxd}
 * @param description       free text category; {@code background} and {@code flatfield} are reserved
 * @param frameCount        number of captured frames, null when the log leaves it empty
 * @param darkCorrectionRef file name or bare file number of the background capture, empty when absent
 * @param analysisComment   free text; containing "exclude" removes the file from analysis
 * @param injectorDistance  optional injector distance, null when absent
 */
public record LogRecord(String fileId, String description, Integer frameCount, String darkCorrectionRef,
                        String analysisComment, Double injectorDistance) {

    public static final String BACKGROUND_DESCRIPTION = "background";
    public static final String FLATFIELD_DESCRIPTION = "flatfield";
    public static final String EXCLUDE_MARKER = "exclude";

    public LogRecord {
        description = description == null ? "" : description.trim();
        darkCorrectionRef = darkCorrectionRef == null ? "" : darkCorrectionRef.trim();
        analysisComment = analysisComment == null ? "" : analysisComment;
    }

    public FileClass classify() {
        if (BACKGROUND_DESCRIPTION.equalsIgnoreCase(description)) {
            return FileClass.BACKGROUND;
        }
        if (FLATFIELD_DESCRIPTION.equalsIgnoreCase(description)) {
            return FileClass.FLATFIELD;
        }
        if (analysisComment.toLowerCase(Locale.ROOT).contains(EXCLUDE_MARKER)) {
            return FileClass.EXCLUDED;
        }
        return FileClass.NORMAL;
    }

    public boolean hasDarkCorrectionRef() {
        return !darkCorrectionRef.isEmpty();
    }
}
