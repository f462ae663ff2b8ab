package org.spts.batch.logbook;

/**
 * Classification of a capture file according to its log book entry.
 */
public enum FileClass {
    NORMAL,     // Sample capture, eligible as a job
    BACKGROUND, // Dark-frame reference for other captures
    FLATFIELD,  // Flat-field reference
    EXCLUDED    // Marked "exclude" in the analysis comment
}
