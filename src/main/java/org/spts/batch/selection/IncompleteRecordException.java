package org.spts.batch.selection;

import org.spts.batch.logbook.ResolutionException;

/**
 * A log book row exists but lacks a value needed to build the job.
 */
public class IncompleteRecordException extends ResolutionException {

    public IncompleteRecordException(String fileName, String fileId, String column) {
        super(fileName, String.format("Log book entry %s has no '%s' value (needed for %s)", fileId, column, fileName));
    }
}
