package org.spts.batch.selection;

import org.spts.batch.logbook.ResolutionException;

public class InvalidBackgroundReferenceException extends ResolutionException {

    public InvalidBackgroundReferenceException(String fileName, String reference) {
        super(fileName, String.format("Background file found for %s in log file is not a number or a .cxd file: '%s'",
                fileName, reference));
    }
}
