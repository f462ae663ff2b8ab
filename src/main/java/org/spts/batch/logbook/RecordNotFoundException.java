package org.spts.batch.logbook;

public class RecordNotFoundException extends ResolutionException {

    public RecordNotFoundException(String fileId) {
        super(fileId, "File " + fileId + " not found in log book. Maybe the log book is outdated.");
    }
}
