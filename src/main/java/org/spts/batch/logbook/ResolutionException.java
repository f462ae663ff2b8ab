package org.spts.batch.logbook;

/**
 * Base class for errors raised while resolving a candidate file against the log book.
 * These affect a single candidate, not the whole batch.
 */
public class ResolutionException extends Exception {

    private final String fileName;

    public ResolutionException(String fileName, String message) {
        super(message);
        this.fileName = fileName;
    }

    public ResolutionException(String fileName, String message, Throwable cause) {
        super(message, cause);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
