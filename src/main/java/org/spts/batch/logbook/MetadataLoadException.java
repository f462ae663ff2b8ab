package org.spts.batch.logbook;

import java.io.IOException;

/**
 * The log book is missing, unreadable or does not have the expected tabular layout.
 */
public class MetadataLoadException extends IOException {

    public MetadataLoadException(String message) {
        super(message);
    }

    public MetadataLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
