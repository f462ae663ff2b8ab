package org.spts.batch.config;

/**
 * Fatal problem found before any job is dispatched: missing data directory, log book, calibration
 * file, command or an invalid option value.
 */
public class BatchConfigurationException extends Exception {

    public BatchConfigurationException(String message) {
        super(message);
    }

    public BatchConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
