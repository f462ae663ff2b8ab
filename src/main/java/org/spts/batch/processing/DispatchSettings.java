package org.spts.batch.processing;

import java.time.Duration;
import java.util.List;

/**
 * Worker pool settings of a batch.
 *
 * @param workers         pool size
 * @param jobTimeout      per-job deadline, null for none
 * @param fatalExceptions exception class names (matched against the class hierarchy and cause chain)
 *                        that stop the batch from starting further jobs
 * @param verbose         whether job output is shown at normal log level
 */
public record DispatchSettings(int workers, Duration jobTimeout, List<String> fatalExceptions, boolean verbose) {

    public DispatchSettings {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, got " + workers);
        }
        if (jobTimeout != null && (jobTimeout.isZero() || jobTimeout.isNegative())) {
            throw new IllegalArgumentException("jobTimeout must be positive, got " + jobTimeout);
        }
        fatalExceptions = fatalExceptions == null ? List.of() : List.copyOf(fatalExceptions);
    }

    public static int defaultWorkers() {
        return Runtime.getRuntime().availableProcessors();
    }
}
