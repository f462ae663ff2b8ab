package org.spts.batch.plugin;

import java.util.logging.Level;

/**
 * Per-job execution context handed to a {@link CaptureProcessor}.
 * Verbosity travels here instead of through global logger state.
 *
 * @param jobNumber 1-based position of the job in the work set
 * @param totalJobs size of the work set
 * @param verbose   whether the job's own output should be shown at normal log level
 */
public record JobContext(int jobNumber, int totalJobs, boolean verbose) {

    /**
     * Level for output produced by the job itself (external program lines and the like).
     */
    public Level outputLevel() {
        return verbose ? Level.INFO : Level.FINE;
    }
}
