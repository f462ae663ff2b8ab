package org.spts.batch.metrics;

/**
 * Lifecycle of a job: PENDING -> RUNNING -> one of the terminal states. A job cancelled before it
 * starts goes from PENDING to CANCELLED.
 */
public enum JobStatus {
    PENDING,   // Submitted, waiting for a worker
    RUNNING,   // Picked up by a worker
    SUCCEEDED,
    FAILED,    // Processor raised, or the job timed out
    SKIPPED,   // Output already present, or the input failed the integrity probe
    CANCELLED; // Never started because the batch was cancelled

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
