package org.spts.batch.selection;

public enum ResolutionStatus {
    RESOLVED,   // All dependencies found, becomes a job
    DROPPED,    // Calibration or excluded file
    UNRESOLVED  // Resolution error, reported and skipped
}
