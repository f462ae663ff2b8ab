package org.spts.batch.metrics;

public interface HasStatus {
    JobStatus status();
}
