package org.spts.batch.plugin;

import org.spts.batch.model.Job;

/**
 * Runs the conversion or analysis of a single job. Implementations must only touch the job's own
 * output paths; they are called concurrently from several workers.
 */
public interface CaptureProcessor {

    /**
     * Processes the job to completion.
     *
     * @throws Exception If processing fails. InterruptedException should be preserved.
     */
    void process(Job job, JobContext context) throws Exception;
}
