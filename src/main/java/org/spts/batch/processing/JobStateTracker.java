package org.spts.batch.processing;

import org.spts.batch.metrics.JobStatus;
import org.spts.batch.model.Job;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Current lifecycle state of each job of one dispatch, keyed by job index. Updated from worker and
 * watchdog threads. The first terminal state recorded for a job is final.
 */
class JobStateTracker {

    private final Map<Integer, JobStatus> states = new ConcurrentHashMap<>();

    void submitted(final Job job) {
        states.put(job.index(), JobStatus.PENDING);
    }

    void started(final Job job) {
        states.replace(job.index(), JobStatus.PENDING, JobStatus.RUNNING);
    }

    void finished(final Job job, final JobStatus terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminal);
        }
        states.computeIfPresent(job.index(), (index, current) -> current.isTerminal() ? current : terminal);
    }

    /**
     * @return the job's state, or null for a job never submitted
     */
    JobStatus state(final int index) {
        return states.get(index);
    }

    long count(final JobStatus status) {
        return states.values().stream().filter(s -> s == status).count();
    }
}
