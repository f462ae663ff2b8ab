package org.spts.batch.selection;

import org.spts.batch.model.Job;

import java.util.List;

/**
 * The ordered, deduplicated jobs of one batch run together with the candidates that did not make it.
 * Built once per run; later changes on disk are not reflected.
 */
public record WorkSet(List<Job> jobs, List<CandidateResolution> dropped, List<CandidateResolution> unresolved,
                      int outOfRange) {

    public WorkSet {
        jobs = List.copyOf(jobs);
        dropped = List.copyOf(dropped);
        unresolved = List.copyOf(unresolved);
    }

    public int size() {
        return jobs.size();
    }

    public boolean isEmpty() {
        return jobs.isEmpty();
    }

    public List<String> fileNames() {
        return jobs.stream().map(Job::fileName).toList();
    }
}
