package org.spts.batch.processing;

import org.junit.jupiter.api.Test;
import org.spts.batch.metrics.JobStatus;
import org.spts.batch.model.BatchMode;
import org.spts.batch.model.Job;
import org.spts.batch.model.JobParameters;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JobStateTrackerTest {

    private static Job job(int index) {
        return new Job(index, BatchMode.CONVERT, Path.of(String.format("data%05d.cxd", index)), null, 0, null, null,
                Path.of(String.format("data%05d.cxi", index)), null, JobParameters.defaults());
    }

    @Test
    void testLifecycle_pendingRunningTerminal() {
        JobStateTracker states = new JobStateTracker();
        Job job = job(1);

        assertNull(states.state(1));
        states.submitted(job);
        assertEquals(JobStatus.PENDING, states.state(1));
        states.started(job);
        assertEquals(JobStatus.RUNNING, states.state(1));
        states.finished(job, JobStatus.SUCCEEDED);
        assertEquals(JobStatus.SUCCEEDED, states.state(1));
    }

    @Test
    void testFinished_firstTerminalStateWins() {
        JobStateTracker states = new JobStateTracker();
        Job job = job(1);
        states.submitted(job);
        states.started(job);

        states.finished(job, JobStatus.FAILED);
        states.finished(job, JobStatus.SUCCEEDED);
        states.started(job);

        assertEquals(JobStatus.FAILED, states.state(1));
    }

    @Test
    void testCancelledStraightFromPending() {
        JobStateTracker states = new JobStateTracker();
        states.submitted(job(1));
        states.submitted(job(2));
        states.started(job(1));

        states.finished(job(2), JobStatus.CANCELLED);

        assertEquals(1, states.count(JobStatus.RUNNING));
        assertEquals(0, states.count(JobStatus.PENDING));
        assertEquals(1, states.count(JobStatus.CANCELLED));
        assertThrows(IllegalArgumentException.class, () -> states.finished(job(1), JobStatus.RUNNING));
    }
}
