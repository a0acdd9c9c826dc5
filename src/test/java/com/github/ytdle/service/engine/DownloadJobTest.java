package com.github.ytdle.service.engine;

import com.github.ytdle.model.DownloadRequest;
import com.github.ytdle.model.ErrorType;
import com.github.ytdle.model.JobSnapshot;
import com.github.ytdle.model.JobStatus;
import com.github.ytdle.model.MediaFormat;
import com.github.ytdle.service.state.JobStateMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DownloadJob")
class DownloadJobTest {

    private final JobStateMachine stateMachine = new JobStateMachine();
    private DownloadJob job;

    @BeforeEach
    void setUp() {
        job = new DownloadJob("job-1", "batch", DownloadRequest.builder()
                .url("https://a")
                .format(MediaFormat.VIDEO)
                .quality("1080p")
                .build(), 1);
    }

    @Test
    @DisplayName("an internal fault on a running job should fail it")
    void internalFaultShouldFailRunningJob() {
        assertTrue(job.begin(stateMachine));

        assertTrue(job.failInternally(stateMachine, "Worker interrupted"));

        JobSnapshot snapshot = job.snapshot();
        assertEquals(JobStatus.FAILED, snapshot.getStatus());
        assertEquals(ErrorType.INTERNAL_ERROR, snapshot.getErrorType());
        assertEquals("Worker interrupted", snapshot.getErrorMessage());
    }

    @ParameterizedTest
    @EnumSource(value = JobStatus.class, names = {"CANCELLED", "SKIPPED"})
    @DisplayName("an accepted stop should win over a later internal fault")
    void acceptedStopShouldWinOverInternalFault(JobStatus target) {
        assertTrue(job.begin(stateMachine));
        assertEquals(DownloadJob.StopDisposition.DEFERRED, job.requestStop(stateMachine, target, "Engine shut down"));

        assertTrue(job.failInternally(stateMachine, "Worker interrupted"));

        JobSnapshot snapshot = job.snapshot();
        assertEquals(target, snapshot.getStatus());
        assertNull(snapshot.getErrorType());
        assertNotNull(snapshot.getFinishedAt());
    }

    @Test
    @DisplayName("an internal fault on a terminal job should change nothing")
    void internalFaultOnTerminalJobShouldBeIgnored() {
        assertEquals(DownloadJob.StopDisposition.STOPPED_NOW,
                job.requestStop(stateMachine, JobStatus.CANCELLED, "Cancelled"));

        assertFalse(job.failInternally(stateMachine, "Worker interrupted"));
        assertEquals(JobStatus.CANCELLED, job.getStatus());
    }
}
