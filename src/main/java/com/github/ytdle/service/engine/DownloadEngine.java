package com.github.ytdle.service.engine;

import com.github.ytdle.model.BatchSubmission;
import com.github.ytdle.model.BatchSummary;
import com.github.ytdle.model.ControlResult;
import com.github.ytdle.model.DownloadRequest;
import com.github.ytdle.model.JobSnapshot;
import com.github.ytdle.service.progress.ProgressSubscription;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Concurrent download engine: accepts batches of requests, runs them on a bounded pool of workers and lets callers
 * steer individual jobs while they run.
 * <p>
 * Control operations never throw for an unknown id or an impossible transition; they report it through
 * {@link ControlResult}.
 */
public interface DownloadEngine extends AutoCloseable {

    /**
     * Start the workers. Jobs submitted before start wait in the queue.
     */
    void start();

    /**
     * Validate and enqueue a batch. Either every request is accepted or none is.
     *
     * @param batchId caller-chosen batch id, or null to generate one
     * @throws com.github.ytdle.exception.InvalidRequestException if a request is malformed
     * @throws com.github.ytdle.exception.EngineClosedException if the engine has been shut down
     */
    BatchSubmission submit(List<DownloadRequest> requests, String batchId);

    ControlResult pause(String jobId);

    ControlResult resume(String jobId);

    ControlResult cancel(String jobId);

    ControlResult skip(String jobId);

    /**
     * Pause every running job and hold dispatch of queued jobs until {@link #resumeAll()}.
     *
     * @return number of jobs whose pause was accepted
     */
    int pauseAll();

    /**
     * Resume every paused job and release dispatch.
     *
     * @return number of jobs whose resume was accepted
     */
    int resumeAll();

    /**
     * Cancel every job that is not terminal.
     *
     * @return number of jobs whose cancel was accepted
     */
    int cancelAll();

    /**
     * Drop a terminal job from live tracking.
     */
    ControlResult acknowledge(String jobId);

    Optional<JobSnapshot> getStatus(String jobId);

    /**
     * Every tracked job in submission order.
     */
    List<JobSnapshot> listJobs();

    Optional<BatchSummary> batchSummary(String batchId);

    /**
     * Progress of one batch, or of every job when {@code batchId} is null.
     */
    ProgressSubscription subscribe(String batchId);

    /**
     * Stop accepting work, cancel queued jobs and wait for running ones.
     *
     * @param cancelInFlight cancel running jobs instead of letting them finish
     * @param timeout how long to wait for workers
     */
    void shutdown(boolean cancelInFlight, Duration timeout);

    boolean isClosed();

    /**
     * Shut down, cancelling running jobs.
     */
    @Override
    void close();
}
