package com.github.ytdle.service.engine;

import com.github.ytdle.model.ControlResult;
import com.github.ytdle.model.DownloadRequest;
import com.github.ytdle.model.ErrorType;
import com.github.ytdle.model.JobSnapshot;
import com.github.ytdle.model.JobStatus;
import com.github.ytdle.model.ProgressUpdate;
import com.github.ytdle.service.fetch.FetchContext;
import com.github.ytdle.service.fetch.FetchControl;
import com.github.ytdle.service.policy.AttemptProfile;
import com.github.ytdle.service.state.JobStateMachine;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live state of one job.
 * <p>
 * All mutable fields are guarded by a per-job lock, so a control request and the worker owning the job always see
 * each other's changes in a single order. Status only changes through the {@link JobStateMachine}.
 * <p>
 * Control requests against a running job are recorded here and acted upon by the worker: the attempt is torn down
 * through the registered teardown action and the worker decides the resulting status.
 */
@Slf4j
public class DownloadJob {

    /**
     * What a cancel or skip request did.
     */
    public enum StopDisposition {
        /** The job was waiting; it is terminal now and the caller must finalize it. */
        STOPPED_NOW,
        /** The job is running or paused; its worker will finalize it. */
        DEFERRED,
        /** The same request was already accepted. */
        DUPLICATE,
        /** The job is terminal or a different stop was already accepted. */
        REJECTED
    }

    @Getter
    private final String id;
    @Getter
    private final String batchId;
    @Getter
    private final DownloadRequest request;
    @Getter
    private final long sequence;
    private final LocalDateTime enqueuedAt = LocalDateTime.now();

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition controlChanged = lock.newCondition();
    private final Control control = new Control();

    private JobStatus status = JobStatus.QUEUED;
    private int attempts;
    private String quality;
    private boolean singleFileFormat;
    private ErrorType errorType;
    private String errorMessage;
    private Long downloadedBytes;
    private Long totalBytes;
    private Double progress;
    private String downloadSpeed;
    private Long etaSeconds;
    private String outputPath;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private final Set<Path> artifacts = new LinkedHashSet<>();

    private JobStatus requestedStop;
    private boolean pauseRequested;
    private Runnable teardown;
    private boolean interrupted;

    public DownloadJob(String id, String batchId, DownloadRequest request, long sequence) {
        this.id = id;
        this.batchId = batchId;
        this.request = request;
        this.sequence = sequence;
        this.quality = request.getQuality();
    }

    public JobStatus getStatus() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public JobSnapshot snapshot() {
        lock.lock();
        try {
            return JobSnapshot.builder()
                    .id(id)
                    .batchId(batchId)
                    .request(request)
                    .status(status)
                    .attempts(attempts)
                    .effectiveQuality(quality)
                    .errorType(errorType)
                    .errorMessage(errorMessage)
                    .downloadedBytes(downloadedBytes)
                    .totalBytes(totalBytes)
                    .progress(progress)
                    .downloadSpeed(downloadSpeed)
                    .etaSeconds(etaSeconds)
                    .outputPath(outputPath)
                    .enqueuedAt(enqueuedAt)
                    .startedAt(startedAt)
                    .finishedAt(finishedAt)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    // ========== Worker Side ==========

    /**
     * Start a new attempt: QUEUED → RUNNING.
     *
     * @return false if the job is no longer waiting (cancelled or skipped meanwhile)
     */
    boolean begin(JobStateMachine stateMachine) {
        lock.lock();
        try {
            if (status != JobStatus.QUEUED) {
                return false;
            }
            status = stateMachine.transitionOrThrow(id, status, JobStatus.RUNNING);
            attempts++;
            if (startedAt == null) {
                startedAt = LocalDateTime.now();
            }
            resetTransfer();
            interrupted = false;
            return true;
        } finally {
            lock.unlock();
        }
    }

    FetchContext fetchContext(boolean resumed) {
        lock.lock();
        try {
            return FetchContext.builder()
                    .jobId(id)
                    .attempt(attempts)
                    .request(request)
                    .quality(quality)
                    .singleFileFormat(singleFileFormat)
                    .resumed(resumed)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    AttemptProfile attemptProfile() {
        lock.lock();
        try {
            return AttemptProfile.builder()
                    .attempts(attempts)
                    .format(request.getFormat())
                    .quality(quality)
                    .singleFileFormat(singleFileFormat)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    FetchControl control() {
        return control;
    }

    JobSnapshot applyProgress(ProgressUpdate update) {
        lock.lock();
        try {
            if (update.getProgress() != null) {
                progress = update.getProgress();
            }
            if (update.getDownloadedBytes() != null) {
                downloadedBytes = update.getDownloadedBytes();
            }
            if (update.getTotalBytes() != null) {
                totalBytes = update.getTotalBytes();
            }
            if (update.getDownloadSpeed() != null) {
                downloadSpeed = update.getDownloadSpeed();
            }
            if (update.getEtaSeconds() != null) {
                etaSeconds = update.getEtaSeconds();
            }
            if (update.getOutputPath() != null) {
                outputPath = update.getOutputPath();
            }
        } finally {
            lock.unlock();
        }
        return snapshot();
    }

    void addArtifact(Path artifact) {
        lock.lock();
        try {
            artifacts.add(artifact);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hand over the artifacts collected so far and forget them.
     */
    List<Path> takeArtifacts() {
        lock.lock();
        try {
            List<Path> taken = new ArrayList<>(artifacts);
            artifacts.clear();
            return taken;
        } finally {
            lock.unlock();
        }
    }

    boolean isStopRequested() {
        lock.lock();
        try {
            return requestedStop != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether a pause or stop request is waiting for the worker.
     */
    boolean hasPendingControl() {
        lock.lock();
        try {
            return requestedStop != null || pauseRequested;
        } finally {
            lock.unlock();
        }
    }

    /**
     * RUNNING → PAUSED if a pause is still requested.
     *
     * @return true if the job is now paused
     */
    boolean enterPause(JobStateMachine stateMachine) {
        lock.lock();
        try {
            if (!pauseRequested || requestedStop != null || status != JobStatus.RUNNING) {
                return false;
            }
            status = stateMachine.transitionOrThrow(id, status, JobStatus.PAUSED);
            downloadSpeed = null;
            etaSeconds = null;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block while the job is paused.
     *
     * @return RUNNING once resumed, or the requested stop status
     */
    JobStatus awaitResume(JobStateMachine stateMachine) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (pauseRequested && requestedStop == null) {
                controlChanged.await();
            }
            if (requestedStop != null) {
                return requestedStop;
            }
            if (status == JobStatus.PAUSED) {
                status = stateMachine.transitionOrThrow(id, status, JobStatus.RUNNING);
            }
            interrupted = false;
            return JobStatus.RUNNING;
        } finally {
            lock.unlock();
        }
    }

    /**
     * RUNNING → COMPLETED.
     *
     * @return false if a stop request won the race; the caller must then finish the stop instead
     */
    boolean complete(JobStateMachine stateMachine, String finalOutputPath) {
        lock.lock();
        try {
            if (requestedStop != null) {
                return false;
            }
            status = stateMachine.transitionOrThrow(id, status, JobStatus.COMPLETED);
            pauseRequested = false;
            progress = 100.0;
            if (totalBytes != null) {
                downloadedBytes = totalBytes;
            }
            downloadSpeed = null;
            etaSeconds = null;
            if (finalOutputPath != null) {
                outputPath = finalOutputPath;
            }
            errorType = null;
            errorMessage = null;
            finishedAt = LocalDateTime.now();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * RUNNING → FAILED → RETRYING in one step, with the parameters of the next attempt.
     *
     * @return false if a stop request won the race
     */
    boolean failForRetry(JobStateMachine stateMachine, ErrorType failure, String message,
                         String nextQuality, boolean nextSingleFile) {
        lock.lock();
        try {
            if (requestedStop != null) {
                return false;
            }
            status = stateMachine.transitionOrThrow(id, status, JobStatus.FAILED);
            status = stateMachine.transitionOrThrow(id, status, JobStatus.RETRYING);
            pauseRequested = false;
            errorType = failure;
            errorMessage = message;
            quality = nextQuality;
            singleFileFormat = nextSingleFile;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * RETRYING → QUEUED.
     *
     * @return false if the job was stopped while retrying
     */
    boolean requeue(JobStateMachine stateMachine) {
        lock.lock();
        try {
            if (status != JobStatus.RETRYING) {
                return false;
            }
            status = stateMachine.transitionOrThrow(id, status, JobStatus.QUEUED);
            resetTransfer();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * RUNNING → FAILED for good.
     *
     * @return false if a stop request won the race
     */
    boolean fail(JobStateMachine stateMachine, ErrorType failure, String message) {
        lock.lock();
        try {
            if (requestedStop != null) {
                return false;
            }
            status = stateMachine.transitionOrThrow(id, status, JobStatus.FAILED);
            pauseRequested = false;
            errorType = failure;
            errorMessage = message;
            finishedAt = LocalDateTime.now();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Apply an accepted stop request: RUNNING or PAUSED → CANCELLED or SKIPPED.
     *
     * @return the status reached
     */
    JobStatus finishStopped(JobStateMachine stateMachine) {
        lock.lock();
        try {
            if (status.isTerminal()) {
                return status;
            }
            JobStatus target = requestedStop != null ? requestedStop : JobStatus.CANCELLED;
            status = stateMachine.transitionOrThrow(id, status, target);
            pauseRequested = false;
            downloadSpeed = null;
            etaSeconds = null;
            finishedAt = LocalDateTime.now();
            return status;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fail the job after an engine fault, whatever non-terminal status it is in. An accepted cancel or skip
     * still wins: the job ends in the requested status instead.
     *
     * @return false if the job was already terminal
     */
    boolean failInternally(JobStateMachine stateMachine, String message) {
        lock.lock();
        try {
            if (status.isTerminal()) {
                return false;
            }
            if (requestedStop != null) {
                status = stateMachine.transitionOrThrow(id, status, requestedStop);
                pauseRequested = false;
                downloadSpeed = null;
                etaSeconds = null;
                finishedAt = LocalDateTime.now();
                return true;
            }
            if (status == JobStatus.RETRYING) {
                status = stateMachine.transitionOrThrow(id, status, JobStatus.QUEUED);
            }
            if (status == JobStatus.QUEUED || status == JobStatus.PAUSED) {
                status = stateMachine.transitionOrThrow(id, status, JobStatus.RUNNING);
            }
            status = stateMachine.transitionOrThrow(id, status, JobStatus.FAILED);
            pauseRequested = false;
            errorType = ErrorType.INTERNAL_ERROR;
            errorMessage = message;
            finishedAt = LocalDateTime.now();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancel a job that is not running: QUEUED or RETRYING → CANCELLED.
     *
     * @return false if the job was not waiting
     */
    boolean cancelIfWaiting(JobStateMachine stateMachine, String reason) {
        lock.lock();
        try {
            if (status != JobStatus.QUEUED && status != JobStatus.RETRYING) {
                return false;
            }
            status = stateMachine.transitionOrThrow(id, status, JobStatus.CANCELLED);
            errorMessage = reason;
            finishedAt = LocalDateTime.now();
            return true;
        } finally {
            lock.unlock();
        }
    }

    // ========== Control Side ==========

    ControlResult requestPause() {
        lock.lock();
        try {
            if (requestedStop != null) {
                return ControlResult.INVALID_TRANSITION;
            }
            if (status == JobStatus.PAUSED || (status == JobStatus.RUNNING && pauseRequested)) {
                return ControlResult.ACCEPTED;
            }
            if (status != JobStatus.RUNNING) {
                return ControlResult.INVALID_TRANSITION;
            }
            pauseRequested = true;
            fireTeardown();
            return ControlResult.ACCEPTED;
        } finally {
            lock.unlock();
        }
    }

    ControlResult requestResume() {
        lock.lock();
        try {
            if (requestedStop != null || !pauseRequested
                    || (status != JobStatus.PAUSED && status != JobStatus.RUNNING)) {
                return ControlResult.INVALID_TRANSITION;
            }
            pauseRequested = false;
            controlChanged.signalAll();
            return ControlResult.ACCEPTED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Request cancel or skip.
     *
     * @param target CANCELLED or SKIPPED
     */
    StopDisposition requestStop(JobStateMachine stateMachine, JobStatus target, String reason) {
        lock.lock();
        try {
            if (status.isTerminal()) {
                return StopDisposition.REJECTED;
            }
            if (requestedStop != null) {
                return requestedStop == target ? StopDisposition.DUPLICATE : StopDisposition.REJECTED;
            }
            if (status == JobStatus.QUEUED || status == JobStatus.RETRYING) {
                status = stateMachine.transitionOrThrow(id, status, target);
                errorMessage = reason;
                finishedAt = LocalDateTime.now();
                return StopDisposition.STOPPED_NOW;
            }
            requestedStop = target;
            errorMessage = reason;
            pauseRequested = false;
            fireTeardown();
            controlChanged.signalAll();
            return StopDisposition.DEFERRED;
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private void fireTeardown() {
        if (teardown != null) {
            interrupted = true;
            try {
                teardown.run();
            } catch (RuntimeException e) {
                log.warn("Teardown of job {} failed: {}", id, e.getMessage(), e);
            }
        }
    }

    // caller holds the lock
    private void resetTransfer() {
        progress = null;
        downloadedBytes = null;
        totalBytes = null;
        downloadSpeed = null;
        etaSeconds = null;
    }

    private class Control implements FetchControl {

        @Override
        public boolean attach(Runnable action) {
            lock.lock();
            try {
                if (pauseRequested || requestedStop != null) {
                    interrupted = true;
                    return false;
                }
                teardown = action;
                return true;
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void detach() {
            lock.lock();
            try {
                teardown = null;
            } finally {
                lock.unlock();
            }
        }

        @Override
        public boolean isInterruptRequested() {
            lock.lock();
            try {
                return interrupted;
            } finally {
                lock.unlock();
            }
        }
    }
}
