package com.github.ytdle.service.engine;

import com.github.ytdle.config.YtdleProperties;
import com.github.ytdle.exception.EngineClosedException;
import com.github.ytdle.exception.InvalidRequestException;
import com.github.ytdle.model.BatchSubmission;
import com.github.ytdle.model.BatchSummary;
import com.github.ytdle.model.ControlResult;
import com.github.ytdle.model.DownloadRequest;
import com.github.ytdle.model.ErrorType;
import com.github.ytdle.model.FetchOutcome;
import com.github.ytdle.model.HistoryRecord;
import com.github.ytdle.model.JobSnapshot;
import com.github.ytdle.model.JobStatus;
import com.github.ytdle.model.ProgressUpdate;
import com.github.ytdle.service.fetch.FetchAdapter;
import com.github.ytdle.service.fetch.FetchListener;
import com.github.ytdle.service.fetch.PartialFileCleaner;
import com.github.ytdle.service.history.HistoryStore;
import com.github.ytdle.service.policy.RetryDecision;
import com.github.ytdle.service.policy.RetryPolicy;
import com.github.ytdle.service.progress.ProgressBroadcastService;
import com.github.ytdle.service.progress.ProgressEventBuilder;
import com.github.ytdle.service.progress.ProgressSubscription;
import com.github.ytdle.service.queue.JobQueue;
import com.github.ytdle.service.state.JobStateMachine;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Job table, control plane and per-job worker logic shared by the engine implementations.
 * <p>
 * Subclasses only decide how workers are scheduled: they take job ids from {@link #queue} while holding a slot of
 * the pool and call {@link #processJob(String)}, which returns once the slot is free again.
 */
@Slf4j
public abstract class AbstractDownloadEngine implements DownloadEngine {

    protected final YtdleProperties.Download settings;
    protected final JobQueue queue = new JobQueue();
    protected final DispatchGate gate;

    private final FetchAdapter fetchAdapter;
    private final RetryPolicy retryPolicy;
    private final ProgressBroadcastService progressBroadcast;
    private final ProgressEventBuilder progressEvents;
    private final HistoryStore historyStore;
    private final PartialFileCleaner fileCleaner;
    private final JobStateMachine stateMachine;

    private final Map<String, DownloadJob> jobs = new ConcurrentHashMap<>();
    private final OutputPathGuard pathGuard = new OutputPathGuard();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    protected AbstractDownloadEngine(EngineComponents components) {
        this.settings = components.getSettings();
        this.fetchAdapter = components.getFetchAdapter();
        this.retryPolicy = components.getRetryPolicy();
        this.progressBroadcast = components.getProgressBroadcast();
        this.progressEvents = components.getProgressEvents();
        this.historyStore = components.getHistoryStore();
        this.fileCleaner = components.getFileCleaner();
        this.stateMachine = components.getStateMachine();
        this.gate = new DispatchGate(components.getReachabilityMonitor(), components.getReachabilityPollMs());
    }

    // ========== Lifecycle ==========

    @Override
    public void start() {
        if (closed.get()) {
            throw new EngineClosedException("Engine has been shut down and cannot be restarted");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Starting {} with {} parallel download(s)", getClass().getSimpleName(), settings.getParallelDownloads());
        startWorkers(settings.getParallelDownloads());
    }

    /**
     * Launch {@code parallelism} workers draining {@link #queue}.
     */
    protected abstract void startWorkers(int parallelism);

    /**
     * Wait for every worker to exit once the queue is closed.
     *
     * @return false if workers were still busy when the timeout elapsed
     */
    protected abstract boolean awaitWorkers(Duration timeout) throws InterruptedException;

    /**
     * Interrupt workers that outlived the shutdown timeout.
     */
    protected abstract void stopWorkers();

    @Override
    public void shutdown(boolean cancelInFlight, Duration timeout) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down {} ({} in-flight jobs)", getClass().getSimpleName(),
                cancelInFlight ? "cancelling" : "finishing");

        queue.close();
        gate.close();

        for (String jobId : queue.drain()) {
            cancelWaiting(jobId, "Engine shut down");
        }
        for (String jobId : pathGuard.drainParked()) {
            cancelWaiting(jobId, "Engine shut down");
        }
        for (DownloadJob job : jobs.values()) {
            JobStatus status = job.getStatus();
            if (status == JobStatus.QUEUED || status == JobStatus.RETRYING) {
                cancelWaiting(job.getId(), "Engine shut down");
            } else if (status == JobStatus.PAUSED || (cancelInFlight && status == JobStatus.RUNNING)) {
                // a paused job can never finish on its own
                job.requestStop(stateMachine, JobStatus.CANCELLED, "Engine shut down");
            }
        }

        if (started.get()) {
            try {
                if (!awaitWorkers(timeout)) {
                    log.warn("Workers still busy after {}s, cancelling remaining jobs", timeout.toSeconds());
                    jobs.values().forEach(job ->
                            job.requestStop(stateMachine, JobStatus.CANCELLED, "Engine shut down"));
                    if (!awaitWorkers(Duration.ofSeconds(settings.getTeardownTimeoutSeconds()))) {
                        stopWorkers();
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stopWorkers();
            }
        }

        progressBroadcast.closeAll();
        log.info("{} shut down", getClass().getSimpleName());
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        shutdown(true, Duration.ofSeconds(settings.getTeardownTimeoutSeconds()));
    }

    // ========== Submission ==========

    @Override
    public BatchSubmission submit(List<DownloadRequest> requests, String batchId) {
        if (closed.get()) {
            throw new EngineClosedException("Engine is shut down, submission rejected");
        }
        if (requests == null || requests.isEmpty()) {
            throw new InvalidRequestException("A batch needs at least one request", -1);
        }

        List<DownloadRequest> normalized = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            normalized.add(normalize(requests.get(i), i));
        }

        String batch = batchId == null || batchId.isBlank() ? UUID.randomUUID().toString() : batchId;
        List<DownloadJob> created = new ArrayList<>(normalized.size());
        for (DownloadRequest request : normalized) {
            DownloadJob job = new DownloadJob(UUID.randomUUID().toString(), batch, request, sequence.incrementAndGet());
            jobs.put(job.getId(), job);
            created.add(job);
        }

        for (DownloadJob job : created) {
            publish(job, null);
            try {
                queue.enqueue(job.getId());
            } catch (EngineClosedException e) {
                created.forEach(pending -> cancelWaiting(pending.getId(), "Engine shut down"));
                throw e;
            }
        }

        log.info("Submitted batch {} with {} job(s)", batch, created.size());
        return new BatchSubmission(batch, created.stream().map(DownloadJob::getId).collect(Collectors.toList()));
    }

    private DownloadRequest normalize(DownloadRequest request, int index) {
        if (request == null) {
            throw new InvalidRequestException("Request " + index + " is missing", index);
        }
        if (request.getUrl() == null || request.getUrl().isBlank()) {
            throw new InvalidRequestException("Request " + index + " has no URL", index);
        }
        if (request.getFormat() == null) {
            throw new InvalidRequestException("Request " + index + " has no format", index);
        }

        DownloadRequest.DownloadRequestBuilder builder = request.toBuilder().url(request.getUrl().trim());
        if (request.getQuality() == null || request.getQuality().isBlank()) {
            builder.quality(request.isAudio() ? settings.getDefaultAudioQuality() : settings.getDefaultVideoQuality());
        }
        if (request.getOutputDirectory() == null || request.getOutputDirectory().isBlank()) {
            builder.outputDirectory(settings.getDefaultDirectory());
        }
        if (request.getFilenameTemplate() == null || request.getFilenameTemplate().isBlank()) {
            builder.filenameTemplate(settings.getDefaultFilenameTemplate());
        }
        return builder.build();
    }

    // ========== Control Plane ==========

    @Override
    public ControlResult pause(String jobId) {
        DownloadJob job = jobs.get(jobId);
        if (job == null) {
            return ControlResult.NOT_FOUND;
        }
        ControlResult result = job.requestPause();
        log.debug("Pause of job {}: {}", jobId, result);
        return result;
    }

    @Override
    public ControlResult resume(String jobId) {
        DownloadJob job = jobs.get(jobId);
        if (job == null) {
            return ControlResult.NOT_FOUND;
        }
        ControlResult result = job.requestResume();
        log.debug("Resume of job {}: {}", jobId, result);
        return result;
    }

    @Override
    public ControlResult cancel(String jobId) {
        return stop(jobId, JobStatus.CANCELLED, "Cancelled by user");
    }

    @Override
    public ControlResult skip(String jobId) {
        return stop(jobId, JobStatus.SKIPPED, "Skipped by user");
    }

    private ControlResult stop(String jobId, JobStatus target, String reason) {
        DownloadJob job = jobs.get(jobId);
        if (job == null) {
            return ControlResult.NOT_FOUND;
        }

        DownloadJob.StopDisposition disposition = job.requestStop(stateMachine, target, reason);
        log.debug("{} of job {}: {}", target, jobId, disposition);
        switch (disposition) {
            case STOPPED_NOW -> {
                queue.remove(jobId);
                pathGuard.removeParked(jobId);
                fileCleaner.cleanup(job.takeArtifacts());
                finalizeJob(job, null);
                return ControlResult.ACCEPTED;
            }
            case DEFERRED, DUPLICATE -> {
                return ControlResult.ACCEPTED;
            }
            default -> {
                return ControlResult.INVALID_TRANSITION;
            }
        }
    }

    @Override
    public int pauseAll() {
        gate.hold();
        int paused = 0;
        for (DownloadJob job : orderedJobs()) {
            if (job.getStatus() == JobStatus.RUNNING && job.requestPause().isAccepted()) {
                paused++;
            }
        }
        log.info("Paused {} running job(s), dispatch held", paused);
        return paused;
    }

    @Override
    public int resumeAll() {
        int resumed = 0;
        for (DownloadJob job : orderedJobs()) {
            if (job.requestResume().isAccepted()) {
                resumed++;
            }
        }
        gate.release();
        log.info("Resumed {} paused job(s), dispatch released", resumed);
        return resumed;
    }

    @Override
    public int cancelAll() {
        int cancelled = 0;
        for (DownloadJob job : orderedJobs()) {
            if (!job.getStatus().isTerminal() && cancel(job.getId()).isAccepted()) {
                cancelled++;
            }
        }
        log.info("Cancel requested for {} job(s)", cancelled);
        return cancelled;
    }

    @Override
    public ControlResult acknowledge(String jobId) {
        DownloadJob job = jobs.get(jobId);
        if (job == null) {
            return ControlResult.NOT_FOUND;
        }
        if (!job.getStatus().isTerminal()) {
            return ControlResult.INVALID_TRANSITION;
        }
        jobs.remove(jobId);
        progressBroadcast.forget(jobId);
        return ControlResult.ACCEPTED;
    }

    // ========== Queries ==========

    @Override
    public Optional<JobSnapshot> getStatus(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(DownloadJob::snapshot);
    }

    @Override
    public List<JobSnapshot> listJobs() {
        return orderedJobs().stream()
                .map(DownloadJob::snapshot)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<BatchSummary> batchSummary(String batchId) {
        List<JobSnapshot> members = orderedJobs().stream()
                .filter(job -> job.getBatchId().equals(batchId))
                .map(DownloadJob::snapshot)
                .collect(Collectors.toList());
        if (members.isEmpty()) {
            return Optional.empty();
        }

        Map<JobStatus, Long> counts = members.stream()
                .collect(Collectors.groupingBy(JobSnapshot::getStatus, Collectors.counting()));
        Function<JobStatus, Integer> count = status -> counts.getOrDefault(status, 0L).intValue();

        return Optional.of(BatchSummary.builder()
                .batchId(batchId)
                .total(members.size())
                .queued(count.apply(JobStatus.QUEUED))
                .running(count.apply(JobStatus.RUNNING))
                .paused(count.apply(JobStatus.PAUSED))
                .retrying(count.apply(JobStatus.RETRYING))
                .completed(count.apply(JobStatus.COMPLETED))
                .failed(count.apply(JobStatus.FAILED))
                .cancelled(count.apply(JobStatus.CANCELLED))
                .skipped(count.apply(JobStatus.SKIPPED))
                .build());
    }

    @Override
    public ProgressSubscription subscribe(String batchId) {
        return progressBroadcast.subscribe(batchId);
    }

    private List<DownloadJob> orderedJobs() {
        return jobs.values().stream()
                .sorted(Comparator.comparingLong(DownloadJob::getSequence))
                .collect(Collectors.toList());
    }

    // ========== Worker Side ==========

    /**
     * Run a dequeued job to the end of its current attempt chain. Called by a worker holding a pool slot; returns
     * once the slot is free. Never throws: a fault fails the job and the slot is reused.
     */
    protected final void processJob(String jobId) {
        DownloadJob job = jobs.get(jobId);
        if (job == null) {
            return;
        }

        try {
            if (!gate.awaitOpen()) {
                cancelWaiting(jobId, "Engine shut down");
                return;
            }
            if (job.getStatus() != JobStatus.QUEUED) {
                // stopped while waiting
                return;
            }

            String key = OutputPathGuard.keyOf(job.getRequest());
            if (!pathGuard.tryAcquire(key, jobId)) {
                log.debug("Job {} waits for another job writing to the same output", jobId);
                return;
            }
            boolean retry;
            try {
                retry = runAttempts(job);
            } finally {
                for (String parkedId : pathGuard.release(key, jobId)) {
                    requeueWaiting(parkedId);
                }
            }
            // only after the release, so a retry never overlaps a job parked on the same output
            if (retry) {
                requeueWaiting(jobId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted while handling job {}", jobId);
            abandon(job, "Worker interrupted");
        } catch (RuntimeException e) {
            log.error("Worker fault while handling job {}: {}", jobId, e.getMessage(), e);
            abandon(job, "Internal error: " + e);
        }
    }

    /**
     * @return true if the job was requeued for another attempt and still has to be put back on the queue
     */
    private boolean runAttempts(DownloadJob job) throws InterruptedException {
        if (!job.begin(stateMachine)) {
            return false;
        }
        log.info("Starting job {} attempt {}: {}", job.getId(), job.snapshot().getAttempts(), job.getRequest().getUrl());
        publish(job, null);

        boolean resumed = false;
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Worker interrupted during job " + job.getId());
            }
            FetchOutcome outcome = fetch(job, resumed);

            boolean interrupted = outcome.getKind() == FetchOutcome.Kind.INTERRUPTED;
            if (job.isStopRequested() || interrupted || (!outcome.isSuccess() && job.hasPendingControl())) {
                if (job.enterPause(stateMachine)) {
                    log.info("Job {} paused", job.getId());
                    publish(job, null);
                }
                JobStatus next = job.awaitResume(stateMachine);
                if (next != JobStatus.RUNNING) {
                    finishStopped(job);
                    return false;
                }
                log.info("Job {} resumed", job.getId());
                publish(job, "Resumed");
                resumed = true;
                continue;
            }

            if (outcome.isSuccess()) {
                if (job.complete(stateMachine, outcome.getOutputPath())) {
                    job.takeArtifacts();
                    log.info("Job {} completed: {}", job.getId(), job.snapshot().getOutputPath());
                    finalizeJob(job, null);
                } else {
                    finishStopped(job);
                }
                return false;
            }

            return handleFailure(job, outcome);
        }
    }

    private FetchOutcome fetch(DownloadJob job, boolean resumed) {
        try {
            return fetchAdapter.fetch(job.fetchContext(resumed), job.control(), listenerFor(job));
        } catch (RuntimeException e) {
            log.error("Fetch adapter fault for job {}: {}", job.getId(), e.getMessage(), e);
            return FetchOutcome.failure(ErrorType.INTERNAL_ERROR,
                    "Fetch adapter fault: " + e.getMessage(), e);
        }
    }

    private boolean handleFailure(DownloadJob job, FetchOutcome outcome) {
        RetryDecision decision = retryPolicy.decide(job.attemptProfile(), outcome);

        if (decision.isRetry()) {
            if (!job.failForRetry(stateMachine, outcome.getErrorType(), outcome.getErrorMessage(),
                    decision.getQuality(), decision.isSingleFileFormat())) {
                finishStopped(job);
                return false;
            }
            log.warn("Job {} attempt {} failed ({}): {}; {}", job.getId(), job.snapshot().getAttempts(),
                    outcome.getErrorType(), outcome.getErrorMessage(), decision.getReason());
            publish(job, decision.getReason());
            fileCleaner.cleanup(job.takeArtifacts());

            if (job.requeue(stateMachine)) {
                publish(job, null);
                return true;
            }
            return false;
        }

        if (!job.fail(stateMachine, decision.getErrorType(), decision.getReason())) {
            finishStopped(job);
            return false;
        }
        log.error("Job {} failed ({}): {}", job.getId(), decision.getErrorType(), decision.getReason());
        fileCleaner.cleanup(job.takeArtifacts());
        finalizeJob(job, decision.getReason());
        return false;
    }

    private FetchListener listenerFor(DownloadJob job) {
        return new FetchListener() {
            @Override
            public void onProgress(ProgressUpdate update) {
                JobSnapshot snapshot = job.applyProgress(update);
                if (snapshot.getStatus() == JobStatus.RUNNING) {
                    progressBroadcast.publish(progressEvents.buildTransferProgress(snapshot, update));
                }
            }

            @Override
            public void onArtifact(Path artifact) {
                job.addArtifact(artifact);
            }
        };
    }

    private void finishStopped(DownloadJob job) {
        JobStatus reached = job.finishStopped(stateMachine);
        List<Path> artifacts = job.takeArtifacts();
        if (reached == JobStatus.SKIPPED || !settings.isKeepPartialOnCancel()) {
            fileCleaner.cleanup(artifacts);
        }
        log.info("Job {} finished as {}", job.getId(), reached);
        finalizeJob(job, null);
    }

    private void cancelWaiting(String jobId, String reason) {
        DownloadJob job = jobs.get(jobId);
        if (job != null && job.cancelIfWaiting(stateMachine, reason)) {
            fileCleaner.cleanup(job.takeArtifacts());
            finalizeJob(job, reason);
        }
    }

    private void requeueWaiting(String jobId) {
        DownloadJob job = jobs.get(jobId);
        if (job == null || job.getStatus() != JobStatus.QUEUED) {
            return;
        }
        try {
            queue.enqueue(jobId);
        } catch (EngineClosedException e) {
            cancelWaiting(jobId, "Engine shut down");
        }
    }

    private void abandon(DownloadJob job, String reason) {
        if (!job.failInternally(stateMachine, reason)) {
            return;
        }
        List<Path> artifacts = job.takeArtifacts();
        if (job.getStatus() != JobStatus.CANCELLED || !settings.isKeepPartialOnCancel()) {
            fileCleaner.cleanup(artifacts);
        }
        log.info("Job {} abandoned as {}", job.getId(), job.getStatus());
        finalizeJob(job, reason);
    }

    /**
     * Emit the finalize record and the terminal progress event of a job that just became terminal.
     */
    private void finalizeJob(DownloadJob job, String detail) {
        JobSnapshot snapshot = job.snapshot();
        try {
            historyStore.record(toHistoryRecord(snapshot));
        } catch (RuntimeException e) {
            log.error("Failed to record history for job {}: {}", job.getId(), e.getMessage(), e);
        }
        progressBroadcast.publish(progressEvents.buildStatusChange(snapshot, detail));
    }

    private void publish(DownloadJob job, String detail) {
        progressBroadcast.publish(progressEvents.buildStatusChange(job.snapshot(), detail));
    }

    private HistoryRecord toHistoryRecord(JobSnapshot snapshot) {
        return HistoryRecord.builder()
                .id(snapshot.getId())
                .batchId(snapshot.getBatchId())
                .url(snapshot.getRequest().getUrl())
                .format(snapshot.getRequest().getFormat())
                .quality(snapshot.getEffectiveQuality())
                .request(snapshot.getRequest())
                .status(snapshot.getStatus())
                .outputPath(snapshot.getOutputPath())
                .errorType(snapshot.getErrorType())
                .errorMessage(snapshot.getErrorMessage())
                .attempts(snapshot.getAttempts())
                .enqueuedAt(snapshot.getEnqueuedAt())
                .startedAt(snapshot.getStartedAt())
                .finishedAt(snapshot.getFinishedAt())
                .build();
    }
}
