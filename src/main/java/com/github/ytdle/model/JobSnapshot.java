package com.github.ytdle.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Point-in-time, immutable view of a job.
 */
@Value
@Builder
public class JobSnapshot {

    String id;
    String batchId;
    DownloadRequest request;
    JobStatus status;
    int attempts;
    String effectiveQuality;
    ErrorType errorType;
    String errorMessage;
    Long downloadedBytes;
    Long totalBytes;
    Double progress;
    String downloadSpeed;
    Long etaSeconds;
    String outputPath;
    LocalDateTime enqueuedAt;
    LocalDateTime startedAt;
    LocalDateTime finishedAt;

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
