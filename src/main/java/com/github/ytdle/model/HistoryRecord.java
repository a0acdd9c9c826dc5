package com.github.ytdle.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;

/**
 * Finalize record emitted once per job when it reaches a terminal status.
 */
@Value
@Builder
@Jacksonized
public class HistoryRecord {

    String id;
    String batchId;
    String url;
    MediaFormat format;
    String quality;
    DownloadRequest request;
    JobStatus status;
    String outputPath;
    ErrorType errorType;
    String errorMessage;
    int attempts;
    LocalDateTime enqueuedAt;
    LocalDateTime startedAt;
    LocalDateTime finishedAt;

    @JsonIgnore
    public boolean isSuccess() {
        return status == JobStatus.COMPLETED;
    }
}
