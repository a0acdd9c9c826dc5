package com.github.ytdle.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder(toBuilder = true)
public class ProgressUpdate {

    private String jobId;
    private String batchId;
    private JobStatus status;
    private Double progress;
    private Long downloadedBytes;
    private Long totalBytes;
    private String downloadSpeed;  // Human readable: "5.2 MB/s"
    private Long etaSeconds;
    private Integer attempt;
    private String message;
    private ErrorType errorType;
    private String errorMessage;
    private String outputPath;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public static ProgressUpdate forSnapshot(JobSnapshot snapshot, String message) {
        return ProgressUpdate.builder()
                .jobId(snapshot.getId())
                .batchId(snapshot.getBatchId())
                .status(snapshot.getStatus())
                .progress(snapshot.getProgress())
                .downloadedBytes(snapshot.getDownloadedBytes())
                .totalBytes(snapshot.getTotalBytes())
                .downloadSpeed(snapshot.getDownloadSpeed())
                .etaSeconds(snapshot.getEtaSeconds())
                .attempt(snapshot.getAttempts())
                .message(message)
                .errorType(snapshot.getErrorType())
                .errorMessage(snapshot.getErrorMessage())
                .outputPath(snapshot.getOutputPath())
                .build();
    }
}
