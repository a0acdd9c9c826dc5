package com.github.ytdle.controller;

import com.github.ytdle.model.BatchRequest;
import com.github.ytdle.model.BatchSubmission;
import com.github.ytdle.model.BatchSummary;
import com.github.ytdle.model.ControlResponse;
import com.github.ytdle.model.ControlResult;
import com.github.ytdle.model.JobSnapshot;
import com.github.ytdle.service.engine.DownloadEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DownloadController {

    private final DownloadEngine downloadEngine;

    /**
     * Submit a batch of downloads
     */
    @PostMapping("/downloads")
    public ResponseEntity<BatchSubmission> submit(@Valid @RequestBody BatchRequest request) {
        log.info("Submitting {} download(s)", request.getJobs().size());
        BatchSubmission submission = downloadEngine.submit(request.getJobs(), request.getBatchId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(submission);
    }

    /**
     * Get all downloads
     */
    @GetMapping("/downloads")
    public ResponseEntity<List<JobSnapshot>> getAllDownloads() {
        return ResponseEntity.ok(downloadEngine.listJobs());
    }

    /**
     * Get download by ID
     */
    @GetMapping("/downloads/{id}")
    public ResponseEntity<JobSnapshot> getDownload(@PathVariable String id) {
        return downloadEngine.getStatus(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/downloads/{id}/pause")
    public ResponseEntity<Void> pause(@PathVariable String id) {
        return toResponse(downloadEngine.pause(id));
    }

    @PostMapping("/downloads/{id}/resume")
    public ResponseEntity<Void> resume(@PathVariable String id) {
        return toResponse(downloadEngine.resume(id));
    }

    @PostMapping("/downloads/{id}/skip")
    public ResponseEntity<Void> skip(@PathVariable String id) {
        return toResponse(downloadEngine.skip(id));
    }

    /**
     * Cancel download
     */
    @DeleteMapping("/downloads/{id}")
    public ResponseEntity<Void> cancel(@PathVariable String id) {
        log.info("Cancelling download {}", id);
        return toResponse(downloadEngine.cancel(id));
    }

    /**
     * Drop a finished download from the live list
     */
    @DeleteMapping("/downloads/{id}/ack")
    public ResponseEntity<Void> acknowledge(@PathVariable String id) {
        return toResponse(downloadEngine.acknowledge(id));
    }

    @PostMapping("/downloads/pause-all")
    public ResponseEntity<ControlResponse> pauseAll() {
        return ResponseEntity.ok(new ControlResponse("pause-all", downloadEngine.pauseAll()));
    }

    @PostMapping("/downloads/resume-all")
    public ResponseEntity<ControlResponse> resumeAll() {
        return ResponseEntity.ok(new ControlResponse("resume-all", downloadEngine.resumeAll()));
    }

    @PostMapping("/downloads/cancel-all")
    public ResponseEntity<ControlResponse> cancelAll() {
        return ResponseEntity.ok(new ControlResponse("cancel-all", downloadEngine.cancelAll()));
    }

    /**
     * Aggregate status of a batch
     */
    @GetMapping("/batches/{batchId}")
    public ResponseEntity<BatchSummary> getBatch(@PathVariable String batchId) {
        return downloadEngine.batchSummary(batchId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    private ResponseEntity<Void> toResponse(ControlResult result) {
        return switch (result) {
            case ACCEPTED -> ResponseEntity.accepted().build();
            case NOT_FOUND -> ResponseEntity.notFound().build();
            case INVALID_TRANSITION -> ResponseEntity.status(HttpStatus.CONFLICT).build();
        };
    }
}
