package com.github.ytdle.controller;

import com.github.ytdle.service.progress.ProgressBroadcastService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Slf4j
@RestController
@RequestMapping("/api/progress")
@RequiredArgsConstructor
public class ProgressController {

    private final ProgressBroadcastService progressBroadcastService;

    /**
     * SSE endpoint for real-time progress updates, optionally limited to one batch
     */
    @GetMapping("/stream")
    public SseEmitter streamProgress(@RequestParam(required = false) String batchId) {
        log.info("New SSE connection established{}", batchId == null ? "" : " for batch " + batchId);
        return progressBroadcastService.createEmitter(batchId);
    }
}
