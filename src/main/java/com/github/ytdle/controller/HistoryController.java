package com.github.ytdle.controller;

import com.github.ytdle.model.HistoryRecord;
import com.github.ytdle.model.HistoryStats;
import com.github.ytdle.service.history.HistoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/history")
@RequiredArgsConstructor
public class HistoryController {

    private final HistoryStore historyStore;

    @GetMapping
    public ResponseEntity<List<HistoryRecord>> getHistory(
            @RequestParam(defaultValue = "false") boolean failedOnly,
            @RequestParam(defaultValue = "0") int limit) {
        return ResponseEntity.ok(failedOnly ? historyStore.findFailed(limit) : historyStore.findAll(limit));
    }

    @GetMapping("/stats")
    public ResponseEntity<HistoryStats> getStats() {
        return ResponseEntity.ok(historyStore.stats());
    }

    /**
     * Failed URLs as commented text, ready to be resubmitted
     */
    @GetMapping(value = "/failed/export", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> exportFailed() {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"failed-urls.txt\"")
                .body(historyStore.renderFailedExport());
    }

    @DeleteMapping
    public ResponseEntity<Void> clearHistory() {
        int removed = historyStore.clear();
        log.info("Cleared {} history record(s)", removed);
        return ResponseEntity.noContent().build();
    }
}
