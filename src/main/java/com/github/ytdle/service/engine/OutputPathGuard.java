package com.github.ytdle.service.engine;

import com.github.ytdle.model.DownloadRequest;
import com.github.ytdle.util.PathUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes jobs that would write to the same output path.
 * <p>
 * A job that finds its output key taken is parked instead of started; when the holder finishes, the parked jobs are
 * handed back for re-queueing.
 */
class OutputPathGuard {

    private final Map<String, String> holders = new HashMap<>();
    private final Map<String, Deque<String>> parked = new HashMap<>();

    /**
     * Output key of a request. Templates with placeholders expand per URL, so the URL is part of the key;
     * a literal template names the same file whatever the URL.
     */
    static String keyOf(DownloadRequest request) {
        String directory = PathUtils.normalizeDirectory(request.getOutputDirectory()).toString();
        String template = PathUtils.sanitizeTemplate(request.getFilenameTemplate());
        StringBuilder key = new StringBuilder(directory).append('|').append(template);
        if (PathUtils.hasPlaceholders(template)) {
            key.append('|').append(request.getUrl());
        }
        return key.append('|').append(request.getFormat()).toString();
    }

    /**
     * @return true if {@code jobId} now holds the key, false if it was parked behind another job
     */
    synchronized boolean tryAcquire(String key, String jobId) {
        String holder = holders.get(key);
        if (holder == null || holder.equals(jobId)) {
            holders.put(key, jobId);
            return true;
        }
        parked.computeIfAbsent(key, k -> new ArrayDeque<>()).add(jobId);
        return false;
    }

    /**
     * Release a key.
     *
     * @return jobs that were parked behind it, in arrival order
     */
    synchronized List<String> release(String key, String jobId) {
        if (!holders.remove(key, jobId)) {
            return List.of();
        }
        Deque<String> waiting = parked.remove(key);
        return waiting == null ? List.of() : new ArrayList<>(waiting);
    }

    synchronized boolean removeParked(String jobId) {
        boolean removed = false;
        for (Deque<String> waiting : parked.values()) {
            removed |= waiting.remove(jobId);
        }
        parked.values().removeIf(Deque::isEmpty);
        return removed;
    }

    synchronized List<String> drainParked() {
        List<String> drained = new ArrayList<>();
        parked.values().forEach(drained::addAll);
        parked.clear();
        return drained;
    }

    synchronized int parkedCount() {
        return parked.values().stream().mapToInt(Deque::size).sum();
    }
}
