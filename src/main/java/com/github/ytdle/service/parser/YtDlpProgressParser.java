package com.github.ytdle.service.parser;

import com.github.ytdle.model.JobStatus;
import com.github.ytdle.model.ProgressUpdate;
import com.github.ytdle.util.FormatUtils;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for yt-dlp console output (run with {@code --newline}).
 * Extracts transfer progress, the announced destination files and error lines.
 */
@Slf4j
public class YtDlpProgressParser implements ProgressParser {

    // [download]  45.3% of ~  12.34MiB at    1.23MiB/s ETA 00:10 (frag 3/20)
    private static final Pattern PERCENT_PATTERN = Pattern.compile("^\\[download\\]\\s+(\\d+(?:\\.\\d+)?)%");
    private static final Pattern TOTAL_PATTERN = Pattern.compile("of\\s+~?\\s*(\\d+(?:\\.\\d+)?)\\s*([KMGT]?i?B)\\b");
    private static final Pattern SPEED_PATTERN = Pattern.compile("at\\s+(\\d+(?:\\.\\d+)?)\\s*([KMGT]?i?B)/s");
    private static final Pattern ETA_PATTERN = Pattern.compile("ETA\\s+(\\d{1,2}(?::\\d{2}){1,2})");

    private static final Pattern DESTINATION_PATTERN = Pattern.compile("^\\[download\\] Destination: (.+)$");
    private static final Pattern ALREADY_DOWNLOADED_PATTERN =
            Pattern.compile("^\\[download\\] (.+) has already been downloaded");
    private static final Pattern MERGER_PATTERN = Pattern.compile("^\\[Merger\\] Merging formats into \"(.+)\"$");
    private static final Pattern EXTRACT_AUDIO_PATTERN = Pattern.compile("^\\[ExtractAudio\\] Destination: (.+)$");
    private static final Pattern MOVE_FILES_PATTERN = Pattern.compile("^\\[MoveFiles\\] Moving file \".+\" to \"(.+)\"$");
    private static final Pattern THUMBNAIL_PATTERN = Pattern.compile("^\\[info\\] Writing video thumbnail .* to: (.+)$");
    private static final Pattern ERROR_PATTERN = Pattern.compile("^ERROR:\\s*(.+)$");

    private Long totalSize;
    private String outputPath;
    private final List<Path> pendingArtifacts = new ArrayList<>();
    private final List<String> errorLines = new ArrayList<>();

    @Override
    public ProgressUpdate parseLine(String line, String jobId) {
        if (line == null || line.isBlank()) {
            return null;
        }
        String trimmed = line.strip();

        Matcher percentMatcher = PERCENT_PATTERN.matcher(trimmed);
        if (percentMatcher.find()) {
            return parseProgressLine(trimmed, percentMatcher, jobId);
        }

        Matcher matcher = DESTINATION_PATTERN.matcher(trimmed);
        if (matcher.find()) {
            // a new stream starts; sizes of the previous one no longer apply
            totalSize = null;
            announce(matcher.group(1), true);
            return null;
        }

        matcher = ALREADY_DOWNLOADED_PATTERN.matcher(trimmed);
        if (matcher.find()) {
            announce(matcher.group(1), false);
            return ProgressUpdate.builder()
                    .jobId(jobId)
                    .status(JobStatus.RUNNING)
                    .progress(100.0)
                    .message("Already downloaded")
                    .outputPath(outputPath)
                    .build();
        }

        for (Pattern pattern : List.of(MERGER_PATTERN, EXTRACT_AUDIO_PATTERN, MOVE_FILES_PATTERN)) {
            matcher = pattern.matcher(trimmed);
            if (matcher.find()) {
                announce(matcher.group(1), true);
                return ProgressUpdate.builder()
                        .jobId(jobId)
                        .status(JobStatus.RUNNING)
                        .message("Post-processing")
                        .outputPath(outputPath)
                        .build();
            }
        }

        matcher = THUMBNAIL_PATTERN.matcher(trimmed);
        if (matcher.find()) {
            pendingArtifacts.add(Paths.get(matcher.group(1).trim()));
            return null;
        }

        matcher = ERROR_PATTERN.matcher(trimmed);
        if (matcher.find()) {
            errorLines.add(matcher.group(1));
            log.debug("Fetch tool error for job {}: {}", jobId, matcher.group(1));
        }

        return null;
    }

    @Override
    public void reset() {
        totalSize = null;
        outputPath = null;
        pendingArtifacts.clear();
        errorLines.clear();
    }

    @Override
    public Long getTotalSize() {
        return totalSize;
    }

    @Override
    public String getOutputPath() {
        return outputPath;
    }

    @Override
    public List<Path> drainArtifacts() {
        List<Path> drained = new ArrayList<>(pendingArtifacts);
        pendingArtifacts.clear();
        return drained;
    }

    @Override
    public List<String> getErrorLines() {
        return List.copyOf(errorLines);
    }

    private ProgressUpdate parseProgressLine(String line, Matcher percentMatcher, String jobId) {
        double progress = Double.parseDouble(percentMatcher.group(1));

        Matcher totalMatcher = TOTAL_PATTERN.matcher(line);
        if (totalMatcher.find()) {
            Long parsed = FormatUtils.parseSize(totalMatcher.group(1), totalMatcher.group(2));
            if (parsed != null && parsed > 0) {
                totalSize = parsed;
            }
        }

        String downloadSpeed = null;
        Matcher speedMatcher = SPEED_PATTERN.matcher(line);
        if (speedMatcher.find()) {
            Long bytesPerSecond = FormatUtils.parseSize(speedMatcher.group(1), speedMatcher.group(2));
            if (bytesPerSecond != null) {
                downloadSpeed = FormatUtils.formatSpeed(bytesPerSecond);
            }
        }

        Long etaSeconds = null;
        Matcher etaMatcher = ETA_PATTERN.matcher(line);
        if (etaMatcher.find()) {
            etaSeconds = parseClock(etaMatcher.group(1));
        }

        Long downloadedBytes = totalSize != null ? Math.round(totalSize * progress / 100.0) : null;

        return ProgressUpdate.builder()
                .jobId(jobId)
                .status(JobStatus.RUNNING)
                .progress(Math.min(progress, 100.0))
                .downloadedBytes(downloadedBytes)
                .totalBytes(totalSize)
                .downloadSpeed(downloadSpeed)
                .etaSeconds(etaSeconds)
                .message(FormatUtils.formatStatus(downloadSpeed, etaSeconds))
                .build();
    }

    private void announce(String rawPath, boolean artifact) {
        String path = rawPath.trim();
        outputPath = path;
        if (artifact) {
            pendingArtifacts.add(Paths.get(path));
        }
    }

    /**
     * Parse "mm:ss" or "hh:mm:ss" to seconds.
     */
    private long parseClock(String clock) {
        long seconds = 0;
        for (String part : clock.split(":")) {
            seconds = seconds * 60 + Long.parseLong(part);
        }
        return seconds;
    }
}
