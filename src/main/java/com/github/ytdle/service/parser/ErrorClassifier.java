package com.github.ytdle.service.parser;

import com.github.ytdle.model.ErrorType;
import com.github.ytdle.util.PathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Maps the error output of a failed fetch to an {@link ErrorType}.
 * <p>
 * Checks run from the most specific cause to the least specific one. Output that matches nothing is treated as a
 * transient network problem so that the job gets another attempt.
 */
@Slf4j
@Component
public class ErrorClassifier {

    private static final List<String> DISK_MARKERS = List.of(
            "no space left", "disk full", "permission denied", "read-only file system", "unable to open for writing",
            "unable to create directory", "errno 28", "errno 13");

    private static final List<String> MERGE_MARKERS = List.of(
            "ffmpeg not found", "ffmpeg is not installed", "ffprobe and ffmpeg not found", "you have requested merging",
            "postprocessing: ffmpeg", "conversion failed", "could not find codec", "encoder not found");

    private static final List<String> FORMAT_MARKERS = List.of(
            "requested format is not available", "requested format not available", "no video formats found",
            "format is not available", "no suitable formats");

    private static final List<String> ACCESS_MARKERS = List.of(
            "sign in to confirm", "login required", "authentication", "private video", "members-only",
            "http error 401", "http error 403", "forbidden", "this video is only available for registered users");

    private static final List<String> INVALID_MARKERS = List.of(
            "unsupported url", "is not a valid url", "video unavailable", "http error 404", "not found",
            "this video has been removed", "does not exist", "no video could be found");

    private static final List<String> NETWORK_MARKERS = List.of(
            "timed out", "timeout", "connection", "network", "temporary failure in name resolution",
            "http error 429", "too many requests", "http error 5", "unable to download webpage", "read error");

    /**
     * Classify the error lines of a failed attempt.
     *
     * @param errorLines lines printed by the tool, oldest first
     * @param exitCode tool exit code
     */
    public ErrorType classify(List<String> errorLines, int exitCode) {
        String text = PathUtils.lowerCase(String.join("\n", errorLines));

        ErrorType type;
        if (containsAny(text, DISK_MARKERS)) {
            type = ErrorType.DISK_WRITE_ERROR;
        } else if (containsAny(text, MERGE_MARKERS)) {
            type = ErrorType.MERGE_CODEC_MISSING;
        } else if (containsAny(text, FORMAT_MARKERS)) {
            type = ErrorType.FORMAT_UNAVAILABLE;
        } else if (containsAny(text, ACCESS_MARKERS)) {
            type = ErrorType.ACCESS_DENIED;
        } else if (containsAny(text, INVALID_MARKERS)) {
            type = ErrorType.INVALID_INPUT;
        } else if (containsAny(text, NETWORK_MARKERS)) {
            type = ErrorType.TRANSIENT_NETWORK_ERROR;
        } else {
            type = ErrorType.TRANSIENT_NETWORK_ERROR;
            log.debug("Unrecognised failure (exit code {}), treating as transient", exitCode);
        }
        return type;
    }

    /**
     * Human-readable message for a failed attempt: the last error line, or the exit code when the tool printed none.
     */
    public String describe(List<String> errorLines, int exitCode) {
        if (errorLines.isEmpty()) {
            return "Fetch tool exited with code " + exitCode;
        }
        return errorLines.get(errorLines.size() - 1);
    }

    private boolean containsAny(String text, List<String> markers) {
        return markers.stream().anyMatch(text::contains);
    }
}
