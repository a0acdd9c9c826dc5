package com.github.ytdle.service.command;

import com.github.ytdle.config.YtdleProperties;
import com.github.ytdle.model.DownloadRequest;
import com.github.ytdle.model.MediaFormat;
import com.github.ytdle.service.fetch.FetchContext;
import com.github.ytdle.service.policy.QualityLadder;
import com.github.ytdle.util.PathUtils;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builder for constructing yt-dlp command-line arguments.
 * Centralizes the translation of a job's request and its current attempt profile into tool options.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class YtDlpCommandBuilder {

    static final String DEFAULT_AUDIO_BITRATE = "192";
    static final String DEFAULT_VIDEO_HEIGHT = "1080";

    private final YtdleProperties properties;
    private final ToolLocator toolLocator;

    /**
     * Build the full command for one attempt.
     *
     * @param context Attempt parameters
     * @return yt-dlp command arguments
     */
    public List<String> buildCommand(@NonNull FetchContext context) {
        DownloadRequest request = context.getRequest();
        YtdleProperties.Download download = properties.getDownload();

        List<String> command = new ArrayList<>();
        command.add(toolLocator.fetchTool());
        command.add("--newline");
        command.add("--no-colors");
        command.add("--continue");
        command.add("-o");
        command.add(PathUtils.buildOutputTemplate(request.getOutputDirectory(), request.getFilenameTemplate()));
        command.add("--retries");
        command.add(String.valueOf(download.getRetries()));
        command.add("--fragment-retries");
        command.add(String.valueOf(download.getFragmentRetries()));
        command.add("-N");
        command.add(String.valueOf(download.getConcurrentFragments()));
        command.add(request.isPlaylist() ? "--yes-playlist" : "--no-playlist");

        if (request.isRestrictFilenames()) {
            command.add("--restrict-filenames");
        }
        if (!request.isCheckCertificates()) {
            command.add("--no-check-certificates");
        }

        toolLocator.ffmpeg().ifPresent(ffmpeg -> {
            command.add("--ffmpeg-location");
            command.add(ffmpeg.toString());
        });

        if (hasText(request.getCookieFile())) {
            command.add("--cookies");
            command.add(request.getCookieFile());
        } else if (hasText(request.getCookiesFromBrowser())) {
            command.add("--cookies-from-browser");
            command.add(request.getCookiesFromBrowser());
        }

        buildPostprocessorArgs(request).ifPresent(args -> {
            command.add("--postprocessor-args");
            command.add("ffmpeg:" + args);
        });

        if (request.isAudio()) {
            addAudioOptions(command, context.getQuality());
        } else {
            addVideoOptions(command, context.getQuality(), context.isSingleFileFormat());
        }

        if (request.isUseAccelerator()) {
            addAcceleratorOptions(command);
        }

        command.add("--");
        command.add(request.getUrl());

        log.debug("Built fetch command for job {} attempt {}: {}",
                context.getJobId(), context.getAttempt(), String.join(" ", command));
        return command;
    }

    /**
     * Format selector for a video attempt.
     * <p>
     * An explicit tier is a hard ceiling; only "best" lets the tool pick anything. The retry policy relaxes the tier
     * when the selector cannot be satisfied.
     */
    public String buildVideoFormat(String quality, boolean singleFileFormat) {
        if (QualityLadder.isBest(quality)) {
            return singleFileFormat ? "best[ext=mp4]/best" : "bv*+ba/best";
        }
        String height = digitsOf(quality, DEFAULT_VIDEO_HEIGHT);
        if (singleFileFormat) {
            return String.format("best[height<=%s][ext=mp4]/best[height<=%s]", height, height);
        }
        return String.format("bv*[height<=%s]+ba/b[height<=%s]", height, height);
    }

    /**
     * Bitrate in kbit/s used for audio extraction.
     */
    public String buildAudioBitrate(String quality) {
        if (QualityLadder.isBest(quality)) {
            return "0";
        }
        return digitsOf(quality, DEFAULT_AUDIO_BITRATE);
    }

    private void addAudioOptions(List<String> command, String quality) {
        command.add("-f");
        command.add("bestaudio/best");
        command.add("-x");
        command.add("--audio-format");
        command.add(MediaFormat.AUDIO.getExtension());
        command.add("--audio-quality");
        String bitrate = buildAudioBitrate(quality);
        command.add("0".equals(bitrate) ? bitrate : bitrate + "K");
        command.add("--embed-metadata");
        command.add("--embed-thumbnail");
    }

    private void addVideoOptions(List<String> command, String quality, boolean singleFileFormat) {
        command.add("-f");
        command.add(buildVideoFormat(quality, singleFileFormat));
        command.add("--merge-output-format");
        command.add(MediaFormat.VIDEO.getExtension());
        command.add("--embed-metadata");
    }

    private void addAcceleratorOptions(List<String> command) {
        Optional<Path> aria2c = toolLocator.accelerator();
        if (aria2c.isEmpty()) {
            log.warn("Accelerator requested but aria2c was not found, using the built-in downloader");
            return;
        }
        int connections = properties.getTools().getAcceleratorConnections();
        command.add("--downloader");
        command.add(aria2c.get().toString());
        command.add("--downloader-args");
        command.add(String.format(
                "aria2c:-x %d -s %d -k 1M --file-allocation=none --optimize-concurrent-downloads=true",
                connections, connections));
    }

    /**
     * Override arguments replace the defaults; otherwise extra arguments are appended to them.
     */
    private Optional<String> buildPostprocessorArgs(DownloadRequest request) {
        if (hasText(request.getOverridePostprocessorArgs())) {
            return Optional.of(request.getOverridePostprocessorArgs().trim());
        }
        if (hasText(request.getPostprocessorArgs())) {
            return Optional.of(request.getPostprocessorArgs().trim());
        }
        return Optional.empty();
    }

    static String digitsOf(String quality, String fallback) {
        String digits = quality == null ? "" : quality.replaceAll("\\D", "");
        return digits.isEmpty() ? fallback : digits;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
