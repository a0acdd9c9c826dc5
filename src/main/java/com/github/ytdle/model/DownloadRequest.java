package com.github.ytdle.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Immutable request fields of one download. Missing optional values are filled from configuration at
 * submission time, after which the request never changes.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DownloadRequest {

    String url;
    MediaFormat format;

    /**
     * Height tier for video ("1080p", "720", "best") or bitrate for audio ("192k").
     */
    String quality;

    String outputDirectory;
    String filenameTemplate;

    @Builder.Default
    boolean playlist = false;

    @Builder.Default
    boolean restrictFilenames = false;

    @Builder.Default
    boolean checkCertificates = true;

    String cookieFile;
    String cookiesFromBrowser;

    /**
     * Post-processor arguments appended to the defaults.
     */
    String postprocessorArgs;

    /**
     * Post-processor arguments that replace the defaults.
     */
    String overridePostprocessorArgs;

    @Builder.Default
    boolean useAccelerator = false;

    @JsonIgnore
    public boolean isAudio() {
        return format == MediaFormat.AUDIO;
    }
}
