package com.github.ytdle.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "ytdle")
public class YtdleProperties {

    private Download download = new Download();
    private Tools tools = new Tools();
    private Network network = new Network();
    private History history = new History();

    public enum EngineType {
        THREADED, ASYNC
    }

    @Data
    public static class Download {
        private EngineType engine = EngineType.THREADED;

        @Min(1)
        private int parallelDownloads = 4;

        /**
         * Total attempts per job, the first one included.
         */
        @Min(1)
        private int maxAttempts = 3;

        @Min(1)
        private long stallTimeoutSeconds = 300;

        @Min(1)
        private long teardownTimeoutSeconds = 10;

        private boolean keepPartialOnCancel = false;

        @NotBlank
        private String defaultDirectory = Paths.get(System.getProperty("user.home"), "Downloads").toString();

        @NotBlank
        private String defaultFilenameTemplate = "%(title).150s";

        @NotBlank
        private String defaultVideoQuality = "1080p";

        @NotBlank
        private String defaultAudioQuality = "192k";

        @Min(0)
        private int retries = 10;

        @Min(0)
        private int fragmentRetries = 10;

        @Min(1)
        private int concurrentFragments = 3;

        @NotEmpty
        private List<String> videoQualityLadder = new ArrayList<>(
                List.of("2160", "1440", "1080", "720", "480", "360", "240", "144"));

        @NotEmpty
        private List<String> audioQualityLadder = new ArrayList<>(
                List.of("320", "256", "192", "160", "128", "96"));
    }

    @Data
    public static class Tools {
        @NotBlank
        private String ytDlpPath = "yt-dlp";

        /**
         * Optional; looked up on PATH when unset.
         */
        private String ffmpegPath;

        @NotBlank
        private String aria2cPath = "aria2c";

        @Min(1)
        private int acceleratorConnections = 16;
    }

    @Data
    public static class Network {
        private boolean enabled = true;

        @NotBlank
        private String checkUrl = "https://www.google.com";

        @Min(1)
        private int timeoutSeconds = 5;

        @Min(100)
        private long pollIntervalMs = 2000;
    }

    @Data
    public static class History {
        @NotBlank
        private String path = Paths.get(System.getProperty("user.home"), ".ytdle", "history-v2.json").toString();

        private String legacyPath = Paths.get(System.getProperty("user.home"), ".ytdle", "history.json").toString();

        public Path getStorePath() {
            return Paths.get(path);
        }

        public Path getLegacyStorePath() {
            return legacyPath == null || legacyPath.isBlank() ? null : Paths.get(legacyPath);
        }
    }
}
