package com.github.ytdle.service.command;

import com.github.ytdle.config.YtdleProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the external tools the fetch adapter drives. A configured value is either a path to the executable or a
 * bare name looked up on {@code PATH}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolLocator {

    private static final boolean WINDOWS = System.getProperty("os.name", "")
            .toLowerCase(Locale.ROOT).startsWith("windows");

    private final YtdleProperties properties;

    /**
     * Command used to launch the fetch tool. Falls back to the configured value so that a missing binary surfaces
     * as a launch failure of the attempt.
     */
    public String fetchTool() {
        String configured = properties.getTools().getYtDlpPath();
        return locate(configured).map(Path::toString).orElse(configured);
    }

    public Optional<Path> ffmpeg() {
        String configured = properties.getTools().getFfmpegPath();
        return locate(configured == null || configured.isBlank() ? "ffmpeg" : configured);
    }

    public Optional<Path> accelerator() {
        return locate(properties.getTools().getAria2cPath());
    }

    /**
     * Find an executable by path or by name on {@code PATH}.
     */
    public Optional<Path> locate(String nameOrPath) {
        if (nameOrPath == null || nameOrPath.isBlank()) {
            return Optional.empty();
        }

        if (nameOrPath.contains("/") || nameOrPath.contains(File.separator)) {
            Path candidate = Paths.get(nameOrPath);
            return isExecutable(candidate) ? Optional.of(candidate.toAbsolutePath()) : Optional.empty();
        }

        String pathEnv = System.getenv("PATH");
        if (pathEnv == null) {
            return Optional.empty();
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Paths.get(dir, nameOrPath);
            if (isExecutable(candidate)) {
                return Optional.of(candidate);
            }
            if (WINDOWS) {
                Path exe = Paths.get(dir, nameOrPath + ".exe");
                if (isExecutable(exe)) {
                    return Optional.of(exe);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Tool name to resolved location, or "Not found".
     */
    public Map<String, String> dependencyReport() {
        Map<String, String> report = new LinkedHashMap<>();
        report.put("yt-dlp", locate(properties.getTools().getYtDlpPath()).map(Path::toString).orElse("Not found"));
        report.put("ffmpeg", ffmpeg().map(Path::toString).orElse("Not found"));
        report.put("aria2c", accelerator().map(Path::toString).orElse("Not found"));
        return report;
    }

    public void logDependencyReport() {
        Map<String, String> report = dependencyReport();
        report.forEach((tool, location) -> log.info("Dependency {}: {}", tool, location));
        if ("Not found".equals(report.get("yt-dlp"))) {
            log.warn("yt-dlp was not found, every download will fail until it is installed");
        }
        if ("Not found".equals(report.get("ffmpeg"))) {
            log.warn("ffmpeg was not found, merging and audio extraction will fail");
        }
    }

    private boolean isExecutable(Path candidate) {
        return Files.isRegularFile(candidate) && Files.isExecutable(candidate);
    }
}
