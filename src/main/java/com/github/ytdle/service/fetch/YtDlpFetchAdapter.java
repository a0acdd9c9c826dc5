package com.github.ytdle.service.fetch;

import com.github.ytdle.config.YtdleProperties;
import com.github.ytdle.model.ErrorType;
import com.github.ytdle.model.FetchOutcome;
import com.github.ytdle.model.ProgressUpdate;
import com.github.ytdle.service.command.YtDlpCommandBuilder;
import com.github.ytdle.service.parser.ErrorClassifier;
import com.github.ytdle.service.parser.ProgressParser;
import com.github.ytdle.service.parser.YtDlpProgressParser;
import com.github.ytdle.util.ProcessUtils;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one attempt by launching yt-dlp as a child process and following its output.
 * <p>
 * The attempt is torn down by killing the process tree: on request through the {@link FetchControl}, or by the stall
 * watchdog when the tool prints nothing for the configured stall timeout.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class YtDlpFetchAdapter implements FetchAdapter {

    private final YtdleProperties properties;
    private final YtDlpCommandBuilder commandBuilder;
    private final ErrorClassifier errorClassifier;

    @Qualifier("fetchWatchdog")
    private final TaskScheduler watchdogScheduler;

    @Override
    public FetchOutcome fetch(@NonNull FetchContext context, @NonNull FetchControl control,
                              @NonNull FetchListener listener) {
        String jobId = context.getJobId();

        Path outputDirectory = Paths.get(context.getRequest().getOutputDirectory());
        try {
            Files.createDirectories(outputDirectory);
        } catch (IOException e) {
            log.error("Cannot create output directory {} for job {}: {}", outputDirectory, jobId, e.getMessage());
            return FetchOutcome.failure(ErrorType.DISK_WRITE_ERROR,
                    "Cannot create output directory " + outputDirectory + ": " + e.getMessage(), e);
        }

        List<String> command = commandBuilder.buildCommand(context);

        Process process;
        try {
            log.debug("Executing fetch for job {}: {}", jobId, String.join(" ", command));
            ProcessBuilder processBuilder = new ProcessBuilder(command);
            processBuilder.redirectErrorStream(true);
            process = processBuilder.start();
        } catch (IOException e) {
            log.error("Failed to launch fetch tool for job {}: {}", jobId, e.getMessage());
            return FetchOutcome.failure(ErrorType.INTERNAL_ERROR, "Failed to launch fetch tool: " + e.getMessage(), e);
        }

        Process running = process;
        if (!control.attach(() -> ProcessUtils.destroyTree(running))) {
            ProcessUtils.destroyTree(process);
            return FetchOutcome.interrupted();
        }

        AtomicLong lastOutputNanos = new AtomicLong(System.nanoTime());
        AtomicBoolean stalled = new AtomicBoolean(false);
        ScheduledFuture<?> watchdog = startWatchdog(jobId, process, lastOutputNanos, stalled);

        ProgressParser parser = new YtDlpProgressParser();
        Integer exitCode;
        try {
            readOutput(process, parser, jobId, lastOutputNanos, listener);
            exitCode = ProcessUtils.awaitExit(process, properties.getDownload().getTeardownTimeoutSeconds(),
                    TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ProcessUtils.destroyTree(process);
            return FetchOutcome.interrupted();
        } finally {
            watchdog.cancel(false);
            control.detach();
        }

        if (control.isInterruptRequested()) {
            log.debug("Fetch for job {} torn down on request", jobId);
            return FetchOutcome.interrupted();
        }

        if (stalled.get()) {
            return FetchOutcome.failure(ErrorType.STALLED_TRANSFER, String.format(
                    "No progress for %d seconds", properties.getDownload().getStallTimeoutSeconds()));
        }

        if (exitCode == null) {
            return FetchOutcome.failure(ErrorType.TRANSIENT_NETWORK_ERROR, "Fetch tool did not exit after its output ended");
        }

        if (exitCode == 0) {
            log.debug("Fetch for job {} finished, output {}", jobId, parser.getOutputPath());
            return FetchOutcome.success(parser.getOutputPath());
        }

        List<String> errorLines = parser.getErrorLines();
        ErrorType errorType = errorClassifier.classify(errorLines, exitCode);
        String message = errorClassifier.describe(errorLines, exitCode);
        log.warn("Fetch for job {} failed with exit code {} ({}): {}", jobId, exitCode, errorType, message);
        return FetchOutcome.failure(errorType, message);
    }

    private void readOutput(Process process, ProgressParser parser, String jobId, AtomicLong lastOutputNanos,
                            FetchListener listener) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {

            String line;
            while ((line = reader.readLine()) != null) {
                lastOutputNanos.set(System.nanoTime());
                log.trace("yt-dlp [{}]: {}", jobId, line);

                ProgressUpdate update = parser.parseLine(line, jobId);
                for (Path artifact : parser.drainArtifacts()) {
                    listener.onArtifact(artifact);
                }
                if (update != null) {
                    listener.onProgress(update);
                }
            }
        } catch (IOException e) {
            // stream closes underneath us when the process tree is killed
            log.debug("Output of job {} ended: {}", jobId, e.getMessage());
        }
    }

    private ScheduledFuture<?> startWatchdog(String jobId, Process process, AtomicLong lastOutputNanos,
                                             AtomicBoolean stalled) {
        long timeoutNanos = TimeUnit.SECONDS.toNanos(properties.getDownload().getStallTimeoutSeconds());
        Duration period = Duration.ofMillis(Math.max(100, Math.min(1000, TimeUnit.NANOSECONDS.toMillis(timeoutNanos) / 4)));

        return watchdogScheduler.scheduleAtFixedRate(() -> {
            if (process.isAlive() && System.nanoTime() - lastOutputNanos.get() > timeoutNanos
                    && stalled.compareAndSet(false, true)) {
                log.warn("Job {} produced no output for {}s, killing the transfer",
                        jobId, properties.getDownload().getStallTimeoutSeconds());
                ProcessUtils.destroyTree(process);
            }
        }, period);
    }
}
