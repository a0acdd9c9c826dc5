package com.github.ytdle.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.ytdle.exception.ConfigurationException;
import com.github.ytdle.service.command.ToolLocator;
import com.github.ytdle.service.engine.AsyncDownloadEngine;
import com.github.ytdle.service.engine.DownloadEngine;
import com.github.ytdle.service.engine.EngineComponents;
import com.github.ytdle.service.engine.ThreadedDownloadEngine;
import com.github.ytdle.service.fetch.FetchAdapter;
import com.github.ytdle.service.fetch.PartialFileCleaner;
import com.github.ytdle.service.history.HistoryStore;
import com.github.ytdle.service.history.JsonHistoryStore;
import com.github.ytdle.service.network.HttpReachabilityMonitor;
import com.github.ytdle.service.network.ReachabilityMonitor;
import com.github.ytdle.service.policy.FallbackRetryPolicy;
import com.github.ytdle.service.policy.QualityLadder;
import com.github.ytdle.service.policy.RetryPolicy;
import com.github.ytdle.service.progress.ProgressBroadcastService;
import com.github.ytdle.service.progress.ProgressEventBuilder;
import com.github.ytdle.service.state.JobStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class EngineConfig {

    private final YtdleProperties properties;

    @Bean
    public JobStateMachine jobStateMachine() {
        return new JobStateMachine();
    }

    @Bean
    public RetryPolicy retryPolicy() {
        YtdleProperties.Download download = properties.getDownload();
        return new FallbackRetryPolicy(
                download.getMaxAttempts(),
                ladder(download.getVideoQualityLadder(), "ytdle.download.video-quality-ladder"),
                ladder(download.getAudioQualityLadder(), "ytdle.download.audio-quality-ladder"));
    }

    @Bean(initMethod = "open", destroyMethod = "close")
    public HistoryStore historyStore(ObjectMapper objectMapper) {
        YtdleProperties.History history = properties.getHistory();
        return new JsonHistoryStore(history.getStorePath(), history.getLegacyStorePath(), objectMapper);
    }

    @Bean
    public ReachabilityMonitor reachabilityMonitor(OkHttpClient okHttpClient) {
        if (!properties.getNetwork().isEnabled()) {
            log.info("Network reachability checks disabled");
            return ReachabilityMonitor.ALWAYS_REACHABLE;
        }
        return new HttpReachabilityMonitor(okHttpClient, properties.getNetwork());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public DownloadEngine downloadEngine(FetchAdapter fetchAdapter,
                                         RetryPolicy retryPolicy,
                                         ProgressBroadcastService progressBroadcast,
                                         ProgressEventBuilder progressEvents,
                                         HistoryStore historyStore,
                                         PartialFileCleaner fileCleaner,
                                         JobStateMachine stateMachine,
                                         ReachabilityMonitor reachabilityMonitor) {
        EngineComponents components = EngineComponents.builder()
                .settings(properties.getDownload())
                .fetchAdapter(fetchAdapter)
                .retryPolicy(retryPolicy)
                .progressBroadcast(progressBroadcast)
                .progressEvents(progressEvents)
                .historyStore(historyStore)
                .fileCleaner(fileCleaner)
                .stateMachine(stateMachine)
                .reachabilityMonitor(reachabilityMonitor)
                .reachabilityPollMs(properties.getNetwork().getPollIntervalMs())
                .build();

        return switch (properties.getDownload().getEngine()) {
            case THREADED -> new ThreadedDownloadEngine(components);
            case ASYNC -> new AsyncDownloadEngine(components);
        };
    }

    @Bean
    public ApplicationRunner dependencyReport(ToolLocator toolLocator) {
        return args -> toolLocator.logDependencyReport();
    }

    private QualityLadder ladder(List<String> tiers, String configKey) {
        QualityLadder ladder = new QualityLadder(tiers);
        if (ladder.getTiers().isEmpty()) {
            throw new ConfigurationException("Quality ladder has no numeric tier", configKey, String.valueOf(tiers));
        }
        return ladder;
    }
}
