package com.github.ytdle.service.engine;

import com.github.ytdle.config.YtdleProperties;
import com.github.ytdle.service.fetch.FetchAdapter;
import com.github.ytdle.service.fetch.PartialFileCleaner;
import com.github.ytdle.service.history.HistoryStore;
import com.github.ytdle.service.network.ReachabilityMonitor;
import com.github.ytdle.service.policy.RetryPolicy;
import com.github.ytdle.service.progress.ProgressBroadcastService;
import com.github.ytdle.service.progress.ProgressEventBuilder;
import com.github.ytdle.service.state.JobStateMachine;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Collaborators shared by every engine implementation.
 */
@Value
@Builder
public class EngineComponents {

    @NonNull
    YtdleProperties.Download settings;
    @NonNull
    FetchAdapter fetchAdapter;
    @NonNull
    RetryPolicy retryPolicy;
    @NonNull
    ProgressBroadcastService progressBroadcast;
    @NonNull
    HistoryStore historyStore;
    @NonNull
    PartialFileCleaner fileCleaner;

    @Builder.Default
    ProgressEventBuilder progressEvents = new ProgressEventBuilder();

    @Builder.Default
    JobStateMachine stateMachine = new JobStateMachine();

    @Builder.Default
    ReachabilityMonitor reachabilityMonitor = ReachabilityMonitor.ALWAYS_REACHABLE;

    @Builder.Default
    long reachabilityPollMs = 2000;
}
