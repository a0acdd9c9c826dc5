package com.github.ytdle.service.network;

import com.github.ytdle.config.YtdleProperties;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.time.Duration;

/**
 * Probes a well-known URL with a HEAD request. The result is cached for the poll interval so that idle workers
 * asking in a loop do not hammer the network.
 */
@Slf4j
public class HttpReachabilityMonitor implements ReachabilityMonitor {

    private final OkHttpClient httpClient;
    private final String checkUrl;
    private final long pollIntervalNanos;

    private volatile NetworkStatus status = NetworkStatus.UNKNOWN;
    private volatile long checkedAtNanos;

    public HttpReachabilityMonitor(OkHttpClient httpClient, YtdleProperties.Network network) {
        int timeoutSeconds = network.getTimeoutSeconds();
        this.httpClient = httpClient.newBuilder()
                .callTimeout(Duration.ofSeconds(timeoutSeconds))
                .connectTimeout(Duration.ofSeconds(timeoutSeconds))
                .readTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
        this.checkUrl = network.getCheckUrl();
        this.pollIntervalNanos = Duration.ofMillis(network.getPollIntervalMs()).toNanos();
    }

    @Override
    public boolean isReachable() {
        return getStatus() == NetworkStatus.ONLINE;
    }

    /**
     * Current status, probing again once the cached result is older than the poll interval.
     */
    public synchronized NetworkStatus getStatus() {
        if (status == NetworkStatus.UNKNOWN || System.nanoTime() - checkedAtNanos >= pollIntervalNanos) {
            NetworkStatus previous = status;
            status = probe();
            checkedAtNanos = System.nanoTime();
            if (previous != status) {
                if (status == NetworkStatus.ONLINE) {
                    log.info("Network is reachable");
                } else {
                    log.warn("Network is unreachable ({}), holding dispatch of queued downloads", checkUrl);
                }
            }
        }
        return status;
    }

    private NetworkStatus probe() {
        Request request = new Request.Builder()
                .url(checkUrl)
                .head()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            log.debug("Reachability probe {} answered {}", checkUrl, response.code());
            return NetworkStatus.ONLINE;
        } catch (IOException e) {
            log.debug("Reachability probe {} failed: {}", checkUrl, e.getMessage());
            return NetworkStatus.OFFLINE;
        }
    }
}
