package com.github.ytdle.service.progress;

import com.github.ytdle.model.ProgressUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Fans job progress out to any number of subscribers.
 * <p>
 * Keeps the latest update of every tracked job so that a new subscriber starts from the current state, and pushes
 * each published update to every open subscription without waiting for its reader.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProgressBroadcastService {

    private static final long SSE_POLL_SECONDS = 1;

    private final ConcurrentHashMap<String, ProgressUpdate> latest = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<ProgressSubscription> subscriptions = new CopyOnWriteArrayList<>();

    // orders publication against the seeding of new subscriptions
    private final Object publishLock = new Object();

    @Qualifier("progressStreamExecutor")
    private final TaskExecutor streamExecutor;

    /**
     * Publish an update to every subscriber.
     */
    public void publish(ProgressUpdate update) {
        log.debug("Broadcasting {} for job {}: {}%", update.getStatus(), update.getJobId(), update.getProgress());
        synchronized (publishLock) {
            latest.put(update.getJobId(), update);
            for (ProgressSubscription subscription : subscriptions) {
                if (!subscription.offer(update)) {
                    subscriptions.remove(subscription);
                }
            }
        }
    }

    /**
     * Open a subscription to every job.
     */
    public ProgressSubscription subscribe() {
        return subscribe(null);
    }

    /**
     * Open a subscription limited to one batch, or to every job when {@code batchId} is null.
     * The subscription is seeded with the current state of the jobs it covers.
     */
    public ProgressSubscription subscribe(String batchId) {
        ProgressSubscription subscription = new ProgressSubscription(batchId, subscriptions::remove);
        synchronized (publishLock) {
            latest.values().stream()
                    .sorted(Comparator.comparing(ProgressUpdate::getTimestamp))
                    .forEach(subscription::offer);
            subscriptions.add(subscription);
        }
        log.debug("Progress subscription opened{}. Total: {}",
                batchId == null ? "" : " for batch " + batchId, subscriptions.size());
        return subscription;
    }

    /**
     * Register a new SSE emitter streaming the updates of one batch, or of every job.
     */
    public SseEmitter createEmitter(String batchId) {
        SseEmitter emitter = new SseEmitter(Long.MAX_VALUE);
        ProgressSubscription subscription = subscribe(batchId);

        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(e -> subscription.close());

        streamExecutor.execute(() -> streamTo(emitter, subscription));
        log.info("New SSE emitter registered. Total subscriptions: {}", subscriptions.size());
        return emitter;
    }

    /**
     * Stop tracking a job that has been acknowledged.
     */
    public void forget(String jobId) {
        latest.remove(jobId);
    }

    public int getActiveSubscriptions() {
        return subscriptions.size();
    }

    /**
     * Close every subscription.
     */
    public void closeAll() {
        for (ProgressSubscription subscription : subscriptions) {
            subscription.close();
        }
    }

    private void streamTo(SseEmitter emitter, ProgressSubscription subscription) {
        try {
            while (!subscription.isClosed() || subscription.pending() > 0) {
                Optional<ProgressUpdate> update = subscription.poll(SSE_POLL_SECONDS, TimeUnit.SECONDS);
                if (update.isPresent()) {
                    emitter.send(SseEmitter.event()
                            .name("progress")
                            .data(update.get()));
                }
            }
            emitter.complete();
        } catch (IOException | IllegalStateException e) {
            log.warn("Failed to send SSE event: {}", e.getMessage());
            subscription.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            subscription.close();
            emitter.complete();
        }
    }
}
