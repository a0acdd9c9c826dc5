package com.github.ytdle.service.progress;

import com.github.ytdle.model.JobStatus;
import com.github.ytdle.model.ProgressUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProgressBroadcastService")
class ProgressBroadcastServiceTest {

    private ProgressBroadcastService service;

    @BeforeEach
    void setUp() {
        service = new ProgressBroadcastService(new SyncTaskExecutor());
    }

    private static ProgressUpdate update(String jobId, String batchId, JobStatus status, double progress) {
        return ProgressUpdate.builder()
                .jobId(jobId)
                .batchId(batchId)
                .status(status)
                .progress(progress)
                .build();
    }

    private static List<ProgressUpdate> drain(ProgressSubscription subscription) throws InterruptedException {
        List<ProgressUpdate> received = new ArrayList<>();
        Optional<ProgressUpdate> next;
        while ((next = subscription.poll(10, TimeUnit.MILLISECONDS)).isPresent()) {
            received.add(next.get());
        }
        return received;
    }

    @Nested
    @DisplayName("publish")
    class PublishTests {

        @Test
        @DisplayName("should reach every subscriber")
        void shouldReachEverySubscriber() throws InterruptedException {
            ProgressSubscription first = service.subscribe();
            ProgressSubscription second = service.subscribe();

            service.publish(update("j1", "b1", JobStatus.RUNNING, 10));

            assertEquals(1, drain(first).size());
            assertEquals(1, drain(second).size());
        }

        @Test
        @DisplayName("should filter by batch")
        void shouldFilterByBatch() throws InterruptedException {
            ProgressSubscription batchOnly = service.subscribe("b1");

            service.publish(update("j1", "b1", JobStatus.RUNNING, 10));
            service.publish(update("j2", "b2", JobStatus.RUNNING, 10));

            List<ProgressUpdate> received = drain(batchOnly);
            assertEquals(1, received.size());
            assertEquals("j1", received.get(0).getJobId());
        }

        @Test
        @DisplayName("should coalesce intermediate updates of a lagging subscriber")
        void shouldCoalesceIntermediateUpdates() throws InterruptedException {
            ProgressSubscription lagging = service.subscribe();

            for (int i = 1; i <= 50; i++) {
                service.publish(update("j1", "b1", JobStatus.RUNNING, i));
            }

            List<ProgressUpdate> received = drain(lagging);
            assertEquals(1, received.size());
            assertEquals(50.0, received.get(0).getProgress());
        }

        @Test
        @DisplayName("should never drop terminal updates")
        void shouldNeverDropTerminalUpdates() throws InterruptedException {
            ProgressSubscription lagging = service.subscribe();

            service.publish(update("j1", "b1", JobStatus.RUNNING, 40));
            service.publish(update("j1", "b1", JobStatus.COMPLETED, 100));
            service.publish(update("j2", "b1", JobStatus.RUNNING, 5));
            service.publish(update("j2", "b1", JobStatus.FAILED, 5));

            List<ProgressUpdate> received = drain(lagging);
            assertEquals(2, received.size());
            assertTrue(received.stream().allMatch(ProgressUpdate::isTerminal));
        }
    }

    @Nested
    @DisplayName("subscribe")
    class SubscribeTests {

        @Test
        @DisplayName("should seed a new subscriber with the latest state in time order")
        void shouldSeedWithLatestState() throws InterruptedException {
            LocalDateTime now = LocalDateTime.now();
            service.publish(update("j2", "b1", JobStatus.QUEUED, 0).toBuilder().timestamp(now).build());
            service.publish(update("j1", "b1", JobStatus.RUNNING, 30).toBuilder().timestamp(now.minusSeconds(5)).build());

            List<ProgressUpdate> received = drain(service.subscribe());

            assertEquals(List.of("j1", "j2"), received.stream().map(ProgressUpdate::getJobId).toList());
        }

        @Test
        @DisplayName("closing should unregister the subscription")
        void closingShouldUnregister() {
            ProgressSubscription subscription = service.subscribe();
            assertEquals(1, service.getActiveSubscriptions());

            subscription.close();

            assertEquals(0, service.getActiveSubscriptions());
            assertTrue(subscription.isClosed());
        }

        @Test
        @DisplayName("closeAll should end every stream")
        void closeAllShouldEndEveryStream() throws InterruptedException {
            ProgressSubscription subscription = service.subscribe();

            service.closeAll();

            assertEquals(Optional.empty(), subscription.poll(1, TimeUnit.SECONDS));
            assertEquals(0, service.getActiveSubscriptions());
        }
    }

    @Nested
    @DisplayName("latest state")
    class LatestStateTests {

        @Test
        @DisplayName("forget should drop an acknowledged job")
        void forgetShouldDropJob() throws InterruptedException {
            service.publish(update("j1", "b1", JobStatus.COMPLETED, 100));
            service.publish(update("j2", "b1", JobStatus.RUNNING, 40));

            service.forget("j1");

            List<ProgressUpdate> seeded = drain(service.subscribe());
            assertEquals(List.of("j2"), seeded.stream().map(ProgressUpdate::getJobId).toList());
        }
    }
}
