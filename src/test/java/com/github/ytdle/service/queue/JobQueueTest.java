package com.github.ytdle.service.queue;

import com.github.ytdle.exception.EngineClosedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JobQueue")
class JobQueueTest {

    private JobQueue queue;

    @BeforeEach
    void setUp() {
        queue = new JobQueue();
    }

    @Nested
    @DisplayName("enqueue")
    class EnqueueTests {

        @Test
        @DisplayName("should keep FIFO order")
        void shouldKeepFifoOrder() throws InterruptedException {
            queue.enqueue("a");
            queue.enqueue("b");
            queue.enqueue("c");

            assertEquals(Optional.of("a"), queue.dequeue());
            assertEquals(Optional.of("b"), queue.dequeue());
            assertEquals(Optional.of("c"), queue.dequeue());
        }

        @Test
        @DisplayName("should hold each id at most once")
        void shouldHoldEachIdOnce() {
            assertTrue(queue.enqueue("a"));
            assertFalse(queue.enqueue("a"));
            assertEquals(1, queue.size());
        }

        @Test
        @DisplayName("should reject work after close")
        void shouldRejectAfterClose() {
            queue.close();
            assertThrows(EngineClosedException.class, () -> queue.enqueue("a"));
        }
    }

    @Nested
    @DisplayName("dequeue")
    class DequeueTests {

        @Test
        @DisplayName("should time out on an empty queue")
        void shouldTimeOutWhenEmpty() throws InterruptedException {
            assertEquals(Optional.empty(), queue.dequeue(50, TimeUnit.MILLISECONDS));
        }

        @Test
        @DisplayName("should wake a blocked consumer on enqueue")
        void shouldWakeBlockedConsumer() throws Exception {
            CompletableFuture<Optional<String>> taken = CompletableFuture.supplyAsync(() -> {
                try {
                    return queue.dequeue(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return Optional.empty();
                }
            });

            Thread.sleep(50);
            queue.enqueue("late");

            assertEquals(Optional.of("late"), taken.get(5, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("should signal end of work to blocked consumers on close")
        void shouldSignalEndOfWorkOnClose() throws Exception {
            CompletableFuture<Optional<String>> taken = CompletableFuture.supplyAsync(() -> {
                try {
                    return queue.dequeue();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return Optional.of("interrupted");
                }
            });

            Thread.sleep(50);
            queue.close();

            assertEquals(Optional.empty(), taken.get(5, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("should stop handing out ids once closed")
        void shouldStopHandingOutIdsOnceClosed() throws InterruptedException {
            queue.enqueue("a");
            queue.close();

            assertEquals(Optional.empty(), queue.dequeue());
            assertEquals(List.of("a"), queue.drain());
        }
    }

    @Nested
    @DisplayName("remove")
    class RemoveTests {

        @Test
        @DisplayName("should excise a waiting id")
        void shouldExciseWaitingId() throws InterruptedException {
            queue.enqueue("a");
            queue.enqueue("b");

            assertTrue(queue.remove("a"));
            assertEquals(List.of("b"), queue.snapshot());
            assertEquals(Optional.of("b"), queue.dequeue());
        }

        @Test
        @DisplayName("should report ids that are no longer waiting")
        void shouldReportMissingIds() throws InterruptedException {
            queue.enqueue("a");
            queue.dequeue();

            assertFalse(queue.remove("a"));
        }
    }

    @Test
    @DisplayName("snapshot and drain should preserve dispatch order")
    void snapshotAndDrainShouldPreserveOrder() {
        queue.enqueue("x");
        queue.enqueue("y");

        assertEquals(List.of("x", "y"), queue.snapshot());
        assertEquals(List.of("x", "y"), queue.drain());
        assertEquals(0, queue.size());
    }
}
