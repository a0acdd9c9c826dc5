package com.github.ytdle.service.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Engine with a single dispatcher handing jobs to asynchronous tasks. A semaphore bounds the number of jobs in
 * flight; a permit is taken before a job leaves the queue and returned when its task ends.
 */
@Slf4j
public class AsyncDownloadEngine extends AbstractDownloadEngine {

    private final Set<CompletableFuture<Void>> inFlight = ConcurrentHashMap.newKeySet();
    private Semaphore slots;
    private ThreadPoolTaskExecutor taskExecutor;
    private Thread dispatcher;

    public AsyncDownloadEngine(EngineComponents components) {
        super(components);
    }

    @Override
    protected void startWorkers(int parallelism) {
        slots = new Semaphore(parallelism);

        taskExecutor = new ThreadPoolTaskExecutor();
        taskExecutor.setCorePoolSize(parallelism);
        taskExecutor.setMaxPoolSize(parallelism);
        taskExecutor.setThreadNamePrefix("download-task-");
        taskExecutor.setWaitForTasksToCompleteOnShutdown(false);
        taskExecutor.initialize();

        dispatcher = new Thread(this::dispatchLoop, "download-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
    }

    private void dispatchLoop() {
        log.debug("Dispatcher started");
        try {
            while (true) {
                slots.acquire();
                Optional<String> next;
                try {
                    next = queue.dequeue();
                } catch (InterruptedException e) {
                    slots.release();
                    throw e;
                }
                if (next.isEmpty()) {
                    slots.release();
                    break;
                }

                String jobId = next.get();
                CompletableFuture<Void> task = CompletableFuture.runAsync(() -> processJob(jobId), taskExecutor);
                inFlight.add(task);
                task.whenComplete((result, error) -> {
                    inFlight.remove(task);
                    slots.release();
                    if (error != null) {
                        log.error("Task for job {} ended abnormally: {}", jobId, error.getMessage(), error);
                    }
                });
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            log.debug("Dispatcher exited");
        }
    }

    @Override
    protected boolean awaitWorkers(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();

        dispatcher.join(Math.max(1, timeout.toMillis()));
        if (dispatcher.isAlive()) {
            return false;
        }

        long remaining = deadline - System.nanoTime();
        try {
            CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0]))
                    .get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            log.debug("A job task ended abnormally during shutdown: {}", e.getMessage());
        }

        taskExecutor.shutdown();
        return true;
    }

    @Override
    protected void stopWorkers() {
        log.warn("Interrupting dispatcher and {} in-flight task(s)", inFlight.size());
        dispatcher.interrupt();
        taskExecutor.getThreadPoolExecutor().shutdownNow();
    }
}
