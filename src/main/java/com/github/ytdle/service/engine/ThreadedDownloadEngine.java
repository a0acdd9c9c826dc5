package com.github.ytdle.service.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Engine running a fixed number of worker threads, each looping over the queue with blocking dequeues.
 * A worker is a pool slot: it handles one job at a time, pauses included.
 */
@Slf4j
public class ThreadedDownloadEngine extends AbstractDownloadEngine {

    private ThreadPoolTaskExecutor workers;
    private CountDownLatch exited;

    public ThreadedDownloadEngine(EngineComponents components) {
        super(components);
    }

    @Override
    protected void startWorkers(int parallelism) {
        workers = new ThreadPoolTaskExecutor();
        workers.setCorePoolSize(parallelism);
        workers.setMaxPoolSize(parallelism);
        workers.setThreadNamePrefix("download-worker-");
        workers.setWaitForTasksToCompleteOnShutdown(false);
        workers.initialize();

        exited = new CountDownLatch(parallelism);
        for (int i = 0; i < parallelism; i++) {
            workers.execute(this::workerLoop);
        }
    }

    private void workerLoop() {
        log.debug("Worker {} started", Thread.currentThread().getName());
        try {
            while (true) {
                Optional<String> next = queue.dequeue();
                if (next.isEmpty()) {
                    break;
                }
                processJob(next.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            exited.countDown();
            log.debug("Worker {} exited", Thread.currentThread().getName());
        }
    }

    @Override
    protected boolean awaitWorkers(Duration timeout) throws InterruptedException {
        if (!exited.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            return false;
        }
        workers.shutdown();
        return true;
    }

    @Override
    protected void stopWorkers() {
        log.warn("Interrupting {} remaining worker(s)", exited.getCount());
        workers.getThreadPoolExecutor().shutdownNow();
    }
}
