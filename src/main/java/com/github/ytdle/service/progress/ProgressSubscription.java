package com.github.ytdle.service.progress;

import com.github.ytdle.model.ProgressUpdate;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * One consumer's view of the progress stream.
 * <p>
 * Publishing never waits for the consumer. While the consumer lags, intermediate updates of a job are coalesced so
 * that only the newest one is kept; terminal updates are always delivered.
 */
@Slf4j
public class ProgressSubscription implements AutoCloseable {

    private final String batchId;
    private final Consumer<ProgressSubscription> onClose;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final LinkedHashMap<String, ProgressUpdate> latest = new LinkedHashMap<>();
    private final Queue<ProgressUpdate> terminal = new ArrayDeque<>();
    private boolean closed = false;

    ProgressSubscription(String batchId, Consumer<ProgressSubscription> onClose) {
        this.batchId = batchId;
        this.onClose = onClose;
    }

    /**
     * Batch this subscription is limited to, or null for every job.
     */
    public String getBatchId() {
        return batchId;
    }

    /**
     * Wait for the next update.
     *
     * @return the update, or empty on timeout or once closed and drained
     */
    public Optional<ProgressUpdate> poll(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (isEmpty()) {
                if (closed || remaining <= 0) {
                    return Optional.empty();
                }
                remaining = available.awaitNanos(remaining);
            }
            return Optional.of(next());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of updates waiting to be read.
     */
    public int pending() {
        lock.lock();
        try {
            return latest.size() + terminal.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            available.signalAll();
        } finally {
            lock.unlock();
        }
        onClose.accept(this);
    }

    /**
     * Hand an update to this subscription without blocking.
     *
     * @return false once the subscription is closed
     */
    boolean offer(ProgressUpdate update) {
        if (batchId != null && !batchId.equals(update.getBatchId())) {
            return true;
        }
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            // re-insert so the job moves to the back of the delivery order
            latest.remove(update.getJobId());
            if (update.isTerminal()) {
                terminal.add(update);
            } else {
                latest.put(update.getJobId(), update);
            }
            available.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private boolean isEmpty() {
        return latest.isEmpty() && terminal.isEmpty();
    }

    private ProgressUpdate next() {
        if (!latest.isEmpty()) {
            Iterator<Map.Entry<String, ProgressUpdate>> it = latest.entrySet().iterator();
            ProgressUpdate update = it.next().getValue();
            it.remove();
            return update;
        }
        return terminal.poll();
    }
}
