package com.github.ytdle.service.queue;

import com.github.ytdle.exception.EngineClosedException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO backlog of job ids waiting for a worker.
 * <p>
 * Enqueue never blocks. Dequeue blocks until an id is available or the queue is closed, in which case it
 * returns {@link Optional#empty()} as the "no more work" signal. A job id is present at most once.
 */
@Slf4j
public class JobQueue {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final LinkedHashSet<String> pending = new LinkedHashSet<>();
    private boolean closed = false;

    /**
     * Append a job id at the tail.
     *
     * @return false if the id was already waiting
     * @throws EngineClosedException if the queue has been closed
     */
    public boolean enqueue(@NonNull String jobId) {
        lock.lock();
        try {
            if (closed) {
                throw new EngineClosedException("Job queue is closed, cannot enqueue " + jobId);
            }
            boolean added = pending.add(jobId);
            if (added) {
                notEmpty.signal();
            }
            return added;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return the head, waiting as long as needed.
     *
     * @return the head id, or empty once the queue is closed
     */
    public Optional<String> dequeue() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (pending.isEmpty() && !closed) {
                notEmpty.await();
            }
            return closed ? Optional.empty() : Optional.of(pollHead());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return the head, waiting at most {@code timeout}.
     *
     * @return the head id, or empty on timeout or once the queue is closed
     */
    public Optional<String> dequeue(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (pending.isEmpty() && !closed) {
                if (remaining <= 0) {
                    return Optional.empty();
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return closed ? Optional.empty() : Optional.of(pollHead());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Excise a job that has not been dispatched yet.
     *
     * @return false if the id was not waiting (already dispatched or never queued)
     */
    public boolean remove(@NonNull String jobId) {
        lock.lock();
        try {
            return pending.remove(jobId);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ids currently waiting, in dispatch order.
     */
    public List<String> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(pending);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every waiting id and return them in dispatch order.
     */
    public List<String> drain() {
        lock.lock();
        try {
            List<String> drained = new ArrayList<>(pending);
            pending.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close the queue and wake every blocked consumer. Ids still waiting stay available to {@link #drain()}.
     */
    public void close() {
        lock.lock();
        try {
            if (!closed) {
                closed = true;
                log.debug("Job queue closed with {} pending job(s)", pending.size());
            }
            notEmpty.signalAll();
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

    private String pollHead() {
        Iterator<String> it = pending.iterator();
        String head = it.next();
        it.remove();
        return head;
    }
}
