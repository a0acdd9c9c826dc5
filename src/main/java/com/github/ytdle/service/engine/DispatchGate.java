package com.github.ytdle.service.engine;

import com.github.ytdle.service.network.ReachabilityMonitor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds back the start of queued jobs while dispatch is paused or the network is unreachable.
 */
@Slf4j
class DispatchGate {

    private final ReachabilityMonitor reachabilityMonitor;
    private final long pollIntervalMs;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private boolean held = false;
    private boolean closed = false;

    DispatchGate(ReachabilityMonitor reachabilityMonitor, long pollIntervalMs) {
        this.reachabilityMonitor = reachabilityMonitor;
        this.pollIntervalMs = pollIntervalMs;
    }

    /**
     * Wait until a job may start.
     *
     * @return true when dispatch may proceed, false once the gate is closed
     */
    boolean awaitOpen() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                if (closed) {
                    return false;
                }
                if (held) {
                    changed.await();
                    continue;
                }

                boolean reachable;
                // the probe may take seconds; do not block hold() and close() meanwhile
                lock.unlock();
                try {
                    reachable = reachabilityMonitor.isReachable();
                } finally {
                    lock.lock();
                }

                if (closed) {
                    return false;
                }
                if (reachable && !held) {
                    return true;
                }
                if (!reachable) {
                    log.debug("Network unreachable, waiting {}ms before dispatching", pollIntervalMs);
                    changed.await(pollIntervalMs, TimeUnit.MILLISECONDS);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    void hold() {
        lock.lock();
        try {
            held = true;
        } finally {
            lock.unlock();
        }
    }

    void release() {
        lock.lock();
        try {
            held = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    boolean isHeld() {
        lock.lock();
        try {
            return held;
        } finally {
            lock.unlock();
        }
    }
}
