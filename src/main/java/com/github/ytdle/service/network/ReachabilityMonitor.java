package com.github.ytdle.service.network;

/**
 * Tells the engine whether new jobs may be dispatched. Jobs already running are not affected.
 */
public interface ReachabilityMonitor {

    /**
     * Monitor that always reports the network as reachable.
     */
    ReachabilityMonitor ALWAYS_REACHABLE = () -> true;

    boolean isReachable();
}
