package com.github.ytdle.service.policy;

import com.github.ytdle.model.FetchOutcome;

/**
 * Decides what happens to a job after a failed attempt.
 */
public interface RetryPolicy {

    /**
     * @param attempt the attempt that just failed, parameters included
     * @param outcome its failure outcome
     */
    RetryDecision decide(AttemptProfile attempt, FetchOutcome outcome);
}
