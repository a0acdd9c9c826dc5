package com.github.ytdle.service.state;

import com.github.ytdle.model.JobStatus;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for job status transitions.
 *
 * Valid state flow:
 * <pre>
 * QUEUED → RUNNING → COMPLETED
 *   ↓        ↓  ↑
 *   ↓      PAUSED
 *   ↓        ↓
 *   ↓      FAILED → RETRYING → QUEUED
 *   ↓
 * CANCELLED / SKIPPED  (from any non-terminal state)
 * </pre>
 */
@Slf4j
public class JobStateMachine {

    private final Map<JobStatus, Set<JobStatus>> validTransitions;

    public JobStateMachine() {
        validTransitions = new EnumMap<>(JobStatus.class);
        initializeTransitions();
    }

    private void initializeTransitions() {
        validTransitions.put(JobStatus.QUEUED,
            EnumSet.of(JobStatus.RUNNING, JobStatus.CANCELLED, JobStatus.SKIPPED));

        validTransitions.put(JobStatus.RUNNING,
            EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED, JobStatus.SKIPPED, JobStatus.PAUSED));

        validTransitions.put(JobStatus.PAUSED,
            EnumSet.of(JobStatus.RUNNING, JobStatus.CANCELLED, JobStatus.SKIPPED));

        // FAILED is only left through the retry path
        validTransitions.put(JobStatus.FAILED, EnumSet.of(JobStatus.RETRYING));

        validTransitions.put(JobStatus.RETRYING,
            EnumSet.of(JobStatus.QUEUED, JobStatus.CANCELLED, JobStatus.SKIPPED));

        validTransitions.put(JobStatus.COMPLETED, EnumSet.noneOf(JobStatus.class));
        validTransitions.put(JobStatus.CANCELLED, EnumSet.noneOf(JobStatus.class));
        validTransitions.put(JobStatus.SKIPPED, EnumSet.noneOf(JobStatus.class));
    }

    /**
     * Check if a state transition is valid. Staying in the same state is always valid.
     */
    public boolean isValidTransition(@NonNull JobStatus currentState, @NonNull JobStatus newState) {
        if (currentState == newState) {
            return true;
        }

        Set<JobStatus> allowedTransitions = validTransitions.get(currentState);
        return allowedTransitions != null && allowedTransitions.contains(newState);
    }

    /**
     * Validate a transition.
     *
     * @return new state if valid, current state if invalid
     */
    public JobStatus transition(
            @NonNull String jobId,
            @NonNull JobStatus currentState,
            @NonNull JobStatus newState) {

        if (isValidTransition(currentState, newState)) {
            if (currentState != newState) {
                log.debug("Job {} state transition: {} → {}", jobId, currentState, newState);
            }
            return newState;
        } else {
            log.debug("Job {} invalid state transition attempted: {} → {} (rejected)",
                    jobId, currentState, newState);
            return currentState;
        }
    }

    /**
     * Validate a transition, throwing if it is not allowed.
     *
     * @throws IllegalStateException if transition is invalid
     */
    public JobStatus transitionOrThrow(
            @NonNull String jobId,
            @NonNull JobStatus currentState,
            @NonNull JobStatus newState) {

        if (!isValidTransition(currentState, newState)) {
            throw new IllegalStateException(String.format(
                    "Invalid state transition for job %s: %s → %s",
                    jobId, currentState, newState));
        }

        if (currentState != newState) {
            log.debug("Job {} state transition: {} → {}", jobId, currentState, newState);
        }
        return newState;
    }

    /**
     * Terminal as reported to callers. FAILED is terminal here even though the retry path may leave it.
     */
    public boolean isTerminalState(@NonNull JobStatus state) {
        return state.isTerminal();
    }

    public Set<JobStatus> getValidNextStates(@NonNull JobStatus currentState) {
        Set<JobStatus> states = validTransitions.get(currentState);
        return states == null || states.isEmpty() ? EnumSet.noneOf(JobStatus.class) : EnumSet.copyOf(states);
    }

    public boolean canPause(@NonNull JobStatus currentState) {
        return currentState != JobStatus.PAUSED && isValidTransition(currentState, JobStatus.PAUSED);
    }

    public boolean canCancel(@NonNull JobStatus currentState) {
        return isValidTransition(currentState, JobStatus.CANCELLED);
    }

    public boolean canSkip(@NonNull JobStatus currentState) {
        return isValidTransition(currentState, JobStatus.SKIPPED);
    }
}
