package com.github.ytdle.model;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregate counts for the live jobs of one batch. Acknowledged jobs are no longer counted.
 */
@Value
@Builder
public class BatchSummary {

    String batchId;
    int total;
    int queued;
    int running;
    int paused;
    int retrying;
    int completed;
    int failed;
    int cancelled;
    int skipped;

    public boolean isFinished() {
        return total > 0 && completed + failed + cancelled + skipped == total;
    }
}
