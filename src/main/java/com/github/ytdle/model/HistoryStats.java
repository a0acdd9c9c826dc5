package com.github.ytdle.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HistoryStats {

    long total;
    long completed;
    long failed;
    long cancelled;
    long skipped;

    /**
     * Completed share of all records, 0 when the history is empty.
     */
    public double getSuccessRate() {
        return total == 0 ? 0.0 : (double) completed / total;
    }
}
