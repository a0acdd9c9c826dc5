package com.github.ytdle.service.policy;

import com.github.ytdle.model.ErrorType;
import lombok.Value;

/**
 * Outcome of the retry policy: either another attempt with the given parameters, or a terminal failure.
 */
@Value
public class RetryDecision {

    boolean retry;
    String quality;
    boolean singleFileFormat;

    /**
     * Error recorded on the job when it is not retried.
     */
    ErrorType errorType;

    String reason;

    public static RetryDecision retryWith(String quality, boolean singleFileFormat, String reason) {
        return new RetryDecision(true, quality, singleFileFormat, null, reason);
    }

    public static RetryDecision fail(ErrorType errorType, String reason) {
        return new RetryDecision(false, null, false, errorType, reason);
    }
}
