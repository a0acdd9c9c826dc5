package com.github.ytdle.model;

import lombok.Builder;
import lombok.Value;

/**
 * Terminal outcome of one fetch attempt.
 */
@Value
@Builder
public class FetchOutcome {

    Kind kind;

    /**
     * Final media file, set on success when the tool reported it.
     */
    String outputPath;

    ErrorType errorType;
    String errorMessage;
    Throwable cause;

    public enum Kind {
        SUCCESS,
        RECOVERABLE_FAILURE,
        FATAL_FAILURE,

        /**
         * The attempt was torn down on request (pause, cancel, skip, shutdown); the engine decides what it means.
         */
        INTERRUPTED
    }

    public static FetchOutcome success(String outputPath) {
        return FetchOutcome.builder()
                .kind(Kind.SUCCESS)
                .outputPath(outputPath)
                .build();
    }

    /**
     * Failure whose kind follows the classification of {@code errorType}.
     */
    public static FetchOutcome failure(ErrorType errorType, String errorMessage) {
        return failure(errorType, errorMessage, null);
    }

    public static FetchOutcome failure(ErrorType errorType, String errorMessage, Throwable cause) {
        return FetchOutcome.builder()
                .kind(errorType.isRecoverable() ? Kind.RECOVERABLE_FAILURE : Kind.FATAL_FAILURE)
                .errorType(errorType)
                .errorMessage(errorMessage)
                .cause(cause)
                .build();
    }

    public static FetchOutcome interrupted() {
        return FetchOutcome.builder()
                .kind(Kind.INTERRUPTED)
                .build();
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }
}
