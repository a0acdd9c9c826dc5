package com.github.ytdle.model;

/**
 * Classification of a failed fetch attempt. Recoverable types are handled by the retry policy and never
 * reach the caller until the retry ceiling is hit.
 */
public enum ErrorType {
    TRANSIENT_NETWORK_ERROR(true),
    FORMAT_UNAVAILABLE(true),
    MERGE_CODEC_MISSING(true),
    STALLED_TRANSFER(true),

    INVALID_INPUT(false),
    ACCESS_DENIED(false),
    DISK_WRITE_ERROR(false),
    RETRY_CEILING_EXCEEDED(false),

    /**
     * Engine-internal fault: a worker crash or a fetch tool that could not be launched.
     */
    INTERNAL_ERROR(false);

    private final boolean recoverable;

    ErrorType(boolean recoverable) {
        this.recoverable = recoverable;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
