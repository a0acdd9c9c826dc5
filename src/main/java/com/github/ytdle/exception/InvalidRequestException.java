package com.github.ytdle.exception;

/**
 * Exception thrown when a submitted request is rejected before it is queued.
 */
public class InvalidRequestException extends DownloadException {

    private final int requestIndex;

    public InvalidRequestException(String message, int requestIndex) {
        super(message);
        this.requestIndex = requestIndex;
    }

    /**
     * Position of the offending request within its batch.
     */
    public int getRequestIndex() {
        return requestIndex;
    }
}
