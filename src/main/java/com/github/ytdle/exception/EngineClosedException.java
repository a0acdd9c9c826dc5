package com.github.ytdle.exception;

/**
 * Thrown when work is submitted to an engine or queue that has been shut down.
 */
public class EngineClosedException extends DownloadException {

    public EngineClosedException(String message) {
        super(message);
    }
}
