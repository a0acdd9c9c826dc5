package com.github.ytdle.exception;

import java.nio.file.Path;

/**
 * Exception thrown when the history store cannot be read or written.
 */
public class HistoryStoreException extends DownloadException {

    private final Path storePath;

    public HistoryStoreException(String message, Path storePath) {
        super(message);
        this.storePath = storePath;
    }

    public HistoryStoreException(String message, Throwable cause, Path storePath) {
        super(message, cause);
        this.storePath = storePath;
    }

    public Path getStorePath() {
        return storePath;
    }
}
