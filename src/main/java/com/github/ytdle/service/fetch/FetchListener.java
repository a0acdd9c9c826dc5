package com.github.ytdle.service.fetch;

import com.github.ytdle.model.ProgressUpdate;

import java.nio.file.Path;

/**
 * Receives what an attempt reports while it runs. Called from the fetching thread.
 */
public interface FetchListener {

    void onProgress(ProgressUpdate update);

    /**
     * A file was created on disk that belongs to this job and must be removed if the job does not complete.
     */
    void onArtifact(Path artifact);
}
