package com.github.ytdle.service.fetch;

import com.github.ytdle.model.DownloadRequest;
import lombok.Builder;
import lombok.Value;

/**
 * Parameters of one attempt. The request is fixed for the life of the job; quality and format profile may be relaxed
 * between attempts by the retry policy.
 */
@Value
@Builder
public class FetchContext {

    String jobId;
    int attempt;
    DownloadRequest request;

    /**
     * Quality in effect for this attempt, "best" once every explicit tier has been given up.
     */
    String quality;

    /**
     * Ask for a single pre-merged file instead of separate video and audio streams.
     */
    boolean singleFileFormat;

    /**
     * The attempt continues a paused transfer; partial files on disk belong to it.
     */
    boolean resumed;
}
