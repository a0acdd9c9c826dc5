package com.github.ytdle.service.policy;

import com.github.ytdle.model.MediaFormat;
import lombok.Builder;
import lombok.Value;

/**
 * Parameters a failed attempt ran with.
 */
@Value
@Builder
public class AttemptProfile {

    /**
     * Attempts made so far, the failed one included.
     */
    int attempts;

    MediaFormat format;
    String quality;
    boolean singleFileFormat;
}
