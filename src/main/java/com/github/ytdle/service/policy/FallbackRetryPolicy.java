package com.github.ytdle.service.policy;

import com.github.ytdle.model.ErrorType;
import com.github.ytdle.model.FetchOutcome;
import com.github.ytdle.model.MediaFormat;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Retry policy with progressive fallback.
 * <p>
 * Fatal failures end the job at once. Recoverable failures get another attempt until the ceiling is reached:
 * <ul>
 *     <li>an unavailable format steps the quality down one tier right away, or straight to "best" for audio,</li>
 *     <li>a merge or codec problem switches to a single pre-merged file,</li>
 *     <li>anything else retries unchanged once, then steps the quality down.</li>
 * </ul>
 * Below the lowest tier the policy asks for "best".
 */
@Slf4j
public class FallbackRetryPolicy implements RetryPolicy {

    private final int maxAttempts;
    private final QualityLadder videoLadder;
    private final QualityLadder audioLadder;

    public FallbackRetryPolicy(int maxAttempts, @NonNull QualityLadder videoLadder, @NonNull QualityLadder audioLadder) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.videoLadder = videoLadder;
        this.audioLadder = audioLadder;
    }

    @Override
    public RetryDecision decide(@NonNull AttemptProfile attempt, @NonNull FetchOutcome outcome) {
        ErrorType errorType = outcome.getErrorType() != null ? outcome.getErrorType() : ErrorType.INTERNAL_ERROR;

        if (!errorType.isRecoverable()) {
            return RetryDecision.fail(errorType,
                    outcome.getErrorMessage() != null ? outcome.getErrorMessage() : errorType.name());
        }

        if (attempt.getAttempts() >= maxAttempts) {
            log.debug("Retry ceiling of {} reached, last error {}", maxAttempts, errorType);
            return RetryDecision.fail(ErrorType.RETRY_CEILING_EXCEEDED, String.format(
                    "Gave up after %d attempts, last error %s", attempt.getAttempts(), describe(errorType, outcome)));
        }

        String quality = attempt.getQuality();
        boolean singleFile = attempt.isSingleFileFormat();

        switch (errorType) {
            case FORMAT_UNAVAILABLE -> {
                if (attempt.getFormat() == MediaFormat.AUDIO) {
                    // audio always selects bestaudio; a lower bitrate only changes the transcode
                    return RetryDecision.retryWith(QualityLadder.BEST, true, "requested audio format not available");
                }
                if (!QualityLadder.isBest(quality)) {
                    return RetryDecision.retryWith(ladderFor(attempt.getFormat()).next(quality), singleFile,
                            "requested quality not available");
                }
                return RetryDecision.retryWith(quality, true, "requested format not available");
            }
            case MERGE_CODEC_MISSING -> {
                return RetryDecision.retryWith(quality, true, "merge failed, asking for a single file");
            }
            default -> {
                if (attempt.getAttempts() <= 1) {
                    return RetryDecision.retryWith(quality, singleFile, "retrying " + errorType);
                }
                return RetryDecision.retryWith(ladderFor(attempt.getFormat()).next(quality), singleFile,
                        "retrying " + errorType + " at lower quality");
            }
        }
    }

    private QualityLadder ladderFor(MediaFormat format) {
        return format == MediaFormat.AUDIO ? audioLadder : videoLadder;
    }

    private String describe(ErrorType errorType, FetchOutcome outcome) {
        return outcome.getErrorMessage() == null
                ? errorType.name()
                : errorType.name() + ": " + outcome.getErrorMessage();
    }
}
