package com.github.ytdle.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Model")
class ModelTest {

    @Nested
    @DisplayName("FetchOutcome")
    class FetchOutcomeTests {

        @Test
        @DisplayName("success should carry the output path")
        void successShouldCarryOutputPath() {
            FetchOutcome outcome = FetchOutcome.success("/media/song.mp3");

            assertTrue(outcome.isSuccess());
            assertEquals(FetchOutcome.Kind.SUCCESS, outcome.getKind());
            assertEquals("/media/song.mp3", outcome.getOutputPath());
            assertNull(outcome.getErrorType());
        }

        @ParameterizedTest
        @EnumSource(value = ErrorType.class, names = {"TRANSIENT_NETWORK_ERROR", "FORMAT_UNAVAILABLE",
                "MERGE_CODEC_MISSING", "STALLED_TRANSFER"})
        @DisplayName("recoverable error types should give a recoverable failure")
        void recoverableFailure(ErrorType type) {
            FetchOutcome outcome = FetchOutcome.failure(type, "boom");

            assertFalse(outcome.isSuccess());
            assertEquals(FetchOutcome.Kind.RECOVERABLE_FAILURE, outcome.getKind());
            assertEquals("boom", outcome.getErrorMessage());
        }

        @ParameterizedTest
        @EnumSource(value = ErrorType.class, names = {"INVALID_INPUT", "ACCESS_DENIED", "DISK_WRITE_ERROR",
                "RETRY_CEILING_EXCEEDED", "INTERNAL_ERROR"})
        @DisplayName("fatal error types should give a fatal failure")
        void fatalFailure(ErrorType type) {
            assertEquals(FetchOutcome.Kind.FATAL_FAILURE, FetchOutcome.failure(type, "boom").getKind());
        }

        @Test
        @DisplayName("interrupted should be neither success nor failure")
        void interrupted() {
            FetchOutcome outcome = FetchOutcome.interrupted();

            assertFalse(outcome.isSuccess());
            assertEquals(FetchOutcome.Kind.INTERRUPTED, outcome.getKind());
        }
    }

    @Nested
    @DisplayName("BatchSummary")
    class BatchSummaryTests {

        @Test
        @DisplayName("should be finished once every job is terminal")
        void finishedWhenAllTerminal() {
            BatchSummary summary = BatchSummary.builder()
                    .batchId("b1").total(4).completed(1).failed(1).cancelled(1).skipped(1)
                    .build();

            assertTrue(summary.isFinished());
        }

        @Test
        @DisplayName("should not be finished while a job is still waiting")
        void notFinishedWhileWaiting() {
            BatchSummary summary = BatchSummary.builder()
                    .batchId("b1").total(2).completed(1).retrying(1)
                    .build();

            assertFalse(summary.isFinished());
        }
    }

    @Nested
    @DisplayName("HistoryStats")
    class HistoryStatsTests {

        @Test
        @DisplayName("success rate should be the completed share")
        void successRate() {
            HistoryStats stats = HistoryStats.builder().total(4).completed(3).failed(1).build();
            assertEquals(0.75, stats.getSuccessRate(), 0.0001);
        }

        @Test
        @DisplayName("success rate of an empty history should be zero")
        void emptySuccessRate() {
            assertEquals(0.0, HistoryStats.builder().build().getSuccessRate());
        }
    }

    @Nested
    @DisplayName("JobStatus")
    class JobStatusTests {

        @ParameterizedTest
        @EnumSource(value = JobStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED", "SKIPPED"})
        @DisplayName("should report terminal statuses")
        void terminal(JobStatus status) {
            assertTrue(status.isTerminal());
        }

        @ParameterizedTest
        @EnumSource(value = JobStatus.class, names = {"QUEUED", "RUNNING", "PAUSED", "RETRYING"})
        @DisplayName("should report live statuses")
        void live(JobStatus status) {
            assertFalse(status.isTerminal());
        }
    }

    @Test
    @DisplayName("DownloadRequest should default to a checked, non-accelerated single download")
    void requestDefaults() {
        DownloadRequest request = DownloadRequest.builder()
                .url("https://example.com/v")
                .format(MediaFormat.VIDEO)
                .build();

        assertFalse(request.isAudio());
        assertFalse(request.isPlaylist());
        assertTrue(request.isCheckCertificates());
        assertFalse(request.isUseAccelerator());
    }
}
