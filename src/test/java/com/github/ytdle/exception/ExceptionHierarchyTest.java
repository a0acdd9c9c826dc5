package com.github.ytdle.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Exception Hierarchy")
class ExceptionHierarchyTest {

    @Nested
    @DisplayName("DownloadException")
    class DownloadExceptionTests {

        @Test
        @DisplayName("should extend RuntimeException")
        void shouldExtendRuntimeException() {
            assertInstanceOf(RuntimeException.class, new DownloadException("Test error"));
        }

        @Test
        @DisplayName("should create with message and cause")
        void shouldCreateWithMessageAndCause() {
            Exception cause = new RuntimeException("Root cause");
            DownloadException ex = new DownloadException("Download failed", cause);

            assertEquals("Download failed", ex.getMessage());
            assertEquals(cause, ex.getCause());
        }
    }

    @Nested
    @DisplayName("InvalidRequestException")
    class InvalidRequestExceptionTests {

        @Test
        @DisplayName("should carry the index of the rejected request")
        void shouldCarryRequestIndex() {
            InvalidRequestException ex = new InvalidRequestException("Request 2 has no URL", 2);

            assertInstanceOf(DownloadException.class, ex);
            assertEquals("Request 2 has no URL", ex.getMessage());
            assertEquals(2, ex.getRequestIndex());
        }
    }

    @Nested
    @DisplayName("HistoryStoreException")
    class HistoryStoreExceptionTests {

        @Test
        @DisplayName("should carry the store path")
        void shouldCarryStorePath() {
            Path store = Path.of("history-v2.json");
            HistoryStoreException ex = new HistoryStoreException("Store not open", store);

            assertInstanceOf(DownloadException.class, ex);
            assertEquals(store, ex.getStorePath());
            assertNull(ex.getCause());
        }

        @Test
        @DisplayName("should keep the I/O cause")
        void shouldKeepCause() {
            IOException cause = new IOException("disk full");
            HistoryStoreException ex = new HistoryStoreException("Write failed", cause, Path.of("h.json"));

            assertEquals(cause, ex.getCause());
            assertEquals(Path.of("h.json"), ex.getStorePath());
        }
    }

    @Nested
    @DisplayName("ConfigurationException")
    class ConfigurationExceptionTests {

        @Test
        @DisplayName("should carry key and value")
        void shouldCarryKeyAndValue() {
            ConfigurationException ex = new ConfigurationException(
                    "Quality ladder has no numeric tier", "ytdle.download.video-quality-ladder", "[best]");

            assertInstanceOf(DownloadException.class, ex);
            assertEquals("ytdle.download.video-quality-ladder", ex.getConfigKey());
            assertEquals("[best]", ex.getConfigValue());
        }
    }

    @Test
    @DisplayName("EngineClosedException should be a DownloadException")
    void engineClosedIsDownloadException() {
        EngineClosedException ex = new EngineClosedException("Engine is closed");
        assertInstanceOf(DownloadException.class, ex);
        assertEquals("Engine is closed", ex.getMessage());
    }
}
