package com.github.ytdle.service.command;

import com.github.ytdle.config.YtdleProperties;
import com.github.ytdle.model.DownloadRequest;
import com.github.ytdle.model.MediaFormat;
import com.github.ytdle.service.fetch.FetchContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("YtDlpCommandBuilder")
class YtDlpCommandBuilderTest {

    private YtdleProperties properties;
    private YtDlpCommandBuilder builder;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        properties = new YtdleProperties();
        properties.getTools().setYtDlpPath("/nonexistent/yt-dlp");
        properties.getTools().setFfmpegPath("/nonexistent/ffmpeg");
        properties.getTools().setAria2cPath("/nonexistent/aria2c");
        builder = new YtDlpCommandBuilder(properties, new ToolLocator(properties));
    }

    private DownloadRequest.DownloadRequestBuilder video() {
        return DownloadRequest.builder()
                .url("https://example.com/watch?v=abc")
                .format(MediaFormat.VIDEO)
                .quality("1080p")
                .outputDirectory(tempDir.toString())
                .filenameTemplate("%(title)s");
    }

    private FetchContext context(DownloadRequest request, String quality, boolean singleFile) {
        return FetchContext.builder()
                .jobId("job-1")
                .attempt(1)
                .request(request)
                .quality(quality)
                .singleFileFormat(singleFile)
                .build();
    }

    @Nested
    @DisplayName("buildCommand")
    class BuildCommandTests {

        @Test
        @DisplayName("should start with the tool and end with the url")
        void shouldStartWithToolAndEndWithUrl() {
            List<String> command = builder.buildCommand(context(video().build(), "1080p", false));

            assertEquals("/nonexistent/yt-dlp", command.get(0));
            assertEquals("--", command.get(command.size() - 2));
            assertEquals("https://example.com/watch?v=abc", command.get(command.size() - 1));
        }

        @Test
        @DisplayName("should include output template and transfer options")
        void shouldIncludeOutputAndTransferOptions() {
            properties.getDownload().setRetries(7);
            properties.getDownload().setConcurrentFragments(5);

            List<String> command = builder.buildCommand(context(video().build(), "1080p", false));

            assertEquals(tempDir.resolve("%(title)s.%(ext)s").toString(), command.get(command.indexOf("-o") + 1));
            assertEquals("7", command.get(command.indexOf("--retries") + 1));
            assertEquals("5", command.get(command.indexOf("-N") + 1));
            assertTrue(command.contains("--newline"));
            assertTrue(command.contains("--continue"));
            assertTrue(command.contains("--no-playlist"));
        }

        @Test
        @DisplayName("should build video options with the attempt quality")
        void shouldBuildVideoOptions() {
            List<String> command = builder.buildCommand(context(video().build(), "720p", false));

            assertEquals("bv*[height<=720]+ba/b[height<=720]", command.get(command.indexOf("-f") + 1));
            assertEquals("mp4", command.get(command.indexOf("--merge-output-format") + 1));
            assertFalse(command.contains("-x"));
        }

        @Test
        @DisplayName("should build audio extraction options")
        void shouldBuildAudioOptions() {
            DownloadRequest request = video().format(MediaFormat.AUDIO).quality("320k").build();

            List<String> command = builder.buildCommand(context(request, "320k", false));

            assertEquals("bestaudio/best", command.get(command.indexOf("-f") + 1));
            assertTrue(command.contains("-x"));
            assertEquals("mp3", command.get(command.indexOf("--audio-format") + 1));
            assertEquals("320K", command.get(command.indexOf("--audio-quality") + 1));
            assertTrue(command.contains("--embed-thumbnail"));
        }

        @Test
        @DisplayName("should pass request switches through")
        void shouldPassRequestSwitches() {
            DownloadRequest request = video()
                    .playlist(true)
                    .restrictFilenames(true)
                    .checkCertificates(false)
                    .cookiesFromBrowser("firefox")
                    .build();

            List<String> command = builder.buildCommand(context(request, "1080p", false));

            assertTrue(command.contains("--yes-playlist"));
            assertTrue(command.contains("--restrict-filenames"));
            assertTrue(command.contains("--no-check-certificates"));
            assertEquals("firefox", command.get(command.indexOf("--cookies-from-browser") + 1));
        }

        @Test
        @DisplayName("cookie file should take precedence over browser cookies")
        void cookieFileShouldTakePrecedence() {
            DownloadRequest request = video().cookieFile("/tmp/cookies.txt").cookiesFromBrowser("chrome").build();

            List<String> command = builder.buildCommand(context(request, "1080p", false));

            assertEquals("/tmp/cookies.txt", command.get(command.indexOf("--cookies") + 1));
            assertFalse(command.contains("--cookies-from-browser"));
        }

        @Test
        @DisplayName("override post-processor args should replace extra args")
        void overridePostprocessorArgsShouldWin() {
            DownloadRequest request = video()
                    .postprocessorArgs("-threads 2")
                    .overridePostprocessorArgs(" -c copy ")
                    .build();

            List<String> command = builder.buildCommand(context(request, "1080p", false));

            assertEquals("ffmpeg:-c copy", command.get(command.indexOf("--postprocessor-args") + 1));
        }

        @Test
        @DisplayName("should omit tool locations that cannot be found")
        void shouldOmitMissingTools() {
            DownloadRequest request = video().useAccelerator(true).build();

            List<String> command = builder.buildCommand(context(request, "1080p", false));

            assertFalse(command.contains("--ffmpeg-location"));
            assertFalse(command.contains("--downloader"));
        }

        @Test
        @EnabledOnOs({OS.LINUX, OS.MAC})
        @DisplayName("should configure the accelerator when it is installed")
        void shouldConfigureAccelerator() throws IOException {
            Path aria2c = tempDir.resolve("aria2c");
            Files.writeString(aria2c, "#!/bin/sh\n");
            Files.setPosixFilePermissions(aria2c, PosixFilePermissions.fromString("rwxr-xr-x"));
            properties.getTools().setAria2cPath(aria2c.toString());
            properties.getTools().setAcceleratorConnections(8);

            List<String> command = builder.buildCommand(context(video().useAccelerator(true).build(), "1080p", false));

            assertEquals(aria2c.toAbsolutePath().toString(), command.get(command.indexOf("--downloader") + 1));
            assertTrue(command.get(command.indexOf("--downloader-args") + 1).startsWith("aria2c:-x 8 -s 8"));
        }
    }

    @Nested
    @DisplayName("buildVideoFormat")
    class BuildVideoFormatTests {

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
            "1080p | false | bv*[height<=1080]+ba/b[height<=1080]",
            "480   | true  | best[height<=480][ext=mp4]/best[height<=480]",
            "best  | false | bv*+ba/best",
            "best  | true  | best[ext=mp4]/best",
            "junk  | false | bv*[height<=1080]+ba/b[height<=1080]"
        })
        @DisplayName("should translate tier and profile into a selector")
        void shouldTranslateTier(String quality, boolean singleFile, String expected) {
            assertEquals(expected, builder.buildVideoFormat(quality, singleFile));
        }
    }

    @Nested
    @DisplayName("buildAudioBitrate")
    class BuildAudioBitrateTests {

        @Test
        @DisplayName("should extract digits and default when missing")
        void shouldExtractDigits() {
            assertEquals("128", builder.buildAudioBitrate("128k"));
            assertEquals("192", builder.buildAudioBitrate(null));
            assertEquals("0", builder.buildAudioBitrate("best"));
        }
    }
}
