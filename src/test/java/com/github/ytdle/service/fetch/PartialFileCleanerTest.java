package com.github.ytdle.service.fetch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PartialFileCleaner")
class PartialFileCleanerTest {

    private PartialFileCleaner cleaner;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        cleaner = new PartialFileCleaner();
    }

    private Path touch(String name) throws IOException {
        return Files.createFile(tempDir.resolve(name));
    }

    @Nested
    @DisplayName("cleanup")
    class CleanupTests {

        @Test
        @DisplayName("should return zero for nothing to clean")
        void shouldReturnZeroForNothing() {
            assertEquals(0, cleaner.cleanup(null));
            assertEquals(0, cleaner.cleanup(List.of()));
        }

        @Test
        @DisplayName("should remove announced streams and their partial files")
        void shouldRemoveStreamsAndPartials() throws IOException {
            touch("Clip.f137.mp4.part");
            touch("Clip.f137.mp4.ytdl");
            touch("Clip.f140.m4a");
            touch("Clip.f137.mp4.part-Frag12");
            touch("Clip.webp");

            int removed = cleaner.cleanup(List.of(tempDir.resolve("Clip.f137.mp4")));

            assertEquals(5, removed);
            try (Stream<Path> remaining = Files.list(tempDir)) {
                assertEquals(0, remaining.count());
            }
        }

        @Test
        @DisplayName("should leave unrelated files alone")
        void shouldLeaveUnrelatedFiles() throws IOException {
            touch("Clip.f137.mp4.part");
            Path other = touch("Clip Extended.mp4");
            Path notes = touch("Clip.txt");

            cleaner.cleanup(List.of(tempDir.resolve("Clip.f137.mp4")));

            assertTrue(Files.exists(other));
            assertTrue(Files.exists(notes));
        }

        @Test
        @DisplayName("should tolerate artifacts that no longer exist")
        void shouldTolerateMissingArtifacts() {
            assertEquals(0, cleaner.cleanup(List.of(tempDir.resolve("gone/Clip.mp4"))));
        }
    }

    @Nested
    @DisplayName("stemOf")
    class StemOfTests {

        @Test
        @DisplayName("should strip format and partial suffixes")
        void shouldStripSuffixes() {
            assertEquals("Clip", PartialFileCleaner.stemOf(Path.of("Clip.f137.mp4")));
            assertEquals("Clip", PartialFileCleaner.stemOf(Path.of("Clip.mp4.part")));
            assertEquals("My.Song", PartialFileCleaner.stemOf(Path.of("My.Song.mp3")));
        }
    }

    @Nested
    @DisplayName("isLeftover")
    class IsLeftoverTests {

        @ParameterizedTest
        @ValueSource(strings = {
            "Clip.mp4", "Clip.f251.webm", "Clip.webm.part", "Clip.mp4.ytdl", "Clip.part",
            "Clip.f137.mp4.part-Frag3", "Clip-video.mp4", "Clip-audio.m4a", "Clip.jpg", "Clip.seg1.ts"
        })
        @DisplayName("should match files derived from the stem")
        void shouldMatchDerivedFiles(String fileName) {
            assertTrue(PartialFileCleaner.isLeftover(fileName, "Clip"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"Clip.txt", "Clip 2.mp4", "Clipper.mp4", "Other.mp4"})
        @DisplayName("should not match other files")
        void shouldNotMatchOtherFiles(String fileName) {
            assertFalse(PartialFileCleaner.isLeftover(fileName, "Clip"));
        }

        @Test
        @DisplayName("empty stem should match nothing")
        void emptyStemShouldMatchNothing() {
            assertFalse(PartialFileCleaner.isLeftover("anything.mp4", ""));
        }
    }
}
