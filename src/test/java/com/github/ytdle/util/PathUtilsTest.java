package com.github.ytdle.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PathUtils")
class PathUtilsTest {

    @Nested
    @DisplayName("sanitizeTemplate")
    class SanitizeTemplateTests {

        @Test
        @DisplayName("should return default template for null")
        void shouldReturnDefaultForNull() {
            assertEquals(PathUtils.DEFAULT_TEMPLATE, PathUtils.sanitizeTemplate(null));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\t"})
        @DisplayName("should return default template for blank input")
        void shouldReturnDefaultForBlank(String input) {
            assertEquals(PathUtils.DEFAULT_TEMPLATE, PathUtils.sanitizeTemplate(input));
        }

        @Test
        @DisplayName("should trim surrounding whitespace")
        void shouldTrim() {
            assertEquals("%(id)s", PathUtils.sanitizeTemplate("  %(id)s "));
        }
    }

    @Nested
    @DisplayName("buildOutputTemplate")
    class BuildOutputTemplateTests {

        @Test
        @DisplayName("should append extension placeholder inside directory")
        void shouldAppendExtensionPlaceholder() {
            String template = PathUtils.buildOutputTemplate("/data/media", "clip");
            assertEquals(Paths.get("/data/media", "clip.%(ext)s").toString(), template);
        }

        @Test
        @DisplayName("should use default template when none given")
        void shouldUseDefaultTemplate() {
            String template = PathUtils.buildOutputTemplate("/data/media", null);
            assertTrue(template.endsWith(PathUtils.DEFAULT_TEMPLATE + ".%(ext)s"));
        }
    }

    @Nested
    @DisplayName("hasPlaceholders")
    class HasPlaceholdersTests {

        @Test
        @DisplayName("should detect tool placeholders")
        void shouldDetectPlaceholders() {
            assertTrue(PathUtils.hasPlaceholders("%(title)s"));
            assertFalse(PathUtils.hasPlaceholders("fixed-name"));
            assertFalse(PathUtils.hasPlaceholders(null));
        }
    }

    @Nested
    @DisplayName("normalizeDirectory")
    class NormalizeDirectoryTests {

        @Test
        @DisplayName("should collapse equivalent spellings")
        void shouldCollapseEquivalentSpellings() {
            assertEquals(PathUtils.normalizeDirectory("/data/media"),
                    PathUtils.normalizeDirectory("/data/./other/../media"));
        }

        @Test
        @DisplayName("should make relative paths absolute")
        void shouldMakeAbsolute() {
            assertTrue(PathUtils.normalizeDirectory("downloads").isAbsolute());
        }
    }

    @Nested
    @DisplayName("stem")
    class StemTests {

        @Test
        @DisplayName("should strip last extension only")
        void shouldStripLastExtension() {
            assertEquals("video.f137", PathUtils.stem(Path.of("video.f137.mp4")));
        }

        @Test
        @DisplayName("should keep names without extension")
        void shouldKeepNamesWithoutExtension() {
            assertEquals("README", PathUtils.stem(Path.of("README")));
            assertEquals(".hidden", PathUtils.stem(Path.of(".hidden")));
        }
    }
}
