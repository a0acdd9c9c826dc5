package com.github.ytdle.util;

import lombok.experimental.UtilityClass;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Utility class for output path handling.
 */
@UtilityClass
public class PathUtils {

    public static final String DEFAULT_TEMPLATE = "%(title).150s";

    /**
     * Trim a filename template, falling back to the title template when blank.
     */
    public static String sanitizeTemplate(String template) {
        String trimmed = template == null ? "" : template.trim();
        return trimmed.isEmpty() ? DEFAULT_TEMPLATE : trimmed;
    }

    /**
     * Output template passed to the fetch tool: {@code <directory>/<template>.%(ext)s}.
     */
    public static String buildOutputTemplate(String directory, String template) {
        return Paths.get(directory).resolve(sanitizeTemplate(template) + ".%(ext)s").toString();
    }

    public static boolean hasPlaceholders(String template) {
        return template != null && template.contains("%(");
    }

    /**
     * Absolute, normalized form of a directory used for comparisons.
     */
    public static Path normalizeDirectory(String directory) {
        return Paths.get(directory).toAbsolutePath().normalize();
    }

    /**
     * File name without its last extension.
     */
    public static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public static String lowerCase(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
