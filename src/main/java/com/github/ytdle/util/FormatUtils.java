package com.github.ytdle.util;

import lombok.experimental.UtilityClass;

/**
 * Formatting and parsing of the speeds, sizes and durations printed by the fetch tool.
 */
@UtilityClass
public class FormatUtils {

    /**
     * Format bytes per second to human-readable speed string.
     *
     * @param bytesPerSecond Speed in bytes per second
     * @return Formatted string like "5.23 MB/s", "128.45 KB/s", or "512 B/s"
     */
    public static String formatSpeed(double bytesPerSecond) {
        if (bytesPerSecond >= 1_000_000_000) {
            return String.format("%.2f GB/s", bytesPerSecond / 1_000_000_000);
        } else if (bytesPerSecond >= 1_000_000) {
            return String.format("%.2f MB/s", bytesPerSecond / 1_000_000);
        } else if (bytesPerSecond >= 1_000) {
            return String.format("%.2f KB/s", bytesPerSecond / 1_000);
        } else {
            return String.format("%.0f B/s", bytesPerSecond);
        }
    }

    /**
     * Format an ETA the way the fetch tool prints it.
     *
     * @param seconds Remaining seconds
     * @return "1:02:03", "4:05", or an empty string when unknown
     */
    public static String formatEta(Long seconds) {
        if (seconds == null || seconds <= 0) {
            return "";
        }
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;
        if (hours > 0) {
            return String.format("%d:%02d:%02d", hours, minutes, secs);
        }
        return String.format("%d:%02d", minutes, secs);
    }

    /**
     * Status line shown while a job is transferring.
     *
     * @return "Downloading... 5.20 MB/s | ETA 0:10", or "Downloading..." when nothing is known
     */
    public static String formatStatus(String speed, Long etaSeconds) {
        StringBuilder status = new StringBuilder("Downloading...");
        String eta = formatEta(etaSeconds);
        if (speed != null && !speed.isBlank()) {
            status.append(' ').append(speed);
        }
        if (!eta.isEmpty()) {
            status.append(speed != null && !speed.isBlank() ? " | " : " ").append("ETA ").append(eta);
        }
        return status.toString();
    }

    /**
     * Parse a size printed by the fetch tool ("12.34MiB", "800KB", "1.2GiB") into bytes.
     *
     * @return bytes, or null if the value cannot be parsed
     */
    public static Long parseSize(String value, String unit) {
        if (value == null || unit == null) {
            return null;
        }
        double base;
        try {
            base = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return null;
        }
        String normalized = unit.trim();
        boolean binary = normalized.contains("i");
        long step = binary ? 1024L : 1000L;
        char prefix = normalized.isEmpty() ? 'B' : Character.toUpperCase(normalized.charAt(0));
        long multiplier = switch (prefix) {
            case 'K' -> step;
            case 'M' -> step * step;
            case 'G' -> step * step * step;
            case 'T' -> step * step * step * step;
            default -> 1L;
        };
        return Math.round(base * multiplier);
    }
}
