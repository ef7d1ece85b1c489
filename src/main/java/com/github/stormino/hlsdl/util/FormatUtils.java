package com.github.stormino.hlsdl.util;

import lombok.experimental.UtilityClass;

import java.util.Locale;

/**
 * Utility class for formatting sizes, speeds and durations in log output.
 */
@UtilityClass
public class FormatUtils {

    /**
     * Format a speed in MiB/s.
     *
     * @param megabytesPerSecond Speed in MiB per second
     * @return Formatted string like "5.23 MB/s"
     */
    public static String formatSpeed(double megabytesPerSecond) {
        return String.format(Locale.ROOT, "%.2f MB/s", Math.max(0.0, megabytesPerSecond));
    }

    /**
     * Format bytes to human-readable size string.
     *
     * @param bytes Size in bytes
     * @return Formatted string like "1.23 GB", "456.78 MB", or "789 B"
     */
    public static String formatSize(long bytes) {
        if (bytes >= 1L << 30) {
            return String.format(Locale.ROOT, "%.2f GB", bytes / (double) (1L << 30));
        } else if (bytes >= 1L << 20) {
            return String.format(Locale.ROOT, "%.2f MB", bytes / (double) (1L << 20));
        } else if (bytes >= 1L << 10) {
            return String.format(Locale.ROOT, "%.2f KB", bytes / (double) (1L << 10));
        } else {
            return String.format(Locale.ROOT, "%d B", bytes);
        }
    }

    /**
     * Format duration in seconds to human-readable time string.
     *
     * @param seconds Duration in seconds
     * @return Formatted string like "2h 15m 30s", "45m 12s", or "23s"
     */
    public static String formatDuration(long seconds) {
        if (seconds < 0) {
            return "0s";
        }

        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;

        if (hours > 0) {
            return String.format(Locale.ROOT, "%dh %dm %ds", hours, minutes, secs);
        } else if (minutes > 0) {
            return String.format(Locale.ROOT, "%dm %ds", minutes, secs);
        } else {
            return String.format(Locale.ROOT, "%ds", secs);
        }
    }

    /**
     * Format percentage with 1 decimal place.
     *
     * @param percentage Percentage value (0-100)
     * @return Formatted percentage string like "45.6%"
     */
    public static String formatPercentage(double percentage) {
        return String.format(Locale.ROOT, "%.1f%%", percentage);
    }
}
