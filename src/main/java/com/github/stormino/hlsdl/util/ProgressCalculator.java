package com.github.stormino.hlsdl.util;

import lombok.experimental.UtilityClass;

/**
 * Rate, ETA and percentage arithmetic for segment downloads.
 * All rates only count work done by the current run, not segments found in the cache.
 */
@UtilityClass
public class ProgressCalculator {

    /**
     * Calculate completion percentage by segment count.
     *
     * @param downloadedSegments Segments present, cached ones included
     * @param totalSegments Segments in the playlist
     * @return Percentage (0-100), 0 when the total is not positive
     */
    public static double calculatePercent(int downloadedSegments, int totalSegments) {
        if (totalSegments <= 0) {
            return 0.0;
        }
        return Math.min(100.0, downloadedSegments * 100.0 / totalSegments);
    }

    /**
     * Calculate segments fetched per second by this run.
     *
     * @param downloadedSegments Segments present, cached ones included
     * @param cachedAtStart Segments already cached when the run started
     * @param elapsedSeconds Seconds since the run started
     * @return Segments per second, 0 when nothing can be computed yet
     */
    public static double calculateSegmentRate(int downloadedSegments, int cachedAtStart, double elapsedSeconds) {
        if (elapsedSeconds <= 0) {
            return 0.0;
        }
        return Math.max(0, downloadedSegments - cachedAtStart) / elapsedSeconds;
    }

    /**
     * Calculate remaining seconds from the segment rate.
     *
     * @param downloadedSegments Segments present
     * @param totalSegments Segments in the playlist
     * @param segmentsPerSecond Current rate
     * @return ETA in whole seconds, 0 when the rate is not positive
     */
    public static long calculateEta(int downloadedSegments, int totalSegments, double segmentsPerSecond) {
        if (segmentsPerSecond <= 0) {
            return 0L;
        }
        int remaining = Math.max(0, totalSegments - downloadedSegments);
        return (long) (remaining / segmentsPerSecond);
    }

    /**
     * Calculate MiB per second fetched by this run.
     *
     * @param bytesDownloaded Bytes present, cached ones included
     * @param bytesAtRunStart Bytes already cached when the run started
     * @param elapsedSeconds Seconds since the run started
     * @return MiB per second, 0 when nothing can be computed yet
     */
    public static double calculateMegabytesPerSecond(long bytesDownloaded, long bytesAtRunStart, double elapsedSeconds) {
        if (elapsedSeconds <= 0) {
            return 0.0;
        }
        long fetched = Math.max(0L, bytesDownloaded - bytesAtRunStart);
        return fetched / elapsedSeconds / DownloadConstants.BYTES_PER_MEGABYTE;
    }
}
