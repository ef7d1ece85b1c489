package com.github.stormino.hlsdl.util;

/**
 * Constants used throughout the download system.
 */
public final class DownloadConstants {

    private DownloadConstants() {
        // Utility class, no instantiation
    }

    // ========== Cache Layout ==========

    /**
     * Number of hex characters of the manifest URL digest used as cache directory name.
     */
    public static final int CACHE_KEY_LENGTH = 16;

    /**
     * Segment file name pattern; the index is zero-padded to five digits.
     */
    public static final String SEGMENT_FILE_FORMAT = "segment_%05d.ts";

    /**
     * Suffix of a segment file that is still being written.
     */
    public static final String PART_SUFFIX = ".part";

    /**
     * Ordered list handed to the ffmpeg concat demuxer.
     */
    public static final String CONCAT_LIST_FILE = "concat.txt";

    // ========== Fetching ==========

    public static final int MIN_THREADS = 1;

    public static final int MAX_THREADS = 32;

    /**
     * Attempts per segment before it is recorded as failed.
     */
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    /**
     * Fixed pause between two attempts for the same segment.
     */
    public static final long DEFAULT_BACKOFF_MS = 1000;

    /**
     * HTTP status treated as a successful segment fetch. Anything else is a failed attempt.
     */
    public static final int HTTP_OK = 200;

    // ========== FFmpeg Configuration ==========

    public static final String FFMPEG_LOG_LEVEL = "warning";

    /**
     * FFmpeg AAC bitstream filter for MP4 compatibility.
     */
    public static final String FFMPEG_AAC_BSF = "aac_adtstoasc";

    /**
     * Number of trailing ffmpeg output lines kept for error reports.
     */
    public static final int FFMPEG_OUTPUT_TAIL_LINES = 20;

    // ========== Output ==========

    public static final String VIDEO_EXTENSION = ".mp4";

    // ========== Progress Tracking ==========

    /**
     * Minimum interval between logged progress lines in milliseconds.
     */
    public static final long PROGRESS_LOG_INTERVAL_MS = 500;

    public static final double BYTES_PER_MEGABYTE = 1024.0 * 1024.0;

    /**
     * Maximum number of segment errors echoed in a failure summary.
     */
    public static final int MAX_REPORTED_ERRORS = 10;
}
