package com.github.stormino.hlsdl.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Outcome of a download run: a success flag plus the last snapshot the run emitted.
 */
@Value
@Builder
public class DownloadResult {

    boolean success;

    /**
     * Terminal status of the run.
     */
    DownloadStatus status;

    ProgressSnapshot snapshot;

    /**
     * Merged file; only set on success.
     */
    Path outputFile;

    /**
     * Reason the run did not complete.
     */
    String errorMessage;

    /**
     * Fatal exception that ended the run, if any.
     */
    Throwable cause;

    public static DownloadResult completed(ProgressSnapshot snapshot, Path outputFile) {
        return DownloadResult.builder()
                .success(true)
                .status(DownloadStatus.COMPLETED)
                .snapshot(snapshot)
                .outputFile(outputFile)
                .build();
    }

    public static DownloadResult failed(ProgressSnapshot snapshot, String errorMessage) {
        return DownloadResult.builder()
                .success(false)
                .status(DownloadStatus.FAILED)
                .snapshot(snapshot)
                .errorMessage(errorMessage)
                .build();
    }

    public static DownloadResult failed(ProgressSnapshot snapshot, String errorMessage, Throwable cause) {
        return DownloadResult.builder()
                .success(false)
                .status(DownloadStatus.FAILED)
                .snapshot(snapshot)
                .errorMessage(errorMessage)
                .cause(cause)
                .build();
    }

    public static DownloadResult cancelled(ProgressSnapshot snapshot) {
        return DownloadResult.builder()
                .success(false)
                .status(DownloadStatus.CANCELLED)
                .snapshot(snapshot)
                .errorMessage("Download cancelled")
                .build();
    }

    /**
     * True when some segments could not be fetched, as opposed to a fatal error or cancellation.
     */
    public boolean hasSegmentFailures() {
        return snapshot != null && snapshot.getFailedSegments() > 0;
    }
}
