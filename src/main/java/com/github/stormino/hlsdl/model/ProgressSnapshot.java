package com.github.stormino.hlsdl.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Immutable view of a run's counters at the moment they were last updated.
 */
@Value
@Builder(toBuilder = true)
public class ProgressSnapshot {

    DownloadStatus status;
    double percent;
    int downloadedSegments;
    int totalSegments;
    int failedSegments;
    long bytesDownloaded;
    double speedMBps;
    double speedSegPerSec;
    long etaSeconds;
    List<String> errors;

    /**
     * Size of the merged output; only set on completion.
     */
    Long fileSize;

    @Builder.Default
    LocalDateTime timestamp = LocalDateTime.now();

    public List<String> getErrors() {
        return errors != null ? errors : List.of();
    }

    /**
     * Snapshot for a run that ended before any counters existed, e.g. a manifest failure.
     */
    public static ProgressSnapshot withoutCounters(DownloadStatus status, List<String> errors) {
        return ProgressSnapshot.builder()
                .status(status)
                .errors(errors)
                .build();
    }

    public static class ProgressSnapshotBuilder {

        public ProgressSnapshotBuilder errors(List<String> errors) {
            this.errors = errors != null ? List.copyOf(errors) : List.of();
            return this;
        }
    }
}
