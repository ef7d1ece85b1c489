package com.github.stormino.hlsdl.service.progress;

import com.github.stormino.hlsdl.model.DownloadStatus;
import com.github.stormino.hlsdl.model.ProgressSnapshot;
import com.github.stormino.hlsdl.util.ProgressCalculator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Shared counters of one download run.
 * <p>
 * Every update and the snapshot it produces happen under one lock, so the listener sees
 * counters that never go backwards. The listener is called while the lock is held and must
 * not block for long.
 */
@Slf4j
public class ProgressAggregator {

    private final Object lock = new Object();

    private final int totalSegments;
    private final int cachedAtStart;
    private final long bytesAtStart;
    private final Consumer<ProgressSnapshot> listener;
    private final LongSupplier nanoTime;
    private final long startNanos;

    private int downloadedSegments;
    private int failedSegments;
    private long bytesDownloaded;
    private final List<String> errors = new ArrayList<>();

    public ProgressAggregator(int totalSegments, int cachedAtStart, long bytesAtStart,
                              Consumer<ProgressSnapshot> listener) {
        this(totalSegments, cachedAtStart, bytesAtStart, listener, System::nanoTime);
    }

    ProgressAggregator(int totalSegments, int cachedAtStart, long bytesAtStart,
                       Consumer<ProgressSnapshot> listener, LongSupplier nanoTime) {
        this.totalSegments = totalSegments;
        this.cachedAtStart = cachedAtStart;
        this.bytesAtStart = bytesAtStart;
        this.listener = listener;
        this.nanoTime = nanoTime;
        this.startNanos = nanoTime.getAsLong();

        this.downloadedSegments = cachedAtStart;
        this.bytesDownloaded = bytesAtStart;
    }

    /**
     * Count a segment that was fetched and written, then emit a downloading snapshot.
     */
    public void recordSuccess(int index, long bytes) {
        synchronized (lock) {
            downloadedSegments++;
            bytesDownloaded += bytes;
            log.trace("Segment {} done ({} bytes), {}/{}", index, bytes, downloadedSegments, totalSegments);
            notifyListener(buildSnapshot(DownloadStatus.DOWNLOADING, null));
        }
    }

    /**
     * Count a segment whose attempts are exhausted. Does not emit.
     */
    public void recordFailure(int index, String message) {
        synchronized (lock) {
            failedSegments++;
            errors.add(message);
            log.trace("Segment {} failed: {}", index, message);
        }
    }

    public ProgressSnapshot snapshot(DownloadStatus status) {
        synchronized (lock) {
            return buildSnapshot(status, null);
        }
    }

    /**
     * Build a snapshot with the given status and hand it to the listener.
     *
     * @return The emitted snapshot
     */
    public ProgressSnapshot emit(DownloadStatus status) {
        return emit(status, null);
    }

    public ProgressSnapshot emit(DownloadStatus status, Long fileSize) {
        synchronized (lock) {
            ProgressSnapshot snapshot = buildSnapshot(status, fileSize);
            notifyListener(snapshot);
            return snapshot;
        }
    }

    /**
     * Emit a failed snapshot whose error list holds only the fatal reason.
     */
    public ProgressSnapshot emitFatal(String reason) {
        synchronized (lock) {
            ProgressSnapshot snapshot = buildSnapshot(DownloadStatus.FAILED, null).toBuilder()
                    .errors(List.of(reason))
                    .build();
            notifyListener(snapshot);
            return snapshot;
        }
    }

    public int getDownloadedSegments() {
        synchronized (lock) {
            return downloadedSegments;
        }
    }

    public int getFailedSegments() {
        synchronized (lock) {
            return failedSegments;
        }
    }

    public int getTotalSegments() {
        return totalSegments;
    }

    public List<String> getErrors() {
        synchronized (lock) {
            return List.copyOf(errors);
        }
    }

    private ProgressSnapshot buildSnapshot(DownloadStatus status, Long fileSize) {
        double elapsedSeconds = (nanoTime.getAsLong() - startNanos) / 1_000_000_000.0;
        double segmentRate = ProgressCalculator.calculateSegmentRate(downloadedSegments, cachedAtStart, elapsedSeconds);

        return ProgressSnapshot.builder()
                .status(status)
                .percent(ProgressCalculator.calculatePercent(downloadedSegments, totalSegments))
                .downloadedSegments(downloadedSegments)
                .totalSegments(totalSegments)
                .failedSegments(failedSegments)
                .bytesDownloaded(bytesDownloaded)
                .speedMBps(ProgressCalculator.calculateMegabytesPerSecond(bytesDownloaded, bytesAtStart, elapsedSeconds))
                .speedSegPerSec(segmentRate)
                .etaSeconds(ProgressCalculator.calculateEta(downloadedSegments, totalSegments, segmentRate))
                .errors(errors)
                .fileSize(fileSize)
                .build();
    }

    private void notifyListener(ProgressSnapshot snapshot) {
        if (listener == null) {
            return;
        }
        try {
            listener.accept(snapshot);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed on {} snapshot", snapshot.getStatus().getValue(), e);
        }
    }
}
