package com.github.stormino.hlsdl.service.progress;

import com.github.stormino.hlsdl.model.DownloadStatus;
import com.github.stormino.hlsdl.model.ProgressSnapshot;

import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Forwards at most one downloading snapshot per interval to a slow consumer such as a log.
 * Snapshots with any other status, and the one that reaches 100%, are always forwarded.
 */
public class ThrottledProgressListener implements Consumer<ProgressSnapshot> {

    private final Consumer<ProgressSnapshot> delegate;
    private final long intervalMillis;
    private final LongSupplier currentTimeMillis;

    private long lastForwarded = Long.MIN_VALUE;
    private DownloadStatus lastStatus;

    public ThrottledProgressListener(Consumer<ProgressSnapshot> delegate, long intervalMillis) {
        this(delegate, intervalMillis, System::currentTimeMillis);
    }

    ThrottledProgressListener(Consumer<ProgressSnapshot> delegate, long intervalMillis, LongSupplier currentTimeMillis) {
        this.delegate = delegate;
        this.intervalMillis = intervalMillis;
        this.currentTimeMillis = currentTimeMillis;
    }

    @Override
    public synchronized void accept(ProgressSnapshot snapshot) {
        long now = currentTimeMillis.getAsLong();

        boolean statusChanged = snapshot.getStatus() != lastStatus;
        boolean finished = snapshot.getDownloadedSegments() >= snapshot.getTotalSegments();
        boolean due = lastForwarded == Long.MIN_VALUE || now - lastForwarded >= intervalMillis;

        if (snapshot.getStatus() != DownloadStatus.DOWNLOADING || statusChanged || finished || due) {
            lastForwarded = now;
            lastStatus = snapshot.getStatus();
            delegate.accept(snapshot);
        }
    }
}
