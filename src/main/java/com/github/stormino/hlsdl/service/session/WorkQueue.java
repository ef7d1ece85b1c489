package com.github.stormino.hlsdl.service.session;

import com.github.stormino.hlsdl.model.SegmentDescriptor;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Pending segments of one run, filled once before the workers start.
 * Each segment is handed to exactly one worker.
 */
public class WorkQueue {

    private final BlockingQueue<SegmentDescriptor> pending;

    public WorkQueue(List<SegmentDescriptor> segments) {
        this.pending = new ArrayBlockingQueue<>(Math.max(1, segments.size()));
        this.pending.addAll(segments);
    }

    /**
     * @return The next pending segment, or null when the queue is drained
     */
    public SegmentDescriptor poll() {
        return pending.poll();
    }

    public int size() {
        return pending.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }
}
