package com.github.stormino.hlsdl.service.cache;

import lombok.Value;

import java.util.Collections;
import java.util.SortedSet;

/**
 * Segments already complete in the cache when a run starts.
 */
@Value
public class CacheScan {

    SortedSet<Integer> completedIndices;
    long totalBytes;

    public CacheScan(SortedSet<Integer> completedIndices, long totalBytes) {
        this.completedIndices = Collections.unmodifiableSortedSet(completedIndices);
        this.totalBytes = totalBytes;
    }

    public int getCompletedCount() {
        return completedIndices.size();
    }

    public boolean contains(int index) {
        return completedIndices.contains(index);
    }
}
