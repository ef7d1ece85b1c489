package com.github.stormino.hlsdl.service.merge;

import com.github.stormino.hlsdl.exception.MergeException;

import java.nio.file.Path;
import java.util.List;

/**
 * Concatenates segment files into one container without re-encoding.
 */
public interface Muxer {

    /**
     * @param orderedSegments Segment files, in the order they must appear in the output
     * @param destination Output file, overwritten if present
     * @throws MergeException if the output cannot be produced
     */
    void merge(List<Path> orderedSegments, Path destination);
}
