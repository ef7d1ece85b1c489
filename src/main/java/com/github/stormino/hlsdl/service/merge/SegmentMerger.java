package com.github.stormino.hlsdl.service.merge;

import com.github.stormino.hlsdl.exception.MergeException;
import com.github.stormino.hlsdl.util.PathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Verifies inputs and output around a {@link Muxer} run.
 * A merge only counts as successful when the muxer returns and the output is non-empty.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SegmentMerger {

    private final Muxer muxer;

    /**
     * Merge segments into the destination file.
     *
     * @param orderedSegments Segment files in ascending index order
     * @param destination Output file
     * @return Size of the merged file in bytes
     * @throws MergeException if an input is missing, the muxer fails or the output is empty
     */
    public long merge(List<Path> orderedSegments, Path destination) {
        List<String> inputs = orderedSegments.stream().map(Path::toString).collect(Collectors.toList());

        for (Path segment : orderedSegments) {
            if (PathUtils.sizeOrZero(segment) <= 0) {
                throw new MergeException("Segment file missing or empty: " + segment, inputs, destination.toString());
            }
        }

        Path parent = destination.toAbsolutePath().getParent();
        if (parent != null && !PathUtils.createDirectoryStructure(parent)) {
            throw new MergeException("Cannot create output directory " + parent, inputs, destination.toString());
        }

        muxer.merge(orderedSegments, destination);

        long size = PathUtils.sizeOrZero(destination);
        if (size <= 0) {
            throw new MergeException("Merged output missing or empty: " + destination, inputs, destination.toString());
        }

        log.info("Merged {} segments into {} ({} bytes)", orderedSegments.size(), destination, size);
        return size;
    }
}
