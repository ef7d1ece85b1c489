package com.github.stormino.hlsdl.service.cache;

import com.github.stormino.hlsdl.exception.CacheIOException;
import com.github.stormino.hlsdl.model.SegmentDescriptor;
import com.github.stormino.hlsdl.util.DownloadConstants;
import com.github.stormino.hlsdl.util.PathUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Content-addressed segment cache for one stream.
 * <p>
 * The directory name is derived from the manifest URL only, so every run on the same manifest
 * finds the segments earlier runs left behind. A segment file with a size above zero is complete;
 * anything else is pending. Writes go to a {@code .part} file that is renamed into place, so a
 * concurrent scan never sees a half-written segment.
 * <p>
 * Closing the cache removes {@code .part} files this instance started but never finished. It does
 * not remove finished segments; only {@link #purge()} does.
 * Thread-safe: workers write different indices concurrently.
 */
@Slf4j
public class SegmentCache implements Closeable {

    private final String cacheKey;
    private final Path directory;
    private final Set<Path> pendingWrites = ConcurrentHashMap.newKeySet();
    private volatile boolean closed = false;

    public SegmentCache(Path cacheRoot, String manifestUrl) {
        this.cacheKey = keyFor(manifestUrl);
        this.directory = cacheRoot.resolve(cacheKey);
    }

    /**
     * Derive the cache key of a manifest: the first 16 hex characters of its MD5 digest.
     *
     * @param manifestUrl Manifest URL exactly as requested
     * @return Lower-case hex key
     */
    public static String keyFor(String manifestUrl) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] digest = md5.digest(manifestUrl.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, DownloadConstants.CACHE_KEY_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is not available on this JVM", e);
        }
    }

    public String getCacheKey() {
        return cacheKey;
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Create the cache directory if it does not exist yet.
     *
     * @throws CacheIOException if the directory cannot be created
     */
    public void ensureDirectory() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new CacheIOException("Cannot create cache directory " + directory + ": " + e.getMessage(), e, directory);
        }
    }

    public boolean exists() {
        return Files.isDirectory(directory);
    }

    public Path segmentPath(int index) {
        return directory.resolve(String.format(DownloadConstants.SEGMENT_FILE_FORMAT, index));
    }

    /**
     * @return true if the segment file exists and is not empty
     */
    public boolean isComplete(int index) {
        return PathUtils.sizeOrZero(segmentPath(index)) > 0;
    }

    /**
     * Find which of the given segments are already complete.
     *
     * @param segments Planned segments
     * @return Complete indices and their total size in bytes
     */
    public CacheScan scan(List<SegmentDescriptor> segments) {
        TreeSet<Integer> completed = new TreeSet<>();
        long totalBytes = 0;

        for (SegmentDescriptor segment : segments) {
            long size = PathUtils.sizeOrZero(segmentPath(segment.getIndex()));
            if (size > 0) {
                completed.add(segment.getIndex());
                totalBytes += size;
            }
        }

        log.debug("Cache {} holds {}/{} segments ({} bytes)", cacheKey, completed.size(), segments.size(), totalBytes);
        return new CacheScan(completed, totalBytes);
    }

    /**
     * Persist one segment.
     *
     * @param index Segment index
     * @param data Segment bytes, expected non-empty
     * @return Path of the completed segment file
     * @throws CacheIOException if the file cannot be written or moved into place
     */
    public Path write(int index, byte[] data) {
        Path target = segmentPath(index);
        Path part = target.resolveSibling(target.getFileName() + DownloadConstants.PART_SUFFIX);

        pendingWrites.add(part);
        try {
            Files.write(part, data);
            moveIntoPlace(part, target);
            pendingWrites.remove(part);
            return target;
        } catch (IOException e) {
            deletePart(part);
            throw new CacheIOException("Cannot write segment " + index + " to " + target + ": " + e.getMessage(), e, target);
        }
    }

    private void deletePart(Path part) {
        try {
            Files.deleteIfExists(part);
            pendingWrites.remove(part);
        } catch (IOException e) {
            log.warn("Failed to remove unfinished segment file: {}", part, e);
        }
    }

    private void moveIntoPlace(Path part, Path target) throws IOException {
        try {
            Files.move(part, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Paths of the given segments in ascending index order, whatever order the list is in.
     */
    public List<Path> orderedSegmentPaths(List<SegmentDescriptor> segments) {
        List<SegmentDescriptor> sorted = new ArrayList<>(segments);
        sorted.sort(Comparator.comparingInt(SegmentDescriptor::getIndex));

        List<Path> paths = new ArrayList<>(sorted.size());
        for (SegmentDescriptor segment : sorted) {
            paths.add(segmentPath(segment.getIndex()));
        }
        return paths;
    }

    /**
     * Delete the cache directory and everything in it.
     *
     * @return true if the directory no longer exists
     */
    public boolean purge() {
        if (!Files.exists(directory)) {
            return true;
        }

        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder())
                    .forEach(path -> {
                        try {
                            Files.delete(path);
                        } catch (IOException e) {
                            log.warn("Failed to delete: {}", path, e);
                        }
                    });
        } catch (IOException e) {
            log.warn("Failed to purge cache directory: {}", directory, e);
        }

        boolean purged = !Files.exists(directory);
        if (purged) {
            log.debug("Purged cache directory: {}", directory);
        }
        return purged;
    }

    /**
     * Remove unfinished {@code .part} files started by this instance.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        for (Path part : new ArrayList<>(pendingWrites)) {
            try {
                Files.deleteIfExists(part);
                log.debug("Removed unfinished segment file: {}", part);
            } catch (IOException e) {
                log.warn("Failed to remove unfinished segment file: {}", part, e);
            }
        }
        pendingWrites.clear();
    }

    public boolean isClosed() {
        return closed;
    }
}
