package com.github.stormino.hlsdl.service;

import com.github.stormino.hlsdl.config.HlsDownloaderProperties;
import com.github.stormino.hlsdl.exception.ConfigurationException;
import com.github.stormino.hlsdl.exception.ManifestException;
import com.github.stormino.hlsdl.model.DownloadRequest;
import com.github.stormino.hlsdl.model.DownloadResult;
import com.github.stormino.hlsdl.model.DownloadStatus;
import com.github.stormino.hlsdl.model.ProgressSnapshot;
import com.github.stormino.hlsdl.model.StreamDescriptor;
import com.github.stormino.hlsdl.model.Variant;
import com.github.stormino.hlsdl.service.cache.SegmentCache;
import com.github.stormino.hlsdl.service.fetch.HttpFetcher;
import com.github.stormino.hlsdl.service.merge.SegmentMerger;
import com.github.stormino.hlsdl.service.playlist.SegmentPlanner;
import com.github.stormino.hlsdl.service.session.DownloadSession;
import com.github.stormino.hlsdl.service.state.DownloadStateMachine;
import com.github.stormino.hlsdl.util.DownloadConstants;
import com.github.stormino.hlsdl.util.PathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Entry point for downloads: validates a request, picks a variant, runs a session on the caller's thread.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DownloadService {

    private static final String BEST_QUALITY = "best";

    private final HlsDownloaderProperties properties;
    private final SegmentPlanner planner;
    private final HttpFetcher fetcher;
    private final SegmentMerger merger;
    private final DownloadStateMachine stateMachine;

    private final Map<String, DownloadSession> activeSessions = new ConcurrentHashMap<>();

    /**
     * Run a download to completion on the calling thread.
     *
     * @param request What to download and where
     * @param progressListener Receives snapshots, possibly from worker threads; may be null
     * @return Outcome with the final snapshot
     * @throws ConfigurationException if the request is invalid
     */
    public DownloadResult download(DownloadRequest request, Consumer<ProgressSnapshot> progressListener) {
        int threads = validate(request);

        StreamDescriptor stream;
        try {
            stream = resolveStream(request);
        } catch (ManifestException e) {
            log.error("Cannot load manifest {}: {}", request.getManifestUrl(), e.getMessage());
            ProgressSnapshot snapshot = ProgressSnapshot.withoutCounters(DownloadStatus.FAILED, List.of(e.getMessage()));
            notifyListener(progressListener, snapshot);
            return DownloadResult.failed(snapshot, e.getMessage(), e);
        }
        String mediaUrl = stream.getManifestUrl();

        HlsDownloaderProperties.Fetch fetch = properties.getFetch();

        try (SegmentCache cache = new SegmentCache(PathUtils.expandHome(properties.getDownload().getCacheRoot()), mediaUrl)) {
            DownloadSession session = DownloadSession.builder()
                    .stream(stream)
                    .outputFile(request.getOutputFile())
                    .planner(planner)
                    .cache(cache)
                    .fetcher(fetcher)
                    .merger(merger)
                    .stateMachine(stateMachine)
                    .threads(threads)
                    .maxAttempts(fetch.getMaxAttempts())
                    .backoffMillis(fetch.getBackoffMs())
                    .progressListener(progressListener)
                    .build();

            String key = cache.getCacheKey();
            if (activeSessions.putIfAbsent(key, session) != null) {
                String message = "A download of " + mediaUrl + " is already running";
                log.warn(message);
                ProgressSnapshot snapshot = ProgressSnapshot.withoutCounters(DownloadStatus.FAILED, List.of(message));
                notifyListener(progressListener, snapshot);
                return DownloadResult.failed(snapshot, message);
            }

            try {
                log.info("Starting download of {} to {} (cache {})", mediaUrl, request.getOutputFile(), cache.getDirectory());
                return session.run();
            } finally {
                activeSessions.remove(key, session);
            }
        }
    }

    private int validate(DownloadRequest request) {
        if (request.getManifestUrl() == null || request.getManifestUrl().isBlank()) {
            throw new ConfigurationException("Manifest URL is required", "manifest");
        }
        if (request.getOutputFile() == null) {
            throw new ConfigurationException("Output file is required", "output");
        }

        int threads = request.getThreads() != null ? request.getThreads() : properties.getDownload().getThreads();
        if (threads < DownloadConstants.MIN_THREADS || threads > DownloadConstants.MAX_THREADS) {
            throw new ConfigurationException(
                    String.format("Thread count must be between %d and %d", DownloadConstants.MIN_THREADS, DownloadConstants.MAX_THREADS),
                    "threads", String.valueOf(threads));
        }
        return threads;
    }

    /**
     * Follow a master playlist to the media playlist of the preferred variant.
     * A media playlist is returned with the text already fetched, so it is not loaded again.
     */
    private StreamDescriptor resolveStream(DownloadRequest request) {
        String manifestUrl = request.getManifestUrl();
        String content = planner.loadManifest(manifestUrl);
        if (!planner.isMasterPlaylist(content)) {
            return StreamDescriptor.of(manifestUrl, content);
        }

        List<Variant> variants = planner.parseMasterPlaylist(content, manifestUrl);
        String quality = request.getQuality() != null ? request.getQuality() : properties.getDownload().getDefaultQuality();
        Variant selected = selectVariant(variants, quality);
        log.info("Selected variant {} for quality '{}'", selected.getLabel(), quality);
        return StreamDescriptor.of(selected.getUrl());
    }

    private void notifyListener(Consumer<ProgressSnapshot> progressListener, ProgressSnapshot snapshot) {
        if (progressListener == null) {
            return;
        }
        try {
            progressListener.accept(snapshot);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed on {} snapshot", snapshot.getStatus().getValue(), e);
        }
    }

    /**
     * Pick the variant whose height matches the quality, else the highest bandwidth.
     *
     * @param variants Variants sorted by bandwidth, highest first
     * @param quality "best" or a height such as "720p"
     */
    Variant selectVariant(List<Variant> variants, String quality) {
        if (variants.size() == 1) {
            return variants.get(0);
        }

        Integer preferredHeight = parseQualityHeight(quality);
        if (preferredHeight != null) {
            for (Variant variant : variants) {
                if (preferredHeight.equals(variant.getHeight())) {
                    return variant;
                }
            }
            log.warn("No variant with height {}, using highest bandwidth", preferredHeight);
        }

        return variants.get(0);
    }

    private Integer parseQualityHeight(String quality) {
        if (quality == null || quality.isBlank() || BEST_QUALITY.equalsIgnoreCase(quality)) {
            return null;
        }

        String digits = quality.toLowerCase().endsWith("p") ? quality.substring(0, quality.length() - 1) : quality;
        try {
            return Integer.parseInt(digits.trim());
        } catch (NumberFormatException e) {
            log.warn("Unrecognized quality '{}', using highest bandwidth", quality);
            return null;
        }
    }

    /**
     * Request cancellation of the active session on the given cache key.
     *
     * @return true if a session was found
     */
    public boolean cancel(String cacheKey) {
        DownloadSession session = activeSessions.get(cacheKey);
        if (session == null) {
            return false;
        }
        session.cancel();
        return true;
    }

    public void cancelAll() {
        activeSessions.values().forEach(DownloadSession::cancel);
    }

    /**
     * Wait until every active session has returned, or the timeout passes.
     *
     * @return true if no session is left running
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (DownloadSession session : List.copyOf(activeSessions.values())) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0 || !session.awaitTermination(Duration.ofNanos(remaining))) {
                return false;
            }
        }
        return true;
    }

    public Set<String> getActiveSessions() {
        return Set.copyOf(activeSessions.keySet());
    }
}
