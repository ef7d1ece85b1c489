package com.github.stormino.hlsdl.service.playlist;

import com.github.stormino.hlsdl.exception.ManifestException;
import com.github.stormino.hlsdl.model.SegmentDescriptor;
import com.github.stormino.hlsdl.model.StreamDescriptor;
import com.github.stormino.hlsdl.model.Variant;
import com.github.stormino.hlsdl.service.fetch.FetchResponse;
import com.github.stormino.hlsdl.service.fetch.HttpFetcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns HLS playlists into ordered segment lists and bandwidth-sorted variant lists.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SegmentPlanner {

    private static final String STREAM_INF_TAG = "#EXT-X-STREAM-INF";
    private static final String KEY_TAG = "#EXT-X-KEY:";

    private static final Pattern BANDWIDTH_PATTERN = Pattern.compile("(?<![A-Z-])BANDWIDTH=(\\d+)");
    private static final Pattern RESOLUTION_PATTERN = Pattern.compile("RESOLUTION=(\\d+)x(\\d+)");
    private static final Pattern KEY_METHOD_PATTERN = Pattern.compile("METHOD=([^,]+)");

    private final HttpFetcher httpFetcher;

    /**
     * Plan the segments of a media playlist, fetching it unless the stream already carries its text.
     *
     * @param stream Stream whose manifest is planned
     * @return Segments in playlist order, indexed from 0
     * @throws ManifestException if the playlist cannot be loaded, is a master playlist, or is empty
     */
    public List<SegmentDescriptor> plan(StreamDescriptor stream) {
        String content = stream.hasManifestContent()
                ? stream.getManifestContent()
                : loadManifest(stream.getManifestUrl());
        if (isMasterPlaylist(content)) {
            throw new ManifestException("Expected a media playlist but got a master playlist; select a variant first",
                    stream.getManifestUrl());
        }
        return parseMediaPlaylist(content, stream.getManifestUrl());
    }

    /**
     * List the variants of a playlist, best bandwidth first.
     * A media playlist yields a single "default" variant pointing at itself.
     */
    public List<Variant> listVariants(String manifestUrl) {
        String content = loadManifest(manifestUrl);
        if (!isMasterPlaylist(content)) {
            return List.of(Variant.builder()
                    .url(manifestUrl)
                    .bandwidth(0)
                    .quality("default")
                    .label("Default quality")
                    .build());
        }
        return parseMasterPlaylist(content, manifestUrl);
    }

    /**
     * Fetch playlist text.
     *
     * @throws ManifestException on a transport error or a non-200 status
     */
    public String loadManifest(String manifestUrl) {
        FetchResponse response;
        try {
            response = httpFetcher.get(manifestUrl);
        } catch (IOException e) {
            throw new ManifestException("Failed to fetch manifest: " + e.getMessage(), e, manifestUrl);
        }

        if (!response.isOk()) {
            throw new ManifestException("Failed to fetch manifest (HTTP " + response.getStatusCode() + ")", manifestUrl);
        }
        return response.bodyAsString();
    }

    public boolean isMasterPlaylist(String content) {
        return content.contains(STREAM_INF_TAG);
    }

    /**
     * Parse the segment references of a media playlist.
     *
     * @param content Playlist text
     * @param manifestUrl URL the text was loaded from, used to resolve relative references
     * @return Segments in playlist order
     * @throws ManifestException if the playlist has no segments
     */
    public List<SegmentDescriptor> parseMediaPlaylist(String content, String manifestUrl) {
        List<SegmentDescriptor> segments = new ArrayList<>();

        for (String rawLine : content.split("\n")) {
            String line = rawLine.trim();

            if (line.startsWith(KEY_TAG)) {
                warnIfEncrypted(line, manifestUrl);
                continue;
            }

            if (!line.isEmpty() && !line.startsWith("#")) {
                segments.add(new SegmentDescriptor(segments.size(), line, UrlResolver.resolve(manifestUrl, line)));
            }
        }

        if (segments.isEmpty()) {
            throw new ManifestException("No segments found in playlist", manifestUrl);
        }

        log.debug("Parsed media playlist: {} segments", segments.size());
        return segments;
    }

    /**
     * Parse the variants of a master playlist.
     *
     * @return Variants sorted by bandwidth, highest first; equal bandwidths keep playlist order
     */
    public List<Variant> parseMasterPlaylist(String content, String manifestUrl) {
        List<Variant> variants = new ArrayList<>();
        String[] lines = content.split("\n");

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (!line.startsWith(STREAM_INF_TAG)) {
                continue;
            }

            String uri = nextUriLine(lines, i + 1);
            if (uri == null) {
                log.warn("Variant without URI in {}", manifestUrl);
                continue;
            }
            variants.add(toVariant(line, UrlResolver.resolve(manifestUrl, uri)));
        }

        if (variants.isEmpty()) {
            throw new ManifestException("No variants found in master playlist", manifestUrl);
        }

        // List.sort is stable, so ties stay in playlist order
        variants.sort(Comparator.comparingLong(Variant::getBandwidth).reversed());

        log.debug("Parsed master playlist: {} variants", variants.size());
        return variants;
    }

    private Variant toVariant(String streamInf, String url) {
        Matcher bandwidthMatcher = BANDWIDTH_PATTERN.matcher(streamInf);
        long bandwidth = bandwidthMatcher.find() ? Long.parseLong(bandwidthMatcher.group(1)) : 0L;

        Matcher resolutionMatcher = RESOLUTION_PATTERN.matcher(streamInf);
        double mbps = Math.round(bandwidth / 100_000.0) / 10.0;

        if (resolutionMatcher.find()) {
            String width = resolutionMatcher.group(1);
            String height = resolutionMatcher.group(2);
            String quality = height + "p";
            return Variant.builder()
                    .url(url)
                    .bandwidth(bandwidth)
                    .resolution(width + "x" + height)
                    .quality(quality)
                    .label(String.format(Locale.ROOT, "%sx%s (%s) - %.1f Mbps", width, height, quality, mbps))
                    .build();
        }

        String quality = String.format(Locale.ROOT, "%.1fM", mbps);
        return Variant.builder()
                .url(url)
                .bandwidth(bandwidth)
                .quality(quality)
                .label(quality)
                .build();
    }

    private String nextUriLine(String[] lines, int from) {
        for (int j = from; j < lines.length; j++) {
            String candidate = lines[j].trim();
            if (candidate.isEmpty()) {
                continue;
            }
            return candidate.startsWith("#") ? null : candidate;
        }
        return null;
    }

    private void warnIfEncrypted(String keyLine, String manifestUrl) {
        Matcher methodMatcher = KEY_METHOD_PATTERN.matcher(keyLine);
        if (methodMatcher.find() && !"NONE".equals(methodMatcher.group(1))) {
            log.warn("Playlist {} declares {} encryption, which is not supported; segments are stored as served",
                    manifestUrl, methodMatcher.group(1));
        }
    }
}
