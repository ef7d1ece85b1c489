package com.github.stormino.hlsdl.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Parameters for a single download run.
 */
@Value
@Builder
public class DownloadRequest {

    /**
     * Master or media playlist URL.
     */
    String manifestUrl;

    /**
     * Destination container file.
     */
    Path outputFile;

    /**
     * Worker count; null means the configured default.
     */
    Integer threads;

    /**
     * Variant preference for master playlists ("best", "720p"); null means the configured default.
     */
    String quality;
}
