package com.github.stormino.hlsdl.model;

import lombok.Builder;
import lombok.Value;

/**
 * One entry of a master playlist.
 */
@Value
@Builder
public class Variant {

    String url;
    long bandwidth;

    /**
     * "WIDTHxHEIGHT", or null when the playlist does not declare it.
     */
    String resolution;

    /**
     * "1080p" when the resolution is known, otherwise the bandwidth in Mbps such as "2.5M".
     */
    String quality;
    String label;

    public Integer getHeight() {
        if (resolution == null) {
            return null;
        }
        int x = resolution.indexOf('x');
        if (x < 0) {
            return null;
        }
        try {
            return Integer.parseInt(resolution.substring(x + 1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
