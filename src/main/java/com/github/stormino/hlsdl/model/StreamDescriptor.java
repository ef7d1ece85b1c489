package com.github.stormino.hlsdl.model;

import com.github.stormino.hlsdl.service.playlist.UrlResolver;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Identity of one media playlist. The manifest URL is what the cache key is derived from.
 * The playlist text is carried along when it was already fetched, so planning does not load it twice.
 */
@Value
public class StreamDescriptor {

    String manifestUrl;
    String baseUrl;

    @ToString.Exclude
    String manifestContent;

    public static StreamDescriptor of(@NonNull String manifestUrl) {
        return of(manifestUrl, null);
    }

    public static StreamDescriptor of(@NonNull String manifestUrl, String manifestContent) {
        return new StreamDescriptor(manifestUrl, UrlResolver.directoryOf(manifestUrl), manifestContent);
    }

    public boolean hasManifestContent() {
        return manifestContent != null;
    }
}
