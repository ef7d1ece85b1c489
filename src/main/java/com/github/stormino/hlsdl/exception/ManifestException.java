package com.github.stormino.hlsdl.exception;

/**
 * Exception thrown when a manifest cannot be fetched, is not a media playlist, or lists no segments.
 * Always fatal: nothing is fetched once planning fails.
 */
public class ManifestException extends DownloadException {

    private final String manifestUrl;

    public ManifestException(String message, String manifestUrl) {
        super(message);
        this.manifestUrl = manifestUrl;
    }

    public ManifestException(String message, Throwable cause, String manifestUrl) {
        super(message, cause);
        this.manifestUrl = manifestUrl;
    }

    public String getManifestUrl() {
        return manifestUrl;
    }
}
