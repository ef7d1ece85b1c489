package com.github.stormino.hlsdl.exception;

import java.nio.file.Path;

/**
 * Exception thrown when the segment cache directory cannot be created or written.
 */
public class CacheIOException extends DownloadException {

    private final Path path;

    public CacheIOException(String message, Path path) {
        super(message);
        this.path = path;
    }

    public CacheIOException(String message, Throwable cause, Path path) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
