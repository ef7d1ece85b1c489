package com.github.stormino.hlsdl.exception;

/**
 * Exception thrown when a single fetch attempt for a segment fails.
 * Retryable; only becomes a recorded segment failure once the retry budget is spent.
 */
public class SegmentFetchException extends DownloadException {

    private final int segmentIndex;
    private final String segmentUrl;
    private final Integer statusCode;

    public SegmentFetchException(String message, int segmentIndex, String segmentUrl) {
        super(message);
        this.segmentIndex = segmentIndex;
        this.segmentUrl = segmentUrl;
        this.statusCode = null;
    }

    public SegmentFetchException(String message, int segmentIndex, String segmentUrl, Integer statusCode) {
        super(message);
        this.segmentIndex = segmentIndex;
        this.segmentUrl = segmentUrl;
        this.statusCode = statusCode;
    }

    public SegmentFetchException(String message, Throwable cause, int segmentIndex, String segmentUrl) {
        super(message, cause);
        this.segmentIndex = segmentIndex;
        this.segmentUrl = segmentUrl;
        this.statusCode = null;
    }

    public int getSegmentIndex() {
        return segmentIndex;
    }

    public String getSegmentUrl() {
        return segmentUrl;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
