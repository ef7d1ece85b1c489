package com.github.stormino.hlsdl.model;

public enum DownloadStatus {
    PLANNING("planning", "Planning"),
    RESUMING("resuming", "Checking cache"),
    DOWNLOADING("downloading", "Downloading"),
    MERGING("merging", "Merging segments"),
    COMPLETED("completed", "Completed"),
    FAILED("failed", "Failed"),
    CANCELLED("cancelled", "Cancelled");

    private final String value;
    private final String displayName;

    DownloadStatus(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    /**
     * Lower-case name reported to progress consumers, e.g. "downloading".
     */
    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
