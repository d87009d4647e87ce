package com.libragraph.drivereport.types;

public enum ParseErrorReason {
    UNSUPPORTED_FORMAT("Unsupported format"),
    MALFORMED_CONTENT("Malformed content"),
    MISSING_REQUIRED_FIELD("Missing required field"),
    ARCHIVE_CORRUPT("Archive corrupt"),
    NESTED_ARCHIVE_DEPTH_EXCEEDED("Nested archive depth exceeded"),
    FILE_TOO_LARGE("File too large");

    private final String label;

    ParseErrorReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
