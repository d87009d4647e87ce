package com.libragraph.drivereport.types;

/**
 * Classification produced by format sniffing. Extraction dispatches on this value.
 */
public enum SourceFormat {
    HTML("html"),
    TEXT("text"),
    PDF("pdf"),
    ZIP("zip"),
    UNSUPPORTED("unsupported");

    private final String label;

    SourceFormat(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Precedence used when merging duplicate drive records; higher wins.
     * PDF reports are produced last in the originating workflow.
     */
    public int mergePrecedence() {
        return switch (this) {
            case PDF -> 3;
            case HTML -> 2;
            case TEXT -> 1;
            default -> 0;
        };
    }

    /** True for formats that carry drive records themselves (not containers). */
    public boolean isDocument() {
        return this == HTML || this == TEXT || this == PDF;
    }
}
