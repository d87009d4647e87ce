package com.libragraph.drivereport.formats.api;

/**
 * A batch-wide resource bound was exceeded (total input size, expanded bytes, file count).
 * Aborts the whole batch.
 */
public class ResourceExhaustedException extends DriveReportException {

    public static final String REASON = "RESOURCE_EXHAUSTED";

    private final String limit;

    public ResourceExhaustedException(String limit, String message) {
        super(message);
        this.limit = limit;
    }

    /** Configuration key of the violated limit. */
    public String limit() {
        return limit;
    }
}
