package com.libragraph.drivereport.formats.api;

/**
 * Base of the engine's unchecked exceptions. Only fatal conditions are thrown;
 * recoverable per-file failures travel as {@link com.libragraph.drivereport.formats.model.ParseError}s.
 */
public class DriveReportException extends RuntimeException {

    public DriveReportException(String message, Throwable cause) {
        super(message, cause);
    }

    public DriveReportException(String message) {
        super(message);
    }
}
