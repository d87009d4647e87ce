package com.libragraph.drivereport.core.batch;

public enum BatchOutcome {
    COMPLETED,
    /** At least one file, member, section or page produced a parse error. */
    COMPLETED_WITH_ERRORS
}
