package com.libragraph.drivereport.types;

/**
 * Verdict vocabulary for whole-drive health and for individual SMART attributes.
 */
public enum HealthStatus {
    PASS,
    WARN,
    FAIL,
    UNKNOWN;

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
