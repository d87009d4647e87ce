package com.libragraph.drivereport.formats.api;

/**
 * Labeled drive fields recognized in report lines.
 */
public enum ReportField {
    SERIAL,
    MODEL,
    VENDOR_INFORMATION,
    INTERFACE,
    CAPACITY,
    HEALTH,
    TEMPERATURE,
    POWER_ON,
    REALLOCATED_SECTORS,
    GROWN_DEFECTS,
    REPORT_DATE
}
