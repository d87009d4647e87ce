package com.libragraph.drivereport.formats.api;

/**
 * One SMART attribute table row as printed, before numeric normalization.
 *
 * @param hexRaw true when the raw column is the hexadecimal {@code Data} column
 */
public record RawSmartRow(
        int id,
        String name,
        String value,
        String worst,
        String threshold,
        String raw,
        boolean hexRaw,
        String status
) {
}
