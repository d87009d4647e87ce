package com.libragraph.drivereport.types;

import java.util.Locale;

public enum InterfaceType {
    SATA,
    SAS,
    NVME,
    UNKNOWN;

    /**
     * Maps a dialect interface description ("S-ATA Gen3, 6 Gbps", "SAS 12Gb/s", "NVMe") to a type.
     */
    public static InterfaceType fromDescription(String description) {
        if (description == null || description.isBlank()) {
            return UNKNOWN;
        }
        String d = description.toUpperCase(Locale.ROOT);
        if (d.contains("NVME") || d.contains("NVM EXPRESS")) {
            return NVME;
        }
        if (d.contains("SERIAL ATTACHED SCSI") || d.matches(".*\\bSAS\\b.*")) {
            return SAS;
        }
        if (d.contains("SATA") || d.contains("S-ATA") || d.contains("SERIAL ATA")) {
            return SATA;
        }
        return UNKNOWN;
    }
}
