package com.libragraph.drivereport.formats.model;

import java.util.Locale;

/**
 * Drive vendor derived from the model number prefix.
 */
public enum DriveVendor {
    SEAGATE("Seagate"),
    WESTERN_DIGITAL("Western Digital"),
    TOSHIBA("Toshiba"),
    HITACHI("Hitachi"),
    IBM("IBM"),
    UNKNOWN("Unknown");

    private final String displayName;

    DriveVendor(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public static DriveVendor fromModel(String model) {
        if (model == null || model.isBlank()) {
            return UNKNOWN;
        }
        String m = model.strip().toUpperCase(Locale.ROOT);
        if (m.startsWith("ST")) return SEAGATE;
        if (m.startsWith("WD")) return WESTERN_DIGITAL;
        if (m.startsWith("DT") || m.startsWith("MG")) return TOSHIBA;
        if (m.startsWith("HUA") || m.startsWith("HUS")) return HITACHI;
        if (m.startsWith("IBM")) return IBM;
        return UNKNOWN;
    }
}
