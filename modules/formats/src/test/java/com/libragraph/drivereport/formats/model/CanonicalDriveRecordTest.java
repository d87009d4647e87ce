package com.libragraph.drivereport.formats.model;

import com.libragraph.drivereport.types.HealthStatus;
import com.libragraph.drivereport.types.InterfaceType;
import com.libragraph.drivereport.types.SourceFormat;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;

import static org.assertj.core.api.Assertions.*;

class CanonicalDriveRecordTest {

    private static CanonicalDriveRecord.Builder minimal(String serial) {
        return CanonicalDriveRecord.builder(serial)
                .sourceFileName("r.txt")
                .sourceFormat(SourceFormat.TEXT)
                .extractedAt(Instant.EPOCH);
    }

    @Test
    void shouldFillDefaultsForMissingValues() {
        CanonicalDriveRecord record = minimal("ZA1234AB").build();

        assertThat(record.model()).isEmpty();
        assertThat(record.interfaceType()).isEqualTo(InterfaceType.UNKNOWN);
        assertThat(record.overallHealth()).isEqualTo(HealthStatus.UNKNOWN);
        assertThat(record.smartAttributes()).isEmpty();
        assertThat(record.vendorInformation()).isEmpty();
        assertThat(record.rawExcerpt()).isEmpty();
        assertThat(record.completeness()).isZero();
    }

    @Test
    void shouldRejectBlankSerialAndNegativeCapacity() {
        assertThatThrownBy(() -> minimal(" ").build()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> minimal(null).build()).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> minimal("ZA1234AB").capacityBytes(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCountPopulatedFields() {
        CanonicalDriveRecord record = minimal("ZA1234AB")
                .model("ST4000NM0023")
                .interfaceType(InterfaceType.SAS)
                .capacityBytes(4_000_000_000_000L)
                .overallHealth(HealthStatus.PASS)
                .temperatureCelsius(30)
                .build();

        assertThat(record.completeness()).isEqualTo(5);
    }

    @Test
    void shouldExposeLabelSerialAndVendor() {
        CanonicalDriveRecord record = minimal("WD-WCC4E1234567").model("WDC WD40EFRX").build();

        assertThat(record.labelSerial()).isEqualTo("WD-WCC4E");
        assertThat(minimal("SHORT").build().labelSerial()).isEqualTo("SHORT");
        assertThat(minimal("ZA1").model("ST4000NM0023").build().vendor()).isEqualTo(DriveVendor.SEAGATE);
    }

    @Test
    void shouldCopySmartAttributesAndKeepThemSorted() {
        var attributes = new HashMap<Integer, SmartAttribute>();
        attributes.put(194, new SmartAttribute(194, "Temperature", 35L, 65, 45, 0, HealthStatus.PASS));
        attributes.put(5, new SmartAttribute(5, "Reallocated", 0L, 100, 100, 10, HealthStatus.PASS));

        CanonicalDriveRecord record = minimal("ZA1234AB").smartAttributes(attributes).build();
        attributes.clear();

        assertThat(record.smartAttributes()).containsOnlyKeys(5, 194);
        assertThat(record.smartAttributes().firstKey()).isEqualTo(5);
        assertThatThrownBy(() -> record.smartAttributes().put(9, null))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
