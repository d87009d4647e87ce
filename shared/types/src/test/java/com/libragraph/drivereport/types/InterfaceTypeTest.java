package com.libragraph.drivereport.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class InterfaceTypeTest {

    @Test
    void shouldRecognizeSentinelInterfaceStrings() {
        assertThat(InterfaceType.fromDescription("S-ATA Gen3, 6 Gbps")).isEqualTo(InterfaceType.SATA);
        assertThat(InterfaceType.fromDescription("Serial ATA")).isEqualTo(InterfaceType.SATA);
        assertThat(InterfaceType.fromDescription("SAS 12 Gb/s")).isEqualTo(InterfaceType.SAS);
        assertThat(InterfaceType.fromDescription("Serial Attached SCSI")).isEqualTo(InterfaceType.SAS);
        assertThat(InterfaceType.fromDescription("NVMe PCIe 3.0 x4")).isEqualTo(InterfaceType.NVME);
    }

    @Test
    void shouldNotMistakeWordsContainingSas() {
        assertThat(InterfaceType.fromDescription("Kansas USB bridge")).isEqualTo(InterfaceType.UNKNOWN);
    }

    @Test
    void shouldReturnUnknownForBlank() {
        assertThat(InterfaceType.fromDescription(null)).isEqualTo(InterfaceType.UNKNOWN);
        assertThat(InterfaceType.fromDescription("  ")).isEqualTo(InterfaceType.UNKNOWN);
    }

    @Test
    void shouldOrderMergePrecedencePdfHtmlText() {
        assertThat(SourceFormat.PDF.mergePrecedence()).isGreaterThan(SourceFormat.HTML.mergePrecedence());
        assertThat(SourceFormat.HTML.mergePrecedence()).isGreaterThan(SourceFormat.TEXT.mergePrecedence());
        assertThat(SourceFormat.ZIP.isDocument()).isFalse();
    }
}
