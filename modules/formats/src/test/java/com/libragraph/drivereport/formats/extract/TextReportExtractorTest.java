package com.libragraph.drivereport.formats.extract;

import com.libragraph.drivereport.formats.api.FileContext;
import com.libragraph.drivereport.formats.api.RawDriveBlock;
import com.libragraph.drivereport.formats.api.RawExtraction;
import com.libragraph.drivereport.formats.api.ReportField;
import com.libragraph.drivereport.formats.testing.ReportSamples;
import com.libragraph.drivereport.types.ParseErrorReason;
import com.libragraph.drivereport.types.SourceFormat;
import com.libragraph.drivereport.util.ContentHash;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class TextReportExtractorTest {

    private final TextReportExtractor extractor = new TextReportExtractor();

    @Test
    void shouldExtractLabeledFieldsOfSentinelTextReport() {
        byte[] content = ReportSamples.textBytes("ZA1234AB", "ST4000NM0023", 92);

        RawExtraction result = extractor.extract(content, FileContext.of("disk0.txt"));

        assertThat(result.errors()).isEmpty();
        assertThat(result.blocks()).hasSize(1);
        RawDriveBlock block = result.blocks().get(0);
        assertThat(block.format()).isEqualTo(SourceFormat.TEXT);
        assertThat(block.fileName()).isEqualTo("disk0.txt");
        assertThat(block.location()).isEqualTo("line 4");
        assertThat(block.field(ReportField.SERIAL)).contains("ZA1234AB");
        assertThat(block.field(ReportField.MODEL)).contains("ST4000NM0023");
        assertThat(block.field(ReportField.INTERFACE)).contains("S-ATA Gen3, 6 Gbps");
        assertThat(block.field(ReportField.CAPACITY)).contains("1000204886016 bytes");
        assertThat(block.field(ReportField.TEMPERATURE)).contains("95 F");
        assertThat(block.field(ReportField.POWER_ON)).contains("120 days, 3 hours");
        assertThat(block.field(ReportField.HEALTH)).contains("#################### 92 %");
        assertThat(block.field(ReportField.REALLOCATED_SECTORS)).contains("3");
        assertThat(block.field(ReportField.GROWN_DEFECTS)).contains("1");
        assertThat(block.sourceHash()).isEqualTo(ContentHash.of(content).toHex());
    }

    @Test
    void shouldInheritReportDateFromPreamble() {
        RawExtraction result = extractor.extract(
                ReportSamples.textBytes("ZA1234AB", "ST4000NM0023", 100), FileContext.of("disk0.txt"));

        assertThat(result.blocks().get(0).field(ReportField.REPORT_DATE)).contains("2024.03.05 10:22:31");
    }

    @Test
    void shouldSplitMultipleDriveBlocks() {
        String report = """
                SCSI Toolbox export

                Drive Information
                =================
                Product = ST4000NM0023
                Serial Number = Z1Z0AAAA

                Drive Information
                =================
                Product = HUS724040ALS640
                Serial Number = PBGBBBBB
                """;

        RawExtraction result = extractor.extract(report.getBytes(StandardCharsets.UTF_8), FileContext.of("toolbox.txt"));

        assertThat(result.blocks()).extracting(b -> b.field(ReportField.SERIAL).orElse(null))
                .containsExactly("Z1Z0AAAA", "PBGBBBBB");
        assertThat(result.blocks()).extracting(RawDriveBlock::location)
                .containsExactly("line 3", "line 8");
    }

    @Test
    void shouldPreferMoreSpecificLabelWithinBlock() {
        String report = """
                Hard Disk Summary
                -----------------
                Serial : SHORT
                Hard Disk Serial Number . . . : LONGSERIAL01
                """;

        RawExtraction result = extractor.extract(report.getBytes(StandardCharsets.UTF_8), FileContext.of("r.txt"));

        assertThat(result.blocks().get(0).field(ReportField.SERIAL)).contains("LONGSERIAL01");
    }

    @Test
    void shouldDecodeWindows1252Reports() {
        String report = """
                Hard Disk Summary
                -----------------
                Hard Disk Serial Number : ZA1234AB
                Current Temperature : 35 °C
                """;

        RawExtraction result = extractor.extract(report.getBytes(Charset.forName("windows-1252")),
                FileContext.of("legacy.txt"));

        assertThat(result.blocks().get(0).field(ReportField.TEMPERATURE)).contains("35 °C");
    }

    @Test
    void shouldCollectSmartTableRows() {
        String report = """
                Hard Disk Summary
                -----------------
                Hard Disk Serial Number : ZA1234AB

                ID   Attribute Name           Current  Worst  Threshold  Raw Value
                5    Reallocated Sectors      100      100    10         0
                9    Power On Hours           97       97     0          2883

                Health : 100 %
                """;

        RawExtraction result = extractor.extract(report.getBytes(StandardCharsets.UTF_8), FileContext.of("r.txt"));

        RawDriveBlock block = result.blocks().get(0);
        assertThat(block.smartRows()).extracting(r -> r.id()).containsExactly(5, 9);
        assertThat(block.field(ReportField.HEALTH)).contains("100 %");
    }

    @Test
    void shouldCarrySourceModificationTime() {
        Instant modified = Instant.parse("2024-02-01T08:00:00Z");

        RawExtraction result = extractor.extract(ReportSamples.textBytes("ZA1234AB", "ST4000NM0023", 100),
                FileContext.of("disk0.txt", modified));

        assertThat(result.blocks().get(0).sourceModified()).contains(modified);
    }

    @Test
    void shouldReportMalformedContentWithoutBlockHeader() {
        byte[] content = "Hard Disk Sentinel\nSerial Number: ZA1234AB\n".getBytes(StandardCharsets.UTF_8);

        RawExtraction result = extractor.extract(content, FileContext.of("partial.txt"));

        assertThat(result.blocks()).isEmpty();
        assertThat(result.errors()).singleElement().satisfies(e -> {
            assertThat(e.reason()).isEqualTo(ParseErrorReason.MALFORMED_CONTENT);
            assertThat(e.fileName()).isEqualTo("partial.txt");
            assertThat(e.formatGuess()).isEqualTo(SourceFormat.TEXT);
        });
    }

    @Test
    void shouldSkipBlockHeaderWithoutFields() {
        String report = """
                Drive Information
                =================
                (no data)

                Drive Information
                =================
                Product = ST4000NM0023
                Serial Number = Z1Z0AAAA
                """;

        RawExtraction result = extractor.extract(report.getBytes(StandardCharsets.UTF_8), FileContext.of("toolbox.txt"));

        assertThat(result.errors()).isEmpty();
        assertThat(result.blocks()).singleElement().satisfies(block -> {
            assertThat(block.field(ReportField.SERIAL)).contains("Z1Z0AAAA");
            assertThat(block.location()).isEqualTo("line 5");
        });
    }

    @Test
    void shouldReportMalformedContentWhenHeadersCarryNoFields() {
        String report = """
                Hard Disk Summary
                -----------------

                Drive Information
                =================
                """;

        RawExtraction result = extractor.extract(report.getBytes(StandardCharsets.UTF_8), FileContext.of("empty.txt"));

        assertThat(result.blocks()).isEmpty();
        assertThat(result.errors()).singleElement().satisfies(e -> {
            assertThat(e.reason()).isEqualTo(ParseErrorReason.MALFORMED_CONTENT);
            assertThat(e.fileName()).isEqualTo("empty.txt");
        });
    }
}
