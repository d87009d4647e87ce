package com.libragraph.drivereport.formats.extract;

import com.libragraph.drivereport.formats.api.RawSmartRow;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SmartTableParserTest {

    @Test
    void shouldDetectTabSeparatedSentinelHeader() {
        var header = SmartTableParser.detectHeader("No.\tAttribute\tThre...\tValue\tWorst\tData\tStatus")
                .orElseThrow();

        assertThat(header.splitting()).isEqualTo(SmartTableParser.Splitting.TAB);
        assertThat(header.idColumn()).isZero();
        assertThat(header.nameColumn()).isEqualTo(1);
        assertThat(header.thresholdColumn()).isEqualTo(2);
        assertThat(header.rawColumn()).isEqualTo(5);
        assertThat(header.hexRaw()).isTrue();
    }

    @Test
    void shouldParseRowsOfDetectedTable() {
        var header = SmartTableParser.detectHeader("No.\tAttribute\tThre...\tValue\tWorst\tData\tStatus")
                .orElseThrow();

        RawSmartRow row = header.parseRow("194\tTemperature\t0\t65\t45\t002D00140023\tOK").orElseThrow();

        assertThat(row.id()).isEqualTo(194);
        assertThat(row.name()).isEqualTo("Temperature");
        assertThat(row.value()).isEqualTo("65");
        assertThat(row.worst()).isEqualTo("45");
        assertThat(row.threshold()).isEqualTo("0");
        assertThat(row.raw()).isEqualTo("002D00140023");
        assertThat(row.hexRaw()).isTrue();
        assertThat(row.status()).isEqualTo("OK");
    }

    @Test
    void shouldDetectWideGapHeaderWithDecimalRawColumn() {
        var header = SmartTableParser.detectHeader("ID   Attribute Name           Current  Worst  Threshold  Raw Value")
                .orElseThrow();

        assertThat(header.splitting()).isEqualTo(SmartTableParser.Splitting.WIDE_GAP);
        assertThat(header.hexRaw()).isFalse();

        RawSmartRow row = header.parseRow("9    Power On Hours           97       97     0          2883")
                .orElseThrow();
        assertThat(row.id()).isEqualTo(9);
        assertThat(row.name()).isEqualTo("Power On Hours");
        assertThat(row.raw()).isEqualTo("2883");
        assertThat(row.status()).isNull();
    }

    @Test
    void shouldFallBackToWhitespaceSplitting() {
        var header = SmartTableParser.detectHeader("ID# ATTRIBUTE_NAME VALUE WORST THRESH RAW_VALUE").orElseThrow();

        assertThat(header.splitting()).isEqualTo(SmartTableParser.Splitting.WHITESPACE);

        RawSmartRow row = header.parseRow("  5 Reallocated_Sector_Ct 100 100 010 0").orElseThrow();
        assertThat(row.id()).isEqualTo(5);
        assertThat(row.name()).isEqualTo("Reallocated_Sector_Ct");
        assertThat(row.threshold()).isEqualTo("010");
        assertThat(row.raw()).isEqualTo("0");
    }

    @Test
    void shouldAcceptHexadecimalIds() {
        var header = SmartTableParser.detectHeader("ID\tAttribute\tValue").orElseThrow();

        assertThat(header.parseRow("0xC2\tTemperature\t35")).hasValueSatisfying(r -> assertThat(r.id()).isEqualTo(194));
    }

    @Test
    void shouldTreatDashAsMissingCell() {
        var header = SmartTableParser.detectHeader("ID\tAttribute\tValue\tWorst").orElseThrow();

        RawSmartRow row = header.parseRow("1\tRead Error Rate\t-\t").orElseThrow();
        assertThat(row.value()).isNull();
        assertThat(row.worst()).isNull();
    }

    @Test
    void shouldNotTreatNonNumericIdAsRow() {
        var header = SmartTableParser.detectHeader("ID\tAttribute\tValue").orElseThrow();

        assertThat(header.parseRow("Total\tsomething\t3")).isEmpty();
        assertThat(header.parseRow("   ")).isEmpty();
    }

    @Test
    void shouldNotDetectHeaderWithoutIdAndAttributeColumns() {
        assertThat(SmartTableParser.detectHeader("Value\tWorst\tData")).isEmpty();
        assertThat(SmartTableParser.detectHeader("Hard Disk Model ID . . . . : ST4000")).isEmpty();
        assertThat(SmartTableParser.detectHeader("")).isEmpty();
    }
}
