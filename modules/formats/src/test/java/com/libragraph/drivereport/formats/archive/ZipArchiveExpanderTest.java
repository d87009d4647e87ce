package com.libragraph.drivereport.formats.archive;

import com.libragraph.drivereport.formats.api.ResourceExhaustedException;
import com.libragraph.drivereport.formats.sniff.FormatSniffer;
import com.libragraph.drivereport.formats.testing.ReportSamples;
import com.libragraph.drivereport.formats.testing.TestZipBuilder;
import com.libragraph.drivereport.types.ParseErrorReason;
import com.libragraph.drivereport.types.SourceFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class ZipArchiveExpanderTest {

    private final ZipArchiveExpander expander = new ZipArchiveExpander(new FormatSniffer());

    @TempDir
    Path tempDir;

    @Test
    void shouldExpandMembersWithFormatsAndNames() {
        byte[] zip = new TestZipBuilder()
                .addFile("reports/disk0.txt", ReportSamples.textBytes("ZA1234AB", "ST4000NM0023", 100))
                .addFile("reports/disk1.html", ReportSamples.htmlBytes("WD-WCC4E1234567", "WD40EFRX", 100))
                .buildBytes();

        List<ArchiveItem> items = expand(zip, "batch.zip", ArchiveLimits.defaults());

        assertThat(items).hasSize(2).allMatch(ArchiveItem.Member.class::isInstance);
        var first = (ArchiveItem.Member) items.get(0);
        var second = (ArchiveItem.Member) items.get(1);
        assertThat(first.name()).isEqualTo("batch.zip!/reports/disk0.txt");
        assertThat(first.format()).isEqualTo(SourceFormat.TEXT);
        assertThat(second.name()).isEqualTo("batch.zip!/reports/disk1.html");
        assertThat(second.format()).isEqualTo(SourceFormat.HTML);
    }

    @Test
    void shouldSkipDirectoriesHiddenEntriesAndResourceForks() {
        byte[] zip = new TestZipBuilder()
                .addDirectory("reports")
                .addFile("reports/.DS_Store", "junk")
                .addFile("__MACOSX/reports/._disk0.txt", "junk")
                .addFile(".hidden/disk0.txt", "junk")
                .addFile("reports/disk0.txt", ReportSamples.textBytes("ZA1234AB", "ST4000NM0023", 100))
                .buildBytes();

        List<ArchiveItem> items = expand(zip, "batch.zip", ArchiveLimits.defaults());

        assertThat(items).hasSize(1);
        assertThat(((ArchiveItem.Member) items.get(0)).name()).isEqualTo("batch.zip!/reports/disk0.txt");
    }

    @Test
    void shouldRecurseIntoNestedArchives() {
        var inner = new TestZipBuilder()
                .addFile("r.txt", ReportSamples.textBytes("ZA1234AB", "ST4000NM0023", 100));
        byte[] zip = new TestZipBuilder()
                .addNestedZip("b.zip", inner)
                .buildBytes();

        List<ArchiveItem> items = expand(zip, "a.zip", ArchiveLimits.defaults());

        assertThat(items).hasSize(1);
        var member = (ArchiveItem.Member) items.get(0);
        assertThat(member.name()).isEqualTo("a.zip!/b.zip!/r.txt");
        assertThat(member.format()).isEqualTo(SourceFormat.TEXT);
    }

    @Test
    void shouldReportNestingBeyondDepthLimitAndKeepSiblings() {
        var innermost = new TestZipBuilder()
                .addFile("deep.txt", ReportSamples.textBytes("DEEP0001", "ST1000DM003", 100));
        var inner = new TestZipBuilder()
                .addNestedZip("innermost.zip", innermost)
                .addFile("shallow.txt", ReportSamples.textBytes("SHALLOW1", "ST1000DM003", 100));
        byte[] zip = new TestZipBuilder()
                .addNestedZip("inner.zip", inner)
                .buildBytes();

        List<ArchiveItem> items = expand(zip, "outer.zip", ArchiveLimits.defaults().withMaxDepth(2));

        assertThat(items).hasSize(2);
        var failure = (ArchiveItem.Failure) items.get(0);
        assertThat(failure.error().reason()).isEqualTo(ParseErrorReason.NESTED_ARCHIVE_DEPTH_EXCEEDED);
        assertThat(failure.error().fileName()).isEqualTo("outer.zip!/inner.zip!/innermost.zip");
        assertThat(failure.error().formatGuess()).isEqualTo(SourceFormat.ZIP);
        assertThat(((ArchiveItem.Member) items.get(1)).name()).isEqualTo("outer.zip!/inner.zip!/shallow.txt");
    }

    @Test
    void shouldRejectArchiveDeclaringTooManyMembers() {
        byte[] zip = new TestZipBuilder()
                .addFile("a.txt", "a")
                .addFile("b.txt", "b")
                .addFile("c.txt", "c")
                .buildBytes();

        List<ArchiveItem> items = expand(zip, "many.zip", ArchiveLimits.defaults().withMaxMembers(2));

        assertThat(items).hasSize(1);
        var failure = (ArchiveItem.Failure) items.get(0);
        assertThat(failure.error().reason()).isEqualTo(ParseErrorReason.ARCHIVE_CORRUPT);
        assertThat(failure.error().fileName()).isEqualTo("many.zip");
        assertThat(failure.error().detail()).contains("limit is 2");
    }

    @Test
    void shouldReportCorruptArchive() {
        byte[] garbage = "PK\u0003\u0004this is not really a zip file".getBytes(StandardCharsets.ISO_8859_1);

        List<ArchiveItem> items = expand(garbage, "broken.zip", ArchiveLimits.defaults());

        assertThat(items).singleElement()
                .isInstanceOfSatisfying(ArchiveItem.Failure.class, f -> {
                    assertThat(f.error().reason()).isEqualTo(ParseErrorReason.ARCHIVE_CORRUPT);
                    assertThat(f.error().fileName()).isEqualTo("broken.zip");
                });
    }

    @Test
    void shouldRejectEntryDeclaringMoreThanFileLimit() {
        byte[] zip = new TestZipBuilder()
                .addFile("big.txt", "x".repeat(64))
                .addFile("small.txt", "y")
                .buildBytes();
        var limits = new ArchiveLimits(3, 500, 100, 32, 4L * 1024 * 1024);

        List<ArchiveItem> items = expand(zip, "sizes.zip", limits);

        assertThat(items).hasSize(2);
        var failure = (ArchiveItem.Failure) items.get(0);
        assertThat(failure.error().reason()).isEqualTo(ParseErrorReason.ARCHIVE_CORRUPT);
        assertThat(failure.error().fileName()).isEqualTo("sizes.zip!/big.txt");
        assertThat(items.get(1)).isInstanceOf(ArchiveItem.Member.class);
    }

    @Test
    void shouldRejectEntryWithExcessiveExpansionRatio() {
        byte[] zeros = new byte[2 * 1024 * 1024];
        byte[] zip = new TestZipBuilder()
                .addDeflated("zeros.txt", zeros)
                .buildBytes();

        List<ArchiveItem> items = expand(zip, "bomb.zip", ArchiveLimits.defaults());

        assertThat(items).singleElement()
                .isInstanceOfSatisfying(ArchiveItem.Failure.class, f -> {
                    assertThat(f.error().reason()).isEqualTo(ParseErrorReason.ARCHIVE_CORRUPT);
                    assertThat(f.error().detail()).contains("Expansion ratio");
                });
    }

    @Test
    void shouldNotApplyRatioCheckToSmallEntries() {
        byte[] zeros = new byte[64 * 1024];
        byte[] zip = new TestZipBuilder()
                .addDeflated("zeros.txt", zeros)
                .buildBytes();

        List<ArchiveItem> items = expand(zip, "small.zip", ArchiveLimits.defaults());

        assertThat(items).singleElement().isInstanceOf(ArchiveItem.Member.class);
    }

    @Test
    void shouldThrowWhenBatchBudgetIsExhausted() {
        byte[] zip = new TestZipBuilder()
                .addFile("a.txt", "x".repeat(40))
                .addFile("b.txt", "x".repeat(40))
                .buildBytes();
        var budget = new ExpansionBudget(50);

        try (Stream<ArchiveItem> items = expander.expand(zip, "budget.zip", 1, ArchiveLimits.defaults(), null, budget)) {
            assertThatThrownBy(items::toList)
                    .isInstanceOfSatisfying(ResourceExhaustedException.class,
                            e -> assertThat(e.limit()).isEqualTo(ExpansionBudget.LIMIT_KEY));
        }
        assertThat(budget.used()).isEqualTo(80);
    }

    @Test
    void shouldSpillLargeArchivesToWorkArea() throws Exception {
        byte[] zip = new TestZipBuilder()
                .addFile("r.txt", ReportSamples.textBytes("ZA1234AB", "ST4000NM0023", 100))
                .buildBytes();
        var limits = ArchiveLimits.defaults().withSpillThresholdBytes(16);

        WorkArea workArea = WorkArea.under(tempDir);
        List<ArchiveItem> items;
        try (Stream<ArchiveItem> stream = expander.expand(zip, "spill.zip", 1, limits, workArea,
                new ExpansionBudget(Long.MAX_VALUE))) {
            items = stream.toList();
        }

        assertThat(items).singleElement().isInstanceOf(ArchiveItem.Member.class);
        try (Stream<Path> files = Files.list(workArea.root())) {
            assertThat(files.toList()).hasSize(1);
        }

        workArea.close();
        assertThat(workArea.root()).doesNotExist();
    }

    @Test
    void shouldCarryEntryModificationTime() {
        byte[] zip = new TestZipBuilder()
                .addFile("r.txt", ReportSamples.textBytes("ZA1234AB", "ST4000NM0023", 100))
                .buildBytes();

        List<ArchiveItem> items = expand(zip, "dated.zip", ArchiveLimits.defaults());

        var member = (ArchiveItem.Member) items.get(0);
        assertThat(member.lastModified()).isPresent();
        assertThat(member.lastModified().get()).isAfter(Instant.parse("2023-12-30T00:00:00Z"));
    }

    private List<ArchiveItem> expand(byte[] zip, String name, ArchiveLimits limits) {
        try (Stream<ArchiveItem> items = expander.expand(zip, name, 1, limits, null,
                new ExpansionBudget(Long.MAX_VALUE))) {
            return items.toList();
        }
    }
}
