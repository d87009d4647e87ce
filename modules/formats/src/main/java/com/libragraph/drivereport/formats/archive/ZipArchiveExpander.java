package com.libragraph.drivereport.formats.archive;

import com.libragraph.drivereport.formats.api.FileContext;
import com.libragraph.drivereport.formats.model.ParseError;
import com.libragraph.drivereport.formats.sniff.FormatSniffer;
import com.libragraph.drivereport.types.ParseErrorReason;
import com.libragraph.drivereport.types.SourceFormat;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.jboss.logging.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Expands ZIP archives into report candidates, recursing into nested archives.
 *
 * <p>Directories, hidden entries and {@code __MACOSX/} resource forks are skipped. Limit
 * violations become {@link ArchiveItem.Failure}s for the member or archive concerned; only the
 * batch-wide {@link ExpansionBudget} aborts expansion.
 */
@ApplicationScoped
public class ZipArchiveExpander {

    private static final Logger log = Logger.getLogger(ZipArchiveExpander.class);

    private static final int COPY_BUFFER_SIZE = 8192;

    private final FormatSniffer sniffer;

    @Inject
    public ZipArchiveExpander(FormatSniffer sniffer) {
        this.sniffer = sniffer;
    }

    /**
     * Lazily expands one archive. Closing the returned stream releases the archive.
     *
     * @param depth     nesting level of this archive; a top-level upload is 1
     * @param workArea  where archives above the spill threshold are written, or null to stay in memory
     */
    public Stream<ArchiveItem> expand(byte[] archive, String archiveName, int depth,
                                      ArchiveLimits limits, WorkArea workArea, ExpansionBudget budget) {
        ZipFile zipFile;
        try {
            zipFile = open(archive, archiveName, limits, workArea);
        } catch (IOException e) {
            log.debugf(e, "Cannot open archive %s", archiveName);
            return Stream.of(failure(archiveName, ParseErrorReason.ARCHIVE_CORRUPT,
                    "Unreadable ZIP archive: " + e.getMessage()));
        }

        List<ZipArchiveEntry> entries = Collections.list(zipFile.getEntries());
        if (entries.size() > limits.maxMembers()) {
            closeArchive(zipFile, archiveName);
            return Stream.of(failure(archiveName, ParseErrorReason.ARCHIVE_CORRUPT,
                    "Archive declares " + entries.size() + " entries, limit is " + limits.maxMembers()));
        }

        log.debugf("Expanding %s (depth %d, %d entries)", archiveName, depth, entries.size());
        return entries.stream()
                .filter(entry -> !isSkipped(entry))
                .flatMap(entry -> expandEntry(zipFile, entry, archiveName, depth, limits, workArea, budget))
                .onClose(() -> closeArchive(zipFile, archiveName));
    }

    private Stream<ArchiveItem> expandEntry(ZipFile zipFile, ZipArchiveEntry entry, String archiveName, int depth,
                                            ArchiveLimits limits, WorkArea workArea, ExpansionBudget budget) {
        String memberName = FileContext.memberName(archiveName, entry.getName());

        if (!zipFile.canReadEntryData(entry)) {
            return Stream.of(failure(memberName, ParseErrorReason.ARCHIVE_CORRUPT,
                    "Entry is encrypted or uses an unsupported compression method"));
        }
        if (entry.getSize() > limits.maxFileBytes()) {
            return Stream.of(failure(memberName, ParseErrorReason.ARCHIVE_CORRUPT,
                    "Entry declares " + entry.getSize() + " bytes, limit is " + limits.maxFileBytes()));
        }

        byte[] content;
        try {
            content = readBounded(zipFile, entry, limits.maxFileBytes());
        } catch (IOException e) {
            return Stream.of(failure(memberName, ParseErrorReason.ARCHIVE_CORRUPT,
                    "Unreadable entry: " + e.getMessage()));
        }
        if (content == null) {
            return Stream.of(failure(memberName, ParseErrorReason.ARCHIVE_CORRUPT,
                    "Entry expands beyond " + limits.maxFileBytes() + " bytes"));
        }
        long compressed = entry.getCompressedSize();
        if (content.length > ArchiveLimits.RATIO_CHECK_THRESHOLD && compressed > 0
                && content.length / compressed > limits.maxExpansionRatio()) {
            return Stream.of(failure(memberName, ParseErrorReason.ARCHIVE_CORRUPT,
                    "Expansion ratio " + (content.length / compressed) + " exceeds limit of "
                            + limits.maxExpansionRatio()));
        }

        budget.charge(content.length, memberName);

        SourceFormat format = sniffer.sniff(content, entry.getName());
        if (format != SourceFormat.ZIP) {
            return Stream.of(new ArchiveItem.Member(memberName, content, format, lastModified(entry)));
        }
        if (depth + 1 > limits.maxDepth()) {
            return Stream.of(failure(memberName, ParseErrorReason.NESTED_ARCHIVE_DEPTH_EXCEEDED,
                    "Archive nested " + (depth + 1) + " levels deep, limit is " + limits.maxDepth()));
        }
        return expand(content, memberName, depth + 1, limits, workArea, budget);
    }

    private static ZipFile open(byte[] archive, String archiveName, ArchiveLimits limits, WorkArea workArea)
            throws IOException {
        if (workArea != null && archive.length > limits.spillThresholdBytes()) {
            Path spilled = workArea.newFile("archive-", ".zip");
            Files.write(spilled, archive);
            log.debugf("Spilled %s (%d bytes) to %s", archiveName, archive.length, spilled);
            return ZipFile.builder().setFile(spilled.toFile()).get();
        }
        return ZipFile.builder().setSeekableByteChannel(new SeekableInMemoryByteChannel(archive)).get();
    }

    /** Returns null when the entry produces more than {@code maxBytes}. */
    private static byte[] readBounded(ZipFile zipFile, ZipArchiveEntry entry, long maxBytes) throws IOException {
        try (InputStream in = zipFile.getInputStream(entry)) {
            ByteArrayOutputStream out = new ByteArrayOutputStream(
                    entry.getSize() > 0 ? (int) Math.min(entry.getSize(), COPY_BUFFER_SIZE * 16L) : COPY_BUFFER_SIZE);
            byte[] buffer = new byte[COPY_BUFFER_SIZE];
            long total = 0;
            int read;
            while ((read = in.read(buffer)) != -1) {
                total += read;
                if (total > maxBytes) {
                    return null;
                }
                out.write(buffer, 0, read);
            }
            return out.toByteArray();
        }
    }

    static boolean isSkipped(ZipArchiveEntry entry) {
        if (entry.isDirectory()) {
            return true;
        }
        String name = entry.getName();
        if (name.startsWith("__MACOSX/") || name.contains("/__MACOSX/")) {
            return true;
        }
        for (String segment : name.split("/")) {
            if (segment.startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    private static Optional<Instant> lastModified(ZipArchiveEntry entry) {
        FileTime time = entry.getLastModifiedTime();
        if (time == null || time.toMillis() <= 0) {
            return Optional.empty();
        }
        return Optional.of(time.toInstant());
    }

    private static ArchiveItem failure(String name, ParseErrorReason reason, String detail) {
        return new ArchiveItem.Failure(ParseError.of(name, SourceFormat.ZIP, reason, detail));
    }

    private static void closeArchive(ZipFile zipFile, String archiveName) {
        try {
            zipFile.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close archive " + archiveName, e);
        }
    }
}
