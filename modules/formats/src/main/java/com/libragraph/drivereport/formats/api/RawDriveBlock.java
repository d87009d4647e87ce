package com.libragraph.drivereport.formats.api;

import com.libragraph.drivereport.types.SourceFormat;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One drive's fields as found in a report, still in the dialect's own representation.
 *
 * @param fields            labeled values by field; absent when the report does not state them
 * @param smartRows         SMART table rows in report order
 * @param excerpt           bounded slice of the source around the block
 * @param location          where the block starts ("line 12", "section 2"), for error hints
 * @param dialectTimestamp  timestamp the dialect carries outside the labeled fields (PDF creation date)
 * @param sourceHash        BLAKE3-128 hex of the whole source file
 */
public record RawDriveBlock(
        SourceFormat format,
        String fileName,
        Map<ReportField, String> fields,
        List<RawSmartRow> smartRows,
        String excerpt,
        String location,
        Optional<Instant> dialectTimestamp,
        Optional<Instant> sourceModified,
        String sourceHash
) {
    public static final int MAX_EXCERPT_LENGTH = 2048;

    public RawDriveBlock {
        fields = fields.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(fields));
        smartRows = List.copyOf(smartRows);
        excerpt = bounded(excerpt);
    }

    public Optional<String> field(ReportField field) {
        return Optional.ofNullable(fields.get(field));
    }

    public boolean has(ReportField field) {
        return fields.containsKey(field);
    }

    private static String bounded(String excerpt) {
        if (excerpt == null) {
            return "";
        }
        return excerpt.length() <= MAX_EXCERPT_LENGTH ? excerpt : excerpt.substring(0, MAX_EXCERPT_LENGTH);
    }
}
