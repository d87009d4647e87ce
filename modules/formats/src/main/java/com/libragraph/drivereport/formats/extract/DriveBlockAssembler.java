package com.libragraph.drivereport.formats.extract;

import com.libragraph.drivereport.formats.api.RawDriveBlock;
import com.libragraph.drivereport.formats.api.RawSmartRow;
import com.libragraph.drivereport.formats.api.ReportField;
import com.libragraph.drivereport.types.SourceFormat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Accumulates the report lines of one drive block into labeled fields and SMART rows.
 * Not thread-safe; one instance per block.
 */
final class DriveBlockAssembler {

    private final Map<ReportField, LabeledFieldMatcher.Match> fields = new EnumMap<>(ReportField.class);
    private final List<RawSmartRow> smartRows = new ArrayList<>();
    private final StringBuilder excerpt = new StringBuilder();
    private SmartTableParser.Header table;

    void accept(String line) {
        appendExcerpt(line);
        if (line.isBlank()) {
            table = null;
            return;
        }
        if (table != null) {
            Optional<RawSmartRow> row = table.parseRow(line);
            if (row.isPresent()) {
                smartRows.add(row.get());
                return;
            }
            table = null;
        }
        Optional<SmartTableParser.Header> header = SmartTableParser.detectHeader(line);
        if (header.isPresent()) {
            table = header.get();
            return;
        }
        LabeledFieldMatcher.match(line).ifPresent(this::record);
    }

    void acceptAll(List<String> lines) {
        lines.forEach(this::accept);
    }

    /** Uses a value found outside the block (a report date in the preamble) when the block has none. */
    void inherit(ReportField field, Optional<String> value) {
        value.ifPresent(v -> fields.putIfAbsent(field,
                new LabeledFieldMatcher.Match(field, Integer.MAX_VALUE, "", v)));
    }

    boolean hasLabels() {
        return !fields.isEmpty() || !smartRows.isEmpty();
    }

    boolean has(ReportField field) {
        return fields.containsKey(field);
    }

    Optional<String> field(ReportField field) {
        LabeledFieldMatcher.Match match = fields.get(field);
        return match == null ? Optional.empty() : Optional.of(match.value());
    }

    RawDriveBlock build(SourceFormat format, String fileName, String location,
                        Optional<Instant> dialectTimestamp, Optional<Instant> sourceModified, String sourceHash) {
        Map<ReportField, String> values = new EnumMap<>(ReportField.class);
        fields.forEach((field, match) -> values.put(field, match.value()));
        return new RawDriveBlock(format, fileName, values, smartRows, excerpt.toString(), location,
                dialectTimestamp, sourceModified, sourceHash);
    }

    private void record(LabeledFieldMatcher.Match match) {
        if (match.value().isEmpty()) {
            return;
        }
        LabeledFieldMatcher.Match current = fields.get(match.field());
        if (current == null || match.rank() < current.rank()) {
            fields.put(match.field(), match);
        }
    }

    private void appendExcerpt(String line) {
        if (excerpt.length() >= RawDriveBlock.MAX_EXCERPT_LENGTH) {
            return;
        }
        if (excerpt.length() > 0) {
            excerpt.append('\n');
        }
        excerpt.append(line, 0, Math.min(line.length(), RawDriveBlock.MAX_EXCERPT_LENGTH - excerpt.length()));
    }
}
