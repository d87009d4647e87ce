package com.libragraph.drivereport.formats.extract;

import com.libragraph.drivereport.formats.api.ReportField;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Recognizes {@code label [. . .] (:|=) value} report lines by exact normalized label.
 *
 * <p>Every field has an ordered alias list; a lower rank means a more specific label, so
 * "Hard Disk Serial Number" outranks a plain "Serial" in the same block. Lines without a
 * colon or equals sign are accepted when a tab or a wide gap separates a known label from
 * its value, which is how two-column table and PDF rows arrive.
 */
public final class LabeledFieldMatcher {

    private static final int MAX_LABEL_LENGTH = 64;

    private static final Pattern DOT_LEADERS = Pattern.compile("\\.");
    private static final Pattern SEPARATORS = Pattern.compile("[-_]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern COLUMN_GAP = Pattern.compile("\\t|\\s{2,}");

    private static final Map<String, Alias> ALIASES = new HashMap<>();

    static {
        register(ReportField.SERIAL, "hard disk serial number", "vpd serial", "vpd serial number",
                "serial number", "serial no", "serial");
        register(ReportField.MODEL, "hard disk model id", "model id", "model number", "device model",
                "product", "model", "hard disk model");
        register(ReportField.VENDOR_INFORMATION, "vendor information", "vendor", "manufacturer");
        register(ReportField.INTERFACE, "interface", "interface type", "connection / interface type",
                "transport protocol", "transport");
        register(ReportField.CAPACITY, "total size", "capacity", "user capacity", "disk capacity", "size");
        register(ReportField.HEALTH, "health", "health score", "overall health", "health status",
                "overall health assessment", "smart overall health self assessment test result");
        register(ReportField.TEMPERATURE, "current temperature", "temperature", "drive temperature",
                "current drive temperature");
        register(ReportField.POWER_ON, "power on time", "power on hours", "power on", "powered on");
        register(ReportField.REALLOCATED_SECTORS, "reallocated sector count", "reallocated sectors count",
                "reallocated sectors", "reallocated sector", "reallocated", "allocated sections");
        register(ReportField.GROWN_DEFECTS, "number of grown defects", "grown defect list count",
                "grown defect count", "grown defects", "grown defect list", "grown defect", "defect count");
        register(ReportField.REPORT_DATE, "report date", "report created", "report creation time",
                "creation date", "date");
    }

    private LabeledFieldMatcher() {
    }

    /**
     * A recognized line.
     *
     * @param rank position of the matched alias in the field's alias list
     */
    public record Match(ReportField field, int rank, String label, String value) {
    }

    private record Alias(ReportField field, int rank) {
    }

    public static Optional<Match> match(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        int separator = separatorIndex(trimmed);
        if (separator > 0) {
            String value = trimmed.substring(separator + 1);
            while (value.startsWith(":")) {
                value = value.substring(1);
            }
            Optional<Match> match = lookup(trimmed.substring(0, separator), value);
            if (match.isPresent()) {
                return match;
            }
        }

        var gap = COLUMN_GAP.matcher(trimmed);
        if (gap.find() && gap.start() > 0) {
            return lookup(trimmed.substring(0, gap.start()), trimmed.substring(gap.end()));
        }
        return Optional.empty();
    }

    /** All labels known for a field, most specific first. */
    static List<String> aliases(ReportField field) {
        return ALIASES.entrySet().stream()
                .filter(e -> e.getValue().field() == field)
                .sorted(Map.Entry.comparingByValue((a, b) -> Integer.compare(a.rank(), b.rank())))
                .map(Map.Entry::getKey)
                .toList();
    }

    static String normalizeLabel(String label) {
        String normalized = label.toLowerCase(Locale.ROOT);
        normalized = DOT_LEADERS.matcher(normalized).replaceAll(" ");
        normalized = SEPARATORS.matcher(normalized).replaceAll(" ");
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ");
        return normalized.strip();
    }

    private static Optional<Match> lookup(String rawLabel, String rawValue) {
        if (rawLabel.length() > MAX_LABEL_LENGTH) {
            return Optional.empty();
        }
        String label = normalizeLabel(rawLabel);
        Alias alias = ALIASES.get(label);
        if (alias == null) {
            return Optional.empty();
        }
        return Optional.of(new Match(alias.field(), alias.rank(), label, rawValue.strip()));
    }

    private static int separatorIndex(String line) {
        int colon = line.indexOf(':');
        int equals = line.indexOf('=');
        if (colon < 0) return equals;
        if (equals < 0) return colon;
        return Math.min(colon, equals);
    }

    private static void register(ReportField field, String... labels) {
        for (int rank = 0; rank < labels.length; rank++) {
            ALIASES.put(normalizeLabel(labels[rank]), new Alias(field, rank));
        }
    }
}
