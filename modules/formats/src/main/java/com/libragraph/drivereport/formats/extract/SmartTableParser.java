package com.libragraph.drivereport.formats.extract;

import com.libragraph.drivereport.formats.api.RawSmartRow;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Recognizes a SMART attribute table by its header line and parses the rows that follow.
 *
 * <p>Cells are tab separated (HTML and PDF rows) or separated by runs of two or more spaces
 * (text reports). Headers that only split on single spaces fall back to whitespace splitting,
 * which suits tables whose attribute names use underscores.
 */
public final class SmartTableParser {

    private static final Pattern TAB = Pattern.compile("\\t");
    private static final Pattern WIDE_GAP = Pattern.compile("\\s{2,}");
    private static final Pattern ANY_SPACE = Pattern.compile("\\s+");

    private static final Set<String> ID_HEADERS = Set.of("no", "no.", "nr", "nr.", "id", "id#", "#");
    private static final Set<String> VALUE_HEADERS = Set.of("value", "current", "norm", "normalized");
    private static final Set<String> RAW_HEADERS = Set.of("data", "raw", "raw value", "raw data");
    private static final Set<String> STATUS_HEADERS = Set.of("status", "state", "condition");

    private SmartTableParser() {
    }

    enum Splitting {
        TAB, WIDE_GAP, WHITESPACE
    }

    /**
     * Column layout of a detected attribute table. Missing columns are -1.
     *
     * @param hexRaw true when the raw column is the hexadecimal {@code Data} column
     */
    public record Header(
            Splitting splitting,
            int idColumn,
            int nameColumn,
            int valueColumn,
            int worstColumn,
            int thresholdColumn,
            int rawColumn,
            int statusColumn,
            boolean hexRaw
    ) {

        /**
         * Parses one table row; empty when the line is not a row of this table.
         */
        public Optional<RawSmartRow> parseRow(String line) {
            if (line == null || line.isBlank()) {
                return Optional.empty();
            }
            List<String> cells = split(line, splitting);
            Integer id = parseId(cell(cells, idColumn));
            if (id == null) {
                return Optional.empty();
            }
            String name = cell(cells, nameColumn);
            return Optional.of(new RawSmartRow(
                    id,
                    name == null ? "" : name,
                    cell(cells, valueColumn),
                    cell(cells, worstColumn),
                    cell(cells, thresholdColumn),
                    cell(cells, rawColumn),
                    hexRaw,
                    cell(cells, statusColumn)
            ));
        }
    }

    public static Optional<Header> detectHeader(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        Splitting splitting = line.contains("\t") ? Splitting.TAB : Splitting.WIDE_GAP;
        List<String> cells = split(line, splitting);
        if (cells.size() < 3 && splitting == Splitting.WIDE_GAP) {
            splitting = Splitting.WHITESPACE;
            cells = split(line, splitting);
        }
        if (cells.size() < 3) {
            return Optional.empty();
        }

        int id = -1, name = -1, value = -1, worst = -1, threshold = -1, raw = -1, status = -1;
        boolean hexRaw = false;
        for (int i = 0; i < cells.size(); i++) {
            String header = cells.get(i).toLowerCase(Locale.ROOT).replace('_', ' ').strip();
            if (id < 0 && ID_HEADERS.contains(header)) {
                id = i;
            } else if (name < 0 && header.startsWith("attribute")) {
                name = i;
            } else if (value < 0 && VALUE_HEADERS.contains(header)) {
                value = i;
            } else if (worst < 0 && header.equals("worst")) {
                worst = i;
            } else if (threshold < 0 && header.startsWith("thre")) {
                threshold = i;
            } else if (raw < 0 && RAW_HEADERS.contains(header)) {
                raw = i;
                hexRaw = header.equals("data");
            } else if (status < 0 && STATUS_HEADERS.contains(header)) {
                status = i;
            }
        }

        boolean hasDataColumn = value >= 0 || worst >= 0 || threshold >= 0 || raw >= 0 || status >= 0;
        if (id < 0 || name < 0 || !hasDataColumn) {
            return Optional.empty();
        }
        return Optional.of(new Header(splitting, id, name, value, worst, threshold, raw, status, hexRaw));
    }

    static List<String> split(String line, Splitting splitting) {
        String trimmed = splitting == Splitting.TAB ? line : line.strip();
        String[] parts = switch (splitting) {
            case TAB -> TAB.split(trimmed, -1);
            case WIDE_GAP -> WIDE_GAP.split(trimmed);
            case WHITESPACE -> ANY_SPACE.split(trimmed);
        };
        return Arrays.stream(parts).map(String::strip).toList();
    }

    private static String cell(List<String> cells, int column) {
        if (column < 0 || column >= cells.size()) {
            return null;
        }
        String value = cells.get(column);
        return value.isEmpty() || value.equals("-") ? null : value;
    }

    private static Integer parseId(String cell) {
        if (cell == null) {
            return null;
        }
        try {
            if (cell.startsWith("0x") || cell.startsWith("0X")) {
                return Integer.parseInt(cell.substring(2), 16);
            }
            return Integer.parseInt(cell);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
