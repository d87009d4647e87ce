package com.libragraph.drivereport.formats.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits report lines into drive blocks at underlined block headers such as
 * <pre>
 * Hard Disk Summary
 * -----------------
 * </pre>
 */
final class BlockSplitter {

    private static final Pattern BLOCK_HEADER = Pattern.compile(
            "(?i)^\\s*(hard\\s+disk\\s+summary|drive\\s+information|device\\s+information)\\s*:?\\s*$");
    private static final Pattern UNDERLINE = Pattern.compile("^\\s*[-=]{3,}[-=\\s]*$");

    private BlockSplitter() {
    }

    /**
     * Half-open line range {@code [start, end)} of one block; {@code start} is the header line.
     */
    record Segment(int start, int end) {
    }

    /**
     * Returns the header-delimited blocks, or an empty list when the lines carry no block header.
     */
    static List<Segment> split(List<String> lines) {
        List<Integer> starts = new ArrayList<>();
        for (int i = 0; i + 1 < lines.size(); i++) {
            if (isBlockHeader(lines.get(i)) && UNDERLINE.matcher(lines.get(i + 1)).matches()) {
                starts.add(i);
            }
        }
        List<Segment> segments = new ArrayList<>(starts.size());
        for (int i = 0; i < starts.size(); i++) {
            int end = i + 1 < starts.size() ? starts.get(i + 1) : lines.size();
            segments.add(new Segment(starts.get(i), end));
        }
        return segments;
    }

    static boolean isBlockHeader(String line) {
        return BLOCK_HEADER.matcher(line).matches();
    }
}
