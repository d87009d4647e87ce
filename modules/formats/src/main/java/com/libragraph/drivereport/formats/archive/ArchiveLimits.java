package com.libragraph.drivereport.formats.archive;

/**
 * Bounds enforced while expanding archives.
 *
 * @param maxDepth            deepest archive nesting level expanded; the top-level archive is level 1
 * @param maxMembers          most entries a single archive may declare
 * @param maxExpansionRatio   largest allowed uncompressed/compressed ratio for one entry
 * @param maxFileBytes        largest expanded size of one entry
 * @param spillThresholdBytes archives larger than this are read from a work-area file instead of memory
 */
public record ArchiveLimits(
        int maxDepth,
        int maxMembers,
        int maxExpansionRatio,
        long maxFileBytes,
        long spillThresholdBytes
) {
    /** Entries smaller than this are never rejected for their ratio. */
    public static final long RATIO_CHECK_THRESHOLD = 1024L * 1024L;

    public ArchiveLimits {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1, got: " + maxDepth);
        if (maxMembers < 1) throw new IllegalArgumentException("maxMembers must be >= 1, got: " + maxMembers);
        if (maxExpansionRatio < 1) {
            throw new IllegalArgumentException("maxExpansionRatio must be >= 1, got: " + maxExpansionRatio);
        }
        if (maxFileBytes < 1) throw new IllegalArgumentException("maxFileBytes must be >= 1, got: " + maxFileBytes);
    }

    public static ArchiveLimits defaults() {
        return new ArchiveLimits(3, 500, 100, 100L * 1024 * 1024, 4L * 1024 * 1024);
    }

    ArchiveLimits withMaxDepth(int depth) {
        return new ArchiveLimits(depth, maxMembers, maxExpansionRatio, maxFileBytes, spillThresholdBytes);
    }

    ArchiveLimits withMaxMembers(int members) {
        return new ArchiveLimits(maxDepth, members, maxExpansionRatio, maxFileBytes, spillThresholdBytes);
    }

    ArchiveLimits withSpillThresholdBytes(long threshold) {
        return new ArchiveLimits(maxDepth, maxMembers, maxExpansionRatio, maxFileBytes, threshold);
    }
}
