package com.libragraph.drivereport.core.batch;

import com.libragraph.drivereport.formats.archive.ArchiveLimits;

/**
 * Resource bounds of one batch run.
 *
 * @param maxFileBytes  largest single input or archive member; larger inputs become FILE_TOO_LARGE errors
 * @param maxBatchBytes largest total of input bytes, and separately of bytes expanded from archives
 * @param maxBatchFiles most top-level inputs, and most documents extracted in one batch
 */
public record EngineLimits(
        int maxArchiveDepth,
        int maxArchiveMembers,
        int maxExpansionRatio,
        long maxFileBytes,
        long maxBatchBytes,
        int maxBatchFiles,
        long spillThresholdBytes
) {
    public static final String MAX_BATCH_BYTES_KEY = "drivereport.limits.max-batch-bytes";
    public static final String MAX_BATCH_FILES_KEY = "drivereport.limits.max-batch-files";

    public EngineLimits {
        if (maxBatchBytes < 1) throw new IllegalArgumentException("maxBatchBytes must be >= 1, got: " + maxBatchBytes);
        if (maxBatchFiles < 1) throw new IllegalArgumentException("maxBatchFiles must be >= 1, got: " + maxBatchFiles);
    }

    public static EngineLimits defaults() {
        return new EngineLimits(3, 500, 100, 100L * 1024 * 1024, 200L * 1024 * 1024, 50, 4L * 1024 * 1024);
    }

    public ArchiveLimits archiveLimits() {
        return new ArchiveLimits(maxArchiveDepth, maxArchiveMembers, maxExpansionRatio, maxFileBytes,
                spillThresholdBytes);
    }
}
