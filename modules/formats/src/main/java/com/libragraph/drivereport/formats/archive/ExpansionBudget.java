package com.libragraph.drivereport.formats.archive;

import com.libragraph.drivereport.formats.api.ResourceExhaustedException;

/**
 * Batch-wide account of bytes produced by archive expansion. Charged during synchronous
 * planning only, so it is not thread-safe.
 */
public final class ExpansionBudget {

    public static final String LIMIT_KEY = "drivereport.limits.max-batch-bytes";

    private final long maxBytes;
    private long used;

    public ExpansionBudget(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    /**
     * Records {@code bytes} more expanded content.
     *
     * @throws ResourceExhaustedException when the batch total passes the limit
     */
    public void charge(long bytes, String source) {
        used += bytes;
        if (used > maxBytes) {
            throw new ResourceExhaustedException(LIMIT_KEY,
                    "Expanded content exceeds batch limit of " + maxBytes + " bytes at " + source);
        }
    }

    public long used() {
        return used;
    }
}
