package com.libragraph.drivereport.core.batch;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One uploaded file handed to the engine.
 *
 * @param lastModified upload modification time, used as the last timestamp fallback
 */
public record ReportInput(String fileName, byte[] content, Optional<Instant> lastModified) {

    public ReportInput {
        Objects.requireNonNull(fileName, "fileName cannot be null");
        Objects.requireNonNull(content, "content cannot be null");
        Objects.requireNonNull(lastModified, "lastModified cannot be null");
    }

    public static ReportInput of(String fileName, byte[] content) {
        return new ReportInput(fileName, content, Optional.empty());
    }

    public static ReportInput of(String fileName, byte[] content, Instant lastModified) {
        return new ReportInput(fileName, content, Optional.ofNullable(lastModified));
    }
}
