package com.libragraph.drivereport.core.reconcile;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.libragraph.drivereport.formats.model.CanonicalDriveRecord;
import com.libragraph.drivereport.types.SourceFormat;

import java.time.Instant;

/**
 * Identifies the report a record was extracted from, for audit trails.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RecordSource(
        String fileName,
        SourceFormat format,
        Instant extractedAt,
        String sourceHash
) {
    public static RecordSource of(CanonicalDriveRecord record) {
        return new RecordSource(record.sourceFileName(), record.sourceFormat(), record.extractedAt(),
                record.sourceHash());
    }
}
