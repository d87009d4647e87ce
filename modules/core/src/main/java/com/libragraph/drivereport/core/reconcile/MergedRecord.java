package com.libragraph.drivereport.core.reconcile;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.libragraph.drivereport.formats.model.CanonicalDriveRecord;

import java.util.List;
import java.util.Optional;

/**
 * The single record derived from a reconciliation group, with per-field provenance.
 *
 * @param primarySource highest-ranked member; provenance fields of {@code record} come from it
 * @param resolutions   one entry per {@link DriveField}, in declaration order
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MergedRecord(
        CanonicalDriveRecord record,
        RecordSource primarySource,
        List<FieldResolution> resolutions
) {
    public MergedRecord {
        resolutions = List.copyOf(resolutions);
    }

    public Optional<FieldResolution> resolution(DriveField field) {
        return resolutions.stream().filter(r -> r.field() == field).findFirst();
    }
}
