package com.libragraph.drivereport.core.reconcile;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Which member record a merged field was taken from.
 *
 * @param populated false when no member carries the field; the source is then the primary record
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FieldResolution(DriveField field, RecordSource source, boolean populated) {
}
