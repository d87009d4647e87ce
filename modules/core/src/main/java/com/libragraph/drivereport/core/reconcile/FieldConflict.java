package com.libragraph.drivereport.core.reconcile;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Members of one group disagree on a field.
 *
 * @param chosen value the merged record carries, or null when it carries none
 * @param values every populated value, one per member, in merge-rank order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FieldConflict(DriveField field, String chosen, List<SourcedValue> values) {

    public FieldConflict {
        values = List.copyOf(values);
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SourcedValue(RecordSource source, String value) {
    }
}
