package com.libragraph.drivereport.core.reconcile;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.libragraph.drivereport.formats.model.CanonicalDriveRecord;

import java.util.List;

/**
 * Records judged to describe the same physical drive, merged into one.
 *
 * @param members records in merge-rank order; the first is the primary source
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReconciliationGroup(
        String serialNumber,
        List<CanonicalDriveRecord> members,
        MergedRecord merged,
        List<FieldConflict> conflicts
) {
    public ReconciliationGroup {
        members = List.copyOf(members);
        conflicts = List.copyOf(conflicts);
    }

    /** Distinct source file names of the members, in merge-rank order. */
    @JsonIgnore
    public List<String> sourceFileNames() {
        return members.stream().map(CanonicalDriveRecord::sourceFileName).distinct().toList();
    }

    @JsonIgnore
    public int duplicateCount() {
        return members.size() - 1;
    }
}
