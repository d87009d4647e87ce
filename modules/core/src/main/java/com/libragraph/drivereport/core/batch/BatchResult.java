package com.libragraph.drivereport.core.batch;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.libragraph.drivereport.core.reconcile.ReconciliationGroup;
import com.libragraph.drivereport.formats.model.ParseError;

import java.util.List;

/**
 * Everything one batch produced.
 *
 * @param groups one group per drive, sorted by serial number
 * @param errors parse errors in input order
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BatchResult(List<ReconciliationGroup> groups, List<ParseError> errors, BatchSummary summary) {

    public BatchResult {
        groups = List.copyOf(groups);
        errors = List.copyOf(errors);
    }

    public BatchOutcome outcome() {
        return summary.outcome();
    }
}
