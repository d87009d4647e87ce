package com.libragraph.drivereport.core.batch;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Counters describing one batch run.
 *
 * @param candidateDocuments documents handed to an extractor after sniffing and archive expansion
 * @param duplicatesMerged   records folded into another record of the same drive
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BatchSummary(
        int inputFiles,
        int candidateDocuments,
        int recordsExtracted,
        int uniqueDrives,
        int duplicatesMerged,
        int errorCount,
        int conflictCount,
        BatchOutcome outcome
) {}
