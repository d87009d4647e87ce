package com.libragraph.drivereport.core.job;

import com.libragraph.drivereport.core.batch.BatchResult;

public sealed interface JobOutcome {

    record Completed(BatchResult result) implements JobOutcome {}

    record CompletedWithErrors(BatchResult result) implements JobOutcome {}

    record Failed(JobError error) implements JobOutcome {}

    record Cancelled(String reason) implements JobOutcome {}

    static JobOutcome of(BatchResult result) {
        return switch (result.outcome()) {
            case COMPLETED -> new Completed(result);
            case COMPLETED_WITH_ERRORS -> new CompletedWithErrors(result);
        };
    }

    static JobOutcome fail(Throwable t) {
        return new Failed(JobError.from(t));
    }

    static JobOutcome cancelled(String reason) {
        return new Cancelled(reason);
    }
}
