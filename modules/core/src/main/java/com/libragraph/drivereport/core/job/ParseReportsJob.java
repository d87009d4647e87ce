package com.libragraph.drivereport.core.job;

import com.libragraph.drivereport.core.batch.BatchCancelledException;
import com.libragraph.drivereport.core.batch.BatchOrchestrator;
import com.libragraph.drivereport.core.batch.CancellationToken;
import com.libragraph.drivereport.core.batch.ReportInput;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Entry point for the job runner. Runs one batch and reports how it ended; never retries,
 * persists or changes job state. Running the same inputs twice gives the same outcome.
 */
@ApplicationScoped
public class ParseReportsJob {

    private static final Logger log = Logger.getLogger(ParseReportsJob.class);

    @Inject
    BatchOrchestrator orchestrator;

    public JobOutcome execute(String jobId, List<ReportInput> inputs, CancellationToken token) {
        log.infof("Job %s: parsing %d files", jobId, inputs.size());
        try {
            return JobOutcome.of(orchestrator.run(inputs, token));
        } catch (BatchCancelledException e) {
            log.infof("Job %s cancelled: %s", jobId, e.getMessage());
            return JobOutcome.cancelled(e.getMessage());
        } catch (Exception e) {
            log.warnf(e, "Job %s failed", jobId);
            return JobOutcome.fail(e);
        }
    }
}
