package com.libragraph.drivereport.core.batch;

import com.libragraph.drivereport.core.reconcile.DuplicateReconciler;
import com.libragraph.drivereport.core.reconcile.ReconciliationGroup;
import com.libragraph.drivereport.formats.api.DriveReportException;
import com.libragraph.drivereport.formats.api.Extraction;
import com.libragraph.drivereport.formats.api.FileContext;
import com.libragraph.drivereport.formats.api.ResourceExhaustedException;
import com.libragraph.drivereport.formats.archive.ArchiveItem;
import com.libragraph.drivereport.formats.archive.ExpansionBudget;
import com.libragraph.drivereport.formats.archive.WorkArea;
import com.libragraph.drivereport.formats.archive.ZipArchiveExpander;
import com.libragraph.drivereport.formats.extract.ReportExtractors;
import com.libragraph.drivereport.formats.model.CanonicalDriveRecord;
import com.libragraph.drivereport.formats.model.ParseError;
import com.libragraph.drivereport.formats.sniff.FormatSniffer;
import com.libragraph.drivereport.types.ParseErrorReason;
import com.libragraph.drivereport.types.SourceFormat;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Stream;

/**
 * Runs one batch of uploaded reports end to end: limit checks, sniffing, archive expansion,
 * parallel extraction and reconciliation.
 *
 * <p>Planning is synchronous and follows input order. Extraction runs on the injected pool and
 * its results are joined in planning order, so records and errors come out the same way for the
 * same input regardless of scheduling.
 */
@ApplicationScoped
public class BatchOrchestrator {

    private static final Logger log = Logger.getLogger(BatchOrchestrator.class);

    @Inject
    FormatSniffer sniffer;

    @Inject
    ZipArchiveExpander expander;

    @Inject
    ReportExtractors extractors;

    @Inject
    DuplicateReconciler reconciler;

    @Inject
    EngineConfig config;

    @Inject
    @Named("extractionExecutor")
    ExecutorService executor;

    public BatchResult run(List<ReportInput> inputs) {
        return run(inputs, CancellationToken.create());
    }

    /**
     * @throws ResourceExhaustedException when a batch-wide limit is exceeded
     * @throws BatchCancelledException    when the token is cancelled before all extractions start
     */
    public BatchResult run(List<ReportInput> inputs, CancellationToken token) {
        EngineLimits limits = config.limits();
        checkBatchLimits(inputs, limits);
        log.infof("Starting batch of %d files", inputs.size());

        int candidates = 0;
        List<Slot> results = new ArrayList<>();
        try (WorkArea workArea = config.newWorkArea()) {
            List<Slot> plan = plan(inputs, limits, workArea);
            candidates = (int) plan.stream().filter(Candidate.class::isInstance).count();
            if (candidates > limits.maxBatchFiles()) {
                throw new ResourceExhaustedException(EngineLimits.MAX_BATCH_FILES_KEY,
                        "Batch contains " + candidates + " documents after archive expansion, limit is "
                                + limits.maxBatchFiles());
            }
            results.addAll(extractAll(plan, token));
        }

        List<CanonicalDriveRecord> records = new ArrayList<>();
        List<ParseError> errors = new ArrayList<>();
        for (Slot slot : results) {
            if (slot instanceof Rejected rejected) {
                errors.add(rejected.error());
            } else if (slot instanceof Extracted extracted) {
                records.addAll(extracted.extraction().records());
                errors.addAll(extracted.extraction().errors());
            }
        }

        List<ReconciliationGroup> groups = reconciler.reconcile(records);
        BatchSummary summary = new BatchSummary(
                inputs.size(),
                candidates,
                records.size(),
                groups.size(),
                groups.stream().mapToInt(ReconciliationGroup::duplicateCount).sum(),
                errors.size(),
                groups.stream().mapToInt(g -> g.conflicts().size()).sum(),
                errors.isEmpty() ? BatchOutcome.COMPLETED : BatchOutcome.COMPLETED_WITH_ERRORS);

        log.infof("Batch finished: %d records, %d drives, %d errors (%s)",
                summary.recordsExtracted(), summary.uniqueDrives(), summary.errorCount(), summary.outcome());
        return new BatchResult(groups, errors, summary);
    }

    private static void checkBatchLimits(List<ReportInput> inputs, EngineLimits limits) {
        if (inputs.size() > limits.maxBatchFiles()) {
            throw new ResourceExhaustedException(EngineLimits.MAX_BATCH_FILES_KEY,
                    "Batch contains " + inputs.size() + " files, limit is " + limits.maxBatchFiles());
        }
        long total = 0;
        for (ReportInput input : inputs) {
            total += input.content().length;
        }
        if (total > limits.maxBatchBytes()) {
            throw new ResourceExhaustedException(EngineLimits.MAX_BATCH_BYTES_KEY,
                    "Batch contains " + total + " bytes, limit is " + limits.maxBatchBytes());
        }
    }

    private List<Slot> plan(List<ReportInput> inputs, EngineLimits limits, WorkArea workArea) {
        ExpansionBudget budget = new ExpansionBudget(limits.maxBatchBytes());
        List<Slot> plan = new ArrayList<>();
        for (ReportInput input : inputs) {
            SourceFormat format = sniffer.sniff(input.content(), input.fileName());
            if (input.content().length > limits.maxFileBytes()) {
                plan.add(new Rejected(ParseError.of(input.fileName(), format, ParseErrorReason.FILE_TOO_LARGE,
                        "File is " + input.content().length + " bytes, limit is " + limits.maxFileBytes())));
                continue;
            }
            switch (format) {
                case ZIP -> {
                    try (Stream<ArchiveItem> items = expander.expand(input.content(), input.fileName(), 1,
                            limits.archiveLimits(), workArea, budget)) {
                        items.forEachOrdered(item -> plan.add(planMember(item)));
                    }
                }
                case HTML, TEXT, PDF -> plan.add(new Candidate(input.fileName(), input.content(), format,
                        input.lastModified()));
                case UNSUPPORTED -> plan.add(unsupported(input.fileName()));
            }
        }
        return plan;
    }

    private static Slot planMember(ArchiveItem item) {
        if (item instanceof ArchiveItem.Failure failure) {
            return new Rejected(failure.error());
        }
        ArchiveItem.Member member = (ArchiveItem.Member) item;
        if (!member.format().isDocument()) {
            return unsupported(member.name());
        }
        return new Candidate(member.name(), member.content(), member.format(), member.lastModified());
    }

    private static Rejected unsupported(String fileName) {
        return new Rejected(ParseError.of(fileName, SourceFormat.UNSUPPORTED, ParseErrorReason.UNSUPPORTED_FORMAT,
                "Not a recognized drive report format"));
    }

    private List<Slot> extractAll(List<Slot> plan, CancellationToken token) {
        List<Future<Slot>> futures = new ArrayList<>(plan.size());
        for (Slot slot : plan) {
            if (slot instanceof Candidate candidate) {
                futures.add(executor.submit(() -> extract(candidate, token)));
            } else {
                futures.add(CompletableFuture.completedFuture(slot));
            }
        }

        List<Slot> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(false));
                throw new BatchCancelledException("Interrupted while waiting for extraction", e);
            } catch (ExecutionException e) {
                results.add(failedTask(plan.get(i), e.getCause()));
            }
        }
        if (results.stream().anyMatch(Skipped.class::isInstance)) {
            throw new BatchCancelledException("Batch cancelled before all documents were extracted");
        }
        return results;
    }

    private Slot extract(Candidate candidate, CancellationToken token) {
        if (token.isCancellationRequested()) {
            return Skipped.INSTANCE;
        }
        FileContext context = new FileContext(candidate.name(), candidate.lastModified());
        try {
            return new Extracted(extractors.extract(candidate.format(), candidate.content(), context));
        } catch (ResourceExhaustedException e) {
            throw e;
        } catch (RuntimeException | StackOverflowError e) {
            return malformed(candidate, e);
        }
    }

    /** A task that died outside the extractor's own handling fails its file, not the batch. */
    private static Slot failedTask(Slot planned, Throwable cause) {
        if (cause instanceof ResourceExhaustedException exhausted) {
            throw exhausted;
        }
        if (cause instanceof BatchCancelledException cancelled) {
            throw cancelled;
        }
        if (planned instanceof Candidate candidate) {
            return malformed(candidate, cause);
        }
        throw new DriveReportException("Extraction task failed", cause);
    }

    private static Slot malformed(Candidate candidate, Throwable cause) {
        log.warnf(cause, "Extractor failed on %s", candidate.name());
        return new Extracted(Extraction.failed(ParseError.of(candidate.name(), candidate.format(),
                ParseErrorReason.MALFORMED_CONTENT, "Extraction failed: " + describe(cause))));
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }

    /** One position in the batch plan, kept in input order. */
    private sealed interface Slot permits Candidate, Rejected, Extracted, Skipped {}

    private record Candidate(String name, byte[] content, SourceFormat format, Optional<Instant> lastModified)
            implements Slot {}

    private record Rejected(ParseError error) implements Slot {}

    private record Extracted(Extraction extraction) implements Slot {}

    private enum Skipped implements Slot { INSTANCE }
}
