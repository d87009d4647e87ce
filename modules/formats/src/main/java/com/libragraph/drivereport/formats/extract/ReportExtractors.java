package com.libragraph.drivereport.formats.extract;

import com.libragraph.drivereport.formats.api.Extraction;
import com.libragraph.drivereport.formats.api.FileContext;
import com.libragraph.drivereport.formats.api.RawDriveBlock;
import com.libragraph.drivereport.formats.api.RawExtraction;
import com.libragraph.drivereport.formats.api.ReportExtractor;
import com.libragraph.drivereport.formats.model.CanonicalDriveRecord;
import com.libragraph.drivereport.formats.model.ParseError;
import com.libragraph.drivereport.formats.normalize.DriveRecordNormalizer;
import com.libragraph.drivereport.formats.normalize.NormalizedOutcome;
import com.libragraph.drivereport.types.SourceFormat;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects the extractor for a document format and normalizes what it finds.
 */
@ApplicationScoped
public class ReportExtractors {

    private final HtmlReportExtractor html;
    private final TextReportExtractor text;
    private final PdfReportExtractor pdf;
    private final DriveRecordNormalizer normalizer;

    @Inject
    public ReportExtractors(HtmlReportExtractor html, TextReportExtractor text, PdfReportExtractor pdf,
                            DriveRecordNormalizer normalizer) {
        this.html = html;
        this.text = text;
        this.pdf = pdf;
        this.normalizer = normalizer;
    }

    public ReportExtractor forFormat(SourceFormat format) {
        return switch (format) {
            case HTML -> html;
            case TEXT -> text;
            case PDF -> pdf;
            case ZIP, UNSUPPORTED -> throw new IllegalArgumentException("No extractor for format " + format);
        };
    }

    /**
     * Extracts and normalizes one document. Records and errors keep document order; errors from
     * the extractor come first, followed by blocks rejected during normalization.
     */
    public Extraction extract(SourceFormat format, byte[] content, FileContext context) {
        RawExtraction raw = forFormat(format).extract(content, context);
        List<CanonicalDriveRecord> records = new ArrayList<>(raw.blocks().size());
        List<ParseError> errors = new ArrayList<>(raw.errors());
        for (RawDriveBlock block : raw.blocks()) {
            NormalizedOutcome outcome = normalizer.normalize(block);
            if (outcome instanceof NormalizedOutcome.Normalized normalized) {
                records.add(normalized.record());
            } else if (outcome instanceof NormalizedOutcome.Rejected rejected) {
                errors.add(rejected.error());
            }
        }
        return new Extraction(records, errors);
    }
}
