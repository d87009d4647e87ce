package com.libragraph.drivereport.formats.extract;

import com.libragraph.drivereport.formats.api.FileContext;
import com.libragraph.drivereport.formats.api.RawDriveBlock;
import com.libragraph.drivereport.formats.api.RawExtraction;
import com.libragraph.drivereport.formats.api.ReportExtractor;
import com.libragraph.drivereport.formats.api.ReportField;
import com.libragraph.drivereport.formats.model.ParseError;
import com.libragraph.drivereport.types.ParseErrorReason;
import com.libragraph.drivereport.types.SourceFormat;
import com.libragraph.drivereport.util.ContentHash;
import com.libragraph.drivereport.util.TextDecoding;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extractor for line-oriented text reports (Hard Disk Sentinel and SCSI Toolbox text exports).
 *
 * <p>Drive blocks start at an underlined block header. A report without any block header is
 * malformed. Lines before the first header only contribute a report date. Headers followed by
 * no recognized field are skipped.
 */
@ApplicationScoped
public class TextReportExtractor implements ReportExtractor {

    private static final Logger log = Logger.getLogger(TextReportExtractor.class);

    @Override
    public SourceFormat format() {
        return SourceFormat.TEXT;
    }

    @Override
    public RawExtraction extract(byte[] content, FileContext context) {
        TextDecoding.Decoded decoded = TextDecoding.decode(content);
        log.debugf("Decoded %s as %s (tried %s)", context.fileName(), decoded.charset(), decoded.attempted());

        List<String> lines = decoded.text().lines().toList();
        List<BlockSplitter.Segment> segments = BlockSplitter.split(lines);
        if (segments.isEmpty()) {
            return RawExtraction.failed(ParseError.of(context.fileName(), SourceFormat.TEXT,
                    ParseErrorReason.MALFORMED_CONTENT,
                    "No drive block header (Hard Disk Summary, Drive Information, Device Information) found"));
        }

        DriveBlockAssembler preamble = new DriveBlockAssembler();
        preamble.acceptAll(lines.subList(0, segments.get(0).start()));
        Optional<String> reportDate = preamble.field(ReportField.REPORT_DATE);

        String sourceHash = ContentHash.of(content).toHex();
        List<RawDriveBlock> blocks = new ArrayList<>(segments.size());
        for (BlockSplitter.Segment segment : segments) {
            DriveBlockAssembler assembler = new DriveBlockAssembler();
            assembler.acceptAll(lines.subList(segment.start(), segment.end()));
            if (!assembler.hasLabels()) {
                continue;
            }
            assembler.inherit(ReportField.REPORT_DATE, reportDate);
            blocks.add(assembler.build(SourceFormat.TEXT, context.fileName(), "line " + (segment.start() + 1),
                    Optional.empty(), context.lastModified(), sourceHash));
        }
        if (blocks.isEmpty()) {
            return RawExtraction.failed(ParseError.of(context.fileName(), SourceFormat.TEXT,
                    ParseErrorReason.MALFORMED_CONTENT, "Drive block headers carry no drive fields"));
        }
        return new RawExtraction(blocks, List.of());
    }
}
