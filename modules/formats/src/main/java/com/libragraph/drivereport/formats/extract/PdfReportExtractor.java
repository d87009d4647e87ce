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
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Extractor for PDF drive reports.
 *
 * <p>Glyph positions of each page are grouped into rows by baseline proximity; wide horizontal
 * gaps inside a row become tab column breaks. The rows of all pages then go through the same
 * block and label matching as text reports, except that block headers are optional: a document
 * without them describes one drive. Pages without a text layer fail on their own.
 */
@ApplicationScoped
public class PdfReportExtractor implements ReportExtractor {

    private static final Logger log = Logger.getLogger(PdfReportExtractor.class);

    @Override
    public SourceFormat format() {
        return SourceFormat.PDF;
    }

    @Override
    public RawExtraction extract(byte[] content, FileContext context) {
        try (PDDocument document = Loader.loadPDF(content)) {
            if (document.isEncrypted()) {
                return RawExtraction.failed(malformed(context, "Encrypted PDF documents are not supported", null));
            }
            return extract(document, content, context);
        } catch (IOException e) {
            log.debugf(e, "Cannot read PDF %s", context.fileName());
            return RawExtraction.failed(malformed(context, "Unreadable PDF document: " + e.getMessage(), null));
        }
    }

    private RawExtraction extract(PDDocument document, byte[] content, FileContext context) {
        Optional<Instant> created = creationDate(document);
        List<String> lines = new ArrayList<>();
        List<Integer> linePages = new ArrayList<>();
        List<ParseError> errors = new ArrayList<>();

        int pageCount = document.getNumberOfPages();
        for (int page = 1; page <= pageCount; page++) {
            try {
                List<String> rows = PageLayout.rows(document, page);
                if (rows.isEmpty()) {
                    errors.add(malformed(context, "Page has no text layer; layout cannot be reconstructed",
                            "page " + page));
                    continue;
                }
                for (String row : rows) {
                    lines.add(row);
                    linePages.add(page);
                }
            } catch (IOException | RuntimeException e) {
                log.debugf(e, "Layout reconstruction failed for %s page %d", context.fileName(), page);
                errors.add(malformed(context, "Layout reconstruction failed: " + e.getMessage(), "page " + page));
            }
        }

        List<BlockSplitter.Segment> segments = BlockSplitter.split(lines);
        Optional<String> reportDate = Optional.empty();
        if (segments.isEmpty()) {
            segments = List.of(new BlockSplitter.Segment(0, lines.size()));
        } else {
            DriveBlockAssembler preamble = new DriveBlockAssembler();
            preamble.acceptAll(lines.subList(0, segments.get(0).start()));
            reportDate = preamble.field(ReportField.REPORT_DATE);
        }

        String sourceHash = ContentHash.of(content).toHex();
        List<RawDriveBlock> blocks = new ArrayList<>();
        for (BlockSplitter.Segment segment : segments) {
            if (segment.start() >= segment.end()) {
                continue;
            }
            DriveBlockAssembler assembler = new DriveBlockAssembler();
            assembler.acceptAll(lines.subList(segment.start(), segment.end()));
            if (!assembler.hasLabels()) {
                continue;
            }
            assembler.inherit(ReportField.REPORT_DATE, reportDate);
            blocks.add(assembler.build(SourceFormat.PDF, context.fileName(),
                    "page " + linePages.get(segment.start()), created, context.lastModified(), sourceHash));
        }

        if (blocks.isEmpty() && errors.isEmpty()) {
            errors.add(malformed(context, "No drive fields found in PDF layout", null));
        }
        return new RawExtraction(blocks, errors);
    }

    private static Optional<Instant> creationDate(PDDocument document) {
        Calendar created = document.getDocumentInformation().getCreationDate();
        return created == null ? Optional.empty() : Optional.of(created.toInstant());
    }

    private static ParseError malformed(FileContext context, String detail, String offsetHint) {
        return ParseError.at(context.fileName(), SourceFormat.PDF, ParseErrorReason.MALFORMED_CONTENT,
                detail, offsetHint);
    }

    /**
     * Rebuilds text rows of one page from glyph positions.
     */
    static final class PageLayout extends PDFTextStripper {

        /** Gaps wider than this many space widths separate columns. */
        private static final float COLUMN_GAP_SPACES = 3.0f;
        /** Gaps wider than this fraction of a space width are word breaks. */
        private static final float WORD_GAP_SPACES = 0.3f;

        private final List<TextPosition> positions = new ArrayList<>();

        private PageLayout() throws IOException {
            setSortByPosition(true);
        }

        static List<String> rows(PDDocument document, int page) throws IOException {
            PageLayout layout = new PageLayout();
            layout.setStartPage(page);
            layout.setEndPage(page);
            layout.getText(document);
            return layout.buildRows();
        }

        @Override
        protected void processTextPosition(TextPosition text) {
            positions.add(text);
        }

        private List<String> buildRows() {
            List<TextPosition> sorted = new ArrayList<>(positions);
            sorted.sort(Comparator.comparingDouble(TextPosition::getYDirAdj)
                    .thenComparingDouble(TextPosition::getXDirAdj));

            List<List<TextPosition>> rows = new ArrayList<>();
            List<TextPosition> row = new ArrayList<>();
            float rowY = Float.NaN;
            for (TextPosition position : sorted) {
                float tolerance = Math.max(1.5f, position.getHeightDir() * 0.4f);
                if (!row.isEmpty() && Math.abs(position.getYDirAdj() - rowY) > tolerance) {
                    rows.add(row);
                    row = new ArrayList<>();
                }
                if (row.isEmpty()) {
                    rowY = position.getYDirAdj();
                }
                row.add(position);
            }
            if (!row.isEmpty()) {
                rows.add(row);
            }

            List<String> lines = new ArrayList<>(rows.size());
            for (List<TextPosition> r : rows) {
                String line = render(r);
                if (!line.isBlank()) {
                    lines.add(line);
                }
            }
            return lines;
        }

        private static String render(List<TextPosition> row) {
            row.sort(Comparator.comparingDouble(TextPosition::getXDirAdj));
            StringBuilder sb = new StringBuilder();
            TextPosition previous = null;
            for (TextPosition position : row) {
                String glyph = position.getUnicode();
                if (glyph == null) {
                    continue;
                }
                if (previous != null) {
                    float gap = position.getXDirAdj() - (previous.getXDirAdj() + previous.getWidthDirAdj());
                    float space = spaceWidth(previous);
                    if (gap > space * COLUMN_GAP_SPACES) {
                        trimTrailingSpace(sb);
                        sb.append('\t');
                    } else if (gap > space * WORD_GAP_SPACES && !endsWithWhitespace(sb) && !glyph.isBlank()) {
                        sb.append(' ');
                    }
                }
                if (!(glyph.isBlank() && endsWithWhitespace(sb))) {
                    sb.append(glyph);
                }
                previous = position;
            }
            return sb.toString().strip();
        }

        private static float spaceWidth(TextPosition position) {
            float width = position.getWidthOfSpace();
            if (Float.isNaN(width) || width <= 0) {
                width = position.getFontSizeInPt() * 0.25f;
            }
            return Math.max(width, 1.0f);
        }

        private static boolean endsWithWhitespace(StringBuilder sb) {
            return sb.length() > 0 && Character.isWhitespace(sb.charAt(sb.length() - 1));
        }

        private static void trimTrailingSpace(StringBuilder sb) {
            while (sb.length() > 0 && sb.charAt(sb.length() - 1) == ' ') {
                sb.setLength(sb.length() - 1);
            }
        }
    }
}
