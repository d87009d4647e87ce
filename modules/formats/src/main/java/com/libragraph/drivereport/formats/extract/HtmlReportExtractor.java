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
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeFilter;
import org.jsoup.select.NodeTraversor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extractor for Hard Disk Sentinel HTML exports.
 *
 * <p>Drive sections are found structurally, in order of preference:
 * <ol>
 *   <li>elements whose class or id mentions a disk or drive (outermost ones; a container
 *       holding several serial-bearing sections is split into them),</li>
 *   <li>{@code h1}-{@code h4} headings naming a disk, together with their following siblings,</li>
 *   <li>the whole body, when it carries any known label.</li>
 * </ol>
 * Each section is flattened to report lines: two-cell table rows become {@code key: value},
 * wider rows become tab-joined cells, block elements become lines of their own.
 */
@ApplicationScoped
public class HtmlReportExtractor implements ReportExtractor {

    private static final Logger log = Logger.getLogger(HtmlReportExtractor.class);

    private static final String SECTION_SELECTOR =
            "[class*=disk], [class*=drive], [id*=disk], [id*=drive]";

    private static final Pattern DISK_HEADING = Pattern.compile(
            "(?i)\\b(hard\\s+disk\\s+summary|hard\\s+disk\\s+\\d+|physical\\s+disk|disk\\s*#?\\d+|drive\\s*#?\\d+)");

    private static final Pattern HEADING_TAG = Pattern.compile("h[1-4]");

    @Override
    public SourceFormat format() {
        return SourceFormat.HTML;
    }

    @Override
    public RawExtraction extract(byte[] content, FileContext context) {
        TextDecoding.Decoded decoded = TextDecoding.decode(content);
        Document document = Jsoup.parse(decoded.text());
        Element body = document.body();

        DriveBlockAssembler page = new DriveBlockAssembler();
        page.acceptAll(HtmlLines.of(body));
        Optional<String> reportDate = page.field(ReportField.REPORT_DATE);

        List<List<String>> sections = markedSections(body);
        if (sections.isEmpty()) {
            sections = headingSections(body);
        }
        if (sections.isEmpty() && page.hasLabels()) {
            sections = List.of(HtmlLines.of(body));
        }

        String sourceHash = ContentHash.of(content).toHex();
        List<RawDriveBlock> blocks = new ArrayList<>();
        int index = 0;
        for (List<String> section : sections) {
            index++;
            DriveBlockAssembler assembler = new DriveBlockAssembler();
            assembler.acceptAll(section);
            if (!assembler.hasLabels()) {
                continue;
            }
            assembler.inherit(ReportField.REPORT_DATE, reportDate);
            blocks.add(assembler.build(SourceFormat.HTML, context.fileName(), "section " + index,
                    Optional.empty(), context.lastModified(), sourceHash));
        }

        if (blocks.isEmpty()) {
            return RawExtraction.failed(ParseError.of(context.fileName(), SourceFormat.HTML,
                    ParseErrorReason.MALFORMED_CONTENT, "No drive sections found in HTML report"));
        }
        log.debugf("Found %d drive sections in %s", blocks.size(), context.fileName());
        return new RawExtraction(blocks, List.of());
    }

    private static List<List<String>> markedSections(Element body) {
        Set<Element> marked = identitySet(body.select(SECTION_SELECTOR));
        List<List<String>> sections = new ArrayList<>();
        for (Element section : outermost(body, marked)) {
            collectSections(section, marked, sections);
        }
        return sections;
    }

    private static void collectSections(Element section, Set<Element> marked, List<List<String>> sections) {
        List<Element> inner = outermost(section, marked);
        long serialBearing = inner.stream().filter(HtmlReportExtractor::hasSerial).count();
        if (serialBearing >= 2) {
            for (Element child : inner) {
                collectSections(child, marked, sections);
            }
            return;
        }
        sections.add(HtmlLines.of(section));
    }

    /** Marked descendants of {@code root} that have no marked ancestor below {@code root}. */
    private static List<Element> outermost(Element root, Set<Element> marked) {
        List<Element> result = new ArrayList<>();
        for (Element candidate : root.getAllElements()) {
            if (candidate == root || !marked.contains(candidate)) {
                continue;
            }
            boolean nested = false;
            for (Element parent = candidate.parent(); parent != null && parent != root; parent = parent.parent()) {
                if (marked.contains(parent)) {
                    nested = true;
                    break;
                }
            }
            if (!nested) {
                result.add(candidate);
            }
        }
        return result;
    }

    private static List<List<String>> headingSections(Element body) {
        List<Element> headings = new ArrayList<>();
        for (Element element : body.getAllElements()) {
            if (HEADING_TAG.matcher(element.normalName()).matches()
                    && DISK_HEADING.matcher(element.text()).find()) {
                headings.add(element);
            }
        }
        Set<Element> headingSet = identitySet(headings);

        List<List<String>> sections = new ArrayList<>();
        for (Element heading : headings) {
            List<String> lines = new ArrayList<>();
            lines.add(heading.text());
            for (Node sibling = heading.nextSibling(); sibling != null; sibling = sibling.nextSibling()) {
                if (sibling instanceof Element element && containsAny(element, headingSet)) {
                    break;
                }
                lines.addAll(HtmlLines.of(sibling));
            }
            sections.add(lines);
        }
        return sections;
    }

    private static boolean containsAny(Element element, Set<Element> targets) {
        for (Element e : element.getAllElements()) {
            if (targets.contains(e)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasSerial(Element element) {
        return HtmlLines.of(element).stream()
                .map(LabeledFieldMatcher::match)
                .flatMap(Optional::stream)
                .anyMatch(m -> m.field() == ReportField.SERIAL);
    }

    private static Set<Element> identitySet(List<Element> elements) {
        Set<Element> set = Collections.newSetFromMap(new IdentityHashMap<>());
        set.addAll(elements);
        return set;
    }

    /**
     * Flattens HTML into report lines. The tree is walked iteratively, so nesting depth is
     * not bounded by the thread stack.
     */
    static final class HtmlLines implements NodeFilter {
        private final List<String> lines = new ArrayList<>();
        private final StringBuilder current = new StringBuilder();

        private HtmlLines() {
        }

        static List<String> of(Node node) {
            HtmlLines collector = new HtmlLines();
            NodeTraversor.filter(collector, node);
            collector.flush();
            return collector.lines;
        }

        @Override
        public FilterResult head(Node node, int depth) {
            if (node instanceof TextNode text) {
                current.append(text.text());
                return FilterResult.CONTINUE;
            }
            if (!(node instanceof Element element)) {
                return FilterResult.CONTINUE;
            }
            String tag = element.normalName();
            if (tag.equals("script") || tag.equals("style")) {
                return FilterResult.SKIP_ENTIRELY;
            }
            if (tag.equals("tr")) {
                List<Element> cells = cells(element);
                if (cells.stream().noneMatch(HtmlLines::hasStructure)) {
                    flush();
                    row(cells);
                    return FilterResult.SKIP_ENTIRELY;
                }
            }
            if (breaksLine(element)) {
                flush();
            }
            return FilterResult.CONTINUE;
        }

        @Override
        public FilterResult tail(Node node, int depth) {
            if (node instanceof Element element && breaksLine(element)) {
                flush();
            }
            return FilterResult.CONTINUE;
        }

        // cells of rows with nested structure are visited one by one and end their own line
        private static boolean breaksLine(Element element) {
            String tag = element.normalName();
            return element.isBlock() || tag.equals("br") || tag.equals("td") || tag.equals("th");
        }

        private static List<Element> cells(Element row) {
            List<Element> cells = new ArrayList<>();
            for (Element child : row.children()) {
                if (child.normalName().equals("td") || child.normalName().equals("th")) {
                    cells.add(child);
                }
            }
            return cells;
        }

        private void row(List<Element> cells) {
            if (cells.isEmpty()) {
                return;
            }
            if (cells.size() == 2 && !cells.get(0).text().isBlank()) {
                String key = clean(cells.get(0).text());
                while (key.endsWith(":")) {
                    key = key.substring(0, key.length() - 1).strip();
                }
                lines.add(key + ": " + clean(cells.get(1).text()));
                return;
            }
            List<String> texts = cells.stream().map(c -> clean(c.text())).toList();
            String line = String.join("\t", texts);
            if (!line.isBlank()) {
                lines.add(line);
            }
        }

        private static String clean(String text) {
            return text.replace('\u00a0', ' ').strip();
        }

        private static boolean hasStructure(Element cell) {
            return !cell.select("table, div, p, br, li, h1, h2, h3, h4").isEmpty();
        }

        private void flush() {
            String line = clean(current.toString());
            if (!line.isEmpty()) {
                lines.add(line);
            }
            current.setLength(0);
        }
    }
}
