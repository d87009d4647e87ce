package com.libragraph.drivereport.formats.sniff;

import com.libragraph.drivereport.formats.api.DetectionCriteria;
import com.libragraph.drivereport.types.SourceFormat;
import com.libragraph.drivereport.util.TextDecoding;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.tika.detect.DefaultDetector;
import org.apache.tika.detect.Detector;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.mime.MediaType;
import org.jboss.logging.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies report content as HTML, TEXT, PDF, ZIP or UNSUPPORTED.
 *
 * <p>Order: magic bytes, then Tika media-type detection to reject binary content without
 * decoding it, then HTML markers in the first 8 KiB, then the section headers of the known
 * text dialects. The file name is only a hint to Tika and never classifies a file by itself.
 * Never throws on malformed input.
 */
@ApplicationScoped
public class FormatSniffer {

    private static final Logger log = Logger.getLogger(FormatSniffer.class);

    private static final Detector DETECTOR = new DefaultDetector();

    private static final int HTML_PREFIX_BYTES = 8 * 1024;
    private static final int TEXT_PREFIX_BYTES = 64 * 1024;

    private static final List<DetectionCriteria> SIGNATURES = List.of(
            DetectionCriteria.magic(SourceFormat.ZIP, (byte) 0x50, (byte) 0x4B, (byte) 0x03, (byte) 0x04),
            // empty archive: end-of-central-directory record only
            DetectionCriteria.magic(SourceFormat.ZIP, (byte) 0x50, (byte) 0x4B, (byte) 0x05, (byte) 0x06),
            DetectionCriteria.magic(SourceFormat.PDF, (byte) '%', (byte) 'P', (byte) 'D', (byte) 'F', (byte) '-')
    );

    private static final Set<String> BINARY_TOP_LEVEL_TYPES = Set.of("image", "audio", "video", "font", "model");

    private static final Set<String> TEXTUAL_APPLICATION_SUBTYPES = Set.of(
            "xhtml+xml", "xml", "json", "rtf", "x-sh", "javascript");

    private static final Pattern HTML_MARKER = Pattern.compile(
            "<!doctype\\s+html|<html[\\s>]|<head[\\s>]|<body[\\s>]|<table[\\s>]");

    private static final Pattern TEXT_REPORT_MARKER = Pattern.compile(
            "hard\\s+disk\\s+sentinel|hard\\s+disk\\s+summary|hard\\s+disk\\s+serial\\s+number"
                    + "|scsi\\s+toolbox|drive\\s+information|device\\s+information");

    public SourceFormat sniff(byte[] content, String fileNameHint) {
        if (content == null || content.length == 0) {
            return SourceFormat.UNSUPPORTED;
        }

        for (DetectionCriteria criteria : SIGNATURES) {
            if (criteria.matches(content)) {
                return criteria.format();
            }
        }

        MediaType mediaType = detectMediaType(content, fileNameHint);
        if (isBinary(mediaType)) {
            log.debugf("Rejecting %s as binary content (%s)", fileNameHint, mediaType);
            return SourceFormat.UNSUPPORTED;
        }

        String htmlPrefix = TextDecoding.decodePrefix(content, HTML_PREFIX_BYTES).toLowerCase(Locale.ROOT);
        if (HTML_MARKER.matcher(htmlPrefix).find()) {
            return SourceFormat.HTML;
        }

        String textPrefix = TextDecoding.decodePrefix(content, TEXT_PREFIX_BYTES).toLowerCase(Locale.ROOT);
        if (TEXT_REPORT_MARKER.matcher(textPrefix).find()) {
            return SourceFormat.TEXT;
        }

        return SourceFormat.UNSUPPORTED;
    }

    private static MediaType detectMediaType(byte[] content, String fileNameHint) {
        try (InputStream stream = new ByteArrayInputStream(content)) {
            Metadata metadata = new Metadata();
            if (fileNameHint != null) {
                metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, lastSegment(fileNameHint));
            }
            return DETECTOR.detect(stream, metadata);
        } catch (IOException e) {
            log.debugf(e, "Media type detection failed for %s", fileNameHint);
            return MediaType.OCTET_STREAM;
        }
    }

    private static boolean isBinary(MediaType mediaType) {
        String type = mediaType.getType();
        if (BINARY_TOP_LEVEL_TYPES.contains(type)) {
            return true;
        }
        if (type.equals("application")) {
            return !TEXTUAL_APPLICATION_SUBTYPES.contains(mediaType.getSubtype());
        }
        return false;
    }

    private static String lastSegment(String fileName) {
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        return slash >= 0 ? fileName.substring(slash + 1) : fileName;
    }
}
