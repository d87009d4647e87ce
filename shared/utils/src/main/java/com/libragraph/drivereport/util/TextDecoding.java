package com.libragraph.drivereport.util;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes report bytes to text with a fixed fallback chain.
 *
 * <p>A byte-order mark decides the charset outright. Without one, strict UTF-8 is tried
 * first, then windows-1252 (Sentinel exports on Western Windows installs), and finally
 * ISO-8859-1, which maps every byte and therefore always succeeds.
 */
public final class TextDecoding {

    private static final Charset WINDOWS_1252 = Charset.forName("windows-1252");

    private static final List<Charset> FALLBACK_CHAIN = List.of(
            StandardCharsets.UTF_8,
            WINDOWS_1252,
            StandardCharsets.ISO_8859_1
    );

    private TextDecoding() {
    }

    /**
     * Decoded text plus the charset that succeeded and every charset attempted, in order.
     */
    public record Decoded(String text, Charset charset, List<String> attempted) {
        public Decoded {
            attempted = List.copyOf(attempted);
        }
    }

    public static Decoded decode(byte[] content) {
        Charset bomCharset = detectBom(content);
        if (bomCharset != null) {
            int bomLength = bomCharset == StandardCharsets.UTF_8 ? 3 : 2;
            String text = new String(content, bomLength, content.length - bomLength, bomCharset);
            return new Decoded(text, bomCharset, List.of(bomCharset.name()));
        }

        List<String> attempted = new ArrayList<>();
        for (Charset charset : FALLBACK_CHAIN) {
            attempted.add(charset.name());
            String text = decodeStrict(content, charset);
            if (text != null) {
                return new Decoded(text, charset, attempted);
            }
        }
        // ISO-8859-1 maps all 256 byte values, so the loop always returns
        throw new IllegalStateException("ISO-8859-1 decoding failed");
    }

    /**
     * Decodes at most {@code maxBytes} leading bytes, replacing malformed sequences.
     * Used for cheap content sniffing where a truncated multi-byte character is acceptable.
     */
    public static String decodePrefix(byte[] content, int maxBytes) {
        int length = Math.min(content.length, maxBytes);
        Charset bomCharset = detectBom(content);
        if (bomCharset != null) {
            int bomLength = bomCharset == StandardCharsets.UTF_8 ? 3 : 2;
            return new String(content, bomLength, Math.max(0, length - bomLength), bomCharset);
        }
        return new String(content, 0, length, StandardCharsets.UTF_8);
    }

    /** Returns null when the content is not valid in the given charset. */
    private static String decodeStrict(byte[] content, Charset charset) {
        CharsetDecoder decoder = strictDecoder(charset);
        CharBuffer out = CharBuffer.allocate((int) Math.ceil(content.length * (double) decoder.maxCharsPerByte()) + 1);
        CoderResult result = decoder.decode(ByteBuffer.wrap(content), out, true);
        if (result.isError()) {
            return null;
        }
        if (decoder.flush(out).isError()) {
            return null;
        }
        out.flip();
        return out.toString();
    }

    private static CharsetDecoder strictDecoder(Charset charset) {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    private static Charset detectBom(byte[] content) {
        if (content.length >= 3
                && (content[0] & 0xFF) == 0xEF
                && (content[1] & 0xFF) == 0xBB
                && (content[2] & 0xFF) == 0xBF) {
            return StandardCharsets.UTF_8;
        }
        if (content.length >= 2) {
            int b0 = content[0] & 0xFF;
            int b1 = content[1] & 0xFF;
            if (b0 == 0xFF && b1 == 0xFE) return StandardCharsets.UTF_16LE;
            if (b0 == 0xFE && b1 == 0xFF) return StandardCharsets.UTF_16BE;
        }
        return null;
    }
}
