package com.libragraph.drivereport.formats.api;

import com.libragraph.drivereport.types.SourceFormat;

import java.util.Arrays;

/**
 * Signature that identifies a format from the leading bytes of its content.
 *
 * @param format      format the signature identifies
 * @param magicBytes  bytes expected at {@code magicOffset}
 * @param magicOffset offset in the header where the magic bytes start
 */
public record DetectionCriteria(
        SourceFormat format,
        byte[] magicBytes,
        int magicOffset
) {
    public DetectionCriteria {
        magicBytes = Arrays.copyOf(magicBytes, magicBytes.length);
    }

    public static DetectionCriteria magic(SourceFormat format, byte... magicBytes) {
        return new DetectionCriteria(format, magicBytes, 0);
    }

    /**
     * Checks if the header starts with this signature.
     */
    public boolean matches(byte[] header) {
        if (header == null) {
            return false;
        }
        int endOffset = magicOffset + magicBytes.length;
        if (header.length < endOffset) {
            return false;
        }
        for (int i = 0; i < magicBytes.length; i++) {
            if (header[magicOffset + i] != magicBytes[i]) {
                return false;
            }
        }
        return true;
    }
}
