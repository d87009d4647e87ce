package com.libragraph.drivereport.util;

import org.apache.commons.codec.digest.Blake3;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * BLAKE3-128 fingerprint (16 bytes) of a report file's bytes.
 * Immutable value object; identifies the exact source a drive record came from.
 */
public record ContentHash(byte[] bytes) {
    private static final int HASH_LENGTH = 16; // 128 bits
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public ContentHash {
        Objects.requireNonNull(bytes, "Content hash bytes cannot be null");
        if (bytes.length != HASH_LENGTH) {
            throw new IllegalArgumentException(
                "Content hash must be 16 bytes (BLAKE3-128), got: " + bytes.length
            );
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Hashes the given content.
     */
    public static ContentHash of(byte[] content) {
        Objects.requireNonNull(content, "content cannot be null");
        return new ContentHash(Blake3.initHash().update(content).doFinalize(HASH_LENGTH));
    }

    /**
     * Returns lowercase hex representation (32 characters).
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ContentHash other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
