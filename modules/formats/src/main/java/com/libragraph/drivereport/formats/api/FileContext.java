package com.libragraph.drivereport.formats.api;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Context information about a report file being processed.
 *
 * @param fileName     display name; archive members use {@code outer.zip!/path/member.html}
 * @param lastModified modification time of the upload or archive entry, when known
 */
public record FileContext(
        String fileName,
        Optional<Instant> lastModified
) {
    public static final String MEMBER_SEPARATOR = "!/";

    public FileContext {
        Objects.requireNonNull(fileName, "fileName cannot be null");
        Objects.requireNonNull(lastModified, "lastModified cannot be null");
    }

    public static FileContext of(String fileName) {
        return new FileContext(fileName, Optional.empty());
    }

    public static FileContext of(String fileName, Instant lastModified) {
        return new FileContext(fileName, Optional.ofNullable(lastModified));
    }

    /**
     * Display name of an entry inside the archive this context names.
     */
    public static String memberName(String archiveName, String entryName) {
        return archiveName + MEMBER_SEPARATOR + entryName;
    }
}
