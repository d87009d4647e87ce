package com.libragraph.drivereport.formats.archive;

import com.libragraph.drivereport.formats.model.ParseError;
import com.libragraph.drivereport.types.SourceFormat;

import java.time.Instant;
import java.util.Optional;

/**
 * One result of archive expansion: a readable member or the failure that replaced it.
 */
public sealed interface ArchiveItem {

    /**
     * @param name         display name in {@code outer.zip!/path} notation
     * @param format       classification of the member content
     * @param lastModified entry modification time, when the archive records one
     */
    record Member(String name, byte[] content, SourceFormat format, Optional<Instant> lastModified)
            implements ArchiveItem {}

    record Failure(ParseError error) implements ArchiveItem {}
}
