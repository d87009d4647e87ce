package com.libragraph.drivereport.formats.normalize;

import com.libragraph.drivereport.formats.model.CanonicalDriveRecord;
import com.libragraph.drivereport.formats.model.ParseError;

/**
 * Result of normalizing one raw drive block.
 */
public sealed interface NormalizedOutcome {

    record Normalized(CanonicalDriveRecord record) implements NormalizedOutcome {}

    record Rejected(ParseError error) implements NormalizedOutcome {}
}
