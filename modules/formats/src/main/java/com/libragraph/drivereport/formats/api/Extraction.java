package com.libragraph.drivereport.formats.api;

import com.libragraph.drivereport.formats.model.CanonicalDriveRecord;
import com.libragraph.drivereport.formats.model.ParseError;

import java.util.List;

/**
 * Canonical records and errors produced from one file, in document order.
 */
public record Extraction(List<CanonicalDriveRecord> records, List<ParseError> errors) {

    public Extraction {
        records = List.copyOf(records);
        errors = List.copyOf(errors);
    }

    public static Extraction failed(ParseError error) {
        return new Extraction(List.of(), List.of(error));
    }
}
