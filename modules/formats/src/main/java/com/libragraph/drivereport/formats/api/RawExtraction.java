package com.libragraph.drivereport.formats.api;

import com.libragraph.drivereport.formats.model.ParseError;

import java.util.List;

/**
 * Raw output of one extractor run over one file.
 */
public record RawExtraction(List<RawDriveBlock> blocks, List<ParseError> errors) {

    public RawExtraction {
        blocks = List.copyOf(blocks);
        errors = List.copyOf(errors);
    }

    public static RawExtraction failed(ParseError error) {
        return new RawExtraction(List.of(), List.of(error));
    }
}
