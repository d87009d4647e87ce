package com.libragraph.drivereport.formats.api;

import com.libragraph.drivereport.types.SourceFormat;

/**
 * Extracts raw drive blocks from one report file of a single format.
 * Implementations are stateless and safe to call concurrently.
 */
public interface ReportExtractor {

    SourceFormat format();

    /**
     * Extracts every drive block in the content. Never throws for malformed input;
     * failures are returned as parse errors alongside whatever blocks could be read.
     */
    RawExtraction extract(byte[] content, FileContext context);
}
