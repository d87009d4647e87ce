package com.libragraph.drivereport.formats.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.libragraph.drivereport.types.ParseErrorReason;
import com.libragraph.drivereport.types.SourceFormat;

import java.util.Objects;

/**
 * Recoverable failure tied to one input file, archive member, section or page.
 *
 * @param formatGuess format the file was classified as when it failed
 * @param offsetHint  location within the source ("line 40", "page 2"), or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ParseError(
        String fileName,
        SourceFormat formatGuess,
        ParseErrorReason reason,
        String detail,
        String offsetHint
) {
    public ParseError {
        Objects.requireNonNull(fileName, "fileName cannot be null");
        Objects.requireNonNull(formatGuess, "formatGuess cannot be null");
        Objects.requireNonNull(reason, "reason cannot be null");
        Objects.requireNonNull(detail, "detail cannot be null");
    }

    public static ParseError of(String fileName, SourceFormat formatGuess, ParseErrorReason reason, String detail) {
        return new ParseError(fileName, formatGuess, reason, detail, null);
    }

    public static ParseError at(String fileName, SourceFormat formatGuess, ParseErrorReason reason,
                                String detail, String offsetHint) {
        return new ParseError(fileName, formatGuess, reason, detail, offsetHint);
    }
}
