package com.libragraph.drivereport.formats.normalize;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalQuery;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses report dates with a fixed list of accepted formats. Values without an offset are
 * read in the configured zone.
 */
final class ReportTimestamps {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy.MM.dd HH:mm:ss", Locale.ROOT),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT),
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss", Locale.ROOT),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss", Locale.ROOT),
            DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss", Locale.ROOT),
            DateTimeFormatter.ofPattern("MM/dd/yyyy h:mm:ss a", Locale.US),
            DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm:ss", Locale.ROOT)
    );

    private static final DateTimeFormatter DATE_ONLY = DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ROOT);

    private final ZoneId zone;

    ReportTimestamps(ZoneId zone) {
        this.zone = zone;
    }

    Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.strip();
        int comment = text.indexOf(" (");
        if (comment > 0) {
            text = text.substring(0, comment).strip();
        }

        OffsetDateTime offset = tryParse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME, OffsetDateTime::from);
        if (offset != null) {
            return Optional.of(offset.toInstant());
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            LocalDateTime local = tryParse(text, format, LocalDateTime::from);
            if (local != null) {
                return Optional.of(local.atZone(zone).toInstant());
            }
        }
        LocalDate date = tryParse(text, DATE_ONLY, LocalDate::from);
        return date == null ? Optional.empty() : Optional.of(date.atStartOfDay(zone).toInstant());
    }

    /** Returns null when the text does not match the format in full. */
    private static <T> T tryParse(String text, DateTimeFormatter format, TemporalQuery<T> query) {
        try {
            return format.parse(text, query);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
