package com.tradeingest.transform;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Locale-aware parsing of the date and time shapes broker exports use (US month-first order).
 * Every method returns empty instead of throwing; an unparseable value is skipped by the caller.
 */
public final class TemporalParser {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            formatter("yyyy-MM-dd HH:mm:ss"),
            formatter("yyyy-MM-dd HH:mm"),
            formatter("M/d/yyyy H:mm:ss"),
            formatter("M/d/yyyy H:mm"),
            formatter("M/d/yyyy h:mm:ss a"),
            formatter("M/d/yyyy h:mm a"),
            formatter("M/d/yy H:mm:ss"),
            formatter("M/d/yy H:mm"),
            formatter("M/d/yy h:mm:ss a"),
            formatter("M/d/yy h:mm a"),
            formatter("yyyyMMdd;HHmmss"));

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            formatter("M/d/yyyy"),
            formatter("M/d/yy"),
            formatter("M-d-yyyy"),
            formatter("yyyy/M/d"),
            DateTimeFormatter.BASIC_ISO_DATE,
            formatter("d-MMM-yyyy"),
            formatter("MMM d, yyyy"));

    private static final List<DateTimeFormatter> TIME_FORMATS = List.of(
            formatter("H:mm:ss"),
            formatter("H:mm"),
            formatter("h:mm:ss a"),
            formatter("h:mm a"),
            formatter("HHmmss"));

    private TemporalParser() {}

    /** Parses a timestamp; a date-only value resolves to the start of that day. */
    public static Optional<LocalDateTime> parseDateTime(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.trim();
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return Optional.of(LocalDateTime.parse(text, format));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        try {
            return Optional.of(OffsetDateTime.parse(text).toLocalDateTime());
        } catch (DateTimeParseException ignored) {
            // fall through to date-only shapes
        }
        return parseDate(text).map(LocalDate::atStartOfDay);
    }

    public static Optional<LocalDate> parseDate(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(text, format));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return Optional.empty();
    }

    public static Optional<LocalTime> parseTime(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.trim();
        for (DateTimeFormatter format : TIME_FORMATS) {
            try {
                return Optional.of(LocalTime.parse(text, format));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return Optional.empty();
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.US);
    }
}
