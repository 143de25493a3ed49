package com.statementprocessor.parser;

import com.statementprocessor.domain.enums.WarningType;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Date and timestamp parsing with a fixed fallback chain, tried in this order:
 * <ol>
 *   <li>{@code yyyy-MM-dd}</li>
 *   <li>{@code yyyy-MM-dd, HH:mm:ss} (Trades "Date/Time")</li>
 *   <li>{@code yyyy-MM-dd HH:mm:ss}</li>
 *   <li>{@code ddMMMyy}, case-insensitive (option expiries, e.g. {@code 07FEB25})</li>
 *   <li>{@code MM/dd/yyyy} (email subjects)</li>
 *   <li>{@code MMMM d, yyyy} (Statement "Period")</li>
 * </ol>
 * Two-digit years resolve into 2000-2099.
 */
public final class DateFieldParser {

    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ENGLISH);
    private static final DateTimeFormatter ISO_DATE_COMMA_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd, HH:mm:ss", Locale.ENGLISH);
    private static final DateTimeFormatter ISO_DATE_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ENGLISH);
    private static final DateTimeFormatter COMPACT_EXPIRY = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("ddMMMyy")
            .toFormatter(Locale.ENGLISH);
    private static final DateTimeFormatter US_DATE = DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter LONG_DATE = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("MMMM d, yyyy")
            .toFormatter(Locale.ENGLISH);

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(ISO_DATE_COMMA_TIME, ISO_DATE_TIME);
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(ISO_DATE, COMPACT_EXPIRY, US_DATE, LONG_DATE);

    private DateFieldParser() {}

    /**
     * Parses a date cell. Timestamps are accepted and truncated to their date.
     *
     * @return the date, or null for an empty cell
     * @throws FieldParseException if no format in the chain matches
     */
    public static LocalDate parseDate(String raw, String field) {
        LocalDateTime dateTime = parseDateTime(raw, field);
        return dateTime != null ? dateTime.toLocalDate() : null;
    }

    /**
     * Parses a timestamp cell. Date-only values resolve to the start of that day.
     *
     * @return the timestamp, or null for an empty cell
     * @throws FieldParseException if no format in the chain matches
     */
    public static LocalDateTime parseDateTime(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String text = raw.trim();

        // Chain order: ISO date, ISO timestamps, compact expiry, US date, long date
        LocalDate date = tryDate(text, ISO_DATE);
        if (date != null) {
            return date.atStartOfDay();
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            LocalDateTime dateTime = tryDateTime(text, format);
            if (dateTime != null) {
                return dateTime;
            }
        }
        for (DateTimeFormatter format : DATE_FORMATS.subList(1, DATE_FORMATS.size())) {
            date = tryDate(text, format);
            if (date != null) {
                return date.atStartOfDay();
            }
        }
        throw new FieldParseException(
                WarningType.FIELD_DATE, field, "Unparseable date '" + raw + "' in '" + field + "'");
    }

    /** Like {@link #parseDate} but an empty cell is an error. */
    public static LocalDate parseRequiredDate(String raw, String field) {
        LocalDate date = parseDate(raw, field);
        if (date == null) {
            throw FieldParseException.missing(field);
        }
        return date;
    }

    private static LocalDateTime tryDateTime(String text, DateTimeFormatter format) {
        try {
            return LocalDateTime.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDate tryDate(String text, DateTimeFormatter format) {
        try {
            return LocalDate.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
