package com.scada.flowmeter.api.util;

import com.scada.flowmeter.api.exception.InvalidDateFormatException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;

/**
 * Parses ISO-8601 filter values into UTC {@link LocalDateTime}s, the representation used by the
 * {@code CreatedAt} column.
 */
public final class TimestampParser {

    private static final DateTimeFormatter ISO_FLEXIBLE = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private TimestampParser() {
        // Private constructor to prevent instantiation
    }

    /**
     * Accepts a date ({@code 2024-01-31}, start of day), a local date-time ({@code 2024-01-31T10:15:00},
     * read as UTC, a space separator is tolerated) or a date-time with offset ({@code 2024-01-31T10:15:00Z},
     * {@code ...+09:00}, shifted to UTC).
     *
     * @param value     the raw query parameter value
     * @param parameter the parameter name, used in the error message
     * @return the instant as a UTC local date-time
     * @throws InvalidDateFormatException if the value is not ISO-8601 or names a day the calendar does not have
     */
    public static LocalDateTime parseUtc(String value, String parameter) {
        if (value == null) {
            throw new InvalidDateFormatException(parameter);
        }
        String text = value.trim();
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }
        try {
            TemporalAccessor parsed = ISO_FLEXIBLE.parseBest(text, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            }
            if (parsed instanceof LocalDateTime localDateTime) {
                return localDateTime;
            }
            return ((LocalDate) parsed).atStartOfDay();
        } catch (DateTimeParseException e) {
            throw new InvalidDateFormatException(parameter);
        }
    }

    /**
     * ISO-8601 text for a stored timestamp, always including seconds.
     */
    public static String format(LocalDateTime timestamp) {
        return timestamp == null ? null : DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(timestamp);
    }
}
