package com.scada.flowmeter.api.util;

import com.scada.flowmeter.api.exception.InvalidDateFormatException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TimestampParserTest {

    @Test
    void parseUtc_withDateOnly_shouldReturnStartOfDay() {
        assertEquals(LocalDateTime.of(2024, 1, 31, 0, 0), TimestampParser.parseUtc("2024-01-31", "start_date"));
    }

    @Test
    void parseUtc_withLocalDateTime_shouldReturnAsIs() {
        assertEquals(LocalDateTime.of(2024, 1, 31, 10, 15, 30),
                TimestampParser.parseUtc("2024-01-31T10:15:30", "start_date"));
        assertEquals(LocalDateTime.of(2024, 1, 31, 10, 15),
                TimestampParser.parseUtc("2024-01-31 10:15", "start_date"));
    }

    @Test
    void parseUtc_withOffset_shouldConvertToUtc() {
        assertEquals(LocalDateTime.of(2024, 1, 31, 10, 0),
                TimestampParser.parseUtc("2024-01-31T10:00:00Z", "end_date"));
        assertEquals(LocalDateTime.of(2024, 1, 31, 1, 0),
                TimestampParser.parseUtc("2024-01-31T10:00:00+09:00", "end_date"));
    }

    @Test
    void parseUtc_withGarbage_shouldFailNamingTheParameter() {
        InvalidDateFormatException ex = assertThrows(InvalidDateFormatException.class,
                () -> TimestampParser.parseUtc("not-a-date", "start_date"));

        assertEquals("start_date", ex.getParameter());
        assertEquals("Invalid start_date format. Use ISO format.", ex.getMessage());
        assertThrows(InvalidDateFormatException.class, () -> TimestampParser.parseUtc("2024-13-01", "end_date"));
        assertThrows(InvalidDateFormatException.class, () -> TimestampParser.parseUtc("31/01/2024", "end_date"));
        assertThrows(InvalidDateFormatException.class, () -> TimestampParser.parseUtc("2024-02-30", "end_date"));
        assertThrows(InvalidDateFormatException.class, () -> TimestampParser.parseUtc("2023-02-29", "end_date"));
    }

    @Test
    void parseUtc_withDayMissingFromCalendar_shouldFailInsteadOfShifting() {
        assertThrows(InvalidDateFormatException.class, () -> TimestampParser.parseUtc("2023-02-29T10:00:00", "start_date"));
        assertThrows(InvalidDateFormatException.class, () -> TimestampParser.parseUtc("2024-04-31T00:00:00Z", "start_date"));
        assertEquals(LocalDateTime.of(2024, 2, 29, 0, 0), TimestampParser.parseUtc("2024-02-29", "start_date"));
    }

    @Test
    void format_shouldAlwaysIncludeSeconds() {
        assertEquals("2024-03-01T12:00:00", TimestampParser.format(LocalDateTime.of(2024, 3, 1, 12, 0)));
        assertEquals("2024-03-01T12:00:00.123456", TimestampParser.format(LocalDateTime.of(2024, 3, 1, 12, 0, 0, 123_456_000)));
        assertNull(TimestampParser.format(null));
    }
}
