package com.scada.flowmeter.api.model;

import com.scada.flowmeter.api.util.TimestampParser;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;

/**
 * Validated filters and paging for reading retrieval. Every non-null filter becomes one predicate.
 *
 * @param deviceId  exact device id, or null for all devices
 * @param startDate inclusive lower bound on {@code CreatedAt}, or null
 * @param endDate   inclusive upper bound on {@code CreatedAt}, or null
 * @param page      1-based page number
 * @param pageSize  rows per page
 */
public record FlowReadingQuery(String deviceId, LocalDateTime startDate, LocalDateTime endDate, int page, int pageSize) {

    public static final String START_DATE_PARAM = "start_date";
    public static final String END_DATE_PARAM = "end_date";

    /**
     * Builds a query from raw request parameters. Blank values count as absent; page values that are
     * not integers fall back to their defaults. Date values are parsed strictly.
     *
     * @throws com.scada.flowmeter.api.exception.InvalidDateFormatException for an unparseable date
     */
    public static FlowReadingQuery fromParameters(String deviceId, String startDate, String endDate,
                                                  String page, String pageSize,
                                                  int defaultPageSize, int maxPageSize) {
        LocalDateTime start = StringUtils.hasText(startDate) ? TimestampParser.parseUtc(startDate, START_DATE_PARAM) : null;
        LocalDateTime end = StringUtils.hasText(endDate) ? TimestampParser.parseUtc(endDate, END_DATE_PARAM) : null;
        return new FlowReadingQuery(
                StringUtils.hasText(deviceId) ? deviceId.strip() : null,
                start,
                end,
                clampPage(parseInt(page, 1)),
                clampPageSize(parseInt(pageSize, defaultPageSize), defaultPageSize, maxPageSize));
    }

    public static FlowReadingQuery forDevice(String deviceId) {
        return new FlowReadingQuery(deviceId, null, null, 1, 1);
    }

    static int clampPage(int page) {
        return Math.max(page, 1);
    }

    static int clampPageSize(int pageSize, int defaultPageSize, int maxPageSize) {
        int size = pageSize < 1 ? defaultPageSize : pageSize;
        return Math.min(size, maxPageSize);
    }

    private static int parseInt(String value, int fallback) {
        if (!StringUtils.hasText(value)) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public long offset() {
        return (long) (page - 1) * pageSize;
    }

    public boolean hasFilters() {
        return deviceId != null || startDate != null || endDate != null;
    }
}
