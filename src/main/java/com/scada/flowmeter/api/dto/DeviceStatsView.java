package com.scada.flowmeter.api.dto;

import com.scada.flowmeter.api.model.DeviceStats;
import com.scada.flowmeter.api.util.TimestampParser;

public record DeviceStatsView(String deviceId, long readingCount, String firstReadingAt, String lastReadingAt) {

    public static DeviceStatsView from(DeviceStats stats) {
        return new DeviceStatsView(
                stats.getDeviceId(),
                stats.getReadingCount(),
                TimestampParser.format(stats.getFirstReadingAt()),
                TimestampParser.format(stats.getLastReadingAt()));
    }
}
