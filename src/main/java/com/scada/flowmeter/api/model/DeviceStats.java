package com.scada.flowmeter.api.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeviceStats {
    private String deviceId;
    private long readingCount;
    private LocalDateTime firstReadingAt;
    private LocalDateTime lastReadingAt;
}
