package com.scada.flowmeter.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scada.flowmeter.api.model.FlowReading;
import com.scada.flowmeter.api.util.TimestampParser;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadResponse {
    private final boolean success;
    private final String message;
    private final String id;
    @JsonProperty("device_id")
    private final String deviceId;
    private final String timestamp;
    private final String environment;

    public static UploadResponse stored(FlowReading reading, String environment) {
        return UploadResponse.builder()
                .success(true)
                .message("Data received and stored successfully")
                .id(reading.getId().toString())
                .deviceId(reading.getDeviceId())
                .timestamp(TimestampParser.format(reading.getCreatedAt()))
                .environment(environment)
                .build();
    }
}
