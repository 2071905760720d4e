package com.scada.flowmeter.api.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.scada.flowmeter.api.model.ChannelField;
import com.scada.flowmeter.api.model.FlowReading;
import com.scada.flowmeter.api.util.TimestampParser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON shape of one stored row: {@code Id} and {@code CreatedAt} as text, and every measurement
 * column by name, {@code null} where the reading has no value.
 */
@JsonPropertyOrder({"Id", "DeviceId", "CreatedAt"})
public class FlowReadingView {
    private final String id;
    private final String deviceId;
    private final String createdAt;
    private final Map<String, Double> measurements;

    private FlowReadingView(String id, String deviceId, String createdAt, Map<String, Double> measurements) {
        this.id = id;
        this.deviceId = deviceId;
        this.createdAt = createdAt;
        this.measurements = measurements;
    }

    public static FlowReadingView from(FlowReading reading) {
        Map<String, Double> measurements = new LinkedHashMap<>();
        for (ChannelField field : ChannelField.all()) {
            measurements.put(field.columnName(), reading.getValue(field));
        }
        return new FlowReadingView(
                reading.getId() == null ? null : reading.getId().toString(),
                reading.getDeviceId(),
                TimestampParser.format(reading.getCreatedAt()),
                Collections.unmodifiableMap(measurements));
    }

    @JsonProperty("Id")
    public String getId() {
        return id;
    }

    @JsonProperty("DeviceId")
    public String getDeviceId() {
        return deviceId;
    }

    @JsonProperty("CreatedAt")
    public String getCreatedAt() {
        return createdAt;
    }

    @JsonAnyGetter
    public Map<String, Double> getMeasurements() {
        return measurements;
    }
}
