package com.scada.flowmeter.api.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A single flow meter sample: device id, up to 54 optional measurement values, and the
 * identity (id, createdAt) assigned when the reading is stored.
 * Instances are immutable; absent measurements are simply not in {@link #getValues()}.
 */
@Getter
@ToString
@EqualsAndHashCode
public class FlowReading {
    private final UUID id;
    private final String deviceId;
    private final LocalDateTime createdAt;
    private final Map<ChannelField, Double> values;

    public FlowReading(UUID id, String deviceId, LocalDateTime createdAt, Map<ChannelField, Double> values) {
        this.id = id;
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId cannot be null");
        this.createdAt = createdAt;
        Map<ChannelField, Double> present = new LinkedHashMap<>();
        for (ChannelField field : ChannelField.all()) {
            Double value = values.get(field);
            if (value != null) {
                present.put(field, value);
            }
        }
        this.values = Collections.unmodifiableMap(present);
    }

    /**
     * Creates a reading that has not been stored yet.
     */
    public static FlowReading unsaved(String deviceId, Map<ChannelField, Double> values) {
        return new FlowReading(null, deviceId, null, values);
    }

    public Double getValue(ChannelField field) {
        return values.get(field);
    }

    public Double getValue(int channel, Measurement measurement) {
        return values.get(ChannelField.of(channel, measurement));
    }

    public boolean isPersisted() {
        return id != null && createdAt != null;
    }

    public FlowReading withIdentity(UUID id, LocalDateTime createdAt) {
        return new FlowReading(id, deviceId, createdAt, values);
    }
}
