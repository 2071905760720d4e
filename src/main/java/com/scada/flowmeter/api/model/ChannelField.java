package com.scada.flowmeter.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One (channel, measurement) slot of a reading, e.g. channel 3 temperature.
 * {@link #columnName()} yields the {@code FT<N><Suffix>} name shared by the upload payload and the table.
 */
public record ChannelField(int channel, Measurement measurement) {

    public static final String CHANNEL_PREFIX = "FT";
    public static final int MAX_CHANNELS = 9;

    private static final List<ChannelField> ALL;

    static {
        List<ChannelField> fields = new ArrayList<>(MAX_CHANNELS * Measurement.values().length);
        for (int channel = 1; channel <= MAX_CHANNELS; channel++) {
            for (Measurement measurement : Measurement.values()) {
                fields.add(new ChannelField(channel, measurement));
            }
        }
        ALL = Collections.unmodifiableList(fields);
    }

    public ChannelField {
        if (channel < 1 || channel > MAX_CHANNELS) {
            throw new IllegalArgumentException("Channel must be between 1 and " + MAX_CHANNELS + ": " + channel);
        }
        if (measurement == null) {
            throw new IllegalArgumentException("Measurement cannot be null");
        }
    }

    public static ChannelField of(int channel, Measurement measurement) {
        return new ChannelField(channel, measurement);
    }

    /**
     * All 54 fields ordered by channel, then by measurement declaration order.
     */
    public static List<ChannelField> all() {
        return ALL;
    }

    public String columnName() {
        return CHANNEL_PREFIX + channel + measurement.getSuffix();
    }
}
