package com.scada.flowmeter.api.service;

import com.scada.flowmeter.api.exception.MalformedRequestException;
import com.scada.flowmeter.api.exception.MissingDeviceIdException;
import com.scada.flowmeter.api.model.ChannelField;
import com.scada.flowmeter.api.model.FlowReading;
import com.scada.flowmeter.api.repository.FlowMeterTable;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Turns a raw SCADA upload payload into a typed {@link FlowReading}.
 * <p>
 * The uploader sends every value as text and uses {@value #PLACEHOLDER} to mark fields without data,
 * e.g. {@code "$$12.5$$"} or {@code "$$   $$"}. Values that are missing, not text, blank after
 * stripping the marker, or not a finite number are treated as absent. Only the device id can fail
 * a payload.
 */
@Component
public class FlowReadingNormalizer {
    public static final String DEVICE_ID_KEY = "deviceid";
    public static final String PLACEHOLDER = "$$";

    /**
     * The device id is stored without surrounding whitespace, matching how query filters read it.
     *
     * @throws MissingDeviceIdException  if {@code deviceid} is absent, not a string or blank
     * @throws MalformedRequestException if {@code deviceid} exceeds the column width
     */
    public FlowReading normalize(Map<String, Object> payload) {
        String deviceId = extractDeviceId(payload);

        Map<ChannelField, Double> values = new HashMap<>();
        for (ChannelField field : ChannelField.all()) {
            Double value = parseMeasurement(payload.get(field.columnName()));
            if (value != null) {
                values.put(field, value);
            }
        }
        return FlowReading.unsaved(deviceId, values);
    }

    /**
     * Coerces one raw field value. Never throws.
     *
     * @return the finite numeric value, or {@code null} when the field carries no usable number
     */
    public static Double parseMeasurement(Object raw) {
        if (!(raw instanceof String text)) {
            return null;
        }
        String cleaned = text.replace(PLACEHOLDER, "").strip();
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            double value = new BigDecimal(cleaned).doubleValue();
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String extractDeviceId(Map<String, Object> payload) {
        Object raw = payload.get(DEVICE_ID_KEY);
        if (!(raw instanceof String text) || text.isBlank()) {
            throw new MissingDeviceIdException();
        }
        String deviceId = text.strip();
        if (deviceId.length() > FlowMeterTable.DEVICE_ID_MAX_LENGTH) {
            throw new MalformedRequestException(
                    "Device ID must not exceed " + FlowMeterTable.DEVICE_ID_MAX_LENGTH + " characters");
        }
        return deviceId;
    }
}
