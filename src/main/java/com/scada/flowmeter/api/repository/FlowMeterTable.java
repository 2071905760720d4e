package com.scada.flowmeter.api.repository;

/**
 * Names of the wide reading table and its fixed columns. Measurement columns come from
 * {@link com.scada.flowmeter.api.model.ChannelField#columnName()}.
 */
public final class FlowMeterTable {
    public static final String TABLE = "FlowMeterData";
    public static final String ID = "Id";
    public static final String DEVICE_ID = "DeviceId";
    public static final String CREATED_AT = "CreatedAt";
    public static final String DEVICE_CREATED_INDEX = "IX_FlowMeterData_DeviceId_CreatedAt";

    public static final int DEVICE_ID_MAX_LENGTH = 50;

    private FlowMeterTable() {
    }
}
