package com.scada.flowmeter.api.exception;

import org.springframework.http.HttpStatus;

public class MissingDeviceIdException extends FlowMeterException {
    public MissingDeviceIdException() {
        super(HttpStatus.BAD_REQUEST, "Device ID is required");
    }
}
