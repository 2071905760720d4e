package com.scada.flowmeter.api.exception;

import org.springframework.http.HttpStatus;

/**
 * The request body is missing, is not JSON, or cannot be used as an upload payload.
 */
public class MalformedRequestException extends FlowMeterException {
    public MalformedRequestException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
