package com.scada.flowmeter.api.exception;

import org.springframework.http.HttpStatus;

/**
 * Custom exception for cases where no data is found for the given criteria.
 */
public class NoDataFoundException extends FlowMeterException {
    public NoDataFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
