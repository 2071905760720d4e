package com.scada.flowmeter.api.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A date filter could not be parsed as an ISO-8601 date or date-time.
 */
@Getter
public class InvalidDateFormatException extends FlowMeterException {
    private final String parameter;

    public InvalidDateFormatException(String parameter) {
        super(HttpStatus.BAD_REQUEST, "Invalid " + parameter + " format. Use ISO format.");
        this.parameter = parameter;
    }
}
