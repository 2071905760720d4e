package com.scada.flowmeter.api.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

/**
 * Standard structure for API error responses.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final boolean success = false;
    private final String message;
    private final String environment;

    public ErrorResponse(String message, String environment) {
        this.message = message;
        this.environment = environment;
    }
}
