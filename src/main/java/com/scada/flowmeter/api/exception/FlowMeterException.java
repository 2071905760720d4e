package com.scada.flowmeter.api.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base type for failures that map to a fixed HTTP status and a client-safe message.
 */
@Getter
public abstract class FlowMeterException extends RuntimeException {
    private final HttpStatus status;

    protected FlowMeterException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected FlowMeterException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
