package com.scada.flowmeter.api.exception;

import org.springframework.http.HttpStatus;

/**
 * Wraps any failure talking to the database. The message is what the client sees;
 * the driver detail stays in the cause and in the server log.
 */
public class StorageException extends FlowMeterException {
    public StorageException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
