package com.scada.flowmeter.api.exception;

import com.scada.flowmeter.api.config.FlowMeterProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import org.springframework.web.server.UnsupportedMediaTypeStatusException;

/**
 * Global exception handler to manage exceptions across the application.
 * Every error becomes an {@link ErrorResponse} with {@code success=false}; driver and stack detail
 * only go to the log.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {
    private final FlowMeterProperties properties;

    /**
     * Validation failures and missing data detected by this service.
     */
    @ExceptionHandler(FlowMeterException.class)
    public ResponseEntity<ErrorResponse> handleFlowMeterException(FlowMeterException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("Request failed: {}", ex.getMessage(), ex);
        } else {
            log.warn("Rejected request: {}", ex.getMessage());
        }
        return respond(ex.getStatus(), ex.getMessage());
    }

    /**
     * The upload body is not declared as JSON. Reported as a client error, not 415.
     */
    @ExceptionHandler(UnsupportedMediaTypeStatusException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedMediaType(UnsupportedMediaTypeStatusException ex) {
        log.warn("Unsupported content type: {}", ex.getContentType());
        return respond(HttpStatus.BAD_REQUEST, "Content-Type must be application/json");
    }

    /**
     * The body could not be read as a JSON object.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleServerWebInput(ServerWebInputException ex) {
        String message = ex.getCause() instanceof DecodingException
                ? "Malformed JSON request body"
                : "No JSON data received";
        log.warn("Unreadable request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException ex) {
        log.warn("Request failed with status {}: {}", ex.getStatusCode(), ex.getReason());
        String reason = ex.getReason() != null ? ex.getReason() : "Request failed";
        return respond(ex.getStatusCode(), reason);
    }

    /**
     * Handles all other un-caught exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(Exception ex) {
        log.error("An unexpected error occurred:", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "An internal server error occurred.");
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatusCode status, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(message, properties.getEnvironment()));
    }
}
