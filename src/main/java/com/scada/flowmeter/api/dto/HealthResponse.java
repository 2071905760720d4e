package com.scada.flowmeter.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthResponse {
    private final boolean success;
    private final String status;
    private final String database;
    private final String error;
    private final String environment;
    private final String timestamp;
}
