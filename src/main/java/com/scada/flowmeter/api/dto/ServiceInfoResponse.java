package com.scada.flowmeter.api.dto;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;

@Getter
@Builder
public class ServiceInfoResponse {
    private final boolean success;
    private final String message;
    private final String status;
    private final String version;
    private final String environment;
    private final Map<String, String> endpoints;
}
