package com.scada.flowmeter.api.controller;

import com.scada.flowmeter.api.config.FlowMeterProperties;
import com.scada.flowmeter.api.dto.HealthResponse;
import com.scada.flowmeter.api.dto.ServiceInfoResponse;
import com.scada.flowmeter.api.service.FlowReadingService;
import com.scada.flowmeter.api.util.TimestampParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness probe and service metadata.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController {
    private final FlowReadingService flowReadingService;
    private final FlowMeterProperties properties;
    private final Clock clock;

    /**
     * Always answers: 200 when the database responds, 500 otherwise.
     */
    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        return flowReadingService.checkDatabase()
                .then(Mono.fromSupplier(() -> ResponseEntity.ok(HealthResponse.builder()
                        .success(true)
                        .status("healthy")
                        .database("connected")
                        .environment(properties.getEnvironment())
                        .timestamp(now())
                        .build())))
                .onErrorResume(e -> {
                    log.error("Health check failed: {}", e.getMessage(), e);
                    return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(HealthResponse.builder()
                            .success(false)
                            .status("unhealthy")
                            .database("disconnected")
                            .error("Database connection failed")
                            .environment(properties.getEnvironment())
                            .timestamp(now())
                            .build()));
                });
    }

    @GetMapping("/")
    public ServiceInfoResponse home() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("upload_data", "POST /api/flowmeter/upload");
        endpoints.put("get_data", "GET /api/flowmeter/data");
        endpoints.put("get_latest", "GET /api/flowmeter/latest");
        endpoints.put("get_stats", "GET /api/flowmeter/stats");
        endpoints.put("health_check", "GET /health");

        return ServiceInfoResponse.builder()
                .success(true)
                .message("SCADA Flow Meter API")
                .status("running")
                .version(properties.getVersion())
                .environment(properties.getEnvironment())
                .endpoints(endpoints)
                .build();
    }

    private String now() {
        return TimestampParser.format(LocalDateTime.now(clock));
    }
}
