package com.scada.flowmeter.api.controller;

import com.scada.flowmeter.api.config.FlowMeterProperties;
import com.scada.flowmeter.api.dto.DataListResponse;
import com.scada.flowmeter.api.dto.DeviceStatsView;
import com.scada.flowmeter.api.dto.FlowReadingView;
import com.scada.flowmeter.api.dto.ReadingPageResponse;
import com.scada.flowmeter.api.dto.UploadResponse;
import com.scada.flowmeter.api.exception.MalformedRequestException;
import com.scada.flowmeter.api.model.FlowReadingQuery;
import com.scada.flowmeter.api.service.FlowReadingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;
import java.util.Map;

/**
 * REST Controller for SCADA flow meter uploads and reading retrieval.
 */
@Slf4j
@RestController
@RequestMapping(path = "/api/flowmeter", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class FlowMeterController {
    private final FlowReadingService flowReadingService;
    private final FlowMeterProperties properties;

    @PostMapping("/upload")
    public Mono<ResponseEntity<UploadResponse>> upload(
            @RequestBody(required = false) Map<String, Object> payload,
            ServerHttpRequest request) {

        log.info("Data upload request from {}", clientAddress(request));

        if (payload == null || payload.isEmpty()) {
            throw new MalformedRequestException("No JSON data received");
        }

        return flowReadingService.upload(payload)
                .map(saved -> ResponseEntity.ok(UploadResponse.stored(saved, properties.getEnvironment())));
    }

    @GetMapping("/data")
    public Mono<ResponseEntity<ReadingPageResponse>> getData(
            @RequestParam(name = "device_id", required = false) String deviceId,
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate,
            @RequestParam(name = "page", required = false) String page,
            @RequestParam(name = "page_size", required = false) String pageSize) {

        FlowReadingQuery query = FlowReadingQuery.fromParameters(deviceId, startDate, endDate, page, pageSize,
                properties.getQuery().getDefaultPageSize(), properties.getQuery().getMaxPageSize());
        log.info("Received request for readings: {}", query);

        return flowReadingService.query(query)
                .map(result -> ResponseEntity.ok(ReadingPageResponse.of(result, properties.getEnvironment())));
    }

    @GetMapping("/latest")
    public Mono<ResponseEntity<DataListResponse<FlowReadingView>>> getLatest(
            @RequestParam(name = "device_id", required = false) String deviceId) {

        String device = StringUtils.hasText(deviceId) ? deviceId.strip() : null;
        return flowReadingService.latest(device)
                .map(FlowReadingView::from)
                .collectList()
                .map(rows -> ResponseEntity.ok(new DataListResponse<>(rows, properties.getEnvironment())));
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<DataListResponse<DeviceStatsView>>> getStats(
            @RequestParam(name = "device_id", required = false) String deviceId,
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate) {

        FlowReadingQuery query = FlowReadingQuery.fromParameters(deviceId, startDate, endDate, null, null,
                properties.getQuery().getDefaultPageSize(), properties.getQuery().getMaxPageSize());

        return flowReadingService.stats(query)
                .map(DeviceStatsView::from)
                .collectList()
                .map(rows -> ResponseEntity.ok(new DataListResponse<>(rows, properties.getEnvironment())));
    }

    private static String clientAddress(ServerHttpRequest request) {
        String forwarded = request.getHeaders().getFirst("X-Forwarded-For");
        if (StringUtils.hasText(forwarded)) {
            return forwarded;
        }
        InetSocketAddress remote = request.getRemoteAddress();
        return remote == null ? "unknown" : remote.getHostString();
    }
}
