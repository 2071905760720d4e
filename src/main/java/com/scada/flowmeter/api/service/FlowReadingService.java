package com.scada.flowmeter.api.service;

import com.scada.flowmeter.api.exception.NoDataFoundException;
import com.scada.flowmeter.api.exception.StorageException;
import com.scada.flowmeter.api.model.DeviceStats;
import com.scada.flowmeter.api.model.FlowReading;
import com.scada.flowmeter.api.model.FlowReadingPage;
import com.scada.flowmeter.api.model.FlowReadingQuery;
import com.scada.flowmeter.api.repository.FlowReadingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Ingestion and retrieval of flow meter readings. Validation errors are raised before the store is
 * touched; store failures are translated into {@link StorageException}s with a client-safe message.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlowReadingService {
    static final String STORE_FAILED = "Internal server error";
    static final String RETRIEVAL_FAILED = "Error retrieving data";

    private final FlowReadingNormalizer normalizer;
    private final FlowReadingRepository repository;

    /**
     * Normalizes and stores one upload payload.
     */
    public Mono<FlowReading> upload(Map<String, Object> payload) {
        return Mono.fromCallable(() -> normalizer.normalize(payload))
                .doOnNext(reading -> log.debug("Normalized reading for device {} with {} measurements",
                        reading.getDeviceId(), reading.getValues().size()))
                .flatMap(reading -> repository.insert(reading)
                        .onErrorMap(DataAccessException.class, e -> new StorageException(STORE_FAILED, e)))
                .doOnNext(saved -> log.info("Data saved successfully for device: {}, Record ID: {}",
                        saved.getDeviceId(), saved.getId()));
    }

    /**
     * One page of readings plus the total number of matching rows.
     */
    public Mono<FlowReadingPage> query(FlowReadingQuery query) {
        Mono<Long> total = repository.count(query);
        Mono<List<FlowReading>> rows = repository.findPage(query).collectList();
        return Mono.zip(total, rows)
                .map(result -> new FlowReadingPage(result.getT1(), query.page(), query.pageSize(), result.getT2()))
                .onErrorMap(DataAccessException.class, e -> new StorageException(RETRIEVAL_FAILED, e));
    }

    /**
     * The newest reading of one device, or of every device when {@code deviceId} is null.
     */
    public Flux<FlowReading> latest(String deviceId) {
        Flux<FlowReading> readings = deviceId == null
                ? repository.findLatestPerDevice()
                : repository.findLatest(deviceId)
                        .switchIfEmpty(Mono.error(() -> new NoDataFoundException("No data found for device " + deviceId)))
                        .flux();
        return readings.onErrorMap(DataAccessException.class, e -> new StorageException(RETRIEVAL_FAILED, e));
    }

    public Flux<DeviceStats> stats(FlowReadingQuery query) {
        return repository.findDeviceStats(query)
                .onErrorMap(DataAccessException.class, e -> new StorageException(RETRIEVAL_FAILED, e));
    }

    /**
     * Completes normally when the store answers a trivial query.
     */
    public Mono<Void> checkDatabase() {
        return repository.ping();
    }
}
