package com.scada.flowmeter.api.repository;

import com.scada.flowmeter.api.model.ChannelField;
import com.scada.flowmeter.api.model.DeviceStats;
import com.scada.flowmeter.api.model.FlowReading;
import com.scada.flowmeter.api.model.FlowReadingQuery;
import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.BiFunction;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.scada.flowmeter.api.repository.FlowMeterTable.CREATED_AT;
import static com.scada.flowmeter.api.repository.FlowMeterTable.DEVICE_ID;
import static com.scada.flowmeter.api.repository.FlowMeterTable.ID;
import static com.scada.flowmeter.api.repository.FlowMeterTable.TABLE;

/**
 * Repository for storing and reading flow meter rows using R2DBC.
 * All SQL is assembled from fixed identifiers; every value is a named bind parameter.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class FlowReadingRepository {
    private final DatabaseClient databaseClient;
    private final Clock clock;

    static final String SELECT_COLUMNS = Stream.concat(
                    Stream.of(ID, DEVICE_ID),
                    Stream.concat(ChannelField.all().stream().map(ChannelField::columnName), Stream.of(CREATED_AT)))
            .collect(Collectors.joining(", "));

    private static final String ORDER_NEWEST_FIRST = " ORDER BY " + CREATED_AT + " DESC, " + ID + " DESC";

    public static final BiFunction<Row, RowMetadata, FlowReading> MAPPING_FUNCTION = (row, rowMetaData) -> {
        Map<ChannelField, Double> values = new HashMap<>();
        for (ChannelField field : ChannelField.all()) {
            Number value = row.get(field.columnName(), Number.class);
            if (value != null) {
                values.put(field, value.doubleValue());
            }
        }
        return new FlowReading(
                row.get(ID, UUID.class),
                row.get(DEVICE_ID, String.class),
                row.get(CREATED_AT, LocalDateTime.class),
                values);
    };

    public static final BiFunction<Row, RowMetadata, DeviceStats> STATS_MAPPING_FUNCTION = (row, rowMetaData) -> new DeviceStats(
            row.get(DEVICE_ID, String.class),
            row.get("ReadingCount", Number.class).longValue(),
            row.get("FirstReadingAt", LocalDateTime.class),
            row.get("LastReadingAt", LocalDateTime.class)
    );

    /**
     * Inserts one reading, assigning a random id and the current UTC time where the reading has none.
     * Only present measurement columns are written. Retrying after a timeout may store a duplicate row.
     *
     * @return the reading as stored, including its identity
     */
    public Mono<FlowReading> insert(FlowReading reading) {
        FlowReading toStore = reading.withIdentity(
                reading.getId() != null ? reading.getId() : UUID.randomUUID(),
                reading.getCreatedAt() != null ? reading.getCreatedAt() : LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS));

        InsertStatement statement = new InsertStatement(TABLE)
                .set(ID, toStore.getId())
                .set(DEVICE_ID, toStore.getDeviceId());
        toStore.getValues().forEach((field, value) -> statement.set(field.columnName(), value));
        statement.set(CREATED_AT, toStore.getCreatedAt());

        String sql = statement.toSql();
        log.debug("Executing insert with {} bound columns: {}", statement.bindings().size(), sql);

        return statement.bindTo(databaseClient.sql(sql))
                .fetch()
                .rowsUpdated()
                .thenReturn(toStore);
    }

    /**
     * Number of rows matching the query filters, ignoring paging.
     */
    public Mono<Long> count(FlowReadingQuery query) {
        FilterClause filter = FilterClause.of(query);
        String sql = "SELECT COUNT(*) AS TotalCount FROM " + TABLE + filter.toSql();
        log.debug("Executing count query: {}", sql);

        return filter.bindTo(databaseClient.sql(sql))
                .map((row, rowMetaData) -> row.get("TotalCount", Number.class).longValue())
                .one()
                .defaultIfEmpty(0L);
    }

    /**
     * One page of matching readings, newest first.
     */
    public Flux<FlowReading> findPage(FlowReadingQuery query) {
        FilterClause filter = FilterClause.of(query);
        String sql = "SELECT " + SELECT_COLUMNS + " FROM " + TABLE + filter.toSql()
                + ORDER_NEWEST_FIRST
                + " OFFSET :offset ROWS FETCH NEXT :limit ROWS ONLY";
        log.debug("Executing page query with bindings {}: {}", filter.bindings().keySet(), sql);

        return filter.bindTo(databaseClient.sql(sql))
                .bind("offset", query.offset())
                .bind("limit", query.pageSize())
                .map(MAPPING_FUNCTION)
                .all();
    }

    public Mono<FlowReading> findLatest(String deviceId) {
        String sql = "SELECT " + SELECT_COLUMNS + " FROM " + TABLE
                + " WHERE " + DEVICE_ID + " = :deviceId"
                + ORDER_NEWEST_FIRST
                + " OFFSET 0 ROWS FETCH NEXT 1 ROWS ONLY";
        log.debug("Executing latest reading query: {}", sql);

        return databaseClient.sql(sql)
                .bind("deviceId", deviceId)
                .map(MAPPING_FUNCTION)
                .first();
    }

    /**
     * The newest reading of every device, ordered by device id. Readings sharing the newest timestamp
     * of a device are all returned.
     */
    public Flux<FlowReading> findLatestPerDevice() {
        String sql = "SELECT " + SELECT_COLUMNS + " FROM " + TABLE + " r"
                + " WHERE r." + CREATED_AT + " = (SELECT MAX(m." + CREATED_AT + ") FROM " + TABLE + " m"
                + " WHERE m." + DEVICE_ID + " = r." + DEVICE_ID + ")"
                + " ORDER BY r." + DEVICE_ID;
        log.debug("Executing latest-per-device query: {}", sql);

        return databaseClient.sql(sql)
                .map(MAPPING_FUNCTION)
                .all();
    }

    /**
     * Reading count and first/last timestamps per device for the rows matching the query filters.
     */
    public Flux<DeviceStats> findDeviceStats(FlowReadingQuery query) {
        FilterClause filter = FilterClause.of(query);
        String sql = "SELECT " + DEVICE_ID + ", COUNT(*) AS ReadingCount, "
                + "MIN(" + CREATED_AT + ") AS FirstReadingAt, MAX(" + CREATED_AT + ") AS LastReadingAt"
                + " FROM " + TABLE + filter.toSql()
                + " GROUP BY " + DEVICE_ID
                + " ORDER BY " + DEVICE_ID;
        log.debug("Executing device stats query: {}", sql);

        return filter.bindTo(databaseClient.sql(sql))
                .map(STATS_MAPPING_FUNCTION)
                .all();
    }

    /**
     * One trivial round trip to the store.
     */
    public Mono<Void> ping() {
        return databaseClient.sql("SELECT 1 AS Test")
                .fetch()
                .first()
                .then();
    }
}
