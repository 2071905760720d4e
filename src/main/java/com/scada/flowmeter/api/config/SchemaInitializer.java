package com.scada.flowmeter.api.config;

import com.scada.flowmeter.api.repository.SqlDialect;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Creates the reading table and its index on startup when they are missing.
 * A failure is logged and startup continues; uploads will then fail with a storage error until the
 * schema exists.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaInitializer implements CommandLineRunner {
    private final DatabaseClient databaseClient;
    private final FlowMeterProperties properties;

    @Override
    public void run(String... args) {
        if (!properties.getDatabase().isInitializeSchema()) {
            log.info("Schema initialization disabled for environment '{}'", properties.getEnvironment());
            return;
        }
        initializeSchema()
                .doOnSuccess(v -> log.info("Database table initialized ({})", properties.getDatabase().getDialect()))
                .doOnError(e -> log.error("Database initialization failed", e))
                .onErrorResume(e -> Mono.empty())
                .block();
    }

    public Mono<Void> initializeSchema() {
        SqlDialect dialect = properties.getDatabase().getDialect();
        return Flux.fromIterable(dialect.schemaStatements())
                .concatMap(sql -> execute(dialect, sql))
                .then();
    }

    private Mono<Void> execute(SqlDialect dialect, String sql) {
        log.debug("Executing DDL: {}", sql);
        return databaseClient.sql(sql)
                .then()
                .onErrorResume(dialect::isAlreadyExists, e -> {
                    log.warn("Schema object already created by another instance: {}", e.getMessage());
                    return Mono.empty();
                });
    }
}
