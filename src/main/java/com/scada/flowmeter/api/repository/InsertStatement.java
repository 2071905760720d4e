package com.scada.flowmeter.api.repository;

import org.springframework.r2dbc.core.DatabaseClient;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Accumulates (column, value) pairs for one INSERT, skipping null values, and emits a statement with
 * one named bind marker per column. Values only ever travel as bindings.
 */
final class InsertStatement {
    private final String table;
    private final Map<String, Object> bindings = new LinkedHashMap<>();

    InsertStatement(String table) {
        this.table = table;
    }

    InsertStatement set(String column, Object value) {
        if (value != null) {
            bindings.put(column, value);
        }
        return this;
    }

    String toSql() {
        if (bindings.isEmpty()) {
            throw new IllegalStateException("INSERT into " + table + " has no columns");
        }
        String columns = String.join(", ", bindings.keySet());
        String markers = bindings.keySet().stream()
                .map(column -> ":" + column)
                .collect(Collectors.joining(", "));
        return "INSERT INTO " + table + " (" + columns + ") VALUES (" + markers + ")";
    }

    DatabaseClient.GenericExecuteSpec bindTo(DatabaseClient.GenericExecuteSpec spec) {
        for (Map.Entry<String, Object> binding : bindings.entrySet()) {
            spec = spec.bind(binding.getKey(), binding.getValue());
        }
        return spec;
    }

    Map<String, Object> bindings() {
        return Collections.unmodifiableMap(bindings);
    }
}
