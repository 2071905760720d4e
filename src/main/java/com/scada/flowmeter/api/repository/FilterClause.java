package com.scada.flowmeter.api.repository;

import com.scada.flowmeter.api.model.FlowReadingQuery;
import org.springframework.r2dbc.core.DatabaseClient;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.scada.flowmeter.api.repository.FlowMeterTable.CREATED_AT;
import static com.scada.flowmeter.api.repository.FlowMeterTable.DEVICE_ID;

/**
 * WHERE clause for the reading filters: one parameterized predicate per supplied filter, joined with AND.
 * Absent filters contribute nothing.
 */
final class FilterClause {
    private final List<String> predicates = new ArrayList<>();
    private final Map<String, Object> bindings = new LinkedHashMap<>();

    static FilterClause of(FlowReadingQuery query) {
        FilterClause clause = new FilterClause();
        if (query.deviceId() != null) {
            clause.add(DEVICE_ID + " = :deviceId", "deviceId", query.deviceId());
        }
        if (query.startDate() != null) {
            clause.add(CREATED_AT + " >= :startDate", "startDate", query.startDate());
        }
        if (query.endDate() != null) {
            clause.add(CREATED_AT + " <= :endDate", "endDate", query.endDate());
        }
        return clause;
    }

    private void add(String predicate, String name, Object value) {
        predicates.add(predicate);
        bindings.put(name, value);
    }

    /**
     * The clause with a leading space, or an empty string when no filter is set.
     */
    String toSql() {
        return predicates.isEmpty() ? "" : " WHERE " + String.join(" AND ", predicates);
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
