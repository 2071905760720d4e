package com.scada.flowmeter.api.repository;

import com.scada.flowmeter.api.model.FlowReadingQuery;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FilterClauseTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0);
    private static final LocalDateTime END = LocalDateTime.of(2024, 1, 31, 23, 59, 59);

    @Test
    void toSql_withoutFilters_shouldBeEmpty() {
        FilterClause clause = FilterClause.of(new FlowReadingQuery(null, null, null, 1, 100));

        assertEquals("", clause.toSql());
        assertTrue(clause.bindings().isEmpty());
    }

    @Test
    void toSql_withAllFilters_shouldCombineWithAnd() {
        FilterClause clause = FilterClause.of(new FlowReadingQuery("FM-7", START, END, 1, 100));

        assertEquals(" WHERE DeviceId = :deviceId AND CreatedAt >= :startDate AND CreatedAt <= :endDate", clause.toSql());
        assertEquals("FM-7", clause.bindings().get("deviceId"));
        assertEquals(START, clause.bindings().get("startDate"));
        assertEquals(END, clause.bindings().get("endDate"));
    }

    @Test
    void toSql_withOnlyEndDate_shouldOmitOtherPredicates() {
        FilterClause clause = FilterClause.of(new FlowReadingQuery(null, null, END, 1, 100));

        assertEquals(" WHERE CreatedAt <= :endDate", clause.toSql());
        assertEquals(1, clause.bindings().size());
    }

    @Test
    void toSql_shouldNeverContainDeviceIdText() {
        String hostile = "FM' OR '1'='1";

        String sql = FilterClause.of(new FlowReadingQuery(hostile, null, null, 1, 100)).toSql();

        assertFalse(sql.contains(hostile));
        assertFalse(sql.contains("'"));
    }
}
