package com.scada.flowmeter.api.repository;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InsertStatementTest {

    @Test
    void toSql_shouldListOnlyColumnsWithValues() {
        UUID id = UUID.randomUUID();
        InsertStatement statement = new InsertStatement("FlowMeterData")
                .set("Id", id)
                .set("DeviceId", "FM-7")
                .set("FT1MassFlow", 12.5)
                .set("FT1Temp", null);

        assertEquals("INSERT INTO FlowMeterData (Id, DeviceId, FT1MassFlow) VALUES (:Id, :DeviceId, :FT1MassFlow)",
                statement.toSql());
        assertEquals(List.of("Id", "DeviceId", "FT1MassFlow"), List.copyOf(statement.bindings().keySet()));
        assertEquals(12.5, statement.bindings().get("FT1MassFlow"));
    }

    @Test
    void toSql_shouldNeverContainBoundValues() {
        String hostile = "x'); DROP TABLE FlowMeterData; --";
        InsertStatement statement = new InsertStatement("FlowMeterData").set("DeviceId", hostile);

        String sql = statement.toSql();

        assertFalse(sql.contains(hostile));
        assertFalse(sql.contains("DROP"));
        assertEquals(hostile, statement.bindings().get("DeviceId"));
    }

    @Test
    void toSql_withoutColumns_shouldFail() {
        assertThrows(IllegalStateException.class, () -> new InsertStatement("FlowMeterData").toSql());
    }
}
