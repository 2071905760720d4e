package com.scada.flowmeter.api.repository;

import com.scada.flowmeter.api.model.ChannelField;
import io.r2dbc.spi.R2dbcException;
import org.springframework.core.NestedExceptionUtils;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.scada.flowmeter.api.repository.FlowMeterTable.CREATED_AT;
import static com.scada.flowmeter.api.repository.FlowMeterTable.DEVICE_CREATED_INDEX;
import static com.scada.flowmeter.api.repository.FlowMeterTable.DEVICE_ID;
import static com.scada.flowmeter.api.repository.FlowMeterTable.DEVICE_ID_MAX_LENGTH;
import static com.scada.flowmeter.api.repository.FlowMeterTable.ID;
import static com.scada.flowmeter.api.repository.FlowMeterTable.TABLE;

/**
 * Store-specific DDL. Query and insert statements are plain ANSI SQL shared by every dialect.
 */
public enum SqlDialect {
    H2(Set.of(42101, 42111)) {
        @Override
        public List<String> schemaStatements() {
            return List.of(
                    "CREATE TABLE IF NOT EXISTS " + TABLE + " ("
                            + ID + " UUID PRIMARY KEY, "
                            + DEVICE_ID + " VARCHAR(" + DEVICE_ID_MAX_LENGTH + ") NOT NULL, "
                            + measurementColumns()
                            + CREATED_AT + " TIMESTAMP(6) DEFAULT LOCALTIMESTAMP NOT NULL)",
                    "CREATE INDEX IF NOT EXISTS " + DEVICE_CREATED_INDEX
                            + " ON " + TABLE + " (" + DEVICE_ID + ", " + CREATED_AT + ")");
        }
    },
    SQLSERVER(Set.of(2714, 1913)) {
        @Override
        public List<String> schemaStatements() {
            return List.of(
                    "IF NOT EXISTS (SELECT * FROM sysobjects WHERE name = '" + TABLE + "' AND xtype = 'U') "
                            + "CREATE TABLE " + TABLE + " ("
                            + ID + " UNIQUEIDENTIFIER PRIMARY KEY DEFAULT NEWID(), "
                            + DEVICE_ID + " NVARCHAR(" + DEVICE_ID_MAX_LENGTH + ") NOT NULL, "
                            + measurementColumns()
                            + CREATED_AT + " DATETIME2 NOT NULL DEFAULT SYSUTCDATETIME())",
                    "IF NOT EXISTS (SELECT * FROM sys.indexes WHERE name = '" + DEVICE_CREATED_INDEX
                            + "' AND object_id = OBJECT_ID('" + TABLE + "')) "
                            + "CREATE INDEX " + DEVICE_CREATED_INDEX
                            + " ON " + TABLE + " (" + DEVICE_ID + ", " + CREATED_AT + ")");
        }
    };

    private final Set<Integer> alreadyExistsErrorCodes;

    SqlDialect(Set<Integer> alreadyExistsErrorCodes) {
        this.alreadyExistsErrorCodes = alreadyExistsErrorCodes;
    }

    /**
     * Idempotent statements creating the reading table and its (DeviceId, CreatedAt) index.
     */
    public abstract List<String> schemaStatements();

    /**
     * True when the failure says the table or index already exists, which happens when another
     * instance creates the schema between our existence check and our CREATE.
     */
    public boolean isAlreadyExists(Throwable error) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(error);
        return cause instanceof R2dbcException r2dbcException
                && alreadyExistsErrorCodes.contains(r2dbcException.getErrorCode());
    }

    private static String measurementColumns() {
        return ChannelField.all().stream()
                .map(field -> field.columnName() + " DECIMAL(18,4), ")
                .collect(Collectors.joining());
    }
}
