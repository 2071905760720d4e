package com.scada.flowmeter.api.config;

import com.scada.flowmeter.api.repository.SqlDialect;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Deployment settings under {@code flowmeter.*}. Development and production differ only in these
 * values and in the {@code spring.r2dbc.*} connection keys.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "flowmeter")
public class FlowMeterProperties {

    @NotBlank
    private String environment = "development";

    @NotBlank
    private String version = "1.0.0";

    @Valid
    private Database database = new Database();

    @Valid
    private Query query = new Query();

    @Valid
    private Cors cors = new Cors();

    @Data
    public static class Database {
        @NotNull
        private SqlDialect dialect = SqlDialect.H2;

        private boolean initializeSchema = true;
    }

    @Data
    public static class Query {
        @Min(1)
        @Max(1000)
        private int defaultPageSize = 100;

        @Min(1)
        @Max(1000)
        private int maxPageSize = 1000;
    }

    @Data
    public static class Cors {
        @NotEmpty
        private List<String> allowedOrigins = List.of("*");
    }
}
