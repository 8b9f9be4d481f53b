// functions/energy-processor/src/main/java/dev/devanks/tuya/processor/config/ProcessorProperties.java
package dev.devanks.tuya.processor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.hibernate.validator.constraints.URL;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "processor")
public class ProcessorProperties {

    // Tuya cloud credentials and endpoint
    @Data
    @Validated
    public static class TuyaProperties {
        @NotEmpty
        private String clientId;
        @NotEmpty
        private String secret; // Injected from the environment, never committed
        @NotEmpty
        @URL
        private String baseUrl = "https://openapi.tuyaeu.com";
        /**
         * Device processed when a trigger does not name one.
         */
        private String deviceId;
    }

    @Data
    @Validated
    public static class IngestionProperties {
        @NotEmpty
        private String energyCode = "add_ele";
        /**
         * Tuya log event types requested from the device log endpoint (7 = data point reports).
         */
        @NotEmpty
        private String eventTypeFilter = "7";
        @Min(0)
        private int fetchSize = 5000;
        @Min(1)
        private int maxPages = 50;
        /**
         * How far back the first run for a device reaches.
         */
        @Min(1)
        private int lookbackDays = 7;
        /**
         * Readings dated before this year are treated as corrupt.
         */
        @Min(1970)
        private int minPlausibleYear = 2020;
    }

    @Data
    @Validated
    public static class TariffProperties {
        @NotEmpty
        private String jurisdiction = "north-macedonia";
        @NotEmpty
        private String timezone = "Europe/Skopje";
    }

    @Data
    @Validated
    public static class QueryProperties {
        @Min(1)
        private int maxBreakdownDays = 30;
    }

    @Valid
    @NotNull
    private TuyaProperties tuya = new TuyaProperties();

    @Valid
    @NotNull
    private IngestionProperties ingestion = new IngestionProperties();

    @Valid
    @NotNull
    private TariffProperties tariff = new TariffProperties();

    @Valid
    @NotNull
    private QueryProperties query = new QueryProperties();

}
