package dev.devanks.tuya.processor.config;

import dev.devanks.tuya.processor.tariff.NorthMacedoniaTariffRules;
import dev.devanks.tuya.processor.tariff.TariffRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AppConfig Unit Tests")
class AppConfigTest {

    private final AppConfig appConfig = new AppConfig();

    @Test
    @DisplayName("tariffRules: default jurisdiction gives North Macedonia rules in the configured zone")
    void tariffRules_default() {
        ProcessorProperties properties = new ProcessorProperties();
        properties.getTariff().setTimezone("Europe/Belgrade");

        TariffRules rules = appConfig.tariffRules(properties);

        assertThat(rules).isInstanceOf(NorthMacedoniaTariffRules.class);
        assertThat(rules.jurisdiction()).isEqualTo("north-macedonia");
        assertThat(rules.zone()).isEqualTo(ZoneId.of("Europe/Belgrade"));
    }

    @Test
    @DisplayName("tariffRules: unknown jurisdiction fails start-up")
    void tariffRules_unknownJurisdiction() {
        ProcessorProperties properties = new ProcessorProperties();
        properties.getTariff().setJurisdiction("atlantis");

        assertThatThrownBy(() -> appConfig.tariffRules(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("atlantis");
    }
}
