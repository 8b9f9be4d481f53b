// functions/energy-processor/src/main/java/dev/devanks/tuya/processor/config/AppConfig.java
package dev.devanks.tuya.processor.config;

import dev.devanks.tuya.processor.tariff.NorthMacedoniaTariffRules;
import dev.devanks.tuya.processor.tariff.TariffRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@Slf4j
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Rules are evaluated in the configured zone, never the host's default zone
    @Bean
    public TariffRules tariffRules(ProcessorProperties properties) {
        var tariff = properties.getTariff();
        ZoneId zone = ZoneId.of(tariff.getTimezone());
        log.info("Initializing tariff rules for jurisdiction '{}' in zone {}.", tariff.getJurisdiction(), zone);
        if (NorthMacedoniaTariffRules.JURISDICTION.equalsIgnoreCase(tariff.getJurisdiction())) {
            return new NorthMacedoniaTariffRules(zone);
        }
        throw new IllegalStateException("Unsupported tariff jurisdiction: " + tariff.getJurisdiction());
    }
}
