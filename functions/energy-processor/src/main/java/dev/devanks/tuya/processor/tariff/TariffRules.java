package dev.devanks.tuya.processor.tariff;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Time-of-use rule set of one jurisdiction.
 * Implementations must be stateless: the same instant always maps to the same tariff,
 * whatever the host timezone.
 */
public interface TariffRules {

    /**
     * @return configuration name of the jurisdiction, e.g. {@code north-macedonia}
     */
    String jurisdiction();

    /**
     * Timezone whose wall clock the rules are written against.
     */
    ZoneId zone();

    boolean isLowTariff(Instant instant);

    default Tariff classify(Instant instant) {
        return isLowTariff(instant) ? Tariff.LOW : Tariff.HIGH;
    }
}
