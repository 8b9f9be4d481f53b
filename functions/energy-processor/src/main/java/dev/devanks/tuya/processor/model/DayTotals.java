package dev.devanks.tuya.processor.model;

import dev.devanks.tuya.processor.tariff.Tariff;
import lombok.Data;

/**
 * Energy gathered for one calendar day during a single run.
 */
@Data
public class DayTotals {
    private double lowTariffKwh;
    private double highTariffKwh;
    private long lastProcessedTimestamp; // Max reading timestamp of this day only
    private int readings;

    public void add(Tariff tariff, double kwh, long epochMillis) {
        if (tariff == Tariff.LOW) {
            lowTariffKwh += kwh;
        } else {
            highTariffKwh += kwh;
        }
        lastProcessedTimestamp = Math.max(lastProcessedTimestamp, epochMillis);
        readings++;
    }
}
