package dev.devanks.tuya.processor.service;

import dev.devanks.tuya.processor.model.DayTotals;
import dev.devanks.tuya.processor.model.NormalizedReading;
import dev.devanks.tuya.processor.tariff.Tariff;
import dev.devanks.tuya.processor.tariff.TariffRules;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

@Component
@RequiredArgsConstructor
@Slf4j
public class DailyAggregator {

    private final TariffRules tariffRules;

    /**
     * Groups readings by calendar day in the tariff timezone and splits each day's energy by tariff.
     *
     * @param readings readings of a single device
     * @return day totals in ascending date order
     */
    public SortedMap<LocalDate, DayTotals> aggregate(List<NormalizedReading> readings) {
        SortedMap<LocalDate, DayTotals> days = new TreeMap<>();
        for (NormalizedReading reading : readings) {
            LocalDate day = reading.getInstant().atZone(tariffRules.zone()).toLocalDate();
            Tariff tariff = tariffRules.classify(reading.getInstant());
            log.trace("Reading at {} (local {}) -> {} tariff, {} kWh",
                    reading.getInstant(), reading.getInstant().atZone(tariffRules.zone()), tariff, reading.getEnergyKwh());
            days.computeIfAbsent(day, d -> new DayTotals())
                    .add(tariff, reading.getEnergyKwh(), reading.epochMillis());
        }
        return days;
    }
}
