package dev.devanks.tuya.processor.service;

import dev.devanks.tuya.processor.config.ProcessorProperties;
import dev.devanks.tuya.processor.entity.DailyConsumptionEntity;
import dev.devanks.tuya.processor.exception.InvalidRequestException;
import dev.devanks.tuya.processor.model.ConsumptionTotals;
import dev.devanks.tuya.processor.model.DailyBreakdown;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static java.util.Comparator.reverseOrder;

@Service
@RequiredArgsConstructor
@Slf4j
public class ConsumptionQueryService {

    private final DailyConsumptionGateway gateway;
    private final ProcessorProperties properties;

    /**
     * Sums low and high tariff energy over an inclusive date range.
     *
     * @param deviceId  device to sum, or null for all devices
     * @param startDate inclusive ISO date
     * @param endDate   inclusive ISO date
     */
    public ConsumptionTotals getConsumptionTotals(String deviceId, String startDate, String endDate) {
        LocalDate start = parseDate("startDate", startDate);
        LocalDate end = parseDate("endDate", endDate);
        requireOrdered(start, end);

        List<DailyConsumptionEntity> buckets = gateway.findBuckets(deviceId, start, end);
        log.info("Summing {} bucket(s) for device {} between {} and {}",
                buckets.size(), deviceId == null ? "<all>" : deviceId, start, end);
        return ConsumptionTotals.builder()
                .deviceId(deviceId)
                .startDate(start.toString())
                .endDate(end.toString())
                .totalLow(buckets.stream().mapToDouble(DailyConsumptionEntity::getLowTariffKwh).sum())
                .totalHigh(buckets.stream().mapToDouble(DailyConsumptionEntity::getHighTariffKwh).sum())
                .build();
    }

    public DailyBreakdown getDailyBreakdown(String deviceId, String startDate, String endDate) {
        return getDailyBreakdown(deviceId, startDate, endDate, properties.getQuery().getMaxBreakdownDays());
    }

    /**
     * Per-day rows, newest first, capped at {@code maxDays} days. With no device every row
     * combines all devices reporting that day.
     */
    public DailyBreakdown getDailyBreakdown(String deviceId, String startDate, String endDate, int maxDays) {
        LocalDate start = parseDate("startDate", startDate);
        LocalDate end = parseDate("endDate", endDate);
        requireOrdered(start, end);
        if (maxDays < 1) {
            throw new InvalidRequestException("maxDays must be at least 1, got " + maxDays);
        }

        List<DailyConsumptionEntity> buckets = gateway.findBuckets(deviceId, start, end);

        Map<String, DayAccumulator> byDate = new TreeMap<>(reverseOrder());
        for (DailyConsumptionEntity bucket : buckets) {
            byDate.computeIfAbsent(bucket.getDate(), d -> new DayAccumulator()).add(bucket);
        }

        List<DailyBreakdown.DayRow> rows = byDate.entrySet().stream()
                .limit(maxDays)
                .map(entry -> entry.getValue().toRow(entry.getKey()))
                .toList();

        return DailyBreakdown.builder()
                .deviceId(deviceId)
                .period(new DailyBreakdown.Period(start.toString(), end.toString()))
                .dailyData(rows)
                .totalDays(rows.size())
                .summary(summarize(rows))
                .build();
    }

    private static DailyBreakdown.Summary summarize(List<DailyBreakdown.DayRow> rows) {
        double totalLow = rows.stream().mapToDouble(DailyBreakdown.DayRow::getLow).sum();
        double totalHigh = rows.stream().mapToDouble(DailyBreakdown.DayRow::getHigh).sum();
        double grandTotal = totalLow + totalHigh;
        int days = rows.size();
        return DailyBreakdown.Summary.builder()
                .totalLow(totalLow)
                .totalHigh(totalHigh)
                .grandTotal(grandTotal)
                .averageLow(days > 0 ? totalLow / days : 0)
                .averageHigh(days > 0 ? totalHigh / days : 0)
                .averageTotal(days > 0 ? grandTotal / days : 0)
                .build();
    }

    private static LocalDate parseDate(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException(name + " is required (YYYY-MM-DD)");
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException("Invalid " + name + " '" + value + "'. Use YYYY-MM-DD format.", e);
        }
    }

    private static void requireOrdered(LocalDate start, LocalDate end) {
        if (start.isAfter(end)) {
            throw new InvalidRequestException("startDate " + start + " is after endDate " + end);
        }
    }

    private static final class DayAccumulator {
        private double low;
        private double high;
        private final Set<String> devices = new HashSet<>();

        void add(DailyConsumptionEntity bucket) {
            low += bucket.getLowTariffKwh();
            high += bucket.getHighTariffKwh();
            devices.add(bucket.getDeviceId());
        }

        DailyBreakdown.DayRow toRow(String date) {
            return DailyBreakdown.DayRow.builder()
                    .date(date)
                    .low(low)
                    .high(high)
                    .total(low + high)
                    .devicesCount(devices.size())
                    .build();
        }
    }
}
