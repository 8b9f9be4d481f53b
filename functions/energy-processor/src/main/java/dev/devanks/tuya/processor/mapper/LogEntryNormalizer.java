// functions/energy-processor/src/main/java/dev/devanks/tuya/processor/mapper/LogEntryNormalizer.java
package dev.devanks.tuya.processor.mapper;

import dev.devanks.tuya.processor.config.ProcessorProperties;
import dev.devanks.tuya.processor.exception.RemoteFetchException;
import dev.devanks.tuya.processor.model.NormalizedReading;
import dev.devanks.tuya.processor.model.TuyaLogEntry;
import dev.devanks.tuya.processor.tariff.TariffRules;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Converts raw Tuya log entries into readings with a millisecond instant and a kWh amount.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LogEntryNormalizer {

    // Anything below 10^12 ms (September 2001) must be epoch seconds
    static final long MILLIS_THRESHOLD = 1_000_000_000_000L;

    private final ProcessorProperties properties;
    private final TariffRules tariffRules;
    private final Clock clock;

    public static long normalizeEpochMillis(long eventTime) {
        return eventTime < MILLIS_THRESHOLD ? eventTime * 1000 : eventTime;
    }

    /**
     * @return the corrected epoch ms of the entry
     * @throws RemoteFetchException if the entry carries no timestamp
     */
    public long timestampOf(TuyaLogEntry entry) {
        if (entry.getEventTime() == null) {
            throw new RemoteFetchException("Log entry without event_time: " + entry);
        }
        long timestamp = normalizeEpochMillis(entry.getEventTime());
        if (timestamp != entry.getEventTime()) {
            log.debug("Converted timestamp from seconds to milliseconds: {} -> {}", entry.getEventTime(), timestamp);
        }
        return timestamp;
    }

    /**
     * Accepts years from the configured minimum up to next year, in the tariff timezone.
     */
    public boolean isPlausible(long epochMillis) {
        ZoneId zone = tariffRules.zone();
        int year = Instant.ofEpochMilli(epochMillis).atZone(zone).getYear();
        int maxYear = LocalDate.now(clock.withZone(zone)).getYear() + 1;
        return year >= properties.getIngestion().getMinPlausibleYear() && year <= maxYear;
    }

    /**
     * @return the reading, or null when the timestamp falls outside the plausible years
     * @throws RemoteFetchException if the entry has no timestamp or a non-numeric value
     */
    public NormalizedReading normalize(TuyaLogEntry entry) {
        long timestamp = timestampOf(entry);
        if (!isPlausible(timestamp)) {
            log.warn("Suspicious timestamp detected: {} -> {}, skipping entry",
                    entry.getEventTime(), Instant.ofEpochMilli(timestamp));
            return null;
        }
        return new NormalizedReading(Instant.ofEpochMilli(timestamp), parseKwh(entry));
    }

    private static double parseKwh(TuyaLogEntry entry) {
        String value = entry.getValue();
        if (value == null || value.isBlank()) {
            throw new RemoteFetchException("Log entry without value: " + entry);
        }
        try {
            return Double.parseDouble(value.trim()) / 1000.0;
        } catch (NumberFormatException e) {
            throw new RemoteFetchException("Log entry with non-numeric value: " + entry, e);
        }
    }
}
