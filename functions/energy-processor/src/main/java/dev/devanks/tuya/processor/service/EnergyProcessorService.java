// functions/energy-processor/src/main/java/dev/devanks/tuya/processor/service/EnergyProcessorService.java
package dev.devanks.tuya.processor.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.tuya.processor.client.TuyaLogClient;
import dev.devanks.tuya.processor.config.ProcessorProperties;
import dev.devanks.tuya.processor.entity.DailyConsumptionEntity;
import dev.devanks.tuya.processor.exception.EnergyProcessingException;
import dev.devanks.tuya.processor.exception.InvalidRequestException;
import dev.devanks.tuya.processor.exception.PersistenceException;
import dev.devanks.tuya.processor.mapper.LogEntryNormalizer;
import dev.devanks.tuya.processor.model.BucketUpdate;
import dev.devanks.tuya.processor.model.DayTotals;
import dev.devanks.tuya.processor.model.LogFetchResult;
import dev.devanks.tuya.processor.model.LogQuery;
import dev.devanks.tuya.processor.model.NormalizedReading;
import dev.devanks.tuya.processor.model.ProcessingResult;
import dev.devanks.tuya.processor.model.TuyaLogEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Folds new energy logs of a device into its daily tariff buckets.
 * <p>
 * Runs for the same device must not overlap; the caller is expected to serialize them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnergyProcessorService {

    private final ProcessorProperties properties;
    private final TuyaLogClient tuyaLogClient;
    private final DailyConsumptionGateway gateway;
    private final LogEntryNormalizer normalizer;
    private final DailyAggregator aggregator;
    private final Clock clock;

    public ProcessingResult processEnergyLogs(String deviceId) {
        return processEnergyLogs(deviceId, null);
    }

    /**
     * @param deviceId            Tuya device id
     * @param forceStartTimestamp null to continue from the stored watermark; 0 to fetch from the stored
     *                            watermark without de-duplication; a positive epoch ms to start there
     */
    public ProcessingResult processEnergyLogs(String deviceId, Long forceStartTimestamp) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new InvalidRequestException("deviceId is required");
        }
        if (forceStartTimestamp != null && forceStartTimestamp < 0) {
            throw new InvalidRequestException("forceStartTimestamp must not be negative: " + forceStartTimestamp);
        }
        log.info("Starting energy log processing for device {} (forceStartTimestamp={}).", deviceId, forceStartTimestamp);
        Instant start = clock.instant();

        try {
            // 1. Where does this run start? A forced 0 still starts at the stored watermark
            boolean forcedReprocess = forceStartTimestamp != null && forceStartTimestamp == 0;
            long watermark = forceStartTimestamp == null || forcedReprocess
                    ? readWatermark(deviceId)
                    : LogEntryNormalizer.normalizeEpochMillis(forceStartTimestamp);
            log.info("Last processed timestamp: {}", watermark);

            // 2. Fetch only energy increment logs
            List<TuyaLogEntry> energyLogs = fetchEnergyLogs(deviceId, watermark);
            if (energyLogs.isEmpty()) {
                log.info("No new '{}' logs to process.", properties.getIngestion().getEnergyCode());
                return noNewLogs(deviceId, 0, start);
            }

            // 3. Drop boundary duplicates already reflected in the stored buckets
            List<TuyaLogEntry> newLogs = forcedReprocess ? energyLogs : filterAfterWatermark(energyLogs, watermark);
            if (newLogs.size() < energyLogs.size()) {
                log.info("Found {} '{}' logs, processing {} after timestamp filtering",
                        energyLogs.size(), properties.getIngestion().getEnergyCode(), newLogs.size());
            }
            if (newLogs.isEmpty()) {
                return noNewLogs(deviceId, energyLogs.size(), start);
            }

            // 4. Normalize and skip implausible timestamps
            List<NormalizedReading> readings = new ArrayList<>(newLogs.size());
            for (TuyaLogEntry entry : newLogs) {
                NormalizedReading reading = normalizer.normalize(entry);
                if (reading != null) {
                    readings.add(reading);
                }
            }

            // 5. Bucket by local day and tariff
            SortedMap<LocalDate, DayTotals> days = aggregator.aggregate(readings);
            log.debug("Aggregated data: {}", days);

            // 6. Merge, oldest day first
            int[] counts = mergeDays(deviceId, days);

            long duration = ChronoUnit.MILLIS.between(start, clock.instant());
            log.info("Successfully processed and saved {} daily aggregate(s) for device {} in {} ms.",
                    days.size(), deviceId, duration);
            return ProcessingResult.builder()
                    .status(ProcessingResult.Status.COMPLETED)
                    .message(ProcessingResult.COMPLETED_MESSAGE)
                    .deviceId(deviceId)
                    .readingsFetched(energyLogs.size())
                    .readingsAggregated(readings.size())
                    .readingsSkipped(energyLogs.size() - readings.size())
                    .bucketsInserted(counts[0])
                    .bucketsUpdated(counts[1])
                    .durationMs(duration)
                    .build();

        } catch (EnergyProcessingException e) {
            log.error("Failed to process energy logs for device {}: {}", deviceId, e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Reads the device watermark; any storage failure is downgraded to "first run".
     *
     * @return the watermark in epoch ms, 0 when unknown
     */
    @VisibleForTesting
    long readWatermark(String deviceId) {
        try {
            return gateway.maxWatermark(deviceId).orElse(0L);
        } catch (RuntimeException e) {
            log.warn("Could not read watermark for device {}. Assuming first run.", deviceId, e);
            return 0L;
        }
    }

    private List<TuyaLogEntry> fetchEnergyLogs(String deviceId, long watermark) {
        var ingestion = properties.getIngestion();
        // A missing watermark reaches back a fixed number of days
        Long windowStart = watermark > 0 ? watermark : -(long) ingestion.getLookbackDays();
        LogQuery query = LogQuery.builder()
                .start(windowStart)
                .end(0L)
                .eventTypeFilter(ingestion.getEventTypeFilter())
                .size(ingestion.getFetchSize())
                .maxPages(ingestion.getMaxPages())
                .extraParams(Map.of())
                .build();

        LogFetchResult result = tuyaLogClient.fetchLogsWithFreshToken(deviceId, query);
        List<TuyaLogEntry> energyLogs = result.getEntries().stream()
                .filter(entry -> ingestion.getEnergyCode().equals(entry.getCode()))
                .toList();
        log.info("Found {} '{}' logs out of {} fetched in {} page(s)",
                energyLogs.size(), ingestion.getEnergyCode(), result.getEntries().size(), result.getPageCount());
        return energyLogs;
    }

    private List<TuyaLogEntry> filterAfterWatermark(List<TuyaLogEntry> entries, long watermark) {
        return entries.stream()
                .filter(entry -> normalizer.timestampOf(entry) > watermark)
                .toList();
    }

    /**
     * @return {@code [inserted, updated]}
     */
    private int[] mergeDays(String deviceId, SortedMap<LocalDate, DayTotals> days) {
        int inserted = 0;
        int updated = 0;
        for (Map.Entry<LocalDate, DayTotals> day : days.entrySet()) {
            LocalDate date = day.getKey();
            DayTotals delta = day.getValue();
            try {
                Instant now = clock.instant();
                Optional<DailyConsumptionEntity> existing = gateway.getBucket(date, deviceId);
                if (existing.isPresent()) {
                    gateway.updateBucket(existing.get().getId(), mergedUpdate(existing.get(), delta, now));
                    updated++;
                } else {
                    gateway.insertBucket(newBucket(deviceId, date, delta, now));
                    inserted++;
                }
            } catch (EnergyProcessingException e) {
                log.error("Failed to upsert data for {}: {}", date, e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                log.error("Failed to upsert data for {}: {}", date, e.getMessage());
                throw new PersistenceException("Failed to upsert bucket " + date + " for device " + deviceId, e);
            }
        }
        return new int[]{inserted, updated};
    }

    /**
     * Totals are added to what is stored. The bucket timestamp never moves backwards, which only
     * matters for forced reprocessing; a regular run only sees readings newer than the watermark.
     * Keeping the stored timestamp non-decreasing takes precedence over writing the day maximum as is.
     */
    @VisibleForTesting
    static BucketUpdate mergedUpdate(DailyConsumptionEntity existing, DayTotals delta, Instant now) {
        return BucketUpdate.builder()
                .lowTariffKwh(existing.getLowTariffKwh() + delta.getLowTariffKwh())
                .highTariffKwh(existing.getHighTariffKwh() + delta.getHighTariffKwh())
                .lastProcessedTimestamp(Math.max(existing.getLastProcessedTimestamp(), delta.getLastProcessedTimestamp()))
                .updatedAt(now)
                .build();
    }

    private static DailyConsumptionEntity newBucket(String deviceId, LocalDate date, DayTotals delta, Instant now) {
        return DailyConsumptionEntity.builder()
                .id(DailyConsumptionEntity.idFor(date, deviceId))
                .date(date.toString())
                .deviceId(deviceId)
                .lowTariffKwh(delta.getLowTariffKwh())
                .highTariffKwh(delta.getHighTariffKwh())
                .lastProcessedTimestamp(delta.getLastProcessedTimestamp())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private ProcessingResult noNewLogs(String deviceId, int fetched, Instant start) {
        return ProcessingResult.builder()
                .status(ProcessingResult.Status.NO_NEW_LOGS)
                .message(ProcessingResult.NO_NEW_LOGS_MESSAGE)
                .deviceId(deviceId)
                .readingsFetched(fetched)
                .readingsSkipped(fetched)
                .durationMs(ChronoUnit.MILLIS.between(start, clock.instant()))
                .build();
    }
}
