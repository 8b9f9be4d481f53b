package dev.devanks.tuya.processor.service;

import dev.devanks.tuya.processor.entity.DailyConsumptionEntity;
import dev.devanks.tuya.processor.model.BucketUpdate;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Storage operations the aggregation engine and the consumption queries depend on.
 * Every method either completes or throws {@link dev.devanks.tuya.processor.exception.PersistenceException}.
 */
public interface DailyConsumptionGateway {

    /**
     * @return the highest {@code lastProcessedTimestamp} stored for the device, empty when it has no buckets
     */
    OptionalLong maxWatermark(String deviceId);

    Optional<DailyConsumptionEntity> getBucket(LocalDate date, String deviceId);

    void insertBucket(DailyConsumptionEntity bucket);

    void updateBucket(String id, BucketUpdate update);

    /**
     * Buckets with {@code startDate <= date <= endDate}; all devices when {@code deviceId} is null.
     */
    List<DailyConsumptionEntity> findBuckets(String deviceId, LocalDate startDate, LocalDate endDate);
}
