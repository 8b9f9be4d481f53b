package dev.devanks.tuya.processor.service;

import dev.devanks.tuya.processor.entity.DailyConsumptionEntity;
import dev.devanks.tuya.processor.exception.PersistenceException;
import dev.devanks.tuya.processor.model.BucketUpdate;
import dev.devanks.tuya.processor.repository.DailyConsumptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

@Service
@RequiredArgsConstructor
@Slf4j
public class FirestoreConsumptionGateway implements DailyConsumptionGateway {

    private final DailyConsumptionRepository repository;

    /**
     * Maximum over all buckets of the device. The query is an equality filter only and must stay
     * that way: adding an ordering on another field requires a composite index.
     */
    @Override
    public OptionalLong maxWatermark(String deviceId) {
        log.debug("Reading watermark for device {}", deviceId);
        Optional<Long> watermark = block(repository.findByDeviceId(deviceId)
                        .map(DailyConsumptionEntity::getLastProcessedTimestamp)
                        .reduce(Math::max),
                "read watermark for device " + deviceId);
        return watermark.map(OptionalLong::of).orElseGet(OptionalLong::empty);
    }

    @Override
    public Optional<DailyConsumptionEntity> getBucket(LocalDate date, String deviceId) {
        String id = DailyConsumptionEntity.idFor(date, deviceId);
        return block(repository.findById(id), "read bucket " + id);
    }

    @Override
    public void insertBucket(DailyConsumptionEntity bucket) {
        block(repository.save(bucket)
                        .doOnSuccess(saved -> log.info("Inserted daily bucket {}", saved.getId())),
                "insert bucket " + bucket.getId());
    }

    @Override
    public void updateBucket(String id, BucketUpdate update) {
        Mono<DailyConsumptionEntity> updated = repository.findById(id)
                .switchIfEmpty(Mono.error(() -> new PersistenceException("Bucket " + id + " does not exist")))
                .map(existing -> {
                    existing.setLowTariffKwh(update.getLowTariffKwh());
                    existing.setHighTariffKwh(update.getHighTariffKwh());
                    existing.setLastProcessedTimestamp(update.getLastProcessedTimestamp());
                    existing.setUpdatedAt(update.getUpdatedAt());
                    return existing;
                })
                .flatMap(repository::save)
                .doOnSuccess(saved -> log.info("Updated daily bucket {}", id));
        block(updated, "update bucket " + id);
    }

    @Override
    public List<DailyConsumptionEntity> findBuckets(String deviceId, LocalDate startDate, LocalDate endDate) {
        String start = startDate.toString();
        String end = endDate.toString();
        Flux<DailyConsumptionEntity> query = deviceId == null
                ? repository.findByDateGreaterThanEqualAndDateLessThanEqual(start, end)
                : repository.findByDeviceIdAndDateGreaterThanEqualAndDateLessThanEqual(deviceId, start, end);
        return block(query.collectList(), "query buckets between " + start + " and " + end)
                .orElse(List.of());
    }

    private <T> Optional<T> block(Mono<T> operation, String description) {
        try {
            return operation.blockOptional();
        } catch (PersistenceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Firestore failed to {}: {}", description, e.getMessage(), e);
            throw new PersistenceException("Failed to " + description + ": " + e.getMessage(), e);
        }
    }
}
