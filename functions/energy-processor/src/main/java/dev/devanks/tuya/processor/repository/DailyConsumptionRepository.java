package dev.devanks.tuya.processor.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.tuya.processor.entity.DailyConsumptionEntity;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface DailyConsumptionRepository extends FirestoreReactiveRepository<DailyConsumptionEntity> {

    // Equality filter only, served by the automatic single-field index
    Flux<DailyConsumptionEntity> findByDeviceId(String deviceId);

    Flux<DailyConsumptionEntity> findByDeviceIdAndDateGreaterThanEqualAndDateLessThanEqual(
            String deviceId, String startDate, String endDate);

    Flux<DailyConsumptionEntity> findByDateGreaterThanEqualAndDateLessThanEqual(String startDate, String endDate);
}
