package dev.devanks.tuya.processor.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "daily_consumption")
public class DailyConsumptionEntity {

    @DocumentId
    private String id;             // "<yyyy-MM-dd>_<deviceId>", unique per (date, device)

    private String date;           // Calendar day in the tariff timezone, ISO yyyy-MM-dd
    private String deviceId;
    private double lowTariffKwh;
    private double highTariffKwh;
    private long lastProcessedTimestamp; // Epoch ms of the newest reading folded into this day
    private Instant createdAt;
    private Instant updatedAt;

    public static String idFor(LocalDate date, String deviceId) {
        return date + "_" + deviceId;
    }
}
