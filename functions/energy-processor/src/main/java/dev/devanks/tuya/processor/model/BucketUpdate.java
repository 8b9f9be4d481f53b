package dev.devanks.tuya.processor.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Mutable fields of an existing daily bucket.
 */
@Value
@Builder
public class BucketUpdate {
    double lowTariffKwh;
    double highTariffKwh;
    long lastProcessedTimestamp;
    Instant updatedAt;
}
