package dev.devanks.tuya.processor.model;

import lombok.Value;

import java.time.Instant;

@Value
public class NormalizedReading {
    Instant instant;
    double energyKwh;

    public long epochMillis() {
        return instant.toEpochMilli();
    }
}
