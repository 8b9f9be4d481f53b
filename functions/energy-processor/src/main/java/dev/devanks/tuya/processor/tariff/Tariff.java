package dev.devanks.tuya.processor.tariff;

public enum Tariff {
    LOW, HIGH
}
